package com.project.regimen.backend.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@AllArgsConstructor
@NoArgsConstructor
public class CreatePlanRequestDto {
    @NotEmpty(message="name is required")
    @Size(max = 100, message="name should be at most 100 characters")
    String name;

    @Size(max = 1000, message="note should be at most 1000 characters")
    String note;
}
