package com.project.regimen.backend.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@AllArgsConstructor
@NoArgsConstructor
public class CreateCycleRequestDto {
    @NotEmpty(message="name is required")
    @Size(max = 100, message="name should be at most 100 characters")
    String name;
}
