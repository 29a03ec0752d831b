package com.project.regimen.backend.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@AllArgsConstructor
@NoArgsConstructor
public class CreatePlanDayRequestDto {
    @Size(max = 100, message="name should be at most 100 characters")
    String name;

    boolean restDay;
}
