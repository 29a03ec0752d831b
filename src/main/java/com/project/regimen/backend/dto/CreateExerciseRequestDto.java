package com.project.regimen.backend.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@AllArgsConstructor
@NoArgsConstructor
public class CreateExerciseRequestDto {
    @NotEmpty(message="name is required")
    String name;

    @NotNull(message="planned set count is required")
    @Min(value = 0, message="planned set count should not be negative")
    @Max(value = 50, message="planned set count should be at most 50")
    Integer plannedSetCount;
}
