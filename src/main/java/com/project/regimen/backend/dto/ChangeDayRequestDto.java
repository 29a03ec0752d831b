package com.project.regimen.backend.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Manual day change. {@code dayIndex} is 1-indexed for plans and 0-indexed
 * inside the current plan of a cycle.
 */
@Getter
@AllArgsConstructor
@NoArgsConstructor
public class ChangeDayRequestDto {
    @NotNull(message="day index is required")
    Integer dayIndex;

    boolean skipAndAdvance;
}
