package com.project.regimen.backend.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Target position of a moved day (1-indexed) or cycle item (0-indexed).
 */
@Getter
@AllArgsConstructor
@NoArgsConstructor
public class MovePositionRequestDto {
    @NotNull(message="position is required")
    @Min(value = 0, message="position should not be negative")
    Integer position;
}
