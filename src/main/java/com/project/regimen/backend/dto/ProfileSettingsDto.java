package com.project.regimen.backend.dto;

import com.project.regimen.backend.entity.ExecutionMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Partial update of the profile settings: null fields are left as they are.
 * {@code clearActivePlan} switches a profile back to free training.
 */
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ProfileSettingsDto {
    @Min(value = 0, message="day boundary hour should be between 0 and 23")
    @Max(value = 23, message="day boundary hour should be between 0 and 23")
    Integer dayBoundaryHour;

    ExecutionMode executionMode;

    UUID activePlanId;

    boolean clearActivePlan;
}
