package com.project.regimen.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Day expected on {@code date} if every day until then is completed.
 * {@code dayIndex} is null when there is nothing to preview.
 */
@Getter
@AllArgsConstructor
public class PreviewDto {
    private final LocalDate date;
    private final int daysDifference;
    private final UUID planId;
    private final Integer dayIndex;
    private final Integer totalDays;
    private final String dayName;

    public static PreviewDto unavailable(LocalDate date, int daysDifference, UUID planId) {
        return new PreviewDto(date, daysDifference, planId, null, null, null);
    }
}
