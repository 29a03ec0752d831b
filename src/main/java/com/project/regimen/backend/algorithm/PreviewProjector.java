package com.project.regimen.backend.algorithm;

import java.util.OptionalInt;

/**
 * Forecasts which day would be shown N program days from now (or N days ago)
 * if every day in between were completed. Pure arithmetic; nothing is read or
 * stored.
 */
public final class PreviewProjector {

    private PreviewProjector() {
    }

    /**
     * @param currentDayIndex 1-indexed day shown today.
     * @param totalDays       number of days in the plan.
     * @param daysDifference  signed distance from today to the target date.
     * @return the 1-indexed day, or empty when the plan has no days.
     */
    public static OptionalInt previewDayIndex(int currentDayIndex, int totalDays, int daysDifference) {
        if (totalDays <= 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Math.floorMod(currentDayIndex - 1 + daysDifference, totalDays) + 1);
    }

    /**
     * Same as {@link #previewDayIndex} for 0-indexed cycle day pointers.
     */
    public static OptionalInt previewCycleDayIndex(int currentDayIndex, int totalDays, int daysDifference) {
        if (totalDays <= 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Math.floorMod(currentDayIndex + daysDifference, totalDays));
    }
}
