package com.project.regimen.backend.algorithm;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Converts timestamps into "program days".
 *
 * A program day is a plain calendar date, except that everything before the
 * profile's boundary hour still belongs to the previous date. With a boundary
 * hour of 3, a workout finished at 01:30 on Dec 16 is counted for Dec 15.
 *
 * These are the only comparison primitives the progression code uses; nothing
 * else compares raw timestamps.
 */
public final class ProgramDayCalendar {

    /** Earliest valid boundary hour (plain midnight truncation). */
    public static final int MIN_BOUNDARY_HOUR = 0;

    /** Latest valid boundary hour. */
    public static final int MAX_BOUNDARY_HOUR = 23;

    private ProgramDayCalendar() {
    }

    // -----------------------------------------------------------------------
    // Normalization
    // -----------------------------------------------------------------------

    /**
     * Returns the program day a zoned timestamp belongs to.
     *
     * @param at           the local date-time of the event.
     * @param boundaryHour hour (0-23) at which a new program day starts.
     * @return the calendar date, shifted back by one day when the local hour
     *         is strictly before {@code boundaryHour}.
     */
    public static LocalDate programDay(ZonedDateTime at, int boundaryHour) {
        checkBoundaryHour(boundaryHour);
        LocalDate date = at.toLocalDate();
        if (at.getHour() < boundaryHour) {
            return date.minusDays(1);
        }
        return date;
    }

    /**
     * Same as {@link #programDay(ZonedDateTime, int)} for an instant observed
     * in the given zone.
     */
    public static LocalDate programDay(Instant at, ZoneId zone, int boundaryHour) {
        return programDay(at.atZone(zone), boundaryHour);
    }

    /**
     * Today's program day according to the clock.
     *
     * @param clock        source of "now" and of the zone.
     * @param boundaryHour hour (0-23) at which a new program day starts.
     */
    public static LocalDate today(Clock clock, int boundaryHour) {
        return programDay(ZonedDateTime.now(clock), boundaryHour);
    }

    // -----------------------------------------------------------------------
    // Comparison
    // -----------------------------------------------------------------------

    public static boolean isSameDay(LocalDate a, LocalDate b) {
        return a != null && b != null && a.isEqual(b);
    }

    /**
     * Signed number of whole program days from {@code a} to {@code b}
     * ({@code b - a}).
     */
    public static int daysBetween(LocalDate a, LocalDate b) {
        return Math.toIntExact(ChronoUnit.DAYS.between(a, b));
    }

    /**
     * Validates a configured boundary hour.
     *
     * @throws IllegalArgumentException when the hour is outside 0-23.
     */
    public static void checkBoundaryHour(int boundaryHour) {
        if (boundaryHour < MIN_BOUNDARY_HOUR || boundaryHour > MAX_BOUNDARY_HOUR) {
            throw new IllegalArgumentException("Day boundary hour must be between 0 and 23, got " + boundaryHour);
        }
    }
}
