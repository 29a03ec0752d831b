package com.project.regimen.backend.algorithm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ProgramDayCalendar Tests")
class ProgramDayCalendarTest {

    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");

    @Test
    @DisplayName("Timestamps before the boundary hour belong to the previous date")
    void shouldShiftEarlyMorningToPreviousDay() {
        ZonedDateTime at = ZonedDateTime.of(2025, 12, 16, 1, 30, 0, 0, TOKYO);

        assertEquals(LocalDate.of(2025, 12, 15), ProgramDayCalendar.programDay(at, 3));
    }

    @Test
    @DisplayName("The boundary hour itself starts the new program day")
    void shouldStartNewDayAtBoundaryHour() {
        ZonedDateTime at = ZonedDateTime.of(2025, 12, 16, 3, 0, 0, 0, TOKYO);

        assertEquals(LocalDate.of(2025, 12, 16), ProgramDayCalendar.programDay(at, 3));
    }

    @Test
    @DisplayName("Boundary hour 0 is plain midnight truncation")
    void shouldTruncateAtMidnightWithBoundaryZero() {
        ZonedDateTime at = ZonedDateTime.of(2025, 12, 16, 0, 5, 0, 0, TOKYO);

        assertEquals(LocalDate.of(2025, 12, 16), ProgramDayCalendar.programDay(at, 0));
    }

    @Test
    @DisplayName("Instants are evaluated in the given zone")
    void shouldUseZoneForInstants() {
        // 17:30 UTC on Dec 15 is 02:30 on Dec 16 in Tokyo
        Instant at = Instant.parse("2025-12-15T17:30:00Z");

        assertEquals(LocalDate.of(2025, 12, 15), ProgramDayCalendar.programDay(at, TOKYO, 3));
        assertEquals(LocalDate.of(2025, 12, 16), ProgramDayCalendar.programDay(at, TOKYO, 2));
        assertEquals(LocalDate.of(2025, 12, 15), ProgramDayCalendar.programDay(at, ZoneOffset.UTC, 3));
    }

    @Test
    @DisplayName("today() reads the clock")
    void shouldComputeTodayFromClock() {
        Clock clock = Clock.fixed(Instant.parse("2025-12-16T02:00:00Z"), ZoneOffset.UTC);

        assertEquals(LocalDate.of(2025, 12, 15), ProgramDayCalendar.today(clock, 3));
        assertEquals(LocalDate.of(2025, 12, 16), ProgramDayCalendar.today(clock, 0));
    }

    @Test
    @DisplayName("isSameDay is false when either side is missing")
    void shouldCompareDaysNullSafely() {
        LocalDate day = LocalDate.of(2025, 12, 16);

        assertTrue(ProgramDayCalendar.isSameDay(day, LocalDate.of(2025, 12, 16)));
        assertFalse(ProgramDayCalendar.isSameDay(day, day.plusDays(1)));
        assertFalse(ProgramDayCalendar.isSameDay(null, day));
        assertFalse(ProgramDayCalendar.isSameDay(day, null));
    }

    @Test
    @DisplayName("daysBetween is signed")
    void shouldReturnSignedDistance() {
        LocalDate day = LocalDate.of(2025, 12, 16);

        assertEquals(3, ProgramDayCalendar.daysBetween(day, day.plusDays(3)));
        assertEquals(-2, ProgramDayCalendar.daysBetween(day, day.minusDays(2)));
        assertEquals(0, ProgramDayCalendar.daysBetween(day, day));
    }

    @Test
    @DisplayName("Boundary hours outside 0-23 are rejected")
    void shouldRejectInvalidBoundaryHour() {
        ZonedDateTime at = ZonedDateTime.of(2025, 12, 16, 12, 0, 0, 0, TOKYO);

        assertThrows(IllegalArgumentException.class, () -> ProgramDayCalendar.programDay(at, 24));
        assertThrows(IllegalArgumentException.class, () -> ProgramDayCalendar.programDay(at, -1));
    }
}
