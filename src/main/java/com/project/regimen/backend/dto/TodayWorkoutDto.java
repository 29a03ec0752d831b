package com.project.regimen.backend.dto;

import com.project.regimen.backend.entity.ExecutionMode;
import com.project.regimen.backend.entity.WorkoutDay;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.util.UUID;

/**
 * What the client shows on open: the program day, where the pointer is and
 * the workout materialized for it.
 */
@Getter
@Builder
public class TodayWorkoutDto {
    private final LocalDate programDay;
    private final ExecutionMode mode;
    private final UUID planId;
    private final UUID cycleId;
    // 1-indexed in SINGLE mode, 0-indexed in CYCLE mode
    private final int dayIndex;
    private final Integer itemIndex;
    private final String outcome;
    private final String reason;
    private final boolean staleRecordDiscarded;
    private final WorkoutDay workout;
}
