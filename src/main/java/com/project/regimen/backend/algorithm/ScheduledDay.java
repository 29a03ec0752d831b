package com.project.regimen.backend.algorithm;

/**
 * Read-only view of one day of a plan, as the progression code needs it.
 * Positions are 1-indexed.
 */
public interface ScheduledDay extends PositionedEntry {

    /** A rest day always counts as completed. */
    boolean isRestDay();

    /** Number of exercises planned for the day; {@code 0} means empty. */
    int getExerciseCount();
}
