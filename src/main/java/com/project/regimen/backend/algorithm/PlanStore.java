package com.project.regimen.backend.algorithm;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Everything the progression code needs to know about stored plans and workout
 * records. The trackers never talk to persistence directly.
 */
public interface PlanStore {

    /**
     * Days of a plan ordered by position.
     *
     * @return empty when the plan does not exist (for instance it was deleted
     *         while a cycle still referenced it).
     */
    Optional<List<ScheduledDay>> daysOf(UUID planId);

    WorkoutRecordStatus workoutRecordStatus(Integer profileId, UUID planId, LocalDate programDay);

    /**
     * Removes the workout record of that program day, if it belongs to the
     * plan. Used to discard a half-finished record so the same day can be
     * offered again.
     */
    void deleteWorkoutRecord(Integer profileId, UUID planId, LocalDate programDay);
}
