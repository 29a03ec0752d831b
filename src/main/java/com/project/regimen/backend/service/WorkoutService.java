package com.project.regimen.backend.service;

import com.project.regimen.backend.entity.PlanDay;
import com.project.regimen.backend.entity.PlanExercise;
import com.project.regimen.backend.entity.WorkoutDay;
import com.project.regimen.backend.entity.WorkoutEntry;
import com.project.regimen.backend.exception.ExceptionMessage;
import com.project.regimen.backend.exception.WorkoutDoesNotExistException;
import com.project.regimen.backend.repository.WorkoutDayRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Workout records: one per profile and program day, filled from a plan day.
 */
@Slf4j
@Service
public class WorkoutService {

    private final WorkoutDayRepository workoutDayRepository;

    WorkoutService(WorkoutDayRepository workoutDayRepository) {
        this.workoutDayRepository = workoutDayRepository;
    }

    public WorkoutDay getWorkout(Integer profileId, UUID workoutId) {
        return workoutDayRepository.findByIdAndProfileId(workoutId, profileId)
                .orElseThrow(() -> new WorkoutDoesNotExistException(ExceptionMessage.WORKOUT_DOES_NOT_EXIST));
    }

    public Optional<WorkoutDay> findWorkout(Integer profileId, LocalDate programDay) {
        return workoutDayRepository.findByProfileIdAndDate(profileId, programDay);
    }

    /**
     * Returns the workout of that program day, creating it (and filling it
     * from {@code planDay}) when there is none yet.
     *
     * An existing workout already linked to the plan, or holding entries of
     * its own, is returned as is. An empty unlinked one is taken over.
     */
    public WorkoutDay getOrCreateWorkout(Integer profileId, LocalDate programDay, UUID planId, UUID cycleId,
                                         PlanDay planDay) {
        Optional<WorkoutDay> existing = workoutDayRepository.findByProfileIdAndDate(profileId, programDay);
        if (existing.isPresent()) {
            WorkoutDay workout = existing.get();
            if (planId.equals(workout.getPlanId()) || !workout.getEntries().isEmpty()) {
                return workout;
            }
            workout.setPlanId(planId);
            workout.setCycleId(cycleId);
            materializeDay(planDay, workout);
            return workoutDayRepository.save(workout);
        }

        WorkoutDay workout = WorkoutDay.builder()
                .profileId(profileId)
                .date(programDay)
                .planId(planId)
                .cycleId(cycleId)
                .build();
        materializeDay(planDay, workout);
        log.info("Created workout for profile {} on {} from day {}", profileId, programDay, planDay.getId());
        return workoutDayRepository.save(workout);
    }

    /**
     * Replaces the entries of {@code workout} with one entry per exercise of
     * {@code planDay}.
     */
    public void materializeDay(PlanDay planDay, WorkoutDay workout) {
        workout.clearEntries();
        workout.setPlanDayId(planDay.getId());
        workout.setDayName(planDay.getName());
        for (PlanExercise exercise : planDay.getSortedExercises()) {
            workout.addEntry(WorkoutEntry.builder()
                    .exerciseName(exercise.getName())
                    .orderIndex(exercise.getOrderIndex())
                    .plannedSetCount(exercise.getPlannedSetCount())
                    .build());
        }
    }

    public WorkoutDay save(WorkoutDay workout) {
        return workoutDayRepository.save(workout);
    }
}
