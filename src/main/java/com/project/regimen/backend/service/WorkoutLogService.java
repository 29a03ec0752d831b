package com.project.regimen.backend.service;

import com.project.regimen.backend.component.ProgressTransitionExecutor;
import com.project.regimen.backend.entity.WorkoutDay;
import com.project.regimen.backend.entity.WorkoutEntry;
import com.project.regimen.backend.exception.ExceptionMessage;
import com.project.regimen.backend.exception.WorkoutDoesNotExistException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Set logging. The set that completes a routine credits the completion to
 * the plan or cycle the workout came from.
 */
@Slf4j
@Service
public class WorkoutLogService {

    private final WorkoutService workoutService;
    private final PlanProgressService planProgressService;
    private final CycleService cycleService;
    private final ProgressTransitionExecutor transitionExecutor;

    WorkoutLogService(WorkoutService workoutService,
                      PlanProgressService planProgressService,
                      CycleService cycleService,
                      ProgressTransitionExecutor transitionExecutor) {
        this.workoutService = workoutService;
        this.planProgressService = planProgressService;
        this.cycleService = cycleService;
        this.transitionExecutor = transitionExecutor;
    }

    public WorkoutDay completeSet(Integer profileId, UUID workoutId, UUID entryId) {
        WorkoutDay found = workoutService.getWorkout(profileId, workoutId);
        String key = lockKey(profileId, found);

        return transitionExecutor.execute(key, () -> {
            WorkoutDay workout = workoutService.getWorkout(profileId, workoutId);
            WorkoutEntry entry = workout.getEntries().stream()
                    .filter(candidate -> candidate.getId().equals(entryId))
                    .findFirst()
                    .orElseThrow(() -> new WorkoutDoesNotExistException(ExceptionMessage.WORKOUT_ENTRY_DOES_NOT_EXIST));

            boolean completedBefore = workout.isRoutineCompleted();
            entry.completeSet();
            WorkoutDay saved = workoutService.save(workout);
            log.debug("Set {}/{} logged for {} on {}", entry.getCompletedSetCount(), entry.getPlannedSetCount(),
                    entry.getExerciseName(), workout.getDate());

            if (!completedBefore && saved.isRoutineCompleted()) {
                log.info("Workout {} of profile {} completed", workoutId, profileId);
                if (saved.getCycleId() != null) {
                    cycleService.creditCompletion(saved.getCycleId(), saved.getDate());
                } else {
                    planProgressService.creditCompletion(profileId, saved.getPlanId(), saved.getDate());
                }
            }
            return saved;
        });
    }

    private static String lockKey(Integer profileId, WorkoutDay workout) {
        if (workout.getCycleId() != null) {
            return ProgressTransitionExecutor.cycleKey(workout.getCycleId());
        }
        if (workout.getPlanId() != null) {
            return ProgressTransitionExecutor.planKey(profileId, workout.getPlanId());
        }
        return ProgressTransitionExecutor.workoutKey(workout.getId());
    }
}
