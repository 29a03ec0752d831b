package com.project.regimen.backend.service;

import com.project.regimen.backend.algorithm.ReindexReconciler;
import com.project.regimen.backend.algorithm.ReindexReconciler.PointerAnchor;
import com.project.regimen.backend.component.ProgressTransitionExecutor;
import com.project.regimen.backend.dto.CreateExerciseRequestDto;
import com.project.regimen.backend.dto.CreatePlanDayRequestDto;
import com.project.regimen.backend.dto.CreatePlanRequestDto;
import com.project.regimen.backend.entity.AppUser;
import com.project.regimen.backend.entity.PlanCycle;
import com.project.regimen.backend.entity.PlanCycleItem;
import com.project.regimen.backend.entity.PlanCycleProgress;
import com.project.regimen.backend.entity.PlanDay;
import com.project.regimen.backend.entity.PlanExercise;
import com.project.regimen.backend.entity.PlanProgress;
import com.project.regimen.backend.entity.WorkoutPlan;
import com.project.regimen.backend.exception.ExceptionMessage;
import com.project.regimen.backend.exception.PlanDoesNotExistException;
import com.project.regimen.backend.repository.AppUserRepository;
import com.project.regimen.backend.repository.PlanCycleProgressRepository;
import com.project.regimen.backend.repository.PlanCycleRepository;
import com.project.regimen.backend.repository.PlanDayRepository;
import com.project.regimen.backend.repository.PlanExerciseRepository;
import com.project.regimen.backend.repository.PlanProgressRepository;
import com.project.regimen.backend.repository.WorkoutPlanRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Plans, their days and exercises.
 *
 * Every edit of a plan's day list is reconciled: the progress pointers into
 * that list (the plan's own progress, and the day pointer of any cycle
 * currently on this plan) keep pointing at the same day afterwards.
 */
@Slf4j
@Service
public class WorkoutPlanService {

    private static final int MAX_LOCK_ATTEMPTS = 5;

    private final WorkoutPlanRepository workoutPlanRepository;
    private final PlanDayRepository planDayRepository;
    private final PlanExerciseRepository planExerciseRepository;
    private final PlanProgressRepository planProgressRepository;
    private final PlanCycleRepository planCycleRepository;
    private final PlanCycleProgressRepository planCycleProgressRepository;
    private final AppUserRepository appUserRepository;
    private final ProgressTransitionExecutor transitionExecutor;

    WorkoutPlanService(WorkoutPlanRepository workoutPlanRepository,
                       PlanDayRepository planDayRepository,
                       PlanExerciseRepository planExerciseRepository,
                       PlanProgressRepository planProgressRepository,
                       PlanCycleRepository planCycleRepository,
                       PlanCycleProgressRepository planCycleProgressRepository,
                       AppUserRepository appUserRepository,
                       ProgressTransitionExecutor transitionExecutor) {
        this.workoutPlanRepository = workoutPlanRepository;
        this.planDayRepository = planDayRepository;
        this.planExerciseRepository = planExerciseRepository;
        this.planProgressRepository = planProgressRepository;
        this.planCycleRepository = planCycleRepository;
        this.planCycleProgressRepository = planCycleProgressRepository;
        this.appUserRepository = appUserRepository;
        this.transitionExecutor = transitionExecutor;
    }

    @Transactional
    public WorkoutPlan createPlan(Integer profileId, CreatePlanRequestDto request) {
        WorkoutPlan plan = WorkoutPlan.builder()
                .profileId(profileId)
                .name(request.getName())
                .note(request.getNote())
                .build();
        WorkoutPlan saved = workoutPlanRepository.save(plan);
        log.info("Created plan {} for profile {}", saved.getId(), profileId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<WorkoutPlan> getPlans(Integer profileId) {
        return workoutPlanRepository.findByProfileIdOrderByCreatedAtAsc(profileId);
    }

    @Transactional(readOnly = true)
    public WorkoutPlan getPlan(Integer profileId, UUID planId) {
        return workoutPlanRepository.findByIdAndProfileId(planId, profileId)
                .orElseThrow(() -> new PlanDoesNotExistException(ExceptionMessage.PLAN_DOES_NOT_EXIST));
    }

    /**
     * Deletes a plan with its progress. Cycle items that reference it stay
     * and are skipped when the cycle advances.
     */
    public void deletePlan(Integer profileId, UUID planId) {
        transitionExecutor.run(ProgressTransitionExecutor.planKey(profileId, planId), () -> {
            WorkoutPlan plan = getPlan(profileId, planId);
            planProgressRepository.deleteByPlanId(planId);
            for (AppUser user : appUserRepository.findByActivePlanId(planId)) {
                user.setActivePlanId(null);
            }
            workoutPlanRepository.delete(plan);
            log.info("Deleted plan {} of profile {}", planId, profileId);
        });
    }

    // ── day list edits ────────────────────────────────────────────────────

    public PlanDay addDay(Integer profileId, UUID planId, CreatePlanDayRequestDto request) {
        return editDays(profileId, planId, plan -> {
            PlanDay day = PlanDay.builder()
                    .name(request.getName())
                    .restDay(request.isRestDay())
                    .build();
            plan.addDay(day);
            return planDayRepository.save(day);
        });
    }

    public WorkoutPlan removeDay(Integer profileId, UUID planId, UUID dayId) {
        return editDays(profileId, planId, plan -> {
            PlanDay day = findDay(plan, dayId);
            plan.removeDay(day);
            return plan;
        });
    }

    /**
     * @param newPosition 1-indexed target position.
     */
    public WorkoutPlan moveDay(Integer profileId, UUID planId, UUID dayId, int newPosition) {
        return editDays(profileId, planId, plan -> {
            plan.moveDay(findDay(plan, dayId), newPosition);
            return plan;
        });
    }

    /**
     * Adding an exercise does not change the day list, only whether a day is
     * empty, so no pointer needs reconciling.
     */
    public PlanExercise addExercise(Integer profileId, UUID planId, UUID dayId, CreateExerciseRequestDto request) {
        return transitionExecutor.execute(ProgressTransitionExecutor.planKey(profileId, planId), () -> {
            WorkoutPlan plan = getPlan(profileId, planId);
            PlanDay day = findDay(plan, dayId);
            PlanExercise exercise = PlanExercise.builder()
                    .name(request.getName())
                    .plannedSetCount(request.getPlannedSetCount())
                    .build();
            day.addExercise(exercise);
            plan.touch();
            return planExerciseRepository.save(exercise);
        });
    }

    /**
     * Runs an edit of the plan's day list while holding the plan's lock and
     * the locks of every cycle that references it, then moves each pointer
     * into the list back onto the day it referred to before.
     *
     * The referencing cycles are looked up before locking; if that set has
     * changed once the locks are held, the locks are dropped and taken again.
     */
    private <T> T editDays(Integer profileId, UUID planId, Function<WorkoutPlan, T> edit) {
        for (int attempt = 1; attempt <= MAX_LOCK_ATTEMPTS; attempt++) {
            Set<UUID> lockedCycles = cycleIds(planCycleRepository.findReferencingPlan(planId));
            List<String> keys = new ArrayList<>();
            keys.add(ProgressTransitionExecutor.planKey(profileId, planId));
            lockedCycles.forEach(cycleId -> keys.add(ProgressTransitionExecutor.cycleKey(cycleId)));

            Optional<T> result = transitionExecutor.execute(keys, () -> {
                List<PlanCycle> referencing = planCycleRepository.findReferencingPlan(planId);
                if (!cycleIds(referencing).equals(lockedCycles)) {
                    return Optional.empty();
                }
                return Optional.of(editLocked(profileId, planId, referencing, edit));
            });
            if (result.isPresent()) {
                return result.get();
            }
            log.debug("Cycles referencing plan {} changed while locking, attempt {}", planId, attempt);
        }
        throw new IllegalStateException("Could not lock the cycles referencing plan " + planId);
    }

    private <T> T editLocked(Integer profileId, UUID planId, List<PlanCycle> referencing,
                             Function<WorkoutPlan, T> edit) {
        WorkoutPlan plan = getPlan(profileId, planId);
        List<PlanDay> before = plan.getSortedDays();

        Map<PlanProgress, PointerAnchor> planAnchors = new LinkedHashMap<>();
        for (PlanProgress progress : planProgressRepository.findByPlanId(planId)) {
            planAnchors.put(progress, ReindexReconciler.capture(before, progress.getState().getCurrentDayIndex(), 1));
        }
        Map<PlanCycleProgress, PointerAnchor> cycleAnchors = new LinkedHashMap<>();
        for (PlanCycle cycle : referencing) {
            planCycleProgressRepository.findByCycleId(cycle.getId())
                    .filter(progress -> isOnPlan(cycle, progress, planId))
                    .ifPresent(progress -> cycleAnchors.put(progress,
                            ReindexReconciler.capture(before, progress.getState().getCurrentDayIndex(), 0)));
        }

        T result = edit.apply(plan);
        plan.reindexDays();
        plan.touch();
        List<PlanDay> after = plan.getSortedDays();

        planAnchors.forEach((progress, anchor) -> {
            int resolved = ReindexReconciler.resolve(anchor, after);
            if (resolved != progress.getState().getCurrentDayIndex()) {
                log.info("Plan {} progress moved from day {} to {} after an edit", planId, anchor.getPointer(), resolved);
                progress.getState().setCurrentDayIndex(resolved);
            }
        });
        cycleAnchors.forEach((progress, anchor) -> {
            int resolved = ReindexReconciler.resolve(anchor, after);
            if (resolved != progress.getState().getCurrentDayIndex()) {
                log.info("Cycle {} day pointer moved from {} to {} after an edit of plan {}",
                        progress.getCycleId(), anchor.getPointer(), resolved, planId);
                progress.getState().setCurrentDayIndex(resolved);
            }
        });
        return result;
    }

    private static Set<UUID> cycleIds(List<PlanCycle> cycles) {
        return cycles.stream().map(PlanCycle::getId).collect(Collectors.toSet());
    }

    private static boolean isOnPlan(PlanCycle cycle, PlanCycleProgress progress, UUID planId) {
        List<PlanCycleItem> items = cycle.getSortedItems();
        int itemIndex = progress.getState().getCurrentItemIndex();
        return itemIndex >= 0 && itemIndex < items.size() && planId.equals(items.get(itemIndex).getPlanId());
    }

    private static PlanDay findDay(WorkoutPlan plan, UUID dayId) {
        return plan.findDay(dayId)
                .orElseThrow(() -> new PlanDoesNotExistException(ExceptionMessage.PLAN_DAY_DOES_NOT_EXIST));
    }
}
