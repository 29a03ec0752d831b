package com.project.regimen.backend.service;

import com.project.regimen.backend.algorithm.ChangeDayResult;
import com.project.regimen.backend.algorithm.ProgramDayCalendar;
import com.project.regimen.backend.algorithm.ProgressTransition;
import com.project.regimen.backend.algorithm.PreviewProjector;
import com.project.regimen.backend.algorithm.ReindexReconciler;
import com.project.regimen.backend.algorithm.SinglePlanProgress;
import com.project.regimen.backend.algorithm.SinglePlanProgressTracker;
import com.project.regimen.backend.component.ProgressTransitionExecutor;
import com.project.regimen.backend.dto.ChangeDayResponseDto;
import com.project.regimen.backend.dto.PreviewDto;
import com.project.regimen.backend.dto.TodayWorkoutDto;
import com.project.regimen.backend.entity.AppUser;
import com.project.regimen.backend.entity.ExecutionMode;
import com.project.regimen.backend.entity.PlanDay;
import com.project.regimen.backend.entity.PlanProgress;
import com.project.regimen.backend.entity.WorkoutDay;
import com.project.regimen.backend.entity.WorkoutPlan;
import com.project.regimen.backend.exception.ExceptionMessage;
import com.project.regimen.backend.exception.InvalidProgressRequestException;
import com.project.regimen.backend.exception.PlanDoesNotExistException;
import com.project.regimen.backend.repository.PlanProgressRepository;
import com.project.regimen.backend.repository.WorkoutPlanRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Host side of single-plan progression: loads the stored progress, runs the
 * tracker under the plan's lock and turns the result into a workout record.
 */
@Slf4j
@Service
public class PlanProgressService {

    private final PlanProgressRepository planProgressRepository;
    private final WorkoutPlanRepository workoutPlanRepository;
    private final WorkoutPlanService workoutPlanService;
    private final WorkoutService workoutService;
    private final CycleService cycleService;
    private final AppUserService appUserService;
    private final SinglePlanProgressTracker tracker;
    private final ProgressTransitionExecutor transitionExecutor;
    private final Clock clock;

    PlanProgressService(PlanProgressRepository planProgressRepository,
                        WorkoutPlanRepository workoutPlanRepository,
                        WorkoutPlanService workoutPlanService,
                        WorkoutService workoutService,
                        CycleService cycleService,
                        AppUserService appUserService,
                        SinglePlanProgressTracker tracker,
                        ProgressTransitionExecutor transitionExecutor,
                        Clock clock) {
        this.planProgressRepository = planProgressRepository;
        this.workoutPlanRepository = workoutPlanRepository;
        this.workoutPlanService = workoutPlanService;
        this.workoutService = workoutService;
        this.cycleService = cycleService;
        this.appUserService = appUserService;
        this.tracker = tracker;
        this.transitionExecutor = transitionExecutor;
        this.clock = clock;
    }

    /**
     * Resolves today's workout for the profile, following its execution mode.
     */
    public TodayWorkoutDto openToday(Integer profileId) {
        AppUser user = appUserService.loadUserById(profileId);
        LocalDate today = ProgramDayCalendar.today(clock, user.getDayBoundaryHour());

        if (user.getExecutionMode() == ExecutionMode.CYCLE) {
            return cycleService.openToday(profileId, today);
        }

        UUID planId = user.getActivePlanId();
        if (planId == null) {
            throw new InvalidProgressRequestException(ExceptionMessage.NO_ACTIVE_PLAN);
        }
        return transitionExecutor.execute(ProgressTransitionExecutor.planKey(profileId, planId),
                () -> openPlan(profileId, planId, today));
    }

    private TodayWorkoutDto openPlan(Integer profileId, UUID planId, LocalDate today) {
        PlanProgress progress = getOrCreateProgress(profileId, planId);
        SinglePlanProgress state = progress.getState();

        ProgressTransition transition = tracker.handleAppOpen(profileId, planId, state, today);
        TodayWorkoutDto.TodayWorkoutDtoBuilder response = TodayWorkoutDto.builder()
                .programDay(today)
                .mode(ExecutionMode.SINGLE)
                .planId(planId)
                .outcome(transition.getOutcome().name())
                .reason(transition.getReason().name())
                .staleRecordDiscarded(transition.isStaleRecordDiscarded());

        if (transition.isInvalid()) {
            log.warn("Plan {} of profile {} has nothing to show: {}", planId, profileId, transition.getReason());
            return response.dayIndex(transition.getDayIndex()).build();
        }

        WorkoutPlan plan = workoutPlanRepository.findById(planId)
                .orElseThrow(() -> new PlanDoesNotExistException(ExceptionMessage.PLAN_DOES_NOT_EXIST));

        // positions may have gaps left by older edits; close them and keep the pointer on its day
        int dayIndex = ReindexReconciler.reconcile(plan.getSortedDays(), state.getCurrentDayIndex(), 1, () -> {
            plan.reindexDays();
            return plan.getSortedDays();
        });
        state.setCurrentDayIndex(dayIndex);
        planProgressRepository.save(progress);

        PlanDay day = plan.dayAt(dayIndex)
                .orElseThrow(() -> new IllegalStateException("Day " + dayIndex + " missing from plan " + planId));
        WorkoutDay workout = workoutService.getOrCreateWorkout(profileId, today, planId, null, day);

        if (transition.isAdvanced()) {
            log.info("Plan {} of profile {} advanced to day {} ({})", planId, profileId, dayIndex, transition.getReason());
        }
        return response.dayIndex(dayIndex).workout(workout).build();
    }

    /**
     * Rescue path for a completion the client reports after the fact.
     */
    public ProgressTransition recordCompletion(Integer profileId, UUID planId, LocalDate completionDate) {
        workoutPlanService.getPlan(profileId, planId);
        AppUser user = appUserService.loadUserById(profileId);
        LocalDate today = ProgramDayCalendar.today(clock, user.getDayBoundaryHour());
        if (completionDate.isAfter(today)) {
            throw new InvalidProgressRequestException(ExceptionMessage.FUTURE_COMPLETION);
        }
        return creditCompletion(profileId, planId, completionDate);
    }

    /**
     * Credits a completed workout without checking ownership. Used when a
     * workout materialized from the plan becomes complete.
     */
    public ProgressTransition creditCompletion(Integer profileId, UUID planId, LocalDate completionDate) {
        return transitionExecutor.execute(ProgressTransitionExecutor.planKey(profileId, planId), () -> {
            PlanProgress progress = getOrCreateProgress(profileId, planId);
            ProgressTransition transition = tracker.recordCompletion(planId, progress.getState(), completionDate);
            if (!transition.isInvalid()) {
                planProgressRepository.save(progress);
            }
            log.info("Completion {} for plan {} of profile {}: {} {}, now day {}", completionDate, planId, profileId,
                    transition.getOutcome(), transition.getReason(), transition.getDayIndex());
            return transition;
        });
    }

    /**
     * Replaces today's workout with another day of the plan.
     *
     * @param newDayIndex 1-indexed day to switch to.
     */
    public ChangeDayResponseDto changeDay(Integer profileId, UUID planId, int newDayIndex, boolean skipAndAdvance) {
        workoutPlanService.getPlan(profileId, planId);
        AppUser user = appUserService.loadUserById(profileId);
        LocalDate today = ProgramDayCalendar.today(clock, user.getDayBoundaryHour());

        return transitionExecutor.execute(ProgressTransitionExecutor.planKey(profileId, planId), () -> {
            PlanProgress progress = getOrCreateProgress(profileId, planId);
            Optional<WorkoutDay> displayed = workoutService.findWorkout(profileId, today);
            int completedSets = displayed.map(WorkoutDay::getTotalCompletedSets).orElse(0);

            ChangeDayResult result = tracker.changeDay(planId, progress.getState(), completedSets, newDayIndex, skipAndAdvance);
            if (!result.isChanged()) {
                log.warn("Day change of plan {} to {} refused: {}", planId, newDayIndex, result.getOutcome());
                return new ChangeDayResponseDto(result.getOutcome(), progress.getState().getCurrentDayIndex(),
                        displayed.orElse(null));
            }

            WorkoutPlan plan = workoutPlanRepository.findById(planId)
                    .orElseThrow(() -> new PlanDoesNotExistException(ExceptionMessage.PLAN_DOES_NOT_EXIST));
            PlanDay day = plan.findDay(result.getTargetDay().getId())
                    .orElseThrow(() -> new PlanDoesNotExistException(ExceptionMessage.PLAN_DAY_DOES_NOT_EXIST));
            WorkoutDay workout = materializeToday(profileId, today, planId, displayed, day);
            planProgressRepository.save(progress);

            log.info("Profile {} switched plan {} to day {} (skip: {}), pointer now {}",
                    profileId, planId, newDayIndex, skipAndAdvance, result.getDayIndex());
            return new ChangeDayResponseDto(result.getOutcome(), result.getDayIndex(), workout);
        });
    }

    private WorkoutDay materializeToday(Integer profileId, LocalDate today, UUID planId,
                                        Optional<WorkoutDay> displayed, PlanDay day) {
        if (displayed.isEmpty()) {
            return workoutService.getOrCreateWorkout(profileId, today, planId, null, day);
        }
        WorkoutDay workout = displayed.get();
        workout.setPlanId(planId);
        workout.setCycleId(null);
        workoutService.materializeDay(day, workout);
        return workoutService.save(workout);
    }

    /**
     * Which day the plan would show on {@code date}. Reads only.
     */
    @Transactional(readOnly = true)
    public PreviewDto preview(Integer profileId, UUID planId, LocalDate date) {
        WorkoutPlan plan = workoutPlanService.getPlan(profileId, planId);
        AppUser user = appUserService.loadUserById(profileId);
        LocalDate today = ProgramDayCalendar.today(clock, user.getDayBoundaryHour());
        int daysDifference = ProgramDayCalendar.daysBetween(today, date);

        int currentDayIndex = planProgressRepository.findByProfileIdAndPlanId(profileId, planId)
                .map(progress -> progress.getState().getCurrentDayIndex())
                .orElse(SinglePlanProgress.FIRST_DAY_INDEX);
        int totalDays = plan.getDays().size();

        OptionalInt dayIndex = PreviewProjector.previewDayIndex(currentDayIndex, totalDays, daysDifference);
        if (dayIndex.isEmpty()) {
            return PreviewDto.unavailable(date, daysDifference, planId);
        }
        String dayName = plan.dayAt(dayIndex.getAsInt()).map(PlanDay::getName).orElse(null);
        return new PreviewDto(date, daysDifference, planId, dayIndex.getAsInt(), totalDays, dayName);
    }

    @Transactional(readOnly = true)
    public SinglePlanProgress getProgress(Integer profileId, UUID planId) {
        workoutPlanService.getPlan(profileId, planId);
        return planProgressRepository.findByProfileIdAndPlanId(profileId, planId)
                .map(PlanProgress::getState)
                .orElseGet(SinglePlanProgress::new);
    }

    // a new progress is only persisted once a transition went through
    private PlanProgress getOrCreateProgress(Integer profileId, UUID planId) {
        return planProgressRepository.findByProfileIdAndPlanId(profileId, planId)
                .orElseGet(() -> {
                    log.info("Creating progress for plan {} of profile {}", planId, profileId);
                    return PlanProgress.builder()
                            .profileId(profileId)
                            .planId(planId)
                            .build();
                });
    }
}
