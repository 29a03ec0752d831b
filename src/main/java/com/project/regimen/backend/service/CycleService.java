package com.project.regimen.backend.service;

import com.project.regimen.backend.algorithm.ChangeDayResult;
import com.project.regimen.backend.algorithm.CycleAdvanceOutcome;
import com.project.regimen.backend.algorithm.CyclePosition;
import com.project.regimen.backend.algorithm.CycleProgress;
import com.project.regimen.backend.algorithm.CycleProgressTracker;
import com.project.regimen.backend.algorithm.PreviewProjector;
import com.project.regimen.backend.algorithm.ProgramDayCalendar;
import com.project.regimen.backend.algorithm.ReindexReconciler;
import com.project.regimen.backend.algorithm.ReindexReconciler.PointerAnchor;
import com.project.regimen.backend.component.ProgressTransitionExecutor;
import com.project.regimen.backend.dto.ChangeDayResponseDto;
import com.project.regimen.backend.dto.CreateCycleItemRequestDto;
import com.project.regimen.backend.dto.CreateCycleRequestDto;
import com.project.regimen.backend.dto.CycleStateDto;
import com.project.regimen.backend.dto.PreviewDto;
import com.project.regimen.backend.dto.TodayWorkoutDto;
import com.project.regimen.backend.entity.AppUser;
import com.project.regimen.backend.entity.ExecutionMode;
import com.project.regimen.backend.entity.PlanCycle;
import com.project.regimen.backend.entity.PlanCycleItem;
import com.project.regimen.backend.entity.PlanCycleProgress;
import com.project.regimen.backend.entity.PlanDay;
import com.project.regimen.backend.entity.WorkoutDay;
import com.project.regimen.backend.entity.WorkoutPlan;
import com.project.regimen.backend.exception.CycleDoesNotExistException;
import com.project.regimen.backend.exception.ExceptionMessage;
import com.project.regimen.backend.exception.InvalidProgressRequestException;
import com.project.regimen.backend.exception.PlanDoesNotExistException;
import com.project.regimen.backend.repository.PlanCycleItemRepository;
import com.project.regimen.backend.repository.PlanCycleProgressRepository;
import com.project.regimen.backend.repository.PlanCycleRepository;
import com.project.regimen.backend.repository.WorkoutPlanRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.function.Function;

/**
 * Cycles: management, activation and everything that moves their pointer.
 * Every transition runs under the cycle's lock.
 */
@Slf4j
@Service
public class CycleService {

    private final PlanCycleRepository planCycleRepository;
    private final PlanCycleItemRepository planCycleItemRepository;
    private final PlanCycleProgressRepository planCycleProgressRepository;
    private final WorkoutPlanRepository workoutPlanRepository;
    private final WorkoutService workoutService;
    private final AppUserService appUserService;
    private final CycleProgressTracker tracker;
    private final ProgressTransitionExecutor transitionExecutor;
    private final Clock clock;

    CycleService(PlanCycleRepository planCycleRepository,
                 PlanCycleItemRepository planCycleItemRepository,
                 PlanCycleProgressRepository planCycleProgressRepository,
                 WorkoutPlanRepository workoutPlanRepository,
                 WorkoutService workoutService,
                 AppUserService appUserService,
                 CycleProgressTracker tracker,
                 ProgressTransitionExecutor transitionExecutor,
                 Clock clock) {
        this.planCycleRepository = planCycleRepository;
        this.planCycleItemRepository = planCycleItemRepository;
        this.planCycleProgressRepository = planCycleProgressRepository;
        this.workoutPlanRepository = workoutPlanRepository;
        this.workoutService = workoutService;
        this.appUserService = appUserService;
        this.tracker = tracker;
        this.transitionExecutor = transitionExecutor;
        this.clock = clock;
    }

    // ── management ────────────────────────────────────────────────────────

    @Transactional
    public PlanCycle createCycle(Integer profileId, CreateCycleRequestDto request) {
        PlanCycle cycle = planCycleRepository.save(PlanCycle.builder()
                .profileId(profileId)
                .name(request.getName())
                .build());
        log.info("Created cycle {} for profile {}", cycle.getId(), profileId);
        return cycle;
    }

    @Transactional(readOnly = true)
    public List<PlanCycle> getCycles(Integer profileId) {
        return planCycleRepository.findByProfileIdOrderByCreatedAtAsc(profileId);
    }

    @Transactional(readOnly = true)
    public PlanCycle getCycle(Integer profileId, UUID cycleId) {
        return planCycleRepository.findByIdAndProfileId(cycleId, profileId)
                .orElseThrow(() -> new CycleDoesNotExistException(ExceptionMessage.CYCLE_DOES_NOT_EXIST));
    }

    /**
     * Makes this the profile's only active cycle.
     */
    public PlanCycle activate(Integer profileId, UUID cycleId) {
        return transitionExecutor.execute(ProgressTransitionExecutor.cycleKey(cycleId), () -> {
            PlanCycle cycle = getCycle(profileId, cycleId);
            for (PlanCycle other : planCycleRepository.findByProfileIdOrderByCreatedAtAsc(profileId)) {
                if (!other.getId().equals(cycleId) && other.isActive()) {
                    other.setActive(false);
                    log.info("Deactivated cycle {} of profile {}", other.getId(), profileId);
                }
            }
            cycle.setActive(true);
            getOrCreateProgress(cycleId);
            log.info("Activated cycle {} of profile {}", cycleId, profileId);
            return cycle;
        });
    }

    @Transactional
    public PlanCycle deactivate(Integer profileId, UUID cycleId) {
        PlanCycle cycle = getCycle(profileId, cycleId);
        cycle.setActive(false);
        log.info("Deactivated cycle {} of profile {}", cycleId, profileId);
        return cycle;
    }

    public void deleteCycle(Integer profileId, UUID cycleId) {
        transitionExecutor.run(ProgressTransitionExecutor.cycleKey(cycleId), () -> {
            PlanCycle cycle = getCycle(profileId, cycleId);
            planCycleProgressRepository.deleteByCycleId(cycleId);
            planCycleRepository.delete(cycle);
            log.info("Deleted cycle {} of profile {}", cycleId, profileId);
        });
    }

    // ── item list edits ───────────────────────────────────────────────────

    public PlanCycleItem addItem(Integer profileId, UUID cycleId, CreateCycleItemRequestDto request) {
        workoutPlanRepository.findByIdAndProfileId(request.getPlanId(), profileId)
                .orElseThrow(() -> new PlanDoesNotExistException(ExceptionMessage.PLAN_DOES_NOT_EXIST));
        return editItems(profileId, cycleId, cycle -> {
            PlanCycleItem item = PlanCycleItem.builder()
                    .planId(request.getPlanId())
                    .note(request.getNote())
                    .build();
            cycle.addItem(item);
            return planCycleItemRepository.save(item);
        });
    }

    public PlanCycle removeItem(Integer profileId, UUID cycleId, UUID itemId) {
        return editItems(profileId, cycleId, cycle -> {
            cycle.removeItem(findItem(cycle, itemId));
            return cycle;
        });
    }

    /**
     * @param newPosition 0-indexed target position.
     */
    public PlanCycle moveItem(Integer profileId, UUID cycleId, UUID itemId, int newPosition) {
        return editItems(profileId, cycleId, cycle -> {
            cycle.moveItem(findItem(cycle, itemId), newPosition);
            return cycle;
        });
    }

    /**
     * Runs an edit of the item list and keeps the item pointer on the same
     * item. If that item was removed the pointer is clamped and the day
     * pointer starts over at the first day.
     */
    private <T> T editItems(Integer profileId, UUID cycleId, Function<PlanCycle, T> edit) {
        return transitionExecutor.execute(ProgressTransitionExecutor.cycleKey(cycleId), () -> {
            PlanCycle cycle = getCycle(profileId, cycleId);
            Optional<PlanCycleProgress> progress = planCycleProgressRepository.findByCycleId(cycleId);
            Optional<PointerAnchor> anchor = progress.map(p ->
                    ReindexReconciler.capture(cycle.getSortedItems(), p.getState().getCurrentItemIndex(), 0));

            T result = edit.apply(cycle);
            cycle.reindexItems();

            if (progress.isPresent()) {
                List<PlanCycleItem> after = cycle.getSortedItems();
                CycleProgress state = progress.get().getState();
                int resolved = ReindexReconciler.resolve(anchor.get(), after);
                boolean sameItem = anchor.get().getEntryId() != null
                        && after.stream().anyMatch(item -> item.getId().equals(anchor.get().getEntryId()));
                if (!sameItem) {
                    state.setCurrentDayIndex(0);
                }
                if (resolved != state.getCurrentItemIndex() || !sameItem) {
                    log.info("Cycle {} pointer moved from item {} to {} after an edit", cycleId, anchor.get().getPointer(), resolved);
                }
                state.setCurrentItemIndex(resolved);
            }
            return result;
        });
    }

    // ── progression ───────────────────────────────────────────────────────

    /**
     * Resolves today's workout from the profile's active cycle. The first
     * open of a program day moves the cycle on when the day shown last time
     * was completed; any open also skips past items whose plan has since been
     * deleted or emptied.
     */
    public TodayWorkoutDto openToday(Integer profileId, LocalDate today) {
        PlanCycle active = planCycleRepository.findFirstByProfileIdAndActiveTrue(profileId)
                .orElseThrow(() -> new InvalidProgressRequestException(ExceptionMessage.NO_ACTIVE_CYCLE));
        UUID cycleId = active.getId();

        return transitionExecutor.execute(ProgressTransitionExecutor.cycleKey(cycleId), () -> {
            PlanCycle cycle = getCycle(profileId, cycleId);
            PlanCycleProgress progress = getOrCreateProgress(cycleId);
            List<PlanCycleItem> items = cycle.getSortedItems();
            CycleAdvanceOutcome outcome = tracker.handleAppOpen(items, progress.getState(), today, clock.instant());
            if (outcome == CycleAdvanceOutcome.ADVANCED) {
                log.info("Cycle {} of profile {} advanced on open to item {} day {}", cycleId, profileId,
                        progress.getState().getCurrentItemIndex(), progress.getState().getCurrentDayIndex());
            }

            Optional<CyclePosition> position = tracker.currentPosition(items, progress.getState());
            if (position.isEmpty()) {
                outcome = tracker.advance(items, progress.getState(), clock.instant());
                position = tracker.currentPosition(items, progress.getState());
            }

            TodayWorkoutDto.TodayWorkoutDtoBuilder response = TodayWorkoutDto.builder()
                    .programDay(today)
                    .mode(ExecutionMode.CYCLE)
                    .cycleId(cycleId)
                    .outcome(outcome.name())
                    .reason(outcome.name())
                    .itemIndex(progress.getState().getCurrentItemIndex())
                    .dayIndex(progress.getState().getCurrentDayIndex());

            if (position.isEmpty()) {
                log.warn("Cycle {} of profile {} has nothing to show: {}", cycleId, profileId, outcome);
                return response.build();
            }

            UUID planId = position.get().getPlanId();
            WorkoutPlan plan = workoutPlanRepository.findById(planId)
                    .orElseThrow(() -> new PlanDoesNotExistException(ExceptionMessage.PLAN_DOES_NOT_EXIST));
            PlanDay day = plan.findDay(position.get().getDay().getId())
                    .orElseThrow(() -> new PlanDoesNotExistException(ExceptionMessage.PLAN_DAY_DOES_NOT_EXIST));
            WorkoutDay workout = workoutService.getOrCreateWorkout(profileId, today, planId, cycleId, day);

            return response.planId(planId)
                    .itemIndex(progress.getState().getCurrentItemIndex())
                    .dayIndex(progress.getState().getCurrentDayIndex())
                    .workout(workout)
                    .build();
        });
    }

    public CycleStateDto advance(Integer profileId, UUID cycleId) {
        return transitionExecutor.execute(ProgressTransitionExecutor.cycleKey(cycleId), () -> {
            PlanCycle cycle = getCycle(profileId, cycleId);
            PlanCycleProgress progress = getOrCreateProgress(cycleId);
            CycleAdvanceOutcome outcome = tracker.advance(cycle.getSortedItems(), progress.getState(), clock.instant());
            log.info("Cycle {} advanced by hand: {}, now item {} day {}", cycleId, outcome,
                    progress.getState().getCurrentItemIndex(), progress.getState().getCurrentDayIndex());
            return CycleStateDto.of(cycleId, outcome, progress.getState());
        });
    }

    public CycleStateDto reset(Integer profileId, UUID cycleId) {
        return transitionExecutor.execute(ProgressTransitionExecutor.cycleKey(cycleId), () -> {
            getCycle(profileId, cycleId);
            PlanCycleProgress progress = getOrCreateProgress(cycleId);
            tracker.reset(progress.getState());
            log.info("Cycle {} of profile {} reset", cycleId, profileId);
            return CycleStateDto.of(cycleId, CycleAdvanceOutcome.NO_OP, progress.getState());
        });
    }

    @Transactional(readOnly = true)
    public CycleStateDto getState(Integer profileId, UUID cycleId) {
        getCycle(profileId, cycleId);
        CycleProgress state = planCycleProgressRepository.findByCycleId(cycleId)
                .map(PlanCycleProgress::getState)
                .orElseGet(CycleProgress::new);
        return CycleStateDto.of(cycleId, CycleAdvanceOutcome.NO_OP, state);
    }

    /**
     * Rescue path for a completion the client reports after the fact.
     */
    public CycleStateDto recordCompletion(Integer profileId, UUID cycleId, LocalDate completionDate) {
        getCycle(profileId, cycleId);
        AppUser user = appUserService.loadUserById(profileId);
        LocalDate today = ProgramDayCalendar.today(clock, user.getDayBoundaryHour());
        if (completionDate.isAfter(today)) {
            throw new InvalidProgressRequestException(ExceptionMessage.FUTURE_COMPLETION);
        }
        return creditCompletion(cycleId, completionDate);
    }

    /**
     * Credits a completed workout without checking ownership. Used when a
     * workout materialized from the cycle becomes complete.
     */
    public CycleStateDto creditCompletion(UUID cycleId, LocalDate completionDate) {
        return transitionExecutor.execute(ProgressTransitionExecutor.cycleKey(cycleId), () -> {
            Optional<PlanCycle> cycle = planCycleRepository.findById(cycleId);
            if (cycle.isEmpty()) {
                log.warn("Completion {} for deleted cycle {} ignored", completionDate, cycleId);
                return CycleStateDto.of(cycleId, CycleAdvanceOutcome.EMPTY_CYCLE, new CycleProgress());
            }
            PlanCycleProgress progress = getOrCreateProgress(cycleId);
            CycleAdvanceOutcome outcome = tracker.recordCompletion(cycle.get().getSortedItems(), progress.getState(),
                    completionDate, clock.instant());
            log.info("Completion {} for cycle {}: {}, now item {} day {}", completionDate, cycleId, outcome,
                    progress.getState().getCurrentItemIndex(), progress.getState().getCurrentDayIndex());
            return CycleStateDto.of(cycleId, outcome, progress.getState());
        });
    }

    /**
     * Replaces today's workout with another day of the cycle's current plan.
     *
     * @param newDayIndex 0-indexed day inside the current plan.
     */
    public ChangeDayResponseDto changeDay(Integer profileId, UUID cycleId, int newDayIndex, boolean skipAndAdvance) {
        getCycle(profileId, cycleId);
        AppUser user = appUserService.loadUserById(profileId);
        LocalDate today = ProgramDayCalendar.today(clock, user.getDayBoundaryHour());

        return transitionExecutor.execute(ProgressTransitionExecutor.cycleKey(cycleId), () -> {
            PlanCycle cycle = getCycle(profileId, cycleId);
            PlanCycleProgress progress = getOrCreateProgress(cycleId);
            List<PlanCycleItem> items = cycle.getSortedItems();
            Optional<WorkoutDay> displayed = workoutService.findWorkout(profileId, today);
            int completedSets = displayed.map(WorkoutDay::getTotalCompletedSets).orElse(0);

            ChangeDayResult result = tracker.changeDay(items, progress.getState(), completedSets, newDayIndex,
                    skipAndAdvance, clock.instant());
            if (!result.isChanged()) {
                log.warn("Day change of cycle {} to {} refused: {}", cycleId, newDayIndex, result.getOutcome());
                return new ChangeDayResponseDto(result.getOutcome(), progress.getState().getCurrentDayIndex(),
                        displayed.orElse(null));
            }

            UUID planId = items.get(progress.getState().getCurrentItemIndex()).getPlanId();
            WorkoutPlan plan = workoutPlanRepository.findById(planId)
                    .orElseThrow(() -> new PlanDoesNotExistException(ExceptionMessage.PLAN_DOES_NOT_EXIST));
            PlanDay day = plan.findDay(result.getTargetDay().getId())
                    .orElseThrow(() -> new PlanDoesNotExistException(ExceptionMessage.PLAN_DAY_DOES_NOT_EXIST));

            WorkoutDay workout;
            if (displayed.isPresent()) {
                workout = displayed.get();
                workout.setPlanId(planId);
                workout.setCycleId(cycleId);
                workoutService.materializeDay(day, workout);
                workout = workoutService.save(workout);
            } else {
                workout = workoutService.getOrCreateWorkout(profileId, today, planId, cycleId, day);
            }

            log.info("Profile {} switched cycle {} to day {} (skip: {}), pointer now {}",
                    profileId, cycleId, newDayIndex, skipAndAdvance, result.getDayIndex());
            return new ChangeDayResponseDto(result.getOutcome(), result.getDayIndex(), workout);
        });
    }

    /**
     * Which day of the current plan the cycle would show on {@code date}.
     * Previews do not cross into the next item.
     */
    @Transactional(readOnly = true)
    public PreviewDto preview(Integer profileId, UUID cycleId, LocalDate date) {
        PlanCycle cycle = getCycle(profileId, cycleId);
        AppUser user = appUserService.loadUserById(profileId);
        LocalDate today = ProgramDayCalendar.today(clock, user.getDayBoundaryHour());
        int daysDifference = ProgramDayCalendar.daysBetween(today, date);

        CycleProgress state = planCycleProgressRepository.findByCycleId(cycleId)
                .map(PlanCycleProgress::getState)
                .orElseGet(CycleProgress::new);
        List<PlanCycleItem> items = cycle.getSortedItems();
        int itemIndex = state.getCurrentItemIndex();
        if (itemIndex < 0 || itemIndex >= items.size()) {
            return PreviewDto.unavailable(date, daysDifference, null);
        }

        UUID planId = items.get(itemIndex).getPlanId();
        Optional<WorkoutPlan> plan = workoutPlanRepository.findById(planId);
        int totalDays = plan.map(p -> p.getDays().size()).orElse(0);
        OptionalInt dayIndex = PreviewProjector.previewCycleDayIndex(state.getCurrentDayIndex(), totalDays, daysDifference);
        if (dayIndex.isEmpty()) {
            return PreviewDto.unavailable(date, daysDifference, planId);
        }
        // 0-indexed pointer, days are looked up 1-indexed
        String dayName = plan.get().dayAt(dayIndex.getAsInt() + 1).map(PlanDay::getName).orElse(null);
        return new PreviewDto(date, daysDifference, planId, dayIndex.getAsInt(), totalDays, dayName);
    }

    private PlanCycleProgress getOrCreateProgress(UUID cycleId) {
        return planCycleProgressRepository.findByCycleId(cycleId)
                .orElseGet(() -> {
                    log.info("Creating progress for cycle {}", cycleId);
                    return planCycleProgressRepository.save(PlanCycleProgress.builder().cycleId(cycleId).build());
                });
    }

    private static PlanCycleItem findItem(PlanCycle cycle, UUID itemId) {
        return cycle.findItem(itemId)
                .orElseThrow(() -> new CycleDoesNotExistException(ExceptionMessage.CYCLE_ITEM_DOES_NOT_EXIST));
    }
}
