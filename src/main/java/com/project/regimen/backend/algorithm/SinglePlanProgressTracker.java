package com.project.regimen.backend.algorithm;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides which day of a plan is shown "today" and when the pointer moves.
 *
 * Two operations mutate a {@link SinglePlanProgress}. {@link #handleAppOpen}
 * runs once per program day and advances at most one step, based on how the
 * previously opened day went. {@link #recordCompletion} credits a completion
 * that was recorded after the fact (backfill).
 *
 * {@link #changeDay} lets the user pick another day by hand.
 *
 * The tracker never persists anything. The caller owns the progress object
 * and is expected to serialize calls for the same (profile, plan).
 */
@Slf4j
public class SinglePlanProgressTracker {

    private final PlanStore planStore;

    public SinglePlanProgressTracker(PlanStore planStore) {
        this.planStore = planStore;
    }

    // ── open-time path ────────────────────────────────────────────────────

    public ProgressTransition handleAppOpen(Integer profileId, UUID planId, SinglePlanProgress progress, LocalDate today) {
        Optional<List<ScheduledDay>> plan = planStore.daysOf(planId);
        if (plan.isEmpty()) {
            log.debug("Open of missing plan {} ignored", planId);
            return ProgressTransition.invalid(TransitionReason.PLAN_NOT_FOUND);
        }
        List<ScheduledDay> days = sorted(plan.get());
        if (days.isEmpty()) {
            log.debug("Open of empty plan {} ignored", planId);
            return ProgressTransition.invalid(TransitionReason.PLAN_EMPTY);
        }

        LocalDate lastOpened = progress.getLastOpenedDate();

        if (lastOpened == null) {
            progress.setLastOpenedDate(today);
            return ProgressTransition.unchanged(TransitionReason.FIRST_OPEN, progress.getCurrentDayIndex());
        }

        if (ProgramDayCalendar.isSameDay(lastOpened, today)) {
            return ProgressTransition.unchanged(TransitionReason.SAME_PROGRAM_DAY, progress.getCurrentDayIndex());
        }

        ProgressTransition transition = evaluatePreviousDay(profileId, planId, progress, days, lastOpened);
        progress.setLastOpenedDate(today);

        log.debug("Plan {} opened on {} after {}: {} (day {})",
                planId, today, lastOpened, transition.getReason(), transition.getDayIndex());
        return transition;
    }

    private ProgressTransition evaluatePreviousDay(Integer profileId, UUID planId, SinglePlanProgress progress,
                                                   List<ScheduledDay> days, LocalDate lastOpened) {
        Optional<ScheduledDay> previousDay = dayAt(days, progress.getCurrentDayIndex());

        if (previousDay.isPresent() && previousDay.get().isRestDay()) {
            progress.advance(days.size());
            return ProgressTransition.advanced(TransitionReason.REST_DAY, progress.getCurrentDayIndex());
        }

        // completion reported for that day through the rescue path
        if (lastOpened.equals(progress.getLastCompletedDate())) {
            progress.advance(days.size());
            return ProgressTransition.advanced(TransitionReason.PREVIOUS_DAY_COMPLETED, progress.getCurrentDayIndex());
        }

        WorkoutRecordStatus status = planStore.workoutRecordStatus(profileId, planId, lastOpened);
        switch (status) {
            case COMPLETE:
                progress.advance(days.size());
                progress.creditCompletion(lastOpened);
                return ProgressTransition.advanced(TransitionReason.PREVIOUS_DAY_COMPLETED, progress.getCurrentDayIndex());
            case INCOMPLETE:
                planStore.deleteWorkoutRecord(profileId, planId, lastOpened);
                return ProgressTransition.discarded(progress.getCurrentDayIndex());
            default:
                return ProgressTransition.unchanged(TransitionReason.PREVIOUS_DAY_NOT_STARTED, progress.getCurrentDayIndex());
        }
    }

    // ── rescue path ───────────────────────────────────────────────────────

    /**
     * Credits a completion for {@code completionDate}.
     *
     * Completions that are not newer than the last credited one are ignored,
     * so replaying or backfilling older days never moves the pointer back.
     * A completion on the last opened day itself is left for the next open,
     * which evaluates exactly that day; only the date is recorded. Every
     * other newer completion advances one step.
     */
    public ProgressTransition recordCompletion(UUID planId, SinglePlanProgress progress, LocalDate completionDate) {
        Optional<List<ScheduledDay>> plan = planStore.daysOf(planId);
        if (plan.isEmpty()) {
            return ProgressTransition.invalid(TransitionReason.PLAN_NOT_FOUND);
        }
        int totalDays = plan.get().size();
        if (totalDays == 0) {
            return ProgressTransition.invalid(TransitionReason.PLAN_EMPTY);
        }

        LocalDate lastCompleted = progress.getLastCompletedDate();
        if (lastCompleted != null && !completionDate.isAfter(lastCompleted)) {
            log.debug("Completion {} for plan {} is not newer than {}", completionDate, planId, lastCompleted);
            return ProgressTransition.unchanged(TransitionReason.COMPLETION_NOT_NEWER, progress.getCurrentDayIndex());
        }

        progress.setLastCompletedDate(completionDate);

        LocalDate lastOpened = progress.getLastOpenedDate();
        if (completionDate.equals(lastOpened)) {
            return ProgressTransition.unchanged(TransitionReason.DEFERRED_TO_OPEN, progress.getCurrentDayIndex());
        }

        progress.advance(totalDays);
        log.debug("Backfilled completion {} advanced plan {} to day {}", completionDate, planId, progress.getCurrentDayIndex());
        return ProgressTransition.advanced(TransitionReason.NEWER_COMPLETION, progress.getCurrentDayIndex());
    }

    // ── manual change ─────────────────────────────────────────────────────

    /**
     * Switches the displayed day to {@code newDayIndex} (1-indexed).
     *
     * @param completedSetsOnDisplayedWorkout sets already logged on the workout
     *                                        currently shown; any logged set
     *                                        blocks the change.
     * @param skipAndAdvance                  when true the pointer moves past
     *                                        the chosen day, so the next open
     *                                        offers the day after it. Otherwise
     *                                        the pointer is left alone and only
     *                                        today's workout changes.
     */
    public ChangeDayResult changeDay(UUID planId, SinglePlanProgress progress, int completedSetsOnDisplayedWorkout,
                                     int newDayIndex, boolean skipAndAdvance) {
        if (completedSetsOnDisplayedWorkout > 0) {
            return ChangeDayResult.rejected();
        }
        List<ScheduledDay> days = planStore.daysOf(planId).map(SinglePlanProgressTracker::sorted).orElse(List.of());
        Optional<ScheduledDay> target = dayAt(days, newDayIndex);
        if (target.isEmpty()) {
            return ChangeDayResult.invalid();
        }

        if (skipAndAdvance) {
            progress.setCurrentDayIndex(Math.floorMod(newDayIndex, days.size()) + 1);
        }
        log.debug("Plan {} moved by hand to day {} (skip: {})", planId, progress.getCurrentDayIndex(), skipAndAdvance);
        return ChangeDayResult.changed(target.get(), progress.getCurrentDayIndex());
    }

    /**
     * Day the pointer currently refers to, if the plan has one there.
     */
    public Optional<ScheduledDay> currentDay(UUID planId, SinglePlanProgress progress) {
        return planStore.daysOf(planId)
                .map(SinglePlanProgressTracker::sorted)
                .flatMap(days -> dayAt(days, progress.getCurrentDayIndex()));
    }

    // ── helpers ───────────────────────────────────────────────────────────

    static Optional<ScheduledDay> dayAt(List<ScheduledDay> days, int dayIndex) {
        if (dayIndex < 1 || dayIndex > days.size()) {
            return Optional.empty();
        }
        return Optional.of(days.get(dayIndex - 1));
    }

    static List<ScheduledDay> sorted(List<? extends ScheduledDay> days) {
        return days.stream().sorted(PositionedEntry.BY_POSITION).map(ScheduledDay.class::cast).toList();
    }
}
