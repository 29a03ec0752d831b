package com.project.regimen.backend.algorithm;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Rotates through the plans of a cycle, one day at a time.
 *
 * A cycle is an ordered list of items, each pointing at a plan. The pointer is
 * (item, day), both 0-indexed. Advancing moves to the next day of the current
 * plan and, after its last day, to the first day of the next item. Items whose
 * plan was deleted or has no days are skipped; the skip scan looks at every
 * item at most once, so it always terminates.
 *
 * The pointer moves once per program day on open, when the day opened last
 * time was completed, the same way a single plan does.
 *
 * Like {@link SinglePlanProgressTracker}, this class only mutates the
 * {@link CycleProgress} it is given.
 */
@Slf4j
public class CycleProgressTracker {

    private final PlanStore planStore;

    public CycleProgressTracker(PlanStore planStore) {
        this.planStore = planStore;
    }

    // ── rotation ──────────────────────────────────────────────────────────

    public CycleAdvanceOutcome advance(List<? extends CycleSlot> cycleItems, CycleProgress progress, Instant now) {
        List<CycleSlot> items = sorted(cycleItems);
        if (items.isEmpty()) {
            return CycleAdvanceOutcome.EMPTY_CYCLE;
        }

        CycleProgress snapshot = progress.copy();
        boolean found;

        if (progress.getCurrentItemIndex() < 0 || progress.getCurrentItemIndex() >= items.size()) {
            log.debug("Cycle pointer {} out of range for {} items, starting over", progress.getCurrentItemIndex(), items.size());
            progress.setCurrentItemIndex(0);
            progress.setCurrentDayIndex(0);
            found = skipToValidPlan(items, progress);
        } else {
            int totalDays = dayCount(items.get(progress.getCurrentItemIndex()));
            if (totalDays == 0) {
                progress.moveToNextItem(items.size());
                found = skipToValidPlan(items, progress);
            } else if (progress.getCurrentDayIndex() + 1 < totalDays) {
                progress.setCurrentDayIndex(progress.getCurrentDayIndex() + 1);
                found = true;
            } else {
                progress.moveToNextItem(items.size());
                found = skipToValidPlan(items, progress);
            }
        }

        if (!found) {
            progress.restore(snapshot);
            log.debug("No item of the cycle references a plan with days");
            return CycleAdvanceOutcome.NO_VALID_PLAN;
        }

        progress.setLastAdvancedAt(now);
        log.debug("Cycle advanced to item {} day {}", progress.getCurrentItemIndex(), progress.getCurrentDayIndex());
        return CycleAdvanceOutcome.ADVANCED;
    }

    // ── open-time path ────────────────────────────────────────────────────

    /**
     * Runs once per program day. Advances one step when a completion was
     * recorded for the day opened last time; a second open on the same
     * program day changes nothing.
     */
    public CycleAdvanceOutcome handleAppOpen(List<? extends CycleSlot> cycleItems, CycleProgress progress,
                                             LocalDate today, Instant now) {
        LocalDate lastOpened = progress.getLastOpenedDate();
        if (ProgramDayCalendar.isSameDay(lastOpened, today)) {
            return CycleAdvanceOutcome.NO_OP;
        }

        CycleAdvanceOutcome outcome = CycleAdvanceOutcome.NO_OP;
        if (lastOpened != null && lastOpened.equals(progress.getLastCompletedDate())) {
            outcome = advance(cycleItems, progress, now);
            log.debug("Cycle opened on {} after completed {}: {}", today, lastOpened, outcome);
        }
        progress.setLastOpenedDate(today);
        return outcome;
    }

    /**
     * Starting at the current item, finds the first item whose plan has days.
     * Looks at each item at most once and stops as soon as the index comes
     * back to where it started.
     *
     * @return false when no item qualifies.
     */
    private boolean skipToValidPlan(List<CycleSlot> items, CycleProgress progress) {
        int start = progress.getCurrentItemIndex();
        for (int checked = 0; checked < items.size(); checked++) {
            if (dayCount(items.get(progress.getCurrentItemIndex())) > 0) {
                return true;
            }
            progress.moveToNextItem(items.size());
            if (progress.getCurrentItemIndex() == start) {
                break;
            }
        }
        return false;
    }

    // ── rescue ────────────────────────────────────────────────────────────

    /**
     * Credits a completed workout. Only a completion newer than the last
     * credited one moves the cycle; replays and older backfills are ignored.
     * A completion of the day opened last is only recorded, the next open
     * advances for it.
     */
    public CycleAdvanceOutcome recordCompletion(List<? extends CycleSlot> cycleItems, CycleProgress progress,
                                                LocalDate completionDate, Instant now) {
        LocalDate lastCompleted = progress.getLastCompletedDate();
        if (lastCompleted != null && !completionDate.isAfter(lastCompleted)) {
            log.debug("Cycle completion {} is not newer than {}", completionDate, lastCompleted);
            return CycleAdvanceOutcome.NO_OP;
        }

        if (completionDate.equals(progress.getLastOpenedDate())) {
            progress.setLastCompletedDate(completionDate);
            return CycleAdvanceOutcome.DEFERRED_TO_OPEN;
        }

        CycleAdvanceOutcome outcome = advance(cycleItems, progress, now);
        if (outcome == CycleAdvanceOutcome.ADVANCED) {
            progress.setLastCompletedDate(completionDate);
        }
        return outcome;
    }

    // ── manual change ─────────────────────────────────────────────────────

    /**
     * Switches to another day of the current plan. {@code newDayIndex} is
     * 0-indexed; with {@code skipAndAdvance} the pointer lands on the day
     * after it, wrapping inside the same plan. Without it the pointer does
     * not move.
     */
    public ChangeDayResult changeDay(List<? extends CycleSlot> cycleItems, CycleProgress progress,
                                     int completedSetsOnDisplayedWorkout, int newDayIndex, boolean skipAndAdvance,
                                     Instant now) {
        if (completedSetsOnDisplayedWorkout > 0) {
            return ChangeDayResult.rejected();
        }
        List<CycleSlot> items = sorted(cycleItems);
        int itemIndex = progress.getCurrentItemIndex();
        if (itemIndex < 0 || itemIndex >= items.size()) {
            return ChangeDayResult.invalid();
        }
        List<ScheduledDay> days = daysOf(items.get(itemIndex));
        if (newDayIndex < 0 || newDayIndex >= days.size()) {
            return ChangeDayResult.invalid();
        }

        if (skipAndAdvance) {
            progress.setCurrentDayIndex((newDayIndex + 1) % days.size());
            progress.setLastAdvancedAt(now);
        }
        return ChangeDayResult.changed(days.get(newDayIndex), progress.getCurrentDayIndex());
    }

    // ── queries ───────────────────────────────────────────────────────────

    /**
     * The item and day shown today, or empty when the pointer does not
     * resolve (out of range, deleted plan or empty plan).
     */
    public Optional<CyclePosition> currentPosition(List<? extends CycleSlot> cycleItems, CycleProgress progress) {
        List<CycleSlot> items = sorted(cycleItems);
        int itemIndex = progress.getCurrentItemIndex();
        if (itemIndex < 0 || itemIndex >= items.size()) {
            return Optional.empty();
        }
        CycleSlot item = items.get(itemIndex);
        List<ScheduledDay> days = daysOf(item);
        int dayIndex = progress.getCurrentDayIndex();
        if (dayIndex < 0 || dayIndex >= days.size()) {
            return Optional.empty();
        }
        return Optional.of(new CyclePosition(item, days.get(dayIndex), dayIndex));
    }

    /**
     * Number of days in the plan of the current item, or 0.
     */
    public int currentPlanDayCount(List<? extends CycleSlot> cycleItems, CycleProgress progress) {
        List<CycleSlot> items = sorted(cycleItems);
        int itemIndex = progress.getCurrentItemIndex();
        if (itemIndex < 0 || itemIndex >= items.size()) {
            return 0;
        }
        return dayCount(items.get(itemIndex));
    }

    public void reset(CycleProgress progress) {
        progress.reset();
    }

    // ── helpers ───────────────────────────────────────────────────────────

    private List<ScheduledDay> daysOf(CycleSlot item) {
        return planStore.daysOf(item.getPlanId())
                .map(SinglePlanProgressTracker::sorted)
                .orElse(List.of());
    }

    private int dayCount(CycleSlot item) {
        return planStore.daysOf(item.getPlanId()).map(List::size).orElse(0);
    }

    private static List<CycleSlot> sorted(List<? extends CycleSlot> items) {
        return items.stream().sorted(PositionedEntry.BY_POSITION).map(CycleSlot.class::cast).toList();
    }
}
