package com.project.regimen.backend.algorithm;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Progress of one profile through one plan.
 *
 * This is the mutable state the {@link SinglePlanProgressTracker} works on.
 * It is embedded in the persisted {@code PlanProgress} row; the tracker itself
 * never saves anything.
 */
@Getter
@Setter
@ToString
@Embeddable
@NoArgsConstructor
public class SinglePlanProgress {

    /** Day index a brand-new progress starts at. */
    public static final int FIRST_DAY_INDEX = 1;

    /**
     * The day to show (1-indexed). Wraps back to 1 after the last day.
     */
    @Column(name = "current_day_index", nullable = false)
    private int currentDayIndex = FIRST_DAY_INDEX;

    /**
     * Program day of the last "what's today" request.
     * Null until the plan is opened for the first time.
     */
    @Column(name = "last_opened_date")
    private LocalDate lastOpenedDate;

    /**
     * Program day of the most recent credited completion. Never moves
     * backwards.
     */
    @Column(name = "last_completed_date")
    private LocalDate lastCompletedDate;

    public SinglePlanProgress(int currentDayIndex, LocalDate lastOpenedDate, LocalDate lastCompletedDate) {
        this.currentDayIndex = currentDayIndex;
        this.lastOpenedDate = lastOpenedDate;
        this.lastCompletedDate = lastCompletedDate;
    }

    /**
     * Moves to the next day, wrapping to day 1 after the last one.
     *
     * Floor modulo keeps the result in {@code [1, totalDays]} even if the plan
     * shrank below the stored pointer.
     *
     * @param totalDays number of days in the plan, must be positive.
     */
    public void advance(int totalDays) {
        if (totalDays <= 0) {
            throw new IllegalArgumentException("Cannot advance through a plan without days");
        }
        this.currentDayIndex = Math.floorMod(currentDayIndex, totalDays) + 1;
    }

    /**
     * Raises {@code lastCompletedDate} to {@code date} unless it is already
     * on or after it.
     */
    void creditCompletion(LocalDate date) {
        if (lastCompletedDate == null || date.isAfter(lastCompletedDate)) {
            this.lastCompletedDate = date;
        }
    }
}
