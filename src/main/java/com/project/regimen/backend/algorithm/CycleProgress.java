package com.project.regimen.backend.algorithm;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Position of a cycle: which item (plan) is current and which day inside it.
 * Both indexes are 0-indexed.
 */
@Getter
@Setter
@ToString
@Embeddable
@NoArgsConstructor
public class CycleProgress {

    @Column(name = "current_item_index", nullable = false)
    private int currentItemIndex;

    @Column(name = "current_day_index", nullable = false)
    private int currentDayIndex;

    /** When the pointer last moved. Informational only. */
    @Column(name = "last_advanced_at")
    private Instant lastAdvancedAt;

    /** Program day of the last "what's today" request, null until the first open. */
    @Column(name = "last_opened_date")
    private LocalDate lastOpenedDate;

    /** Program day of the most recent recorded completion. */
    @Column(name = "last_completed_date")
    private LocalDate lastCompletedDate;

    public CycleProgress(int currentItemIndex, int currentDayIndex) {
        this.currentItemIndex = currentItemIndex;
        this.currentDayIndex = currentDayIndex;
    }

    /** Back to the first day of the first item. */
    public void reset() {
        this.currentItemIndex = 0;
        this.currentDayIndex = 0;
        this.lastAdvancedAt = null;
        this.lastOpenedDate = null;
        this.lastCompletedDate = null;
    }

    /**
     * Moves to the first day of the next item, wrapping to the first item.
     *
     * @param totalItems number of items in the cycle, must be positive.
     */
    void moveToNextItem(int totalItems) {
        this.currentItemIndex = Math.floorMod(currentItemIndex + 1, totalItems);
        this.currentDayIndex = 0;
    }

    CycleProgress copy() {
        CycleProgress copy = new CycleProgress(currentItemIndex, currentDayIndex);
        copy.setLastAdvancedAt(lastAdvancedAt);
        copy.setLastOpenedDate(lastOpenedDate);
        copy.setLastCompletedDate(lastCompletedDate);
        return copy;
    }

    void restore(CycleProgress snapshot) {
        this.currentItemIndex = snapshot.currentItemIndex;
        this.currentDayIndex = snapshot.currentDayIndex;
        this.lastAdvancedAt = snapshot.lastAdvancedAt;
        this.lastOpenedDate = snapshot.lastOpenedDate;
        this.lastCompletedDate = snapshot.lastCompletedDate;
    }
}
