package com.project.regimen.backend.algorithm;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * The item and the day a cycle currently points at.
 */
@Getter
@ToString
@AllArgsConstructor
public class CyclePosition {

    private final CycleSlot item;

    private final ScheduledDay day;

    /** 0-indexed day inside the item's plan. */
    private final int dayIndex;

    public UUID getPlanId() {
        return item.getPlanId();
    }
}
