package com.project.regimen.backend.algorithm;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one single-plan transition (an app open or a rescue).
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProgressTransition {

    /** Day index reported when the plan is missing or empty. */
    public static final int DEFAULT_DAY_INDEX = 1;

    private final TransitionOutcome outcome;

    private final TransitionReason reason;

    /** The 1-indexed day to show after the transition. */
    private final int dayIndex;

    /**
     * True when an incomplete record of the previous program day was deleted
     * so the same day can be offered again.
     */
    private final boolean staleRecordDiscarded;

    static ProgressTransition advanced(TransitionReason reason, int dayIndex) {
        return new ProgressTransition(TransitionOutcome.ADVANCED, reason, dayIndex, false);
    }

    static ProgressTransition unchanged(TransitionReason reason, int dayIndex) {
        return new ProgressTransition(TransitionOutcome.NO_OP, reason, dayIndex, false);
    }

    static ProgressTransition discarded(int dayIndex) {
        return new ProgressTransition(TransitionOutcome.NO_OP, TransitionReason.PREVIOUS_DAY_INCOMPLETE, dayIndex, true);
    }

    static ProgressTransition invalid(TransitionReason reason) {
        return new ProgressTransition(TransitionOutcome.INVALID, reason, DEFAULT_DAY_INDEX, false);
    }

    public boolean isAdvanced() {
        return outcome == TransitionOutcome.ADVANCED;
    }

    public boolean isInvalid() {
        return outcome == TransitionOutcome.INVALID;
    }
}
