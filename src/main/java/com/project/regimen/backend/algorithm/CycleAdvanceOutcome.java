package com.project.regimen.backend.algorithm;

/**
 * Result of moving a cycle forward.
 *
 * <pre>
 *  ADVANCED         : the pointer moved to the next day (possibly of another plan).
 *  NO_OP            : nothing to do, e.g. a completion that was already credited.
 *  DEFERRED_TO_OPEN : completion of the day last opened; only the date was
 *                     recorded and the next open advances.
 *  EMPTY_CYCLE      : the cycle has no items.
 *  NO_VALID_PLAN    : every item references a missing or empty plan; the
 *                     progress was left as it was before the call.
 * </pre>
 */
public enum CycleAdvanceOutcome {

    ADVANCED,
    NO_OP,
    DEFERRED_TO_OPEN,
    EMPTY_CYCLE,
    NO_VALID_PLAN
}
