package com.project.regimen.backend.algorithm;

/**
 * Result of a manual day change.
 *
 * <pre>
 *  CHANGED                   – the target day is now displayed.
 *  REJECTED_WORK_IN_PROGRESS – the displayed workout already has logged sets.
 *  INVALID                   – the target day (or its plan) does not exist.
 * </pre>
 */
public enum ChangeDayOutcome {

    CHANGED,
    REJECTED_WORK_IN_PROGRESS,
    INVALID
}
