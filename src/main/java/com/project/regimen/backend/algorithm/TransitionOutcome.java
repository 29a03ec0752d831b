package com.project.regimen.backend.algorithm;

/**
 * What a progress transition did to the stored pointer.
 *
 * <pre>
 *  ADVANCED: the pointer moved forward by one step.
 *  NO_OP   : the pointer did not move (dates may still have been updated).
 *  INVALID : the plan is missing or empty; nothing was touched.
 * </pre>
 */
public enum TransitionOutcome {

    ADVANCED,
    NO_OP,
    INVALID
}
