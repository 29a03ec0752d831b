package com.project.regimen.backend.algorithm;

/**
 * Which branch of a single-plan transition was taken. Mostly useful for logs
 * and for clients that want to explain why the day did or did not change.
 */
public enum TransitionReason {

    FIRST_OPEN("First open of this plan"),
    SAME_PROGRAM_DAY("Already opened on this program day"),
    REST_DAY("Previous day was a rest day"),
    PREVIOUS_DAY_COMPLETED("Previous day was completed"),
    PREVIOUS_DAY_NOT_STARTED("Previous day was never started"),
    PREVIOUS_DAY_INCOMPLETE("Previous day was left incomplete"),

    NEWER_COMPLETION("Completion is newer than the last one"),
    COMPLETION_NOT_NEWER("Completion is not newer than the last one"),
    DEFERRED_TO_OPEN("Completion will be credited by the next open"),

    PLAN_NOT_FOUND("Plan not found"),
    PLAN_EMPTY("Plan has no days");

    private final String message;

    TransitionReason(String message) {
        this.message = message;
    }

    public String toString() {
        return message;
    }
}
