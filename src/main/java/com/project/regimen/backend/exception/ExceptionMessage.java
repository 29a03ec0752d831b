package com.project.regimen.backend.exception;

public enum ExceptionMessage {

    USER_DOES_NOT_EXIST("User does not exist"),
    USERNAME_ALREADY_TAKEN("Username is already taken"),
    VALIDATION_FAILED("Validation has failed"),
    PLAN_DOES_NOT_EXIST("Plan does not exist"),
    PLAN_DAY_DOES_NOT_EXIST("Plan day does not exist"),
    CYCLE_DOES_NOT_EXIST("Cycle does not exist"),
    CYCLE_ITEM_DOES_NOT_EXIST("Cycle item does not exist"),
    WORKOUT_DOES_NOT_EXIST("Workout does not exist"),
    WORKOUT_ENTRY_DOES_NOT_EXIST("Workout entry does not exist"),
    NO_ACTIVE_PLAN("No active plan selected"),
    NO_ACTIVE_CYCLE("No active cycle"),
    FUTURE_COMPLETION("Completion date is in the future"),
    ;

    final private String message;
    ExceptionMessage(String message) {
        this.message = message;
    }

    public String toString() {
        return message;
    }
}
