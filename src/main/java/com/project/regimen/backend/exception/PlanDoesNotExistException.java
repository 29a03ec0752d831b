package com.project.regimen.backend.exception;

public class PlanDoesNotExistException extends RuntimeException {
    public PlanDoesNotExistException(String message) {
        super(message);
    }

    public PlanDoesNotExistException(ExceptionMessage message) {
        super(message.toString());
    }
}
