package com.project.regimen.backend.exception;

public class WorkoutDoesNotExistException extends RuntimeException {
    public WorkoutDoesNotExistException(String message) {
        super(message);
    }

    public WorkoutDoesNotExistException(ExceptionMessage message) {
        super(message.toString());
    }
}
