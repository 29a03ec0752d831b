package com.project.regimen.backend.exception;

public class CycleDoesNotExistException extends RuntimeException {
    public CycleDoesNotExistException(String message) {
        super(message);
    }

    public CycleDoesNotExistException(ExceptionMessage message) {
        super(message.toString());
    }
}
