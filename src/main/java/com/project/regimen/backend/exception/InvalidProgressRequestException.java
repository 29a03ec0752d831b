package com.project.regimen.backend.exception;

/**
 * A progress request that cannot be served in the profile's current state,
 * e.g. asking for today's workout with no active plan.
 */
public class InvalidProgressRequestException extends RuntimeException {
    public InvalidProgressRequestException(ExceptionMessage message) {
        super(message.toString());
    }
}
