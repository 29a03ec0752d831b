package com.project.regimen.backend.response;

public enum ResponseMessage {
    LOGIN_SUCCESSFUL("Login successful"),
    LOGOUT_SUCCESSFUL("Logout successful"),
    REGISTRATION_SUCCESSFUL("Registration successful"),
    AUTHENTICATION_FAILED("Authentication Failed"),
    ACCESS_DENIED("Access Denied"),
    SUCCESS("Success"),
    NOT_FOUND("Not found"),
    BAD_REQUEST("Bad request"),
    INTERNAL_ERROR("Something went wrong, please try again later"),
    DAY_CHANGE_REJECTED("Cannot change a day already in progress"),
    ;
    private final String message;
    ResponseMessage(String message) {
        this.message = message;
    }

    public String toString() {
        return message;
    }
}
