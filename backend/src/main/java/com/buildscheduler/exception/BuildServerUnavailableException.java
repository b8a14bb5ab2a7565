package com.buildscheduler.exception;

public class BuildServerUnavailableException extends BuildServerException {

    public BuildServerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
