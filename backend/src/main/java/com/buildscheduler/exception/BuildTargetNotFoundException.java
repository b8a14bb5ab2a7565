package com.buildscheduler.exception;

public class BuildTargetNotFoundException extends BuildServerException {

    public BuildTargetNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
