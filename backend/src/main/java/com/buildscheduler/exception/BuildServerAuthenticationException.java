package com.buildscheduler.exception;

public class BuildServerAuthenticationException extends BuildServerException {

    public BuildServerAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
