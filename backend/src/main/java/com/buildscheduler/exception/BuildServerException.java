package com.buildscheduler.exception;

/**
 * Failure talking to a build server. Subclasses name the cause the scheduler cares about.
 */
public class BuildServerException extends RuntimeException {

    public BuildServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
