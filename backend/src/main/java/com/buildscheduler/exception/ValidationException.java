package com.buildscheduler.exception;

/**
 * Rejected input at the API boundary. Reported to the caller, never logged as a failure.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
