package com.buildscheduler.exception;

import com.buildscheduler.dto.JobExecutionResult;
import lombok.Getter;

/**
 * The build server configuration a job points at no longer exists. The attempt has
 * already been recorded as failed when this is thrown; {@link #getResult()} carries it.
 */
@Getter
public class ConfigResolutionException extends RuntimeException {

    private final transient JobExecutionResult result;

    public ConfigResolutionException(String message, JobExecutionResult result) {
        super(message);
        this.result = result;
    }
}
