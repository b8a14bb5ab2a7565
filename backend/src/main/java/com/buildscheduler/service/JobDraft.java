package com.buildscheduler.service;

import com.buildscheduler.model.enums.JobStatus;
import com.buildscheduler.model.enums.ScheduleKind;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Validated input for creating or rewriting a job. Key order of
 * {@code targetParameters} is the order targets are triggered in.
 */
public record JobDraft(
        String name,
        UUID buildServerConfigId,
        Map<String, Map<String, Object>> targetParameters,
        Map<String, Object> defaultParameters,
        ScheduleKind scheduleKind,
        LocalDateTime executeAt,
        String cronExpression,
        JobStatus status
) {
}
