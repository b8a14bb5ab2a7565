package com.buildscheduler.service;

import com.buildscheduler.model.enums.JobStatus;
import com.buildscheduler.model.enums.ScheduleKind;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Normalized, detached view of a scheduled job. Every target has an entry in
 * {@code targetParameters}, whatever shape the stored row had.
 */
public record JobDefinition(
        UUID id,
        String name,
        UUID buildServerConfigId,
        List<String> targets,
        Map<String, Map<String, Object>> targetParameters,
        Map<String, Object> defaultParameters,
        ScheduleKind scheduleKind,
        LocalDateTime executeAt,
        String cronExpression,
        JobStatus status,
        LocalDateTime lastExecutionAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public JobDefinition {
        targets = targets == null ? List.of() : List.copyOf(targets);
        defaultParameters = defaultParameters == null ? Map.of() : copyOf(defaultParameters);
        Map<String, Map<String, Object>> perTarget = new LinkedHashMap<>();
        if (targetParameters != null) {
            targetParameters.forEach((target, params) -> perTarget.put(target, copyOf(params)));
        }
        targetParameters = Collections.unmodifiableMap(perTarget);
    }

    /** Parameters for one target, falling back to the job-level mapping. */
    public Map<String, Object> parametersFor(String target) {
        Map<String, Object> params = targetParameters.get(target);
        return params != null ? params : defaultParameters;
    }

    // Map.copyOf rejects null values, which mean "use the server default"
    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
