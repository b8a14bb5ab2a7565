package com.buildscheduler.service;

import com.buildscheduler.dto.CronPreviewResponse;
import com.buildscheduler.dto.JobExecutionResult;
import com.buildscheduler.dto.ScheduledJobRequest;
import com.buildscheduler.dto.ScheduledJobResponse;
import com.buildscheduler.dto.StatusUpdateRequest;
import com.buildscheduler.exception.ConfigResolutionException;
import com.buildscheduler.exception.NotFoundException;
import com.buildscheduler.exception.ValidationException;
import com.buildscheduler.model.BuildServerConfig;
import com.buildscheduler.model.enums.JobStatus;
import com.buildscheduler.model.enums.ScheduleKind;
import com.buildscheduler.model.enums.TriggerType;
import com.buildscheduler.repository.BuildServerConfigRepository;
import com.buildscheduler.scheduling.CronExpressions;
import com.buildscheduler.scheduling.FanOutExecutor;
import com.buildscheduler.scheduling.SchedulingRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Request-scoped operations on scheduled jobs. Every change is persisted first and
 * then mirrored into the {@link SchedulingRegistry}, which re-reads the stored job, so a
 * trigger never fires for a definition the store has not committed or has since replaced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduledJobService {

    private static final int PREVIEW_COUNT = 5;

    private final JobStore jobStore;
    private final SchedulingRegistry registry;
    private final FanOutExecutor fanOutExecutor;
    private final BuildServerConfigRepository configRepository;
    private final Clock clock;

    // ── CRUD ──────────────────────────────────────────────────────────────

    public ScheduledJobResponse create(ScheduledJobRequest req) {
        JobStatus status = req.getStatus() != null ? parseToggleStatus(req.getStatus()) : JobStatus.ACTIVE;
        JobDefinition job = jobStore.create(toDraft(req, status));
        registry.arm(job);
        log.info("Created scheduled job '{}' ({}) with {} target(s)", job.name(), job.id(), job.targets().size());
        return findById(job.id());
    }

    public List<ScheduledJobResponse> findAll() {
        return jobStore.findAll().stream().map(this::toResponse).toList();
    }

    public ScheduledJobResponse findById(UUID id) {
        return toResponse(jobStore.get(id));
    }

    public ScheduledJobResponse update(UUID id, ScheduledJobRequest req) {
        JobDefinition current = jobStore.get(id);
        JobStatus status;
        if (req.getStatus() != null) {
            status = parseToggleStatus(req.getStatus());
        } else {
            // A new definition revives an expired job
            status = current.status() == JobStatus.EXPIRED ? JobStatus.ACTIVE : current.status();
        }
        JobDraft draft = toDraft(req, status);

        registry.disarm(id);
        JobDefinition updated = jobStore.update(id, draft);
        registry.refresh(id);
        log.info("Updated scheduled job '{}' ({})", updated.name(), id);
        return findById(id);
    }

    public ScheduledJobResponse updateStatus(UUID id, StatusUpdateRequest req) {
        JobStatus target = parseToggleStatus(req.getStatus());
        jobStore.transitionStatus(id, target);
        registry.refresh(id);
        return findById(id);
    }

    public void delete(UUID id) {
        registry.disarm(id);
        jobStore.delete(id);
        log.info("Deleted scheduled job {}", id);
    }

    /** Runs every target now, outside any trigger. Works for inactive jobs too. */
    public JobExecutionResult executeNow(UUID id) {
        JobDefinition job = jobStore.get(id);
        try {
            return fanOutExecutor.execute(job, TriggerType.MANUAL);
        } catch (ConfigResolutionException e) {
            return e.getResult();
        }
    }

    // ── Cron preview ──────────────────────────────────────────────────────

    public CronPreviewResponse preview(String cronExpression) {
        try {
            String normalized = CronExpressions.validate(cronExpression);
            return CronPreviewResponse.builder()
                    .valid(true)
                    .normalizedExpression(normalized)
                    .nextFireTimes(CronExpressions.nextFireTimes(normalized, LocalDateTime.now(clock), PREVIEW_COUNT))
                    .build();
        } catch (IllegalArgumentException e) {
            return CronPreviewResponse.builder()
                    .valid(false)
                    .error(e.getMessage())
                    .build();
        }
    }

    // ── Validation ────────────────────────────────────────────────────────

    private JobDraft toDraft(ScheduledJobRequest req, JobStatus status) {
        configRepository.findById(req.getBuildServerConfigId())
                .orElseThrow(() -> new NotFoundException(
                        "Build server configuration not found: " + req.getBuildServerConfigId()));

        ScheduleKind kind = ScheduleKind.fromWire(req.getScheduleKind());
        LocalDateTime executeAt = null;
        String cron = null;
        if (kind == ScheduleKind.ONCE) {
            if (req.getExecuteAt() == null) {
                throw new ValidationException("Execution time is required for one-time jobs");
            }
            executeAt = req.getExecuteAt();
        } else {
            try {
                cron = CronExpressions.validate(req.getCronExpression());
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage());
            }
        }

        Map<String, Map<String, Object>> jobConfigs = req.getJobConfigs() != null ? req.getJobConfigs() : Map.of();
        if (jobConfigs.isEmpty()) {
            throw new ValidationException("At least one target job is required");
        }
        Map<String, Map<String, Object>> targets = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : jobConfigs.entrySet()) {
            String target = entry.getKey() != null ? entry.getKey().trim() : "";
            if (target.isEmpty()) {
                throw new ValidationException("Target job names must not be blank");
            }
            if (targets.containsKey(target)) {
                throw new ValidationException("Target job listed twice: " + target);
            }
            targets.put(target, normalizeParameters(entry.getValue(), "target " + target));
        }

        return new JobDraft(
                req.getName().trim(),
                req.getBuildServerConfigId(),
                targets,
                normalizeParameters(req.getParameters(), "job"),
                kind,
                executeAt,
                cron,
                status);
    }

    private Map<String, Object> normalizeParameters(Map<String, Object> params, String owner) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (params == null) {
            return normalized;
        }
        params.forEach((name, value) -> {
            if (name == null || name.isBlank()) {
                throw new ValidationException("Parameter names of " + owner + " must not be blank");
            }
            if (value == null || value instanceof String || value instanceof Boolean) {
                normalized.put(name, value);
            } else if (value instanceof Number) {
                normalized.put(name, value.toString());
            } else {
                throw new ValidationException("Parameter " + name + " of " + owner
                        + " must be a string, boolean or null");
            }
        });
        return normalized;
    }

    private JobStatus parseToggleStatus(String value) {
        JobStatus status;
        try {
            status = JobStatus.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Status must be 'active' or 'inactive'");
        }
        if (status == JobStatus.EXPIRED) {
            throw new ValidationException("Status must be 'active' or 'inactive'");
        }
        return status;
    }

    // ── Mapping ───────────────────────────────────────────────────────────

    private ScheduledJobResponse toResponse(JobDefinition job) {
        return ScheduledJobResponse.builder()
                .id(job.id().toString())
                .name(job.name())
                .buildServerConfigId(job.buildServerConfigId() != null ? job.buildServerConfigId().toString() : null)
                .buildServerName(resolveBuildServerName(job.buildServerConfigId()))
                .targets(job.targets())
                .jobConfigs(job.targetParameters())
                .parameters(job.defaultParameters())
                .scheduleKind(job.scheduleKind().wireName())
                .executeAt(job.executeAt())
                .cronExpression(job.cronExpression())
                .status(job.status().wireName())
                .armed(registry.isArmed(job.id()))
                .nextExecutionAt(computeNextExecutionAt(job))
                .lastExecutionAt(job.lastExecutionAt())
                .createdAt(job.createdAt())
                .updatedAt(job.updatedAt())
                .build();
    }

    private LocalDateTime computeNextExecutionAt(JobDefinition job) {
        if (job.status() != JobStatus.ACTIVE) {
            return null;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (job.scheduleKind() == ScheduleKind.ONCE) {
            return job.executeAt() != null && job.executeAt().isAfter(now) ? job.executeAt() : null;
        }
        return job.cronExpression() != null ? CronExpressions.next(job.cronExpression(), now) : null;
    }

    private String resolveBuildServerName(UUID configId) {
        if (configId == null) {
            return "(deleted)";
        }
        return configRepository.findById(configId)
                .map(BuildServerConfig::getName)
                .orElse("(deleted)");
    }
}
