package com.buildscheduler.service;

import com.buildscheduler.exception.NotFoundException;
import com.buildscheduler.exception.ValidationException;
import com.buildscheduler.model.ExecutionHistory;
import com.buildscheduler.model.ScheduledJob;
import com.buildscheduler.model.enums.ExecutionStatus;
import com.buildscheduler.model.enums.JobStatus;
import com.buildscheduler.model.enums.TriggerType;
import com.buildscheduler.repository.ExecutionHistoryRepository;
import com.buildscheduler.repository.ScheduledJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable home of job definitions and execution history. All reads hand out
 * normalized {@link JobDefinition}s; legacy single-target rows and double-encoded
 * JSON are resolved here and nowhere else.
 *
 * <p>Deleting a job leaves its history rows in place. They stay readable by job id
 * until purged separately.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobStore {

    private final ScheduledJobRepository jobRepository;
    private final ExecutionHistoryRepository historyRepository;
    private final StoredJsonCodec codec;
    private final Clock clock;

    // ── Jobs ──────────────────────────────────────────────────────────────

    @Transactional
    public JobDefinition create(JobDraft draft) {
        ScheduledJob job = new ScheduledJob();
        apply(job, draft);
        job.setStatus(draft.status() != null ? draft.status() : JobStatus.ACTIVE);
        return toDefinition(jobRepository.save(job));
    }

    @Transactional(readOnly = true)
    public Optional<JobDefinition> findById(UUID id) {
        return jobRepository.findById(id).map(this::toDefinition);
    }

    @Transactional(readOnly = true)
    public JobDefinition get(UUID id) {
        return findById(id).orElseThrow(() -> new NotFoundException("Scheduled job not found: " + id));
    }

    @Transactional(readOnly = true)
    public List<JobDefinition> findAll() {
        return jobRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(this::toDefinition)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<JobDefinition> findAllActive() {
        return jobRepository.findByStatus(JobStatus.ACTIVE).stream()
                .map(this::toDefinition)
                .toList();
    }

    @Transactional(readOnly = true)
    public Map<UUID, String> findNames(Collection<UUID> ids) {
        Map<UUID, String> names = new HashMap<>();
        jobRepository.findAllById(ids).forEach(job -> names.put(job.getId(), job.getName()));
        return names;
    }

    @Transactional(readOnly = true)
    public long countByBuildServerConfig(UUID buildServerConfigId) {
        return jobRepository.countByBuildServerConfigId(buildServerConfigId);
    }

    @Transactional
    public JobDefinition update(UUID id, JobDraft draft) {
        ScheduledJob job = jobRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Scheduled job not found: " + id));
        apply(job, draft);
        if (draft.status() != null) {
            job.setStatus(draft.status());
        }
        // The rewritten definition replaces the legacy single-target column
        job.setTargetJob(null);
        return toDefinition(jobRepository.save(job));
    }

    @Transactional
    public void delete(UUID id) {
        if (!jobRepository.existsById(id)) {
            throw new NotFoundException("Scheduled job not found: " + id);
        }
        jobRepository.deleteById(id);
    }

    /**
     * Moves a job between {@code active} and {@code inactive}, or to {@code expired}
     * from any state. Expired jobs only come back through {@link #update}.
     */
    @Transactional
    public JobDefinition transitionStatus(UUID id, JobStatus target) {
        ScheduledJob job = jobRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Scheduled job not found: " + id));
        if (job.getStatus() == JobStatus.EXPIRED && target != JobStatus.EXPIRED) {
            throw new ValidationException("Job " + id + " has expired; update its schedule to reactivate it");
        }
        job.setStatus(target);
        return toDefinition(jobRepository.save(job));
    }

    @Transactional
    public boolean markExpired(UUID id) {
        return jobRepository.updateStatus(id, JobStatus.EXPIRED, LocalDateTime.now(clock)) > 0;
    }

    @Transactional
    public boolean recordExecution(UUID id, LocalDateTime at) {
        return jobRepository.updateLastExecutionAt(id, at) > 0;
    }

    // ── History ───────────────────────────────────────────────────────────

    @Transactional
    public ExecutionHistory startExecution(UUID jobId, TriggerType triggerType) {
        ExecutionHistory history = ExecutionHistory.builder()
                .jobId(jobId)
                .status(ExecutionStatus.STARTED)
                .triggerType(triggerType)
                .startTime(LocalDateTime.now(clock))
                .build();
        return historyRepository.save(history);
    }

    /** Moves the attempt's single history row to its terminal status. */
    @Transactional
    public ExecutionHistory completeExecution(UUID historyId, ExecutionStatus status,
                                              int successCount, int failedCount, String logOutput) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal execution status: " + status);
        }
        ExecutionHistory history = historyRepository.findById(historyId)
                .orElseThrow(() -> new NotFoundException("Execution history not found: " + historyId));
        history.setStatus(status);
        history.setEndTime(LocalDateTime.now(clock));
        history.setSuccessCount(successCount);
        history.setFailedCount(failedCount);
        history.setLogOutput(logOutput);
        return historyRepository.save(history);
    }

    @Transactional(readOnly = true)
    public List<ExecutionHistory> findHistory(UUID jobId, int limit) {
        return historyRepository.findByJobIdOrderByStartTimeDesc(jobId, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<ExecutionHistory> findRecentHistory(int limit) {
        return historyRepository.findAllByOrderByStartTimeDesc(PageRequest.of(0, limit));
    }

    // ── Mapping ───────────────────────────────────────────────────────────

    private void apply(ScheduledJob job, JobDraft draft) {
        Map<String, Map<String, Object>> configs = draft.targetParameters() != null
                ? draft.targetParameters() : Map.of();
        job.setName(draft.name());
        job.setBuildServerConfigId(draft.buildServerConfigId());
        job.setTargets(codec.write(new ArrayList<>(configs.keySet())));
        job.setJobConfigs(codec.write(configs));
        job.setParameters(codec.write(draft.defaultParameters() != null ? draft.defaultParameters() : Map.of()));
        job.setScheduleKind(draft.scheduleKind());
        job.setExecuteAt(draft.executeAt());
        job.setCronExpression(draft.cronExpression());
    }

    private JobDefinition toDefinition(ScheduledJob job) {
        List<String> targets = codec.readTargets(job.getTargets());
        Map<String, Map<String, Object>> configs = codec.readJobConfigs(job.getJobConfigs());
        Map<String, Object> defaults = codec.readParameters(job.getParameters());

        if (targets.isEmpty() && job.getTargetJob() != null && !job.getTargetJob().isBlank()) {
            targets = List.of(job.getTargetJob().trim());
        }
        if (targets.isEmpty()) {
            targets = new ArrayList<>(configs.keySet());
        }

        Map<String, Map<String, Object>> perTarget = new LinkedHashMap<>();
        for (String target : targets) {
            perTarget.put(target, configs.getOrDefault(target, defaults));
        }

        return new JobDefinition(
                job.getId(),
                job.getName(),
                job.getBuildServerConfigId(),
                targets,
                perTarget,
                defaults,
                job.getScheduleKind(),
                job.getExecuteAt(),
                job.getCronExpression(),
                job.getStatus(),
                job.getLastExecutionAt(),
                job.getCreatedAt(),
                job.getUpdatedAt());
    }
}
