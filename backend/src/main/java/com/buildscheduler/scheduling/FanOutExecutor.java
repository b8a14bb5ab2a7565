package com.buildscheduler.scheduling;

import com.buildscheduler.connector.BuildServerClient;
import com.buildscheduler.connector.BuildServerClientFactory;
import com.buildscheduler.dto.JobExecutionResult;
import com.buildscheduler.dto.TargetExecutionResult;
import com.buildscheduler.exception.BuildServerException;
import com.buildscheduler.exception.ConfigResolutionException;
import com.buildscheduler.model.BuildServerConfig;
import com.buildscheduler.model.ExecutionHistory;
import com.buildscheduler.model.enums.TriggerType;
import com.buildscheduler.repository.BuildServerConfigRepository;
import com.buildscheduler.service.JobDefinition;
import com.buildscheduler.service.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Triggers every target of a job once and records the attempt. Targets are tried
 * sequentially in stored order; one failing target never stops the others.
 *
 * <p>Overlapping runs of the same job are not serialized. Each writes its own
 * history row and both update the last-execution time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FanOutExecutor {

    private final JobStore jobStore;
    private final BuildServerConfigRepository configRepository;
    private final BuildServerClientFactory clientFactory;
    private final ExecutionReconciler reconciler;
    private final Clock clock;

    /**
     * @throws ConfigResolutionException if the job's build server configuration is gone;
     *                                   the attempt is recorded as failed before throwing
     */
    public JobExecutionResult execute(JobDefinition job, TriggerType triggerType) {
        ExecutionHistory history = jobStore.startExecution(job.id(), triggerType);
        log.info("Starting {} execution of job '{}' ({}) across {} target(s)",
                triggerType, job.name(), job.id(), job.targets().size());
        try {
            Optional<BuildServerConfig> config = job.buildServerConfigId() == null
                    ? Optional.empty()
                    : configRepository.findById(job.buildServerConfigId());
            if (config.isEmpty()) {
                String message = "Build server configuration not found: " + job.buildServerConfigId();
                log.warn("Job '{}' ({}) cannot run: {}", job.name(), job.id(), message);
                JobExecutionResult failed = reconciler.fail(history.getId(), job.id(), message);
                throw new ConfigResolutionException(message, failed);
            }

            BuildServerClient client = clientFactory.create(config.get());
            List<TargetExecutionResult> results = new ArrayList<>();
            for (String target : job.targets()) {
                results.add(trigger(client, job, target));
            }

            JobExecutionResult result = reconciler.reconcile(history.getId(), job.id(), results);
            log.info("Job '{}' ({}) finished with {}: {}/{} targets triggered",
                    job.name(), job.id(), result.getStatus(), result.getSuccessCount(), result.getTotalCount());
            return result;
        } finally {
            markExecuted(job);
        }
    }

    private TargetExecutionResult trigger(BuildServerClient client, JobDefinition job, String target) {
        try {
            String location = client.triggerBuild(target, job.parametersFor(target));
            return TargetExecutionResult.success(target, location);
        } catch (BuildServerException e) {
            log.warn("Job '{}' ({}): target {} failed: {}", job.name(), job.id(), target, e.getMessage());
            return TargetExecutionResult.failed(target, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Job '{}' ({}): target {} failed unexpectedly", job.name(), job.id(), target, e);
            return TargetExecutionResult.failed(target,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void markExecuted(JobDefinition job) {
        try {
            if (!jobStore.recordExecution(job.id(), LocalDateTime.now(clock))) {
                log.debug("Job {} was deleted during its execution", job.id());
            }
        } catch (DataAccessException e) {
            log.error("Failed to record last execution time for job {}: {}", job.id(), e.getMessage(), e);
        }
    }
}
