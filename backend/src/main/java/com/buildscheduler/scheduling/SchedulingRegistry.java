package com.buildscheduler.scheduling;

import com.buildscheduler.exception.ConfigResolutionException;
import com.buildscheduler.model.enums.JobStatus;
import com.buildscheduler.model.enums.ScheduleKind;
import com.buildscheduler.model.enums.TriggerType;
import com.buildscheduler.service.JobDefinition;
import com.buildscheduler.service.JobStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * In-memory map from job id to the timer or cron trigger that fires it. Holds no
 * schedule intent of its own: everything here can be rebuilt from the job store,
 * which {@link #loadActiveJobs()} does at startup.
 *
 * <p>{@link #arm}, {@link #refresh} and {@link #disarm} are serialized on one monitor so
 * that at most one handle exists per job id. Firing callbacks check, under the same
 * monitor, that their handle is still the registered one; a replaced or cancelled handle
 * never runs a fan-out, even if its timer had already been dequeued. A handle whose
 * schedule no longer matches the stored job is re-armed from the store instead of firing.
 */
@Component
@Slf4j
public class SchedulingRegistry {

    private final TaskScheduler taskScheduler;
    private final JobStore jobStore;
    private final FanOutExecutor fanOutExecutor;
    private final Clock clock;

    private final ConcurrentHashMap<UUID, TriggerHandle> handles = new ConcurrentHashMap<>();
    private final Object monitor = new Object();

    public SchedulingRegistry(TaskScheduler taskScheduler,
                              JobStore jobStore,
                              FanOutExecutor fanOutExecutor,
                              Clock clock) {
        this.taskScheduler = taskScheduler;
        this.jobStore = jobStore;
        this.fanOutExecutor = fanOutExecutor;
        this.clock = clock;
    }

    @PostConstruct
    public void loadActiveJobs() {
        List<JobDefinition> active = jobStore.findAllActive();
        int armed = 0;
        for (JobDefinition job : active) {
            try {
                if (arm(job)) {
                    armed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to arm job '{}' ({}) on startup: {}", job.name(), job.id(), e.getMessage(), e);
            }
        }
        log.info("Loaded {} active scheduled jobs on startup, {} armed", active.size(), armed);
    }

    @PreDestroy
    public void disarmAll() {
        synchronized (monitor) {
            handles.values().forEach(TriggerHandle::cancel);
            handles.clear();
        }
    }

    // ── Arm / disarm ──────────────────────────────────────────────────────

    /**
     * Installs the trigger for {@code job}, replacing any existing one. Inactive jobs are
     * left unarmed; a one-shot job whose time has passed is marked expired instead.
     *
     * @return whether a trigger is now installed for the job
     */
    public boolean arm(JobDefinition job) {
        synchronized (monitor) {
            cancel(job.id());
            if (job.status() != JobStatus.ACTIVE) {
                log.debug("Job {} is {}, not arming", job.id(), job.status());
                return false;
            }
            TriggerHandle handle = switch (job.scheduleKind()) {
                case ONCE -> armOnce(job);
                case RECURRING -> armRecurring(job);
            };
            if (handle == null) {
                return false;
            }
            handles.put(job.id(), handle);
            return true;
        }
    }

    /**
     * Re-arms the job from its current stored definition, or drops its trigger when the
     * job is gone. Request-driven changes go through here so that the trigger always
     * follows the last committed definition, whatever order concurrent requests finish in.
     *
     * @return whether a trigger is now installed for the job
     */
    public boolean refresh(UUID jobId) {
        synchronized (monitor) {
            Optional<JobDefinition> job = jobStore.findById(jobId);
            if (job.isEmpty()) {
                cancel(jobId);
                return false;
            }
            return arm(job.get());
        }
    }

    /** Removes whatever trigger the job has. No-op when none is installed. */
    public void disarm(UUID jobId) {
        synchronized (monitor) {
            if (cancel(jobId)) {
                log.info("Disarmed job {}", jobId);
            }
        }
    }

    public boolean isArmed(UUID jobId) {
        return handles.containsKey(jobId);
    }

    public int armedCount() {
        return handles.size();
    }

    private boolean cancel(UUID jobId) {
        TriggerHandle existing = handles.remove(jobId);
        if (existing == null) {
            return false;
        }
        existing.cancel();
        return true;
    }

    private TriggerHandle armOnce(JobDefinition job) {
        if (job.executeAt() == null) {
            log.warn("One-time job '{}' ({}) has no execution time, not arming", job.name(), job.id());
            return null;
        }
        Instant fireAt = job.executeAt().atZone(clock.getZone()).toInstant();
        Duration delay = Duration.between(clock.instant(), fireAt);
        if (delay.isZero() || delay.isNegative()) {
            jobStore.markExpired(job.id());
            log.info("One-time job '{}' ({}) was due at {}, marked expired", job.name(), job.id(), job.executeAt());
            return null;
        }

        TriggerHandle handle = new TriggerHandle(job.id(), TriggerHandle.Kind.ONE_SHOT, scheduleOf(job));
        handle.attach(taskScheduler.schedule(() -> fire(handle), fireAt));
        log.info("Armed one-time job '{}' ({}) for {}", job.name(), job.id(), job.executeAt());
        return handle;
    }

    private TriggerHandle armRecurring(JobDefinition job) {
        CronTrigger trigger;
        try {
            trigger = new CronTrigger(CronExpressions.validate(job.cronExpression()), clock.getZone());
        } catch (IllegalArgumentException e) {
            log.error("Cannot arm job '{}' ({}): {}", job.name(), job.id(), e.getMessage());
            return null;
        }

        TriggerHandle handle = new TriggerHandle(job.id(), TriggerHandle.Kind.CRON, scheduleOf(job));
        ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(handle), trigger);
        if (future == null) {
            log.warn("Cron expression '{}' of job {} never fires, not arming", job.cronExpression(), job.id());
            return null;
        }
        handle.attach(future);
        log.info("Armed recurring job '{}' ({}) with cron '{}'", job.name(), job.id(), job.cronExpression());
        return handle;
    }

    // ── Firing ────────────────────────────────────────────────────────────

    private void fire(TriggerHandle handle) {
        UUID jobId = handle.jobId();
        synchronized (monitor) {
            if (handles.get(jobId) != handle) {
                return;
            }
            // One-shot triggers never re-arm themselves
            if (handle.kind() == TriggerHandle.Kind.ONE_SHOT) {
                handles.remove(jobId);
            }
        }

        try {
            // Deleted or deactivated since it was armed
            Optional<JobDefinition> job = jobStore.findById(jobId);
            if (job.isEmpty() || job.get().status() != JobStatus.ACTIVE) {
                log.info("Job {} is no longer active, dropping its trigger", jobId);
                release(handle);
                return;
            }
            if (!handle.schedule().equals(scheduleOf(job.get()))) {
                log.warn("Trigger of job {} was armed for '{}' but the job is now scheduled for '{}', re-arming",
                        jobId, handle.schedule(), scheduleOf(job.get()));
                rearmStale(handle);
                return;
            }
            fanOutExecutor.execute(job.get(), TriggerType.SCHEDULED);
        } catch (ConfigResolutionException e) {
            log.warn("Scheduled run of job {} recorded as failed: {}", jobId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled run of job {} failed: {}", jobId, e.getMessage(), e);
        }
    }

    private void rearmStale(TriggerHandle handle) {
        synchronized (monitor) {
            TriggerHandle current = handles.get(handle.jobId());
            // A newer handle was installed meanwhile; it already reflects the store
            if (current != null && current != handle) {
                return;
            }
            refresh(handle.jobId());
        }
    }

    private static String scheduleOf(JobDefinition job) {
        return job.scheduleKind() == ScheduleKind.ONCE
                ? "once@" + job.executeAt()
                : "cron@" + CronExpressions.normalize(String.valueOf(job.cronExpression()));
    }

    private void release(TriggerHandle handle) {
        synchronized (monitor) {
            if (handles.remove(handle.jobId(), handle)) {
                handle.cancel();
            }
        }
    }
}
