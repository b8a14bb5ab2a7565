package com.buildscheduler.scheduling;

import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * Live timer or cron trigger backing an armed job. Identity matters: a firing
 * callback only runs while its own handle is still the registered one.
 */
final class TriggerHandle {

    enum Kind { ONE_SHOT, CRON }

    private final UUID jobId;
    private final Kind kind;
    private final String schedule;
    private volatile ScheduledFuture<?> future;

    /**
     * @param schedule the execute-at time or cron expression the trigger was built from
     */
    TriggerHandle(UUID jobId, Kind kind, String schedule) {
        this.jobId = jobId;
        this.kind = kind;
        this.schedule = schedule;
    }

    UUID jobId() {
        return jobId;
    }

    Kind kind() {
        return kind;
    }

    String schedule() {
        return schedule;
    }

    void attach(ScheduledFuture<?> future) {
        this.future = future;
    }

    /** Stops future firings; a run already in progress completes. */
    void cancel() {
        ScheduledFuture<?> current = future;
        if (current != null) {
            current.cancel(false);
        }
    }
}
