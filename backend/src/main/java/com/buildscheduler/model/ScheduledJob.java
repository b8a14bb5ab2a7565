package com.buildscheduler.model;

import com.buildscheduler.model.enums.JobStatus;
import com.buildscheduler.model.enums.ScheduleKind;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Persisted schedule definition. {@code targets}, {@code jobConfigs} and
 * {@code parameters} hold JSON text; read them through the job store, which
 * normalizes legacy and double-encoded values.
 */
@Entity
@Table(name = "scheduled_jobs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "build_server_config_id")
    private UUID buildServerConfigId;

    @Column(columnDefinition = "TEXT")
    private String targets;

    @Column(name = "job_configs", columnDefinition = "TEXT")
    private String jobConfigs;

    // Single-target rows written before per-target configuration existed
    @Column(name = "target_job", length = 500)
    private String targetJob;

    @Column(columnDefinition = "TEXT")
    private String parameters;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_kind", nullable = false, length = 20)
    private ScheduleKind scheduleKind;

    @Column(name = "execute_at")
    private LocalDateTime executeAt;

    @Column(name = "cron_expression", length = 100)
    private String cronExpression;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.ACTIVE;

    @Column(name = "last_execution_at")
    private LocalDateTime lastExecutionAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
