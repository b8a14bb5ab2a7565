package com.buildscheduler.repository;

import com.buildscheduler.model.ScheduledJob;
import com.buildscheduler.model.enums.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, UUID> {

    List<ScheduledJob> findAllByOrderByCreatedAtDesc();

    List<ScheduledJob> findByStatus(JobStatus status);

    long countByBuildServerConfigId(UUID buildServerConfigId);

    @Modifying
    @Query("UPDATE ScheduledJob j SET j.status = :status, j.updatedAt = :now WHERE j.id = :id")
    int updateStatus(@Param("id") UUID id, @Param("status") JobStatus status, @Param("now") LocalDateTime now);

    @Modifying
    @Query("UPDATE ScheduledJob j SET j.lastExecutionAt = :at WHERE j.id = :id")
    int updateLastExecutionAt(@Param("id") UUID id, @Param("at") LocalDateTime at);
}
