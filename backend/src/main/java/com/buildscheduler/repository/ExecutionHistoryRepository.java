package com.buildscheduler.repository;

import com.buildscheduler.model.ExecutionHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ExecutionHistoryRepository extends JpaRepository<ExecutionHistory, UUID> {

    List<ExecutionHistory> findByJobIdOrderByStartTimeDesc(UUID jobId, Pageable pageable);

    List<ExecutionHistory> findAllByOrderByStartTimeDesc(Pageable pageable);
}
