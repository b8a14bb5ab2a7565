package com.buildscheduler.service;

import com.buildscheduler.dto.ExecutionHistoryResponse;
import com.buildscheduler.model.ExecutionHistory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ExecutionHistoryService {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private final JobStore jobStore;

    /** Newest first, across all jobs or for {@code jobId} only. */
    public List<ExecutionHistoryResponse> find(UUID jobId, Integer limit) {
        int size = clamp(limit);
        List<ExecutionHistory> rows = jobId != null
                ? jobStore.findHistory(jobId, size)
                : jobStore.findRecentHistory(size);
        Map<UUID, String> names = jobStore.findNames(
                rows.stream().map(ExecutionHistory::getJobId).collect(Collectors.toSet()));
        return rows.stream()
                .map(h -> ExecutionHistoryResponse.from(h, names.getOrDefault(h.getJobId(), "(deleted)")))
                .toList();
    }

    static int clamp(Integer limit) {
        if (limit == null || limit < 1) return DEFAULT_LIMIT;
        return Math.min(limit, MAX_LIMIT);
    }
}
