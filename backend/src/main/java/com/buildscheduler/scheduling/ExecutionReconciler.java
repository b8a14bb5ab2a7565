package com.buildscheduler.scheduling;

import com.buildscheduler.dto.JobExecutionResult;
import com.buildscheduler.dto.TargetExecutionResult;
import com.buildscheduler.model.enums.ExecutionStatus;
import com.buildscheduler.service.JobStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Folds per-target outcomes of one fan-out into a single job-level status and
 * writes it to the attempt's history row.
 */
@Component
@RequiredArgsConstructor
public class ExecutionReconciler {

    private final JobStore jobStore;

    /**
     * All targets succeeded: success. Some: partial success. None (or no targets at all): failed.
     */
    public static ExecutionStatus aggregate(int successCount, int totalCount) {
        if (totalCount <= 0 || successCount <= 0) {
            return ExecutionStatus.FAILED;
        }
        return successCount >= totalCount ? ExecutionStatus.SUCCESS : ExecutionStatus.PARTIAL_SUCCESS;
    }

    public static String summarize(List<TargetExecutionResult> results) {
        long successCount = results.stream().filter(TargetExecutionResult::isSuccess).count();
        StringBuilder summary = new StringBuilder()
                .append(successCount).append('/').append(results.size())
                .append(" targets triggered successfully, ")
                .append(results.size() - successCount).append(" failed");
        for (TargetExecutionResult result : results) {
            summary.append('\n');
            if (result.isSuccess()) {
                summary.append("[OK] ").append(result.getTarget());
                if (result.getBuildLocation() != null) {
                    summary.append(" -> ").append(result.getBuildLocation());
                }
            } else {
                summary.append("[FAILED] ").append(result.getTarget()).append(": ").append(result.getErrorMessage());
            }
        }
        return summary.toString();
    }

    public JobExecutionResult reconcile(UUID historyId, UUID jobId, List<TargetExecutionResult> results) {
        int successCount = (int) results.stream().filter(TargetExecutionResult::isSuccess).count();
        int failedCount = results.size() - successCount;
        ExecutionStatus status = aggregate(successCount, results.size());
        String summary = results.isEmpty() ? "No targets configured" : summarize(results);

        jobStore.completeExecution(historyId, status, successCount, failedCount, summary);

        return JobExecutionResult.builder()
                .jobId(jobId.toString())
                .historyId(historyId.toString())
                .status(status.wireName())
                .totalCount(results.size())
                .successCount(successCount)
                .failedCount(failedCount)
                .errorMessage(results.isEmpty() ? summary : null)
                .results(List.copyOf(results))
                .build();
    }

    /** Records an attempt that failed before any target was tried. */
    public JobExecutionResult fail(UUID historyId, UUID jobId, String errorMessage) {
        jobStore.completeExecution(historyId, ExecutionStatus.FAILED, 0, 0, errorMessage);
        return JobExecutionResult.builder()
                .jobId(jobId.toString())
                .historyId(historyId.toString())
                .status(ExecutionStatus.FAILED.wireName())
                .errorMessage(errorMessage)
                .results(List.of())
                .build();
    }
}
