package com.buildscheduler.scheduling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.buildscheduler.dto.JobExecutionResult;
import com.buildscheduler.dto.TargetExecutionResult;
import com.buildscheduler.model.enums.ExecutionStatus;
import com.buildscheduler.service.JobStore;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ExecutionReconcilerTest {

    @Test
    void aggregateFollowsSuccessShare() {
        assertThat(ExecutionReconciler.aggregate(3, 3)).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(ExecutionReconciler.aggregate(1, 3)).isEqualTo(ExecutionStatus.PARTIAL_SUCCESS);
        assertThat(ExecutionReconciler.aggregate(0, 3)).isEqualTo(ExecutionStatus.FAILED);
        assertThat(ExecutionReconciler.aggregate(0, 0)).isEqualTo(ExecutionStatus.FAILED);
    }

    @Test
    void summaryListsEveryTarget() {
        String summary = ExecutionReconciler.summarize(List.of(
                TargetExecutionResult.success("folder/A", "http://ci/queue/item/1/"),
                TargetExecutionResult.failed("folder/B", "Build server has no job folder/B (404)")));

        assertThat(summary).startsWith("1/2 targets triggered successfully, 1 failed");
        assertThat(summary).contains("[OK] folder/A -> http://ci/queue/item/1/");
        assertThat(summary).contains("[FAILED] folder/B: Build server has no job folder/B (404)");
    }

    @Test
    void reconcileWritesTerminalHistoryRow() {
        JobStore jobStore = mock(JobStore.class);
        ExecutionReconciler reconciler = new ExecutionReconciler(jobStore);
        UUID historyId = UUID.randomUUID();
        UUID jobId = UUID.randomUUID();

        JobExecutionResult result = reconciler.reconcile(historyId, jobId, List.of(
                TargetExecutionResult.success("A", null),
                TargetExecutionResult.failed("B", "boom")));

        assertThat(result.getStatus()).isEqualTo("partial_success");
        assertThat(result.getTotalCount()).isEqualTo(2);
        assertThat(result.getSuccessCount()).isEqualTo(1);
        assertThat(result.getFailedCount()).isEqualTo(1);
        assertThat(result.getHistoryId()).isEqualTo(historyId.toString());
        verify(jobStore).completeExecution(eq(historyId), eq(ExecutionStatus.PARTIAL_SUCCESS), eq(1), eq(1),
                contains("[FAILED] B: boom"));
    }

    @Test
    void emptyTargetListIsFailure() {
        JobStore jobStore = mock(JobStore.class);
        ExecutionReconciler reconciler = new ExecutionReconciler(jobStore);

        JobExecutionResult result = reconciler.reconcile(UUID.randomUUID(), UUID.randomUUID(), List.of());

        assertThat(result.getStatus()).isEqualTo("failed");
        assertThat(result.getErrorMessage()).isEqualTo("No targets configured");
    }
}
