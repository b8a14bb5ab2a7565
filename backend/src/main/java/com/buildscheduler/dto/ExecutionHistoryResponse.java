package com.buildscheduler.dto;

import com.buildscheduler.model.ExecutionHistory;
import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutionHistoryResponse {
    private String id;
    private String jobId;
    private String jobName;
    private String status;
    private String triggerType;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Integer successCount;
    private Integer failedCount;
    private String logOutput;

    public static ExecutionHistoryResponse from(ExecutionHistory history, String jobName) {
        return ExecutionHistoryResponse.builder()
                .id(history.getId().toString())
                .jobId(history.getJobId().toString())
                .jobName(jobName)
                .status(history.getStatus().wireName())
                .triggerType(history.getTriggerType().name())
                .startTime(history.getStartTime())
                .endTime(history.getEndTime())
                .successCount(history.getSuccessCount())
                .failedCount(history.getFailedCount())
                .logOutput(history.getLogOutput())
                .build();
    }
}
