package com.buildscheduler.dto;

import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobExecutionResult {
    private String jobId;
    private String historyId;
    private String status; // success, partial_success, failed
    private int totalCount;
    private int successCount;
    private int failedCount;
    private String errorMessage;
    private List<TargetExecutionResult> results;
}
