package com.buildscheduler.dto;

import com.buildscheduler.model.enums.ExecutionStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TargetExecutionResult {
    private String target;
    private String status; // success, failed
    private String buildLocation;
    private String errorMessage;

    public static TargetExecutionResult success(String target, String buildLocation) {
        return TargetExecutionResult.builder()
                .target(target)
                .status(ExecutionStatus.SUCCESS.wireName())
                .buildLocation(buildLocation)
                .build();
    }

    public static TargetExecutionResult failed(String target, String errorMessage) {
        return TargetExecutionResult.builder()
                .target(target)
                .status(ExecutionStatus.FAILED.wireName())
                .errorMessage(errorMessage)
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return ExecutionStatus.SUCCESS.wireName().equals(status);
    }
}
