package com.buildscheduler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledJobResponse {
    private String id;
    private String name;
    private String buildServerConfigId;
    private String buildServerName;
    private List<String> targets;
    @JsonProperty("job_configs")
    private Map<String, Map<String, Object>> jobConfigs;
    private Map<String, Object> parameters;
    private String scheduleKind;
    private LocalDateTime executeAt;
    private String cronExpression;
    private String status;
    private boolean armed;
    private LocalDateTime nextExecutionAt;
    private LocalDateTime lastExecutionAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
