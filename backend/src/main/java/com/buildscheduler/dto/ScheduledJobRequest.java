package com.buildscheduler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledJobRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must not exceed 255 characters")
    private String name;

    @NotNull(message = "Build server configuration is required")
    private UUID buildServerConfigId;

    @NotBlank(message = "Schedule kind is required")
    private String scheduleKind;

    private LocalDateTime executeAt;

    @Size(max = 100)
    private String cronExpression;

    // target path -> parameter name -> value; insertion order is the trigger order
    @JsonProperty("job_configs")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private Map<String, Map<String, Object>> jobConfigs = new LinkedHashMap<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    private String status;
}
