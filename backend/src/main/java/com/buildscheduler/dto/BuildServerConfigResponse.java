package com.buildscheduler.dto;

import com.buildscheduler.model.BuildServerConfig;
import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuildServerConfigResponse {
    private String id;
    private String name;
    private String url;
    private String username;
    private boolean hasToken;
    private LocalDateTime createdAt;

    public static BuildServerConfigResponse from(BuildServerConfig config) {
        return BuildServerConfigResponse.builder()
                .id(config.getId().toString())
                .name(config.getName())
                .url(config.getUrl())
                .username(config.getUsername())
                .hasToken(config.getApiToken() != null && !config.getApiToken().isEmpty())
                .createdAt(config.getCreatedAt())
                .build();
    }
}
