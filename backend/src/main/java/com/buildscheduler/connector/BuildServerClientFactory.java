package com.buildscheduler.connector;

import com.buildscheduler.model.BuildServerConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

@Component
@RequiredArgsConstructor
public class BuildServerClientFactory {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public BuildServerClient create(BuildServerConfig config) {
        return new JenkinsClient(restTemplate, objectMapper,
                config.getUrl(), config.getUsername(), config.getApiToken());
    }
}
