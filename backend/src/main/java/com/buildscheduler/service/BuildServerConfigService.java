package com.buildscheduler.service;

import com.buildscheduler.connector.BuildServerClientFactory;
import com.buildscheduler.connector.BuildServerJob;
import com.buildscheduler.connector.ParameterDefinition;
import com.buildscheduler.dto.BuildServerConfigRequest;
import com.buildscheduler.dto.BuildServerConfigResponse;
import com.buildscheduler.exception.NotFoundException;
import com.buildscheduler.exception.ValidationException;
import com.buildscheduler.model.BuildServerConfig;
import com.buildscheduler.repository.BuildServerConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class BuildServerConfigService {

    private final BuildServerConfigRepository configRepository;
    private final JobStore jobStore;
    private final BuildServerClientFactory clientFactory;

    @Transactional(readOnly = true)
    public List<BuildServerConfigResponse> findAll() {
        return configRepository.findAllByOrderByNameAsc().stream()
                .map(BuildServerConfigResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public BuildServerConfigResponse findById(UUID id) {
        return BuildServerConfigResponse.from(resolve(id));
    }

    @Transactional
    public BuildServerConfigResponse create(BuildServerConfigRequest req) {
        String name = req.getName().trim();
        if (configRepository.existsByName(name)) {
            throw new ValidationException("Build server configuration already exists: " + name);
        }
        String url = req.getUrl().trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        BuildServerConfig config = BuildServerConfig.builder()
                .name(name)
                .url(url)
                .username(blankToNull(req.getUsername()))
                .apiToken(blankToNull(req.getApiToken()))
                .build();
        config = configRepository.save(config);
        log.info("Registered build server '{}' at {}", config.getName(), config.getUrl());
        return BuildServerConfigResponse.from(config);
    }

    @Transactional
    public void delete(UUID id) {
        BuildServerConfig config = resolve(id);
        long inUse = jobStore.countByBuildServerConfig(id);
        if (inUse > 0) {
            throw new ValidationException("Cannot delete build server configuration '" + config.getName()
                    + "': " + inUse + " scheduled job(s) still use it");
        }
        configRepository.delete(config);
    }

    // ── Discovery ─────────────────────────────────────────────────────────

    public List<BuildServerJob> listJobs(UUID id) {
        return clientFactory.create(resolve(id)).listJobs();
    }

    public List<ParameterDefinition> getParameters(UUID id, String target) {
        return clientFactory.create(resolve(id)).getParameterDefinitions(requireTarget(target));
    }

    /** Declared defaults, shaped the way a job configuration stores them. */
    public Map<String, Object> getParameterDefaults(UUID id, String target) {
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (ParameterDefinition definition : getParameters(id, target)) {
            defaults.put(definition.name(), definition.collect(null));
        }
        return defaults;
    }

    private BuildServerConfig resolve(UUID id) {
        return configRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Build server configuration not found: " + id));
    }

    private static String requireTarget(String target) {
        if (target == null || target.isBlank()) {
            throw new ValidationException("Job name is required");
        }
        return target.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
