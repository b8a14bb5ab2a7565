package com.buildscheduler.controller;

import com.buildscheduler.connector.BuildServerJob;
import com.buildscheduler.connector.ParameterDefinition;
import com.buildscheduler.dto.BuildServerConfigRequest;
import com.buildscheduler.dto.BuildServerConfigResponse;
import com.buildscheduler.service.BuildServerConfigService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/build-servers")
@RequiredArgsConstructor
public class BuildServerConfigController {

    private final BuildServerConfigService buildServerConfigService;

    @GetMapping
    public List<BuildServerConfigResponse> findAll() {
        return buildServerConfigService.findAll();
    }

    @GetMapping("/{id}")
    public BuildServerConfigResponse findById(@PathVariable UUID id) {
        return buildServerConfigService.findById(id);
    }

    @PostMapping
    public ResponseEntity<BuildServerConfigResponse> create(@Valid @RequestBody BuildServerConfigRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(buildServerConfigService.create(request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        buildServerConfigService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/jobs")
    public List<BuildServerJob> listJobs(@PathVariable UUID id) {
        return buildServerConfigService.listJobs(id);
    }

    @GetMapping("/{id}/parameters")
    public List<ParameterDefinition> parameters(@PathVariable UUID id, @RequestParam String job) {
        return buildServerConfigService.getParameters(id, job);
    }

    @GetMapping("/{id}/parameter-defaults")
    public Map<String, Object> parameterDefaults(@PathVariable UUID id, @RequestParam String job) {
        return buildServerConfigService.getParameterDefaults(id, job);
    }
}
