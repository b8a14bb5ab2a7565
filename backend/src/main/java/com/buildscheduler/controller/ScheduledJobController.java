package com.buildscheduler.controller;

import com.buildscheduler.dto.CronPreviewResponse;
import com.buildscheduler.dto.JobExecutionResult;
import com.buildscheduler.dto.ScheduledJobRequest;
import com.buildscheduler.dto.ScheduledJobResponse;
import com.buildscheduler.dto.StatusUpdateRequest;
import com.buildscheduler.service.ScheduledJobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/scheduled-jobs")
@RequiredArgsConstructor
public class ScheduledJobController {

    private final ScheduledJobService scheduledJobService;

    @PostMapping
    public ResponseEntity<ScheduledJobResponse> create(@Valid @RequestBody ScheduledJobRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scheduledJobService.create(request));
    }

    @GetMapping
    public List<ScheduledJobResponse> findAll() {
        return scheduledJobService.findAll();
    }

    @GetMapping("/{id}")
    public ScheduledJobResponse findById(@PathVariable UUID id) {
        return scheduledJobService.findById(id);
    }

    @PutMapping("/{id}")
    public ScheduledJobResponse update(@PathVariable UUID id,
                                       @Valid @RequestBody ScheduledJobRequest request) {
        return scheduledJobService.update(id, request);
    }

    @PutMapping("/{id}/status")
    public ScheduledJobResponse updateStatus(@PathVariable UUID id,
                                             @Valid @RequestBody StatusUpdateRequest request) {
        return scheduledJobService.updateStatus(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        scheduledJobService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/execute")
    public JobExecutionResult execute(@PathVariable UUID id) {
        return scheduledJobService.executeNow(id);
    }

    @GetMapping("/cron-preview")
    public CronPreviewResponse preview(@RequestParam String cron) {
        return scheduledJobService.preview(cron);
    }
}
