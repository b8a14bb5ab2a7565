package com.buildscheduler.controller;

import com.buildscheduler.dto.ExecutionHistoryResponse;
import com.buildscheduler.service.ExecutionHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/execution-history")
@RequiredArgsConstructor
public class ExecutionHistoryController {

    private final ExecutionHistoryService executionHistoryService;

    @GetMapping
    public List<ExecutionHistoryResponse> find(@RequestParam(required = false) UUID jobId,
                                               @RequestParam(required = false) Integer limit) {
        return executionHistoryService.find(jobId, limit);
    }

    @GetMapping("/{jobId}")
    public List<ExecutionHistoryResponse> findByJob(@PathVariable UUID jobId,
                                                    @RequestParam(required = false) Integer limit) {
        return executionHistoryService.find(jobId, limit);
    }
}
