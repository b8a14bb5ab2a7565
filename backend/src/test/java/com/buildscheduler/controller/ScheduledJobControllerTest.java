package com.buildscheduler.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.buildscheduler.dto.CronPreviewResponse;
import com.buildscheduler.dto.JobExecutionResult;
import com.buildscheduler.dto.ScheduledJobRequest;
import com.buildscheduler.dto.ScheduledJobResponse;
import com.buildscheduler.exception.BuildServerUnavailableException;
import com.buildscheduler.exception.NotFoundException;
import com.buildscheduler.exception.ValidationException;
import com.buildscheduler.service.ScheduledJobService;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;

@WebMvcTest(ScheduledJobController.class)
class ScheduledJobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScheduledJobService scheduledJobService;

    private static final String CONFIG_ID = "6f1c2a0e-5d7b-4c1e-9a8f-2b3c4d5e6f70";

    @Test
    void createReturns201AndReadsJobConfigs() throws Exception {
        UUID id = UUID.randomUUID();
        when(scheduledJobService.create(any())).thenReturn(ScheduledJobResponse.builder()
                .id(id.toString())
                .name("nightly")
                .status("active")
                .jobConfigs(Map.of("folder/job/A", Map.of("X", "1")))
                .build());

        mockMvc.perform(post("/api/scheduled-jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "nightly", "buildServerConfigId": "%s",
                                 "scheduleKind": "recurring", "cronExpression": "0 2 * * *",
                                 "job_configs": {"folder/job/A": {"X": "1", "FLAG": true}}}
                                """.formatted(CONFIG_ID)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(id.toString()))
                .andExpect(jsonPath("$.job_configs['folder/job/A'].X").value("1"));

        ArgumentCaptor<ScheduledJobRequest> request = ArgumentCaptor.forClass(ScheduledJobRequest.class);
        verify(scheduledJobService).create(request.capture());
        assertThat(request.getValue().getJobConfigs().get("folder/job/A"))
                .containsEntry("X", "1")
                .containsEntry("FLAG", true);
    }

    @Test
    void missingNameIsRejectedWithFieldErrors() throws Exception {
        mockMvc.perform(post("/api/scheduled-jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"buildServerConfigId\": \"%s\", \"scheduleKind\": \"once\"}".formatted(CONFIG_ID)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.name").value("Name is required"));
    }

    @Test
    void validationErrorsMapTo400() throws Exception {
        when(scheduledJobService.create(any())).thenThrow(new ValidationException("At least one target job is required"));

        mockMvc.perform(post("/api/scheduled-jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "n", "buildServerConfigId": "%s", "scheduleKind": "recurring",
                                 "cronExpression": "0 2 * * *", "job_configs": {}}
                                """.formatted(CONFIG_ID)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At least one target job is required"));
    }

    @Test
    void unknownJobIs404() throws Exception {
        UUID id = UUID.randomUUID();
        when(scheduledJobService.findById(id)).thenThrow(new NotFoundException("Scheduled job not found: " + id));

        mockMvc.perform(get("/api/scheduled-jobs/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Scheduled job not found: " + id));
    }

    @Test
    void statusUpdateDelegates() throws Exception {
        UUID id = UUID.randomUUID();
        when(scheduledJobService.updateStatus(eq(id), any()))
                .thenReturn(ScheduledJobResponse.builder().id(id.toString()).status("inactive").build());

        mockMvc.perform(put("/api/scheduled-jobs/{id}/status", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"inactive\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("inactive"));
    }

    @Test
    void deleteReturns204() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete("/api/scheduled-jobs/{id}", id))
                .andExpect(status().isNoContent());

        verify(scheduledJobService).delete(id);
    }

    @Test
    void executeReturnsAggregateResult() throws Exception {
        UUID id = UUID.randomUUID();
        when(scheduledJobService.executeNow(id)).thenReturn(JobExecutionResult.builder()
                .jobId(id.toString())
                .status("partial_success")
                .totalCount(2)
                .successCount(1)
                .failedCount(1)
                .results(List.of())
                .build());

        mockMvc.perform(post("/api/scheduled-jobs/{id}/execute", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("partial_success"))
                .andExpect(jsonPath("$.successCount").value(1));
    }

    @Test
    void cronPreviewIsNotMistakenForAnId() throws Exception {
        when(scheduledJobService.preview("0 2 * * *")).thenReturn(CronPreviewResponse.builder()
                .valid(true)
                .normalizedExpression("0 0 2 * * *")
                .nextFireTimes(List.of())
                .build());

        mockMvc.perform(get("/api/scheduled-jobs/cron-preview").param("cron", "0 2 * * *"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.normalizedExpression").value("0 0 2 * * *"));
    }

    @Test
    void buildServerFailuresMapTo502() throws Exception {
        UUID id = UUID.randomUUID();
        when(scheduledJobService.findById(id)).thenThrow(new BuildServerUnavailableException("down", null));

        mockMvc.perform(get("/api/scheduled-jobs/{id}", id))
                .andExpect(status().isBadGateway());
    }
}
