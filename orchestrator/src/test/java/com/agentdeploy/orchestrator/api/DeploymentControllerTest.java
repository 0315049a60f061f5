package com.agentdeploy.orchestrator.api;

import com.agentdeploy.orchestrator.error.ActiveJobConflictException;
import com.agentdeploy.orchestrator.error.InvalidConfigException;
import com.agentdeploy.orchestrator.error.JobNotFoundException;
import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.model.JobStatus;
import com.agentdeploy.orchestrator.observer.JobWatcher;
import com.agentdeploy.orchestrator.observer.WatchResult;
import com.agentdeploy.orchestrator.service.DeploymentService;
import com.agentdeploy.orchestrator.store.JobStoreException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for DeploymentController.
 *
 * @WebMvcTest spins up only the web layer (no DB, no scheduler, no runtime).
 * The service and the watcher are mocks; SnapshotStreams is real so SSE
 * output can be asserted.
 */
@WebMvcTest(DeploymentController.class)
@Import(SnapshotStreams.class)
class DeploymentControllerTest {

    static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    @Autowired MockMvc           mockMvc;
    @MockitoBean DeploymentService service;
    @MockitoBean JobWatcher        watcher;

    // ------------------------------------------------------------------
    // POST /deployments
    // ------------------------------------------------------------------

    @Test
    void submit_validRequest_returns201WithQueuedJob() throws Exception {
        JobRecord job = fakeJob();
        when(service.submit(eq("agent-1"), any(JsonNode.class), isNull()))
                .thenReturn(job);

        mockMvc.perform(post("/deployments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"targetId":"agent-1","config":{"source":"gs://agents/a1.tar.gz"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.jobId").value(job.jobId().toString()))
                .andExpect(jsonPath("$.status").value("queued"))
                .andExpect(jsonPath("$.progressPercent").value(0))
                .andExpect(jsonPath("$.config.source").value("gs://agents/a1.tar.gz"));
    }

    @Test
    void submit_targetBusy_returns409() throws Exception {
        when(service.submit(any(), any(JsonNode.class), any()))
                .thenThrow(new ActiveJobConflictException("agent-1", UUID.randomUUID()));

        mockMvc.perform(post("/deployments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetId\":\"agent-1\",\"config\":{}}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"));
    }

    @Test
    void submit_invalidInput_returns400() throws Exception {
        when(service.submit(any(), any(JsonNode.class), any()))
                .thenThrow(new InvalidConfigException("priority must be between 0 and 100"));

        mockMvc.perform(post("/deployments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetId\":\"agent-1\",\"config\":{},\"priority\":500}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_CONFIG"))
                .andExpect(jsonPath("$.message").value("priority must be between 0 and 100"));
    }

    @Test
    void submit_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/deployments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void submit_storeDown_returns503() throws Exception {
        when(service.submit(any(), any(JsonNode.class), any()))
                .thenThrow(new JobStoreException("connection refused"));

        mockMvc.perform(post("/deployments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetId\":\"agent-1\",\"config\":{}}"))
                .andExpect(status().isServiceUnavailable());
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Test
    void get_unknownId_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(service.get(id)).thenThrow(new JobNotFoundException(id));

        mockMvc.perform(get("/deployments/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void get_badUuid_returns400() throws Exception {
        mockMvc.perform(get("/deployments/not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void list_passesFilters() throws Exception {
        when(service.list("agent-1", "deployed", 5)).thenReturn(List.of(fakeJob()));

        mockMvc.perform(get("/deployments").param("targetId", "agent-1").param("status", "deployed").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void queue_reportsCountsByWireName() throws Exception {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            counts.put(s, 0L);
        }
        counts.put(JobStatus.QUEUED, 3L);
        when(service.countsByStatus()).thenReturn(counts);
        when(service.inFlight()).thenReturn(1);

        mockMvc.perform(get("/deployments/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.counts.queued").value(3))
                .andExpect(jsonPath("$.counts.deployed").value(0))
                .andExpect(jsonPath("$.inFlight").value(1));
    }

    @Test
    void cancel_returns202() throws Exception {
        JobRecord job = fakeJob().requestCancel(T0);
        when(service.cancel(job.jobId())).thenReturn(job);

        mockMvc.perform(post("/deployments/{id}/cancel", job.jobId()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.cancelRequested").value(true));
    }

    // ------------------------------------------------------------------
    // GET /deployments/{id}/events
    // ------------------------------------------------------------------

    @Test
    @SuppressWarnings("unchecked")
    void events_streamsSnapshotsAndCompletesOnTerminal() throws Exception {
        JobRecord done = fakeJob().claim("w1", T0, Duration.ofMinutes(5)).deploy("https://x", T0).withVersion(2);
        when(service.get(done.jobId())).thenReturn(done);
        when(watcher.defaultTimeout()).thenReturn(Duration.ofSeconds(600));
        when(watcher.watch(eq(done.jobId()), any(Duration.class), eq(-1L), any())).thenAnswer(inv -> {
            ((Consumer<JobRecord>) inv.getArgument(3)).accept(done);
            return finishedWatch(new WatchResult(WatchResult.Outcome.TERMINAL, done));
        });

        MvcResult result = mockMvc.perform(get("/deployments/{id}/events", done.jobId()))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(5_000);

        String body = result.getResponse().getContentAsString();
        assertThat(body).contains("id:2", "event:snapshot", "\"status\":\"deployed\"");
        assertThat(body).doesNotContain("event:timeout");
    }

    @Test
    void events_resumeFromLastEventId_andTimeoutEvent() throws Exception {
        JobRecord job = fakeJob().withVersion(4);
        when(service.get(job.jobId())).thenReturn(job);
        when(watcher.defaultTimeout()).thenReturn(Duration.ofSeconds(600));
        when(watcher.watch(eq(job.jobId()), eq(Duration.ofSeconds(30)), eq(4L), any()))
                .thenReturn(finishedWatch(new WatchResult(WatchResult.Outcome.INDETERMINATE, job)));

        MvcResult result = mockMvc.perform(get("/deployments/{id}/events", job.jobId())
                        .header("Last-Event-ID", "4")
                        .param("timeoutSeconds", "30"))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(5_000);

        assertThat(result.getResponse().getContentAsString()).contains("event:timeout", "TIMEOUT");
    }

    @Test
    void events_unknownJob_returns404BeforeStreaming() throws Exception {
        UUID id = UUID.randomUUID();
        when(service.get(id)).thenThrow(new JobNotFoundException(id));

        mockMvc.perform(get("/deployments/{id}/events", id))
                .andExpect(status().isNotFound());
        verify(watcher, never()).watch(any(), any(Duration.class), any(Long.class), any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static JobRecord fakeJob() {
        return JobRecord.queued(UUID.randomUUID(), "agent-1", "{\"source\":\"gs://agents/a1.tar.gz\"}", 5, T0);
    }

    private static JobWatcher.Watch finishedWatch(WatchResult result) {
        JobWatcher.Watch watch = mock(JobWatcher.Watch.class);
        when(watch.result()).thenReturn(CompletableFuture.completedFuture(result));
        return watch;
    }
}
