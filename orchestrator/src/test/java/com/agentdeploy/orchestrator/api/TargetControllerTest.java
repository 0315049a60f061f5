package com.agentdeploy.orchestrator.api;

import com.agentdeploy.orchestrator.error.JobNotFoundException;
import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.observer.JobWatcher;
import com.agentdeploy.orchestrator.service.DeploymentService;
import com.agentdeploy.orchestrator.store.JobSubscription;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TargetController.class)
@Import(SnapshotStreams.class)
class TargetControllerTest {

    static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    @Autowired MockMvc            mockMvc;
    @MockitoBean DeploymentService service;
    @MockitoBean JobWatcher        watcher;

    @Test
    void latest_returnsNewestJob() throws Exception {
        JobRecord job = fakeJob();
        when(service.latestForTarget("agent-1")).thenReturn(job);

        mockMvc.perform(get("/targets/{targetId}/deployments/latest", "agent-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId").value(job.jobId().toString()))
                .andExpect(jsonPath("$.targetId").value("agent-1"));
    }

    @Test
    void latest_noDeployments_returns404() throws Exception {
        when(service.latestForTarget("nobody")).thenThrow(new JobNotFoundException("No deployments for target nobody"));

        mockMvc.perform(get("/targets/{targetId}/deployments/latest", "nobody"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No deployments for target nobody"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void events_sendsLatestThenNewerChangesOnly() throws Exception {
        JobRecord v0 = fakeJob();
        JobRecord v1 = v0.claim("w1", T0, Duration.ofMinutes(5)).withVersion(1);
        AtomicReference<Consumer<JobRecord>> listener = new AtomicReference<>();
        when(watcher.defaultTimeout()).thenReturn(Duration.ofSeconds(600));
        when(service.latestForTarget("agent-1")).thenReturn(v0);
        when(service.subscribeTarget(eq("agent-1"), any())).thenAnswer(inv -> {
            listener.set((Consumer<JobRecord>) inv.getArgument(1));
            return (JobSubscription) () -> listener.set(null);
        });

        MvcResult result = mockMvc.perform(get("/targets/{targetId}/deployments/events", "agent-1"))
                .andExpect(request().asyncStarted())
                .andReturn();
        listener.get().accept(v0);   // replay of what was already sent
        listener.get().accept(v1);

        String v1Id = "id:" + v0.jobId() + ":1";
        String body = awaitContent(result, v1Id);
        assertThat(body).contains("id:" + v0.jobId() + ":0", v1Id);
        assertThat(body.indexOf("id:" + v0.jobId() + ":0"))
                .isEqualTo(body.lastIndexOf("id:" + v0.jobId() + ":0"));
    }

    private static String awaitContent(MvcResult result, String expected) throws Exception {
        long deadline = System.currentTimeMillis() + 5_000;
        String body = result.getResponse().getContentAsString();
        while (!body.contains(expected) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            body = result.getResponse().getContentAsString();
        }
        return body;
    }

    private static JobRecord fakeJob() {
        return JobRecord.queued(UUID.randomUUID(), "agent-1", "{}", 5, T0);
    }
}
