package com.agentdeploy.orchestrator.api;

import com.agentdeploy.orchestrator.api.dto.JobResponse;
import com.agentdeploy.orchestrator.error.JobNotFoundException;
import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.observer.JobWatcher;
import com.agentdeploy.orchestrator.observer.ProgressTracker;
import com.agentdeploy.orchestrator.service.DeploymentService;
import com.agentdeploy.orchestrator.store.JobSubscription;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-target views of deployments.
 *
 * GET /targets/{targetId}/deployments/latest  — newest job for the target (404 if none)
 * GET /targets/{targetId}/deployments/events  — SSE stream of every job change for the target
 */
@RestController
@RequestMapping("/targets/{targetId}/deployments")
public class TargetController {

    private final DeploymentService service;
    private final JobWatcher        watcher;
    private final SnapshotStreams   streams;
    private final ObjectMapper      objectMapper;

    public TargetController(DeploymentService service,
                            JobWatcher watcher,
                            SnapshotStreams streams,
                            ObjectMapper objectMapper) {
        this.service      = service;
        this.watcher      = watcher;
        this.streams      = streams;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/latest")
    public JobResponse latest(@PathVariable String targetId) {
        return JobResponse.from(service.latestForTarget(targetId), objectMapper);
    }

    /**
     * Stream snapshots of all jobs for a target, starting with the newest one.
     * Event ids are "{jobId}:{version}". Open until the client disconnects or
     * the observer timeout elapses.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable String targetId) {
        Map<UUID, ProgressTracker> trackers = new ConcurrentHashMap<>();
        AtomicReference<JobSubscription> subscription = new AtomicReference<>();
        SnapshotStreams.Stream stream = streams.open(watcher.defaultTimeout().toMillis(), () -> {
            JobSubscription s = subscription.get();
            if (s != null) {
                s.close();
            }
        });

        subscription.set(service.subscribeTarget(targetId, job -> forward(stream, trackers, job)));
        try {
            forward(stream, trackers, service.latestForTarget(targetId));
        } catch (JobNotFoundException e) {
            // No deployment yet; the stream waits for the first submit.
        }
        return stream.emitter();
    }

    private static void forward(SnapshotStreams.Stream stream, Map<UUID, ProgressTracker> trackers, JobRecord job) {
        if (trackers.computeIfAbsent(job.jobId(), id -> new ProgressTracker()).accept(job)) {
            stream.snapshot(job.jobId() + ":" + job.version(), job);
        }
    }
}
