package com.agentdeploy.orchestrator.api;

import com.agentdeploy.orchestrator.api.dto.ErrorResponse;
import com.agentdeploy.orchestrator.api.dto.JobResponse;
import com.agentdeploy.orchestrator.api.dto.QueueDepthResponse;
import com.agentdeploy.orchestrator.api.dto.StepResponse;
import com.agentdeploy.orchestrator.api.dto.SubmitDeploymentRequest;
import com.agentdeploy.orchestrator.error.ErrorCode;
import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.model.JobStatus;
import com.agentdeploy.orchestrator.observer.JobWatcher;
import com.agentdeploy.orchestrator.observer.WatchResult;
import com.agentdeploy.orchestrator.service.DeploymentService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * REST API for deployment jobs.
 *
 * POST /deployments                — submit a deployment (201, 409 if the target is busy)
 * GET  /deployments                — list, newest first (?targetId, ?status, ?limit)
 * GET  /deployments/queue          — job counts per status + jobs running on this instance
 * GET  /deployments/{id}           — current record
 * GET  /deployments/{id}/steps     — step entries with their outputs
 * POST /deployments/{id}/cancel    — request cancellation (202)
 * GET  /deployments/{id}/events    — SSE stream of snapshots until terminal or timeout
 */
@RestController
@RequestMapping("/deployments")
public class DeploymentController {

    // The watcher times out first, so the client gets a "timeout" event before the response ends.
    private static final long EMITTER_GRACE_MILLIS = 5_000;

    private final DeploymentService service;
    private final JobWatcher        watcher;
    private final SnapshotStreams   streams;
    private final ObjectMapper      objectMapper;

    public DeploymentController(DeploymentService service,
                                JobWatcher watcher,
                                SnapshotStreams streams,
                                ObjectMapper objectMapper) {
        this.service      = service;
        this.watcher      = watcher;
        this.streams      = streams;
        this.objectMapper = objectMapper;
    }

    /**
     * Submit a deployment.
     *
     * Example:
     *   curl -X POST http://localhost:8080/deployments \
     *     -H "Content-Type: application/json" \
     *     -d '{"targetId":"agent-42","config":{"source":"gs://agents/agent-42.tar.gz"}}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@RequestBody SubmitDeploymentRequest req) {
        JobRecord job = service.submit(req.targetId(), req.config(), req.priority());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job, objectMapper));
    }

    @GetMapping
    public List<JobResponse> list(@RequestParam(required = false) String targetId,
                                  @RequestParam(required = false) String status,
                                  @RequestParam(required = false) Integer limit) {
        return service.list(targetId, status, limit).stream()
                .map(j -> JobResponse.from(j, objectMapper))
                .toList();
    }

    @GetMapping("/queue")
    public QueueDepthResponse queue() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Map.Entry<JobStatus, Long> e : service.countsByStatus().entrySet()) {
            counts.put(e.getKey().wireName(), e.getValue());
        }
        return new QueueDepthResponse(counts, service.inFlight());
    }

    /** Returns 404 if the job ID is not found. */
    @GetMapping("/{id}")
    public JobResponse get(@PathVariable UUID id) {
        return JobResponse.from(service.get(id), objectMapper);
    }

    @GetMapping("/{id}/steps")
    public List<StepResponse> steps(@PathVariable UUID id) {
        return service.steps(id).stream().map(StepResponse::from).toList();
    }

    /**
     * Request cancellation. The job stops at its next step boundary; completed
     * steps are compensated. A terminal job is returned unchanged.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<JobResponse> cancel(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(JobResponse.from(service.cancel(id), objectMapper));
    }

    /**
     * Stream snapshots of one job as server-sent events.
     *
     * Each event is named "snapshot" with id = record version. A reconnecting
     * client sends Last-Event-ID and only gets newer versions. The stream
     * ends after the terminal snapshot, or with a "timeout" event when the
     * watch runs out ({@code timeoutSeconds}, default the observer timeout);
     * timing out says nothing about the job's outcome.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable UUID id,
                             @RequestHeader(value = "Last-Event-ID", required = false) String lastEventId,
                             @RequestParam(required = false) Long timeoutSeconds) {
        service.get(id);   // 404 before the stream opens

        Duration timeout = watcher.defaultTimeout();
        if (timeoutSeconds != null && timeoutSeconds > 0 && timeoutSeconds < timeout.getSeconds()) {
            timeout = Duration.ofSeconds(timeoutSeconds);
        }

        AtomicReference<JobWatcher.Watch> watchRef = new AtomicReference<>();
        SnapshotStreams.Stream stream = streams.open(timeout.toMillis() + EMITTER_GRACE_MILLIS, () -> {
            JobWatcher.Watch w = watchRef.get();
            if (w != null) {
                w.close();
            }
        });

        JobWatcher.Watch watch = watcher.watch(id, timeout, parseVersion(lastEventId),
                job -> stream.snapshot(Long.toString(job.version()), job));
        watchRef.set(watch);
        Duration finalTimeout = timeout;
        watch.result().thenAccept(result -> {
            if (result.outcome() == WatchResult.Outcome.INDETERMINATE) {
                stream.end("timeout", new ErrorResponse(ErrorCode.TIMEOUT,
                        "No terminal state within " + finalTimeout.getSeconds() + " s; the deployment may still complete"));
            } else if (result.outcome() == WatchResult.Outcome.NOT_FOUND) {
                stream.end("error", new ErrorResponse(ErrorCode.NOT_FOUND, "Deployment job not found: " + id));
            } else {
                stream.complete();
            }
        });
        return stream.emitter();
    }

    private static long parseVersion(String lastEventId) {
        if (lastEventId == null || lastEventId.isBlank()) {
            return -1L;
        }
        try {
            return Long.parseLong(lastEventId.trim());
        } catch (NumberFormatException e) {
            return -1L;
        }
    }
}
