package com.agentdeploy.orchestrator.service;

import com.agentdeploy.orchestrator.error.InvalidConfigException;
import com.agentdeploy.orchestrator.error.JobNotFoundException;
import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.model.JobStatus;
import com.agentdeploy.orchestrator.model.StepRun;
import com.agentdeploy.orchestrator.store.JobQuery;
import com.agentdeploy.orchestrator.store.JobStore;
import com.agentdeploy.orchestrator.store.JobSubscription;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Request-side operations on deployment jobs: submit, read, cancel, list.
 *
 * Nothing here runs a pipeline. Submit only writes a QUEUED record; the
 * {@link QueueProcessor} picks it up on its next tick. Cancel only sets a flag
 * that the processor honours at the next step boundary.
 */
@Service
public class DeploymentService {

    private static final Logger log = LoggerFactory.getLogger(DeploymentService.class);

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 100;

    private static final int MAX_TARGET_ID_LENGTH = 128;
    private static final int CANCEL_ATTEMPTS      = 5;

    private final JobStore       store;
    private final QueueProcessor processor;
    private final ObjectMapper   json;
    private final Clock          clock;

    public DeploymentService(JobStore store, QueueProcessor processor, ObjectMapper objectMapper, Clock clock) {
        this.store     = store;
        this.processor = processor;
        this.json      = objectMapper;
        this.clock     = clock;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Create a QUEUED job for {@code targetId}.
     *
     * @param config   JSON object; kept as text and never interpreted here
     * @param priority lower is claimed first; null means {@link JobRecord#DEFAULT_PRIORITY}
     * @throws InvalidConfigException on a blank target, a non-object config or an out-of-range priority
     * @throws com.agentdeploy.orchestrator.error.ActiveJobConflictException if the target already has
     *         a queued or processing job
     */
    public JobRecord submit(String targetId, JsonNode config, Integer priority) {
        if (targetId == null || targetId.isBlank()) {
            throw new InvalidConfigException("targetId is required");
        }
        String target = targetId.trim();
        if (target.length() > MAX_TARGET_ID_LENGTH) {
            throw new InvalidConfigException("targetId must be at most " + MAX_TARGET_ID_LENGTH + " characters");
        }
        if (config == null || !config.isObject()) {
            throw new InvalidConfigException("config must be a JSON object");
        }
        int prio = priority == null ? JobRecord.DEFAULT_PRIORITY : priority;
        if (prio < MIN_PRIORITY || prio > MAX_PRIORITY) {
            throw new InvalidConfigException("priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }

        JobRecord created = store.create(
                JobRecord.queued(UUID.randomUUID(), target, toText(config), prio, clock.instant()));
        log.info("Deployment {} queued for target {} (priority={})", created.jobId(), target, prio);
        return created;
    }

    /** Same as {@link #submit(String, JsonNode, Integer)} for a config given as JSON text. */
    public JobRecord submit(String targetId, String configJson, Integer priority) {
        JsonNode config;
        try {
            config = configJson == null ? null : json.readTree(configJson);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigException("config is not valid JSON");
        }
        return submit(targetId, config, priority);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public JobRecord get(UUID jobId) {
        return store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<StepRun> steps(UUID jobId) {
        return get(jobId).steps();
    }

    /**
     * @param status wire name ("queued", "deployed", ...) or null for all
     * @param limit  1..{@value JobQuery#MAX_LIMIT}; null means {@value JobQuery#DEFAULT_LIMIT}
     */
    public List<JobRecord> list(String targetId, String status, Integer limit) {
        JobStatus statusFilter = null;
        if (status != null && !status.isBlank()) {
            try {
                statusFilter = JobStatus.fromWireName(status);
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigException("Unknown status '" + status + "'");
            }
        }
        int n = limit == null ? JobQuery.DEFAULT_LIMIT : limit;
        if (n < 1 || n > JobQuery.MAX_LIMIT) {
            throw new InvalidConfigException("limit must be between 1 and " + JobQuery.MAX_LIMIT);
        }
        return store.find(new JobQuery(targetId, statusFilter, n));
    }

    public JobRecord latestForTarget(String targetId) {
        return store.findLatestByTarget(targetId)
                .orElseThrow(() -> new JobNotFoundException("No deployments for target " + targetId));
    }

    public Map<JobStatus, Long> countsByStatus() {
        return store.countByStatus();
    }

    public int inFlight() {
        return processor.inFlightCount();
    }

    /** Every committed change to any job of {@code targetId}. */
    public JobSubscription subscribeTarget(String targetId, Consumer<JobRecord> listener) {
        return store.subscribeTarget(targetId, listener);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Request cancellation. No-op on a terminal job or when already requested.
     *
     * @return the job after the flag was written (or as it was, if nothing changed)
     */
    public JobRecord cancel(UUID jobId) {
        for (int attempt = 1; attempt <= CANCEL_ATTEMPTS; attempt++) {
            JobRecord current = get(jobId);
            if (current.isTerminal() || current.cancelRequested()) {
                return current;
            }
            Optional<JobRecord> written = store.compareAndSet(jobId, current.version(),
                    r -> r.requestCancel(clock.instant()));
            if (written.isPresent()) {
                log.info("Cancel requested for job {} ({})", jobId, current.status().wireName());
                return written.get();
            }
            // The processor wrote in between; read again.
        }
        log.warn("Cancel of job {} kept losing to concurrent writes, returning latest state", jobId);
        return get(jobId);
    }

    private String toText(JsonNode config) {
        try {
            return json.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigException("config could not be serialized");
        }
    }
}
