package com.agentdeploy.orchestrator.service;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.pipeline.DeploymentPipeline;
import com.agentdeploy.orchestrator.pipeline.PipelineStep;
import com.agentdeploy.orchestrator.pipeline.StepContext;
import com.agentdeploy.orchestrator.pipeline.StepException;
import com.agentdeploy.orchestrator.pipeline.StepManifest;
import com.agentdeploy.orchestrator.pipeline.StepOutput;
import com.agentdeploy.orchestrator.store.JobStoreException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Drives one claimed job through the pipeline.
 *
 * For each step, in order:
 *   1. Re-read the job; if a cancel was requested, compensate and stop
 *   2. Write currentStep and a running step entry
 *   3. Execute the step
 *   4. Success → write the step's progress weight and output
 *      Failure → write FAILED with the step's message and stop
 * When every step succeeded the job is written DEPLOYED with its endpoint; a
 * cancel that arrives during the last step is too late to stop it.
 *
 * A heartbeat renews the lease while the job runs. If any write finds the job
 * no longer owned by this worker (the reaper took it back), the runner stops
 * without touching it again. The same happens when the store stays down
 * through every retry of a non-terminal read or write: the job is left
 * PROCESSING, its lease runs out and the reaper requeues it.
 *
 * Called on a QueueProcessor worker thread; never throws.
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final DeploymentPipeline       pipeline;
    private final StatusPublisher          publisher;
    private final MeterRegistry            meterRegistry;
    private final Duration                 lease;
    private final ScheduledExecutorService heartbeats;

    public JobRunner(DeploymentPipeline pipeline,
                     StatusPublisher publisher,
                     MeterRegistry meterRegistry,
                     @Value("${deployer.processor.lease-duration:5m}") Duration lease) {
        this.pipeline      = pipeline;
        this.publisher     = publisher;
        this.meterRegistry = meterRegistry;
        this.lease         = lease;
        this.heartbeats    = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "job-heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        heartbeats.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Entry point, called by QueueProcessor for each claimed job
    // ------------------------------------------------------------------

    public void run(JobRecord claimed, String workerId) {
        MDC.put("jobId",    claimed.jobId().toString());
        MDC.put("targetId", claimed.targetId());
        Owned job = new Owned(claimed, workerId);
        long period = Math.max(1000L, lease.toMillis() / 3);
        ScheduledFuture<?> heartbeat = heartbeats.scheduleAtFixedRate(
                () -> job.heartbeat(), period, period, TimeUnit.MILLISECONDS);
        try {
            log.info("Running job {} for target {} (claim #{})",
                    claimed.jobId(), claimed.targetId(), claimed.claimCount());
            runPipeline(job);
        } catch (JobStoreException e) {
            log.error("Job store unavailable while running job {}, leaving it to the lease reaper: {}",
                    claimed.jobId(), e.getMessage());
            meterRegistry.counter("deployer.jobs.abandoned").increment();
        } catch (RuntimeException e) {
            log.error("Unhandled error running job {}", claimed.jobId(), e);
            failQuietly(job, "Internal error: " + e.getMessage());
        } finally {
            heartbeat.cancel(false);
            // Pool threads are reused; never leak one job's context into the next.
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Pipeline loop
    // ------------------------------------------------------------------

    private void runPipeline(Owned job) {
        List<PipelineStep> steps = pipeline.steps();
        List<PipelineStep> completed = new ArrayList<>();
        Map<String, Map<String, String>> outputs = new LinkedHashMap<>();

        for (int i = 0; i < steps.size(); i++) {
            PipelineStep step = steps.get(i);
            StepManifest m = step.manifest();
            int sequence = i + 1;

            if (cancelRequested(job)) {
                cancelWithCompensation(job, completed, outputs);
                return;
            }
            if (!job.write(r -> publisher.startStep(r, job.workerId, sequence, m.name(), lease))) {
                return;
            }

            MDC.put("step", m.name());
            StepContext ctx = context(job, outputs);
            StepOutput out;
            try {
                log.info("Step {}/{} '{}' started", sequence, steps.size(), m.name());
                out = pipeline.execute(step, ctx);
            } catch (StepException e) {
                log.warn("Step '{}' failed ({}): {}", m.name(), e.getKind(), e.getMessage());
                finish(job, "failed", r -> publisher.fail(r, job.workerId, e.getMessage()));
                return;
            } finally {
                MDC.remove("step");
            }

            outputs.put(m.name(), out.values());
            completed.add(step);
            if (!job.write(r -> publisher.completeStep(r, job.workerId, sequence, m.progressPercent(), out.values(), lease))) {
                return;
            }
            log.info("Step '{}' succeeded, progress {}%", m.name(), m.progressPercent());
        }

        String endpoint = endpointOf(outputs);
        finish(job, "deployed", r -> publisher.deploy(r, job.workerId, endpoint));
        log.info("Job {} deployed at {}", job.current().jobId(), endpoint);
    }

    /** Fresh read, so a cancel requested during the previous step is seen now. */
    private boolean cancelRequested(Owned job) {
        Optional<JobRecord> fresh = publisher.reload(job.current().jobId());
        return fresh.map(JobRecord::cancelRequested).orElse(false);
    }

    private void cancelWithCompensation(Owned job, List<PipelineStep> completed,
                                        Map<String, Map<String, String>> outputs) {
        log.info("Cancel requested for job {}, compensating {} completed step(s)",
                job.current().jobId(), completed.size());
        StepContext ctx = context(job, outputs);
        for (int i = completed.size() - 1; i >= 0; i--) {
            String name = completed.get(i).manifest().name();
            try {
                if (!completed.get(i).compensate(ctx)) {
                    log.warn("Step '{}' of job {} cannot be undone; manual cleanup required",
                            name, job.current().jobId());
                }
            } catch (RuntimeException e) {
                log.warn("Compensation of step '{}' for job {} failed; manual cleanup required: {}",
                        name, job.current().jobId(), e.getMessage());
            }
        }
        finish(job, "cancelled", r -> publisher.cancel(r, job.workerId));
    }

    /**
     * Terminal write. If the store stays unavailable through all retries, one
     * last attempt records FAILED with the store error; if that fails too the
     * job is left PROCESSING for the lease reaper.
     */
    private void finish(Owned job, String outcome, Function<JobRecord, Optional<JobRecord>> write) {
        try {
            if (job.write(write)) {
                meterRegistry.counter("deployer.jobs.finished", "outcome", outcome).increment();
            }
        } catch (JobStoreException e) {
            log.error("Could not record outcome '{}' for job {}: {}", outcome, job.current().jobId(), e.getMessage());
            failQuietly(job, "Could not record outcome '" + outcome + "': " + e.getMessage());
        }
    }

    private void failQuietly(Owned job, String error) {
        try {
            if (job.write(r -> publisher.fail(r, job.workerId, error))) {
                meterRegistry.counter("deployer.jobs.finished", "outcome", "failed").increment();
            }
        } catch (RuntimeException e) {
            log.error("Giving up on job {}; lease reaper will recover it: {}", job.current().jobId(), e.getMessage());
        }
    }

    private static StepContext context(Owned job, Map<String, Map<String, String>> outputs) {
        JobRecord r = job.current();
        return new StepContext(r.jobId(), r.targetId(), r.config(), outputs);
    }

    private static String endpointOf(Map<String, Map<String, String>> outputs) {
        String endpoint = null;
        for (Map<String, String> out : outputs.values()) {
            if (out.get(StepOutput.ENDPOINT) != null) {
                endpoint = out.get(StepOutput.ENDPOINT);
            }
        }
        return endpoint;
    }

    // ------------------------------------------------------------------
    // Owned snapshot, shared by the runner and its heartbeat
    // ------------------------------------------------------------------

    /**
     * Latest committed snapshot of a job this worker owns. Writes are
     * serialized so the runner thread and the heartbeat never race each
     * other's version.
     */
    private final class Owned {
        private final String workerId;
        private JobRecord    snapshot;
        private boolean      lost;

        Owned(JobRecord claimed, String workerId) {
            this.snapshot = claimed;
            this.workerId = workerId;
        }

        synchronized JobRecord current() {
            return snapshot;
        }

        /** @return false once ownership is gone; later writes are skipped. */
        synchronized boolean write(Function<JobRecord, Optional<JobRecord>> write) {
            if (lost) {
                return false;
            }
            Optional<JobRecord> committed = write.apply(snapshot);
            if (committed.isEmpty()) {
                lost = true;
                log.warn("Job {} lost by {}, stopping without further writes", snapshot.jobId(), workerId);
                return false;
            }
            snapshot = committed.get();
            return true;
        }

        void heartbeat() {
            try {
                write(r -> publisher.heartbeat(r, workerId, lease));
            } catch (RuntimeException e) {
                log.warn("Heartbeat for job {} failed: {}", current().jobId(), e.getMessage());
            }
        }
    }
}
