package com.agentdeploy.orchestrator.service;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.model.JobStatus;
import com.agentdeploy.orchestrator.model.StepRun;
import com.agentdeploy.orchestrator.model.StepState;
import com.agentdeploy.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Every write the processor makes to a job goes through here.
 *
 * Each method is one compare-and-set of the whole record (status, progress,
 * step list, lease) against the version of the snapshot passed in, retried on
 * store errors by {@link StoreRetry}. An empty result means somebody else
 * wrote first; the caller decides whether that is fatal.
 *
 * {@link #writeOwned} is the variant used while running a claimed job: it
 * absorbs concurrent writes that do not take the job away (a cancel request
 * bumps the version too) by reloading and re-applying the change.
 */
@Component
public class StatusPublisher {

    private static final Logger log = LoggerFactory.getLogger(StatusPublisher.class);

    private static final int OWNED_WRITE_ATTEMPTS = 5;

    private final JobStore   store;
    private final StoreRetry retry;
    private final Clock      clock;

    public StatusPublisher(JobStore store, StoreRetry retry, Clock clock) {
        this.store = store;
        this.retry = retry;
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Queue-side writes (snapshot from findQueued / findExpiredLeases)
    // ------------------------------------------------------------------

    public Optional<JobRecord> claim(JobRecord queued, String workerId, Duration lease) {
        return write(queued, r -> r.claim(workerId, clock.instant(), lease));
    }

    public Optional<JobRecord> cancelQueued(JobRecord queued) {
        return write(queued, r -> r.cancel(clock.instant()));
    }

    /** PROCESSING → QUEUED; used for orphans and for a claim that lost the post-claim check. */
    public Optional<JobRecord> requeue(JobRecord processing) {
        return write(processing, r -> r.requeue(clock.instant()));
    }

    /** Terminal failure of a job nobody owns any more, closing the step that was running. */
    public Optional<JobRecord> failOrphan(JobRecord processing, String error) {
        return write(processing, failChange(error));
    }

    // ------------------------------------------------------------------
    // Runner-side writes (job owned by workerId)
    // ------------------------------------------------------------------

    public Optional<JobRecord> startStep(JobRecord owned, String workerId, int sequence, String name, Duration lease) {
        return writeOwned(owned, workerId, r -> r.startStep(sequence, name, clock.instant(), lease));
    }

    public Optional<JobRecord> completeStep(JobRecord owned, String workerId, int sequence, int progress,
                                            Map<String, String> output, Duration lease) {
        return writeOwned(owned, workerId, r -> r.completeStep(sequence, progress, output, clock.instant(), lease));
    }

    public Optional<JobRecord> heartbeat(JobRecord owned, String workerId, Duration lease) {
        return writeOwned(owned, workerId, r -> r.renewLease(clock.instant(), lease));
    }

    public Optional<JobRecord> deploy(JobRecord owned, String workerId, String endpoint) {
        return writeOwned(owned, workerId, r -> r.deploy(endpoint, clock.instant()));
    }

    public Optional<JobRecord> cancel(JobRecord owned, String workerId) {
        return writeOwned(owned, workerId, r -> r.cancel(clock.instant()));
    }

    public Optional<JobRecord> fail(JobRecord owned, String workerId, String error) {
        return writeOwned(owned, workerId, failChange(error));
    }

    /**
     * Apply {@code change} to a job this worker owns.
     *
     * @return the committed snapshot, or empty if the job is no longer
     *         PROCESSING under {@code workerId} (lease lost or job gone)
     */
    private Optional<JobRecord> writeOwned(JobRecord snapshot, String workerId, UnaryOperator<JobRecord> change) {
        JobRecord current = snapshot;
        for (int attempt = 1; attempt <= OWNED_WRITE_ATTEMPTS; attempt++) {
            Optional<JobRecord> written = write(current, change);
            if (written.isPresent()) {
                return written;
            }
            Optional<JobRecord> fresh = reload(current.jobId());
            if (fresh.isEmpty() || !ownedBy(fresh.get(), workerId)) {
                log.warn("Job {} is no longer owned by {} (now {})", snapshot.jobId(), workerId,
                        fresh.map(f -> f.status() + " by " + f.claimedBy()).orElse("gone"));
                return Optional.empty();
            }
            log.debug("Concurrent write on job {} (v{} → v{}), re-applying", current.jobId(),
                    current.version(), fresh.get().version());
            current = fresh.get();
        }
        log.warn("Job {} kept changing under {}, giving up after {} attempts", snapshot.jobId(), workerId,
                OWNED_WRITE_ATTEMPTS);
        return Optional.empty();
    }

    public Optional<JobRecord> reload(UUID jobId) {
        return retry.call(() -> store.get(jobId));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Optional<JobRecord> write(JobRecord snapshot, UnaryOperator<JobRecord> change) {
        return retry.call(() -> store.compareAndSet(snapshot.jobId(), snapshot.version(), change));
    }

    // Marks the in-flight step failed too, so the step list never shows a step running on a terminal job.
    private UnaryOperator<JobRecord> failChange(String error) {
        return r -> {
            JobRecord withStep = r;
            for (StepRun run : r.steps()) {
                if (run.state() == StepState.RUNNING) {
                    withStep = withStep.failStep(run.sequence(), error, clock.instant());
                }
            }
            return withStep.fail(error, clock.instant());
        };
    }

    private static boolean ownedBy(JobRecord job, String workerId) {
        return job.status() == JobStatus.PROCESSING && workerId.equals(job.claimedBy());
    }
}
