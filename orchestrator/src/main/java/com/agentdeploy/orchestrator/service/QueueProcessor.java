package com.agentdeploy.orchestrator.service;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.model.JobStatus;
import com.agentdeploy.orchestrator.store.JobStore;
import com.agentdeploy.orchestrator.store.JobStoreException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background loop that turns queued jobs into running ones.
 *
 * Every poll interval it looks at as many queued jobs as it has free worker
 * slots (plus a small look-ahead, since some candidates get skipped), claims
 * them with a conditional write and hands each claimed job to a
 * {@link JobRunner} on a fixed worker pool.
 *
 * The store is the queue: several processor instances can tick against the
 * same store, and the version check on the claim decides who wins.
 *
 * Queued jobs with a cancel request are swept on every tick, busy or not,
 * so a cancelled job never holds its target while the workers are occupied.
 *
 * A candidate is skipped when:
 *   - its target already has a PROCESSING job (in the store or running here)
 *   - another processor claimed it first
 * and cancelled without running anything when a cancel was requested while queued.
 */
@Component
@EnableScheduling
public class QueueProcessor {

    private static final Logger log = LoggerFactory.getLogger(QueueProcessor.class);

    private static final int LOOK_AHEAD = 4;
    private static final int CANCEL_SWEEP_LIMIT = 20;

    private final JobStore        store;
    private final StatusPublisher publisher;
    private final JobRunner       runner;
    private final StoreRetry      retry;
    private final MeterRegistry   meterRegistry;
    private final int             concurrency;
    private final Duration        lease;
    private final ExecutorService workers;
    private final String          workerId;

    // jobId → targetId of every job this instance is running right now.
    private final Map<UUID, String> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public QueueProcessor(JobStore store,
                          StatusPublisher publisher,
                          JobRunner runner,
                          StoreRetry retry,
                          MeterRegistry meterRegistry,
                          @Value("${deployer.processor.concurrency:1}") int concurrency,
                          @Value("${deployer.processor.lease-duration:5m}") Duration lease,
                          @Value("${deployer.processor.worker-id:}") String workerId) {
        this(store, publisher, runner, retry, meterRegistry, concurrency, lease, workerId,
                Executors.newFixedThreadPool(Math.max(1, concurrency), namedThreads()));
    }

    QueueProcessor(JobStore store,
                   StatusPublisher publisher,
                   JobRunner runner,
                   StoreRetry retry,
                   MeterRegistry meterRegistry,
                   int concurrency,
                   Duration lease,
                   String workerId,
                   ExecutorService workers) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("deployer.processor.concurrency must be >= 1");
        }
        this.store         = store;
        this.publisher     = publisher;
        this.runner        = runner;
        this.retry         = retry;
        this.meterRegistry = meterRegistry;
        this.concurrency   = concurrency;
        this.lease         = lease;
        this.workers       = workers;
        this.workerId      = workerId == null || workerId.isBlank()
                ? "processor-" + UUID.randomUUID().toString().substring(0, 8)
                : workerId;
        log.info("Queue processor '{}' started: concurrency={}, lease={}", this.workerId, concurrency, lease);
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        workers.shutdown();
        if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
            // Interrupted jobs keep their lease until it expires; the reaper requeues them.
            workers.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Tick
    // ------------------------------------------------------------------

    /**
     * Claim up to the number of free worker slots and dispatch them.
     *
     * fixedDelay: the next tick starts one poll interval after this one returns,
     * so a slow store never piles ticks up.
     */
    @Scheduled(fixedDelayString = "${deployer.processor.poll-interval:2s}")
    public void tick() {
        try {
            sweepCancelled();
        } catch (JobStoreException e) {
            log.warn("Could not read the queue, skipping tick: {}", e.getMessage());
            return;
        }
        int free = concurrency - inFlight.size();
        if (free <= 0) {
            return;
        }
        List<JobRecord> candidates;
        try {
            candidates = retry.call(() -> store.findQueued(free + LOOK_AHEAD));
        } catch (JobStoreException e) {
            log.warn("Could not read the queue, skipping tick: {}", e.getMessage());
            return;
        }

        int started = 0;
        for (JobRecord candidate : candidates) {
            if (started >= free) {
                break;
            }
            try {
                if (tryStart(candidate)) {
                    started++;
                }
            } catch (JobStoreException e) {
                // Job stays QUEUED; a later tick picks it up again.
                log.warn("Claim of job {} dropped after store errors: {}", candidate.jobId(), e.getMessage());
            }
        }
    }

    /** Jobs this instance is executing right now. */
    public int inFlightCount() {
        return inFlight.size();
    }

    public String workerId() {
        return workerId;
    }

    // ------------------------------------------------------------------
    // Claim
    // ------------------------------------------------------------------

    private void sweepCancelled() {
        for (JobRecord queued : retry.call(() -> store.findQueuedCancelRequested(CANCEL_SWEEP_LIMIT))) {
            cancelQueued(queued);
        }
    }

    private void cancelQueued(JobRecord queued) {
        publisher.cancelQueued(queued).ifPresent(c -> {
            log.info("Job {} cancelled before it was claimed", c.jobId());
            meterRegistry.counter("deployer.jobs.finished", "outcome", "cancelled").increment();
        });
    }

    private boolean tryStart(JobRecord candidate) {
        if (candidate.cancelRequested()) {
            // Flag set after this tick's sweep.
            cancelQueued(candidate);
            return false;
        }
        if (inFlight.containsValue(candidate.targetId()) || hasProcessing(candidate)) {
            log.debug("Target {} is busy, leaving job {} queued", candidate.targetId(), candidate.jobId());
            return false;
        }

        Optional<JobRecord> claimed = publisher.claim(candidate, workerId, lease);
        if (claimed.isEmpty()) {
            log.debug("Job {} was claimed or changed by someone else", candidate.jobId());
            return false;
        }
        JobRecord job = claimed.get();

        // Stores without a unique active-target index can let two claimers through;
        // the one whose job sorts later backs off.
        for (JobRecord other : retry.call(() -> store.findActiveByTarget(job.targetId()))) {
            if (!other.jobId().equals(job.jobId())
                    && other.status() == JobStatus.PROCESSING
                    && JobRecord.CLAIM_ORDER.compare(job, other) > 0) {
                log.warn("Job {} lost the target {} to job {}, returning it to the queue",
                        job.jobId(), job.targetId(), other.jobId());
                publisher.requeue(job);
                return false;
            }
        }

        meterRegistry.counter("deployer.jobs.claimed").increment();
        log.info("Worker '{}' claimed job {} (target={}, priority={})",
                workerId, job.jobId(), job.targetId(), job.priority());
        dispatch(job);
        return true;
    }

    private boolean hasProcessing(JobRecord candidate) {
        return retry.call(() -> store.findActiveByTarget(candidate.targetId())).stream()
                .anyMatch(j -> j.status() == JobStatus.PROCESSING && !j.jobId().equals(candidate.jobId()));
    }

    private void dispatch(JobRecord job) {
        inFlight.put(job.jobId(), job.targetId());
        try {
            workers.submit(() -> {
                try {
                    runner.run(job, workerId);
                } catch (Exception e) {
                    log.error("Unhandled error in job runner for {}: {}", job.jobId(), e.getMessage(), e);
                } finally {
                    inFlight.remove(job.jobId());
                }
            });
        } catch (RuntimeException e) {
            // Pool shut down: the lease expires and the reaper requeues the job.
            inFlight.remove(job.jobId());
            log.warn("Could not dispatch job {}: {}", job.jobId(), e.getMessage());
        }
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "deploy-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
