package com.agentdeploy.orchestrator.service;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.store.JobStore;
import com.agentdeploy.orchestrator.store.JobStoreException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Recovers PROCESSING jobs whose worker stopped renewing its lease.
 *
 * A worker that crashes or hangs mid-step leaves its job PROCESSING forever,
 * and with it the target blocked for new submits. Once the lease runs out the
 * job goes back to QUEUED with its progress kept, so the next claim re-runs
 * the pipeline; after {@code max-claims} attempts it is failed instead, so a
 * job that reliably kills its worker cannot loop.
 */
@Component
public class LeaseReaper {

    private static final Logger log = LoggerFactory.getLogger(LeaseReaper.class);

    private final JobStore        store;
    private final StatusPublisher publisher;
    private final StoreRetry      retry;
    private final MeterRegistry   meterRegistry;
    private final Clock           clock;
    private final int             maxClaims;

    public LeaseReaper(JobStore store,
                       StatusPublisher publisher,
                       StoreRetry retry,
                       MeterRegistry meterRegistry,
                       Clock clock,
                       @Value("${deployer.reaper.max-claims:3}") int maxClaims) {
        this.store         = store;
        this.publisher     = publisher;
        this.retry         = retry;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.maxClaims     = maxClaims;
    }

    @Scheduled(fixedDelayString = "${deployer.reaper.interval:60s}",
               initialDelayString = "${deployer.reaper.interval:60s}")
    public void reap() {
        int recovered = reapExpired();
        if (recovered > 0) {
            log.info("Lease reaper recovered {} job(s)", recovered);
        }
    }

    /** @return how many jobs were requeued or failed */
    public int reapExpired() {
        List<JobRecord> expired;
        try {
            expired = retry.call(() -> store.findExpiredLeases(clock.instant()));
        } catch (JobStoreException e) {
            log.warn("Lease reaper could not read expired leases: {}", e.getMessage());
            return 0;
        }
        int recovered = 0;
        for (JobRecord job : expired) {
            try {
                if (recover(job)) {
                    recovered++;
                }
            } catch (JobStoreException e) {
                log.warn("Lease reaper could not recover job {}: {}", job.jobId(), e.getMessage());
            }
        }
        return recovered;
    }

    private boolean recover(JobRecord job) {
        if (job.claimCount() >= maxClaims) {
            String error = "worker lease expired after " + job.claimCount() + " claims";
            boolean failed = publisher.failOrphan(job, error).isPresent();
            if (failed) {
                log.error("Job {} (target {}) failed: {}", job.jobId(), job.targetId(), error);
                meterRegistry.counter("deployer.jobs.finished", "outcome", "failed").increment();
            }
            return failed;
        }
        boolean requeued = publisher.requeue(job).isPresent();
        if (requeued) {
            log.warn("Job {} (target {}) orphaned by {} at step '{}' ({}%), requeued",
                    job.jobId(), job.targetId(), job.claimedBy(), job.currentStep(), job.progressPercent());
            meterRegistry.counter("deployer.jobs.requeued").increment();
        }
        return requeued;
    }
}
