package com.agentdeploy.orchestrator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable snapshot of one deployment attempt.
 *
 * This is what the store hands out, what the processor transforms and what
 * observers receive. Every transition method returns a new snapshot and
 * enforces the state machine in {@link JobStatus}; the store bumps
 * {@code version} when the snapshot is written.
 *
 * {@code config} is the caller's JSON object, kept as text. Nothing in this
 * class looks inside it.
 */
public record JobRecord(
        UUID      jobId,
        String    targetId,
        JobStatus status,
        int       progressPercent,
        String    currentStep,
        int       priority,
        String    config,
        String    resultEndpoint,
        String    errorMessage,
        boolean   cancelRequested,
        long      version,
        Instant   createdAt,
        Instant   updatedAt,
        Instant   completedAt,
        String    claimedBy,
        Instant   leaseExpiresAt,
        int       claimCount,
        List<StepRun> steps
) {

    public static final int DEFAULT_PRIORITY = 5;

    /** Queue order: lower priority first, then oldest first, then id for a total order. */
    public static final Comparator<JobRecord> CLAIM_ORDER = Comparator
            .comparingInt(JobRecord::priority)
            .thenComparing(JobRecord::createdAt)
            .thenComparing(JobRecord::jobId);

    public JobRecord {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(status, "status");
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static JobRecord queued(UUID jobId, String targetId, String config, int priority, Instant now) {
        return new JobRecord(jobId, targetId, JobStatus.QUEUED, 0, null, priority, config,
                null, null, false, 0L, now, now, null, null, null, 0, List.of());
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /** QUEUED → PROCESSING, owned by {@code workerId} until the lease runs out. */
    public JobRecord claim(String workerId, Instant now, Duration lease) {
        if (status != JobStatus.QUEUED) {
            throw new IllegalJobTransitionException(jobId, status, JobStatus.PROCESSING);
        }
        return toBuilder()
                .status(JobStatus.PROCESSING)
                .currentStep(null)
                .claimedBy(workerId)
                .leaseExpiresAt(now.plus(lease))
                .claimCount(claimCount + 1)
                .updatedAt(now)
                .build();
    }

    /** Sets the cancel flag. No-op on a terminal job. */
    public JobRecord requestCancel(Instant now) {
        if (status.isTerminal() || cancelRequested) {
            return this;
        }
        return toBuilder().cancelRequested(true).updatedAt(now).build();
    }

    /** Marks step {@code sequence} as in flight and renews the lease. */
    public JobRecord startStep(int sequence, String name, Instant now, Duration lease) {
        requireProcessing();
        return toBuilder()
                .currentStep(name)
                .step(StepRun.running(sequence, name, now))
                .leaseExpiresAt(now.plus(lease))
                .updatedAt(now)
                .build();
    }

    /**
     * Records a successful step. Progress never goes down: a step re-run after
     * orphan recovery keeps whatever the earlier attempt had reached.
     */
    public JobRecord completeStep(int sequence, int progress, Map<String, String> output,
                                  Instant now, Duration lease) {
        requireProcessing();
        StepRun run = stepAt(sequence);
        if (run == null) {
            throw new IllegalJobTransitionException(
                    "Job " + jobId + " has no running step #" + sequence);
        }
        return toBuilder()
                .progressPercent(Math.max(progressPercent, clampPercent(progress)))
                .step(run.succeeded(output, now))
                .leaseExpiresAt(now.plus(lease))
                .updatedAt(now)
                .build();
    }

    /** Records the step error on the step entry only; pair with {@link #fail}. */
    public JobRecord failStep(int sequence, String error, Instant now) {
        requireProcessing();
        StepRun run = stepAt(sequence);
        if (run == null) {
            return this;
        }
        return toBuilder().step(run.failed(error, now)).updatedAt(now).build();
    }

    public JobRecord renewLease(Instant now, Duration lease) {
        requireProcessing();
        return toBuilder().leaseExpiresAt(now.plus(lease)).updatedAt(now).build();
    }

    public JobRecord deploy(String endpoint, Instant now) {
        requireTransition(JobStatus.DEPLOYED);
        return terminal(JobStatus.DEPLOYED, now)
                .progressPercent(100)
                .resultEndpoint(endpoint)
                .build();
    }

    public JobRecord fail(String error, Instant now) {
        requireTransition(JobStatus.FAILED);
        return terminal(JobStatus.FAILED, now).errorMessage(error).build();
    }

    public JobRecord cancel(Instant now) {
        requireTransition(JobStatus.CANCELLED);
        return terminal(JobStatus.CANCELLED, now).build();
    }

    /** PROCESSING → QUEUED for an orphaned job; progress is kept. */
    public JobRecord requeue(Instant now) {
        requireTransition(JobStatus.QUEUED);
        return toBuilder()
                .status(JobStatus.QUEUED)
                .currentStep(null)
                .claimedBy(null)
                .leaseExpiresAt(null)
                .updatedAt(now)
                .build();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isLeaseExpired(Instant now) {
        return status == JobStatus.PROCESSING
                && (leaseExpiresAt == null || !leaseExpiresAt.isAfter(now));
    }

    public StepRun stepAt(int sequence) {
        for (StepRun run : steps) {
            if (run.sequence() == sequence) {
                return run;
            }
        }
        return null;
    }

    public List<StepRun> succeededSteps() {
        return steps.stream().filter(s -> s.state() == StepState.SUCCEEDED).toList();
    }

    /** Same record with a different version, used by stores when persisting. */
    public JobRecord withVersion(long newVersion) {
        return toBuilder().version(newVersion).build();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Builder terminal(JobStatus next, Instant now) {
        return toBuilder()
                .status(next)
                .currentStep(null)
                .leaseExpiresAt(null)
                .completedAt(now)
                .updatedAt(now);
    }

    private void requireTransition(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalJobTransitionException(jobId, status, next);
        }
    }

    private void requireProcessing() {
        if (status != JobStatus.PROCESSING) {
            throw new IllegalJobTransitionException(jobId, status, JobStatus.PROCESSING);
        }
    }

    private static int clampPercent(int value) {
        return Math.max(0, Math.min(100, value));
    }

    private Builder toBuilder() {
        return new Builder(this);
    }

    private static final class Builder {
        private final UUID jobId;
        private final String targetId;
        private JobStatus status;
        private int progressPercent;
        private String currentStep;
        private final int priority;
        private final String config;
        private String resultEndpoint;
        private String errorMessage;
        private boolean cancelRequested;
        private long version;
        private final Instant createdAt;
        private Instant updatedAt;
        private Instant completedAt;
        private String claimedBy;
        private Instant leaseExpiresAt;
        private int claimCount;
        private final List<StepRun> steps;

        private Builder(JobRecord r) {
            this.jobId           = r.jobId;
            this.targetId        = r.targetId;
            this.status          = r.status;
            this.progressPercent = r.progressPercent;
            this.currentStep     = r.currentStep;
            this.priority        = r.priority;
            this.config          = r.config;
            this.resultEndpoint  = r.resultEndpoint;
            this.errorMessage    = r.errorMessage;
            this.cancelRequested = r.cancelRequested;
            this.version         = r.version;
            this.createdAt       = r.createdAt;
            this.updatedAt       = r.updatedAt;
            this.completedAt     = r.completedAt;
            this.claimedBy       = r.claimedBy;
            this.leaseExpiresAt  = r.leaseExpiresAt;
            this.claimCount      = r.claimCount;
            this.steps           = new ArrayList<>(r.steps);
        }

        Builder status(JobStatus v)          { this.status = v; return this; }
        Builder progressPercent(int v)       { this.progressPercent = v; return this; }
        Builder currentStep(String v)        { this.currentStep = v; return this; }
        Builder resultEndpoint(String v)     { this.resultEndpoint = v; return this; }
        Builder errorMessage(String v)       { this.errorMessage = v; return this; }
        Builder cancelRequested(boolean v)   { this.cancelRequested = v; return this; }
        Builder version(long v)              { this.version = v; return this; }
        Builder updatedAt(Instant v)         { this.updatedAt = v; return this; }
        Builder completedAt(Instant v)       { this.completedAt = v; return this; }
        Builder claimedBy(String v)          { this.claimedBy = v; return this; }
        Builder leaseExpiresAt(Instant v)    { this.leaseExpiresAt = v; return this; }
        Builder claimCount(int v)            { this.claimCount = v; return this; }

        // Replaces the entry with the same sequence, otherwise appends in order.
        Builder step(StepRun run) {
            steps.removeIf(s -> s.sequence() == run.sequence());
            steps.add(run);
            steps.sort(Comparator.comparingInt(StepRun::sequence));
            return this;
        }

        JobRecord build() {
            return new JobRecord(jobId, targetId, status, progressPercent, currentStep, priority,
                    config, resultEndpoint, errorMessage, cancelRequested, version, createdAt,
                    updatedAt, completedAt, claimedBy, leaseExpiresAt, claimCount, steps);
        }
    }
}
