package com.agentdeploy.orchestrator.store;

import com.agentdeploy.orchestrator.error.ActiveJobConflictException;
import com.agentdeploy.orchestrator.error.JobNotFoundException;
import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Durable home of job records.
 *
 * The only way to change a stored record is {@link #compareAndSet}, which
 * applies a transformation to the current snapshot and commits it only if
 * nobody else wrote in between. Every committed write is delivered to the
 * matching subscribers.
 *
 * Infrastructure failures are reported as {@link JobStoreException} so that
 * callers can tell them apart from domain errors and retry them.
 */
public interface JobStore {

    /**
     * Insert a new QUEUED record.
     *
     * @throws ActiveJobConflictException if the target already has a queued or processing job
     */
    JobRecord create(JobRecord job);

    Optional<JobRecord> get(UUID jobId);

    /**
     * Conditional write guarded by {@code expectedVersion}.
     *
     * @return the committed snapshot (version bumped), or empty if the stored
     *         version no longer matches
     * @throws JobNotFoundException if the job does not exist
     */
    Optional<JobRecord> compareAndSet(UUID jobId, long expectedVersion, UnaryOperator<JobRecord> change);

    /** QUEUED jobs in claim order: priority ascending, then creation time. */
    List<JobRecord> findQueued(int limit);

    /** QUEUED jobs with a pending cancel request, oldest first. */
    List<JobRecord> findQueuedCancelRequested(int limit);

    /** QUEUED or PROCESSING jobs for a target; more than one means the invariant is being raced. */
    List<JobRecord> findActiveByTarget(String targetId);

    /** Newest first. */
    List<JobRecord> find(JobQuery query);

    Optional<JobRecord> findLatestByTarget(String targetId);

    /** Every status is present in the result, zero when no job has it. */
    Map<JobStatus, Long> countByStatus();

    /** PROCESSING jobs whose lease ran out before {@code now}. */
    List<JobRecord> findExpiredLeases(Instant now);

    JobSubscription subscribe(UUID jobId, Consumer<JobRecord> listener);

    JobSubscription subscribeTarget(String targetId, Consumer<JobRecord> listener);
}
