package com.agentdeploy.orchestrator.store;

import com.agentdeploy.orchestrator.error.ActiveJobConflictException;
import com.agentdeploy.orchestrator.error.JobNotFoundException;
import com.agentdeploy.orchestrator.events.JobChangeBus;
import com.agentdeploy.orchestrator.model.DeploymentJob;
import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * {@link JobStore} on Postgres via Spring Data JPA.
 *
 * Conditional writes rely on the {@code @Version} column of
 * {@link DeploymentJob}: the snapshot is loaded, the expected version is
 * compared, the change is applied and flushed as
 * {@code UPDATE ... WHERE id = ? AND version = ?}. A concurrent commit in
 * between makes the flush fail with an optimistic-lock error, which is
 * reported to the caller as "version conflict" after the transaction rolled back.
 *
 * The one-active-job-per-target rule is checked in {@link #create} and backed
 * by the partial unique index {@code ux_deployment_jobs_active_target}, so two
 * racing inserts cannot both commit.
 *
 * Data-access and transaction-manager failures (no connection for
 * {@code getTransaction}, a failed commit) both surface as {@link JobStoreException}.
 */
@Component
public class JpaJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JpaJobStore.class);

    private static final List<JobStatus> ACTIVE = List.of(JobStatus.QUEUED, JobStatus.PROCESSING);

    private final DeploymentJobRepository repository;
    private final JobRecordMapper         mapper;
    private final JobChangeBus            bus;
    private final TransactionTemplate     tx;
    private final TransactionTemplate     readTx;

    public JpaJobStore(DeploymentJobRepository repository,
                       JobRecordMapper mapper,
                       JobChangeBus bus,
                       PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.mapper     = mapper;
        this.bus        = bus;
        this.tx         = new TransactionTemplate(transactionManager);
        this.readTx     = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Override
    public JobRecord create(JobRecord job) {
        if (job.status() != JobStatus.QUEUED) {
            throw new IllegalArgumentException("New jobs must be QUEUED, got " + job.status());
        }
        JobRecord created;
        try {
            created = tx.execute(status -> {
                List<DeploymentJob> active = repository.findByTargetIdAndStatusIn(job.targetId(), ACTIVE);
                if (!active.isEmpty()) {
                    throw new ActiveJobConflictException(job.targetId(), active.get(0).getId());
                }
                return mapper.toRecord(repository.saveAndFlush(mapper.newEntity(job)));
            });
        } catch (DataIntegrityViolationException e) {
            // Lost the insert race against another submit for the same target.
            throw new ActiveJobConflictException(job.targetId(), null);
        } catch (DataAccessException | TransactionException e) {
            throw new JobStoreException("create failed for target " + job.targetId(), e);
        }
        log.info("Job {} created for target {} (priority={})", created.jobId(), created.targetId(), created.priority());
        bus.publish(created);
        return created;
    }

    @Override
    public Optional<JobRecord> compareAndSet(UUID jobId, long expectedVersion, UnaryOperator<JobRecord> change) {
        WriteResult result;
        try {
            result = tx.execute(status -> {
                DeploymentJob entity = repository.findById(jobId)
                        .orElseThrow(() -> new JobNotFoundException(jobId));
                if (entity.getVersion() != expectedVersion) {
                    return WriteResult.CONFLICT;
                }
                JobRecord current = mapper.toRecord(entity);
                JobRecord next    = change.apply(current);
                if (next == current) {
                    return new WriteResult(current, false);
                }
                if (!next.jobId().equals(jobId)) {
                    throw new IllegalStateException("Change replaced job " + jobId + " with " + next.jobId());
                }
                mapper.copyInto(next, entity);
                return new WriteResult(mapper.toRecord(repository.saveAndFlush(entity)), true);
            });
        } catch (ObjectOptimisticLockingFailureException e) {
            log.debug("Version conflict on job {} (expected v{})", jobId, expectedVersion);
            return Optional.empty();
        } catch (DataAccessException | TransactionException e) {
            throw new JobStoreException("compareAndSet failed for job " + jobId, e);
        }
        if (result == null || result.record() == null) {
            return Optional.empty();
        }
        if (result.written()) {
            bus.publish(result.record());
        }
        return Optional.of(result.record());
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    public Optional<JobRecord> get(UUID jobId) {
        return read("get " + jobId, () -> repository.findById(jobId).map(mapper::toRecord));
    }

    @Override
    public List<JobRecord> findQueued(int limit) {
        return read("findQueued", () -> repository
                .findByStatusOrderByPriorityAscCreatedAtAsc(JobStatus.QUEUED, PageRequest.of(0, Math.max(1, limit)))
                .stream().map(mapper::toRecord).toList());
    }

    @Override
    public List<JobRecord> findQueuedCancelRequested(int limit) {
        return read("findQueuedCancelRequested", () -> repository
                .findByStatusAndCancelRequestedTrueOrderByCreatedAtAsc(JobStatus.QUEUED, PageRequest.of(0, Math.max(1, limit)))
                .stream().map(mapper::toRecord).toList());
    }

    @Override
    public List<JobRecord> findActiveByTarget(String targetId) {
        return read("findActiveByTarget " + targetId, () -> repository
                .findByTargetIdAndStatusIn(targetId, ACTIVE)
                .stream().map(mapper::toRecord).toList());
    }

    @Override
    public List<JobRecord> find(JobQuery query) {
        return read("find", () -> repository
                .search(query.targetId(), query.status(), PageRequest.of(0, query.limit()))
                .stream().map(mapper::toRecord).toList());
    }

    @Override
    public Optional<JobRecord> findLatestByTarget(String targetId) {
        return read("findLatestByTarget " + targetId, () -> repository
                .findFirstByTargetIdOrderByCreatedAtDesc(targetId).map(mapper::toRecord));
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        return read("countByStatus", () -> {
            Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
            for (JobStatus s : JobStatus.values()) {
                counts.put(s, 0L);
            }
            for (Object[] row : repository.countGroupedByStatus()) {
                counts.put((JobStatus) row[0], ((Number) row[1]).longValue());
            }
            return counts;
        });
    }

    @Override
    public List<JobRecord> findExpiredLeases(Instant now) {
        return read("findExpiredLeases", () -> repository
                .findByStatusAndLeaseExpiresAtBefore(JobStatus.PROCESSING, now)
                .stream().map(mapper::toRecord).toList());
    }

    // ------------------------------------------------------------------
    // Change notification
    // ------------------------------------------------------------------

    @Override
    public JobSubscription subscribe(UUID jobId, Consumer<JobRecord> listener) {
        return bus.subscribe(jobId, listener);
    }

    @Override
    public JobSubscription subscribeTarget(String targetId, Consumer<JobRecord> listener) {
        return bus.subscribeTarget(targetId, listener);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <T> T read(String op, Supplier<T> query) {
        try {
            return readTx.execute(status -> query.get());
        } catch (DataAccessException | TransactionException e) {
            throw new JobStoreException(op + " failed", e);
        }
    }

    private record WriteResult(JobRecord record, boolean written) {
        static final WriteResult CONFLICT = new WriteResult(null, false);
    }
}
