package com.agentdeploy.orchestrator.store;

import com.agentdeploy.orchestrator.model.DeploymentJob;
import com.agentdeploy.orchestrator.model.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + queue queries for the deployment_jobs table.
 */
public interface DeploymentJobRepository extends JpaRepository<DeploymentJob, UUID> {

    /** Claim candidates. Backed by ix_deployment_jobs_queue (status, priority, created_at). */
    List<DeploymentJob> findByStatusOrderByPriorityAscCreatedAtAsc(JobStatus status, Pageable page);

    List<DeploymentJob> findByStatusAndCancelRequestedTrueOrderByCreatedAtAsc(JobStatus status, Pageable page);

    List<DeploymentJob> findByTargetIdAndStatusIn(String targetId, Collection<JobStatus> statuses);

    Optional<DeploymentJob> findFirstByTargetIdOrderByCreatedAtDesc(String targetId);

    /** PROCESSING rows whose owner stopped renewing its lease. */
    List<DeploymentJob> findByStatusAndLeaseExpiresAtBefore(JobStatus status, Instant cutoff);

    @Query("""
            SELECT j FROM DeploymentJob j
            WHERE (:targetId IS NULL OR j.targetId = :targetId)
              AND (:status IS NULL OR j.status = :status)
            ORDER BY j.createdAt DESC
            """)
    List<DeploymentJob> search(@Param("targetId") String targetId,
                               @Param("status") JobStatus status,
                               Pageable page);

    @Query("SELECT j.status, COUNT(j) FROM DeploymentJob j GROUP BY j.status")
    List<Object[]> countGroupedByStatus();
}
