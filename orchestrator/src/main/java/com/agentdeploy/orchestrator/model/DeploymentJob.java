package com.agentdeploy.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persistent form of a {@link JobRecord}.
 *
 * The {@code @Version} column is the compare-and-swap guard: Hibernate issues
 * {@code UPDATE ... WHERE id = ? AND version = ?}, so two processors can never
 * both land a write based on the same snapshot.
 *
 * DB table: deployment_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "deployment_jobs")
public class DeploymentJob {

    @Id
    private UUID id;

    @Column(name = "target_id", nullable = false)
    private String targetId;

    // Enum name as TEXT; the active-target unique index filters on it.
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.QUEUED;

    @Column(name = "progress_percent", nullable = false)
    private int progressPercent;

    @Column(name = "current_step")
    private String currentStep;

    @Column(nullable = false)
    private int priority = JobRecord.DEFAULT_PRIORITY;

    // Caller-owned JSON object, never parsed at this layer.
    @Column(name = "config", columnDefinition = "TEXT", nullable = false)
    private String config;

    @Column(name = "result_endpoint")
    private String resultEndpoint;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    // Null until first persisted, so Spring Data treats the entity as new.
    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // Ownership lease; null unless PROCESSING.
    @Column(name = "claimed_by")
    private String claimedBy;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Column(name = "claim_count", nullable = false)
    private int claimCount;

    @OneToMany(mappedBy = "job", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("sequence ASC")
    private List<JobStep> steps = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected DeploymentJob() {}   // required by JPA

    public DeploymentJob(UUID id, String targetId, String config, int priority, Instant createdAt) {
        this.id        = id;
        this.targetId  = targetId;
        this.config    = config;
        this.priority  = priority;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID      getId()              { return id; }
    public String    getTargetId()        { return targetId; }
    public JobStatus getStatus()          { return status; }
    public int       getProgressPercent() { return progressPercent; }
    public String    getCurrentStep()     { return currentStep; }
    public int       getPriority()        { return priority; }
    public String    getConfig()          { return config; }
    public String    getResultEndpoint()  { return resultEndpoint; }
    public String    getErrorMessage()    { return errorMessage; }
    public boolean   isCancelRequested()  { return cancelRequested; }
    public long      getVersion()         { return version == null ? 0L : version; }
    public Instant   getCreatedAt()       { return createdAt; }
    public Instant   getUpdatedAt()       { return updatedAt; }
    public Instant   getCompletedAt()     { return completedAt; }
    public String    getClaimedBy()       { return claimedBy; }
    public Instant   getLeaseExpiresAt()  { return leaseExpiresAt; }
    public int       getClaimCount()      { return claimCount; }
    public List<JobStep> getSteps()       { return steps; }

    public void setStatus(JobStatus status)             { this.status = status; }
    public void setProgressPercent(int v)               { this.progressPercent = v; }
    public void setCurrentStep(String v)                { this.currentStep = v; }
    public void setResultEndpoint(String v)             { this.resultEndpoint = v; }
    public void setErrorMessage(String v)               { this.errorMessage = v; }
    public void setCancelRequested(boolean v)           { this.cancelRequested = v; }
    public void setUpdatedAt(Instant v)                 { this.updatedAt = v; }
    public void setCompletedAt(Instant v)               { this.completedAt = v; }
    public void setClaimedBy(String v)                  { this.claimedBy = v; }
    public void setLeaseExpiresAt(Instant v)            { this.leaseExpiresAt = v; }
    public void setClaimCount(int v)                    { this.claimCount = v; }
}
