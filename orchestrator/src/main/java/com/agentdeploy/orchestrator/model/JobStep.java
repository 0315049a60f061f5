package com.agentdeploy.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Persistent form of a {@link StepRun}: one pipeline step executed for a job.
 *
 * Rows are written in the same transaction as the owning job's progress
 * fields, so the step list and the progress percentage never disagree.
 *
 * DB table: job_steps  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "job_steps")
public class JobStep {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Many steps belong to one job.
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false)
    private DeploymentJob job;

    @Column(name = "seq", nullable = false)
    private int sequence;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepState state = StepState.RUNNING;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // Step output map, JSON-encoded.
    @Column(name = "output_json", columnDefinition = "TEXT")
    private String outputJson;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected JobStep() {}   // required by JPA

    public JobStep(DeploymentJob job, int sequence, String name, Instant startedAt) {
        this.job       = job;
        this.sequence  = sequence;
        this.name      = name;
        this.startedAt = startedAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()           { return id; }
    public DeploymentJob getJob()          { return job; }
    public int           getSequence()     { return sequence; }
    public String        getName()         { return name; }
    public StepState     getState()        { return state; }
    public Instant       getStartedAt()    { return startedAt; }
    public Instant       getFinishedAt()   { return finishedAt; }
    public String        getOutputJson()   { return outputJson; }
    public String        getErrorMessage() { return errorMessage; }

    public void setState(StepState state)           { this.state = state; }
    public void setStartedAt(Instant t)             { this.startedAt = t; }
    public void setFinishedAt(Instant t)            { this.finishedAt = t; }
    public void setOutputJson(String outputJson)    { this.outputJson = outputJson; }
    public void setErrorMessage(String v)           { this.errorMessage = v; }
}
