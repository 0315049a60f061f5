package com.agentdeploy.orchestrator.store;

import com.agentdeploy.orchestrator.model.DeploymentJob;
import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.model.JobStep;
import com.agentdeploy.orchestrator.model.StepRun;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Copies between the immutable {@link JobRecord} and its JPA entities.
 *
 * The entity's version is owned by Hibernate and never written from here.
 */
@Component
public class JobRecordMapper {

    private static final TypeReference<Map<String, String>> OUTPUT_TYPE = new TypeReference<>() {};

    private final ObjectMapper json;

    public JobRecordMapper(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public JobRecord toRecord(DeploymentJob e) {
        List<StepRun> steps = e.getSteps().stream().map(this::toStepRun).toList();
        return new JobRecord(
                e.getId(),
                e.getTargetId(),
                e.getStatus(),
                e.getProgressPercent(),
                e.getCurrentStep(),
                e.getPriority(),
                e.getConfig(),
                e.getResultEndpoint(),
                e.getErrorMessage(),
                e.isCancelRequested(),
                e.getVersion(),
                e.getCreatedAt(),
                e.getUpdatedAt(),
                e.getCompletedAt(),
                e.getClaimedBy(),
                e.getLeaseExpiresAt(),
                e.getClaimCount(),
                steps);
    }

    public DeploymentJob newEntity(JobRecord r) {
        DeploymentJob e = new DeploymentJob(r.jobId(), r.targetId(), r.config(), r.priority(), r.createdAt());
        copyInto(r, e);
        return e;
    }

    /** Overwrites every mutable column of {@code e} (steps included) with {@code r}. */
    public void copyInto(JobRecord r, DeploymentJob e) {
        e.setStatus(r.status());
        e.setProgressPercent(r.progressPercent());
        e.setCurrentStep(r.currentStep());
        e.setResultEndpoint(r.resultEndpoint());
        e.setErrorMessage(r.errorMessage());
        e.setCancelRequested(r.cancelRequested());
        e.setUpdatedAt(r.updatedAt());
        e.setCompletedAt(r.completedAt());
        e.setClaimedBy(r.claimedBy());
        e.setLeaseExpiresAt(r.leaseExpiresAt());
        e.setClaimCount(r.claimCount());
        syncSteps(r.steps(), e);
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    private void syncSteps(List<StepRun> runs, DeploymentJob e) {
        // Drop rows that are no longer in the record; orphanRemoval deletes them.
        Iterator<JobStep> it = e.getSteps().iterator();
        while (it.hasNext()) {
            JobStep row = it.next();
            if (runs.stream().noneMatch(run -> run.sequence() == row.getSequence())) {
                it.remove();
            }
        }
        for (StepRun run : runs) {
            JobStep row = e.getSteps().stream()
                    .filter(s -> s.getSequence() == run.sequence())
                    .findFirst()
                    .orElse(null);
            if (row == null) {
                row = new JobStep(e, run.sequence(), run.name(), run.startedAt());
                e.getSteps().add(row);
            }
            row.setState(run.state());
            row.setStartedAt(run.startedAt());
            row.setFinishedAt(run.finishedAt());
            row.setOutputJson(run.output().isEmpty() ? null : writeOutput(run.output()));
            row.setErrorMessage(run.errorMessage());
        }
    }

    private StepRun toStepRun(JobStep s) {
        return new StepRun(s.getSequence(), s.getName(), s.getState(), s.getStartedAt(),
                s.getFinishedAt(), readOutput(s.getOutputJson()), s.getErrorMessage());
    }

    private String writeOutput(Map<String, String> output) {
        try {
            return json.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Could not encode step output", e);
        }
    }

    private Map<String, String> readOutput(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return json.readValue(raw, OUTPUT_TYPE);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Corrupt step output: " + raw, e);
        }
    }
}
