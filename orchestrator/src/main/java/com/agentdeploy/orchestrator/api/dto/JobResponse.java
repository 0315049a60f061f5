package com.agentdeploy.orchestrator.api.dto;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Job record as returned by the REST API and sent as SSE "snapshot" events.
 * status is the lower-case wire name ("queued", "processing", ...).
 */
public record JobResponse(
        UUID     jobId,
        String   targetId,
        String   status,
        int      progressPercent,
        String   currentStep,
        int      priority,
        JsonNode config,
        String   resultEndpoint,
        String   errorMessage,
        boolean  cancelRequested,
        long     version,
        Instant  createdAt,
        Instant  updatedAt,
        Instant  completedAt,
        List<StepResponse> steps
) {
    public static JobResponse from(JobRecord r, ObjectMapper json) {
        return new JobResponse(
                r.jobId(),
                r.targetId(),
                r.status().wireName(),
                r.progressPercent(),
                r.currentStep(),
                r.priority(),
                parse(r.config(), json),
                r.resultEndpoint(),
                r.errorMessage(),
                r.cancelRequested(),
                r.version(),
                r.createdAt(),
                r.updatedAt(),
                r.completedAt(),
                r.steps().stream().map(StepResponse::from).toList()
        );
    }

    // Config was validated as an object on submit; fall back to a string if it ever is not.
    private static JsonNode parse(String config, ObjectMapper json) {
        if (config == null) {
            return null;
        }
        try {
            return json.readTree(config);
        } catch (Exception e) {
            return json.getNodeFactory().textNode(config);
        }
    }
}
