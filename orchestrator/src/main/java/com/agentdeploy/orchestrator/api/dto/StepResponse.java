package com.agentdeploy.orchestrator.api.dto;

import com.agentdeploy.orchestrator.model.StepRun;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only view of one pipeline step, returned by GET /deployments/{id}/steps
 * and embedded in every job response.
 */
public record StepResponse(
        int      sequence,
        String   name,
        String   state,
        Instant  startedAt,
        Instant  finishedAt,
        Map<String, String> output,
        String   errorMessage
) {
    public static StepResponse from(StepRun s) {
        return new StepResponse(
                s.sequence(),
                s.name(),
                s.state().name().toLowerCase(Locale.ROOT),
                s.startedAt(),
                s.finishedAt(),
                s.output(),
                s.errorMessage()
        );
    }
}
