package com.agentdeploy.orchestrator.runtime.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of POST /builds and GET /builds/{id}.
 *
 * status is one of QUEUED, WORKING, SUCCESS, FAILURE, TIMEOUT, CANCELLED.
 * imageUri is set once the push succeeded; error carries the builder's reason otherwise.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BuildStatus(String buildId, String status, String imageUri, String error) {

    public boolean succeeded() {
        return "SUCCESS".equalsIgnoreCase(status);
    }

    public boolean finished() {
        return succeeded()
                || "FAILURE".equalsIgnoreCase(status)
                || "TIMEOUT".equalsIgnoreCase(status)
                || "CANCELLED".equalsIgnoreCase(status);
    }
}
