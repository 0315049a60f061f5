package com.agentdeploy.orchestrator.runtime.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of POST /services and GET /services/{name}.
 *
 * status is DEPLOYING, READY or FAILED; url is set once the service is READY.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceStatus(String name, String status, String url, String error) {

    public boolean ready() {
        return "READY".equalsIgnoreCase(status) && url != null && !url.isBlank();
    }

    public boolean failed() {
        return "FAILED".equalsIgnoreCase(status);
    }
}
