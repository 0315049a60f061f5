package com.agentdeploy.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request body for POST /deployments.
 *
 * Required: targetId, config (a JSON object, passed through to the pipeline untouched)
 * Optional: priority (0..100, lower is claimed first, default 5)
 */
public record SubmitDeploymentRequest(String targetId, JsonNode config, Integer priority) {}
