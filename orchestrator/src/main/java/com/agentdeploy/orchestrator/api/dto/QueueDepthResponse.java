package com.agentdeploy.orchestrator.api.dto;

import java.util.Map;

/**
 * Response of GET /deployments/queue.
 *
 * @param counts   jobs per status across the whole store, keyed by wire name
 * @param inFlight jobs this instance is executing right now
 */
public record QueueDepthResponse(Map<String, Long> counts, int inFlight) {}
