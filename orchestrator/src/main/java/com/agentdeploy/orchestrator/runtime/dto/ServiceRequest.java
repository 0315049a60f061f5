package com.agentdeploy.orchestrator.runtime.dto;

import java.util.Map;

/**
 * Body for POST /services: create or replace a service revision running {@code image}.
 */
public record ServiceRequest(
        String name,
        String image,
        String region,
        String memory,
        String cpu,
        int    minInstances,
        int    maxInstances,
        Map<String, String> env) {}
