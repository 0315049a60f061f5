package com.agentdeploy.orchestrator.runtime.dto;

/**
 * Body for POST /builds: build {@code source} into an image and push it as {@code image}.
 */
public record BuildRequest(String source, String image) {}
