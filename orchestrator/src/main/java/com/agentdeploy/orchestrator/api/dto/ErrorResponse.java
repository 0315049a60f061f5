package com.agentdeploy.orchestrator.api.dto;

import com.agentdeploy.orchestrator.error.ErrorCode;

/**
 * Body of every non-2xx response: {"code": "CONFLICT", "message": "..."}.
 */
public record ErrorResponse(ErrorCode code, String message) {}
