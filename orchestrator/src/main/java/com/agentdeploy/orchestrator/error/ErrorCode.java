package com.agentdeploy.orchestrator.error;

/**
 * Error codes surfaced at the external boundary.
 *
 * TIMEOUT is only ever produced on the observing side; the orchestrator
 * itself never reports a job as timed out.
 */
public enum ErrorCode {
    NOT_FOUND,
    CONFLICT,
    INVALID_CONFIG,
    TIMEOUT,
    INTERNAL
}
