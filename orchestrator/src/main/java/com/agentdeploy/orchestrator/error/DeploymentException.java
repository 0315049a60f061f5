package com.agentdeploy.orchestrator.error;

/**
 * Base type for request-level failures of submit / get / cancel.
 *
 * Unchecked so controllers let it propagate to the exception handler, which
 * maps {@link #getCode()} to an HTTP status.
 */
public class DeploymentException extends RuntimeException {

    private final ErrorCode code;

    public DeploymentException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public DeploymentException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() { return code; }
}
