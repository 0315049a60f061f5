package com.agentdeploy.orchestrator.runtime;

/**
 * Thrown when the runtime API returns an error or is unreachable.
 */
public class RuntimeClientException extends RuntimeException {

    private final int statusCode;

    public RuntimeClientException(String message) {
        this(message, -1);
    }

    public RuntimeClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RuntimeClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed call, or -1 if no response was received. */
    public int getStatusCode() { return statusCode; }
}
