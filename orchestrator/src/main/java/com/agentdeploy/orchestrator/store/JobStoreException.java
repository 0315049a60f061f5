package com.agentdeploy.orchestrator.store;

/**
 * The store itself could not be reached or failed mid-operation.
 *
 * Never used for domain outcomes (not found, conflict, version mismatch);
 * those have their own signals. Callers retry this one with backoff.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
