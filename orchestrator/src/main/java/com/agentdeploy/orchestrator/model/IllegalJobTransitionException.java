package com.agentdeploy.orchestrator.model;

import java.util.UUID;

/**
 * Thrown when a write would move a job along an edge the state machine does not have,
 * e.g. anything leaving a terminal state.
 */
public class IllegalJobTransitionException extends RuntimeException {

    public IllegalJobTransitionException(UUID jobId, JobStatus from, JobStatus to) {
        super("Job " + jobId + " cannot move from " + from + " to " + to);
    }

    public IllegalJobTransitionException(String message) {
        super(message);
    }
}
