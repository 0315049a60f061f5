package com.agentdeploy.orchestrator.observer;

import com.agentdeploy.orchestrator.model.JobRecord;

/**
 * How a watch ended.
 *
 * @param last newest snapshot the watcher accepted; null for NOT_FOUND, and
 *             possibly null for INDETERMINATE if nothing arrived in time
 */
public record WatchResult(Outcome outcome, JobRecord last) {

    public enum Outcome {
        /** The job reached deployed, failed or cancelled. */
        TERMINAL,
        /** The observer gave up waiting; the job itself may still succeed. */
        INDETERMINATE,
        NOT_FOUND
    }

    public boolean isTerminal() {
        return outcome == Outcome.TERMINAL;
    }
}
