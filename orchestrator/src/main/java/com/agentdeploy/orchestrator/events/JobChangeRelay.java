package com.agentdeploy.orchestrator.events;

import com.agentdeploy.orchestrator.model.JobRecord;

/**
 * Forwards committed job changes to other orchestrator instances.
 *
 * Implementations attach themselves to the {@link JobChangeBus}; the bus calls
 * {@link #forward} after dispatching locally. Failures must be logged, never thrown.
 */
public interface JobChangeRelay {

    void forward(JobRecord committed);
}
