package com.agentdeploy.orchestrator.observer;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.store.JobSubscription;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Source of job snapshots for an observer.
 *
 * Snapshots may arrive more than once, late or out of order; consumers
 * reconcile them with a {@link ProgressTracker}.
 */
public interface JobFeed {

    JobSubscription open(UUID jobId, Consumer<JobRecord> listener);
}
