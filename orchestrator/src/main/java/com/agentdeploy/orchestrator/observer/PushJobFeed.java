package com.agentdeploy.orchestrator.observer;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.store.JobStore;
import com.agentdeploy.orchestrator.store.JobSubscription;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Feed backed by the store's change notifications: one snapshot per committed write.
 */
@Component
@ConditionalOnProperty(name = "deployer.observer.feed", havingValue = "push", matchIfMissing = true)
public class PushJobFeed implements JobFeed {

    private final JobStore store;

    public PushJobFeed(JobStore store) {
        this.store = store;
    }

    @Override
    public JobSubscription open(UUID jobId, Consumer<JobRecord> listener) {
        return store.subscribe(jobId, listener);
    }
}
