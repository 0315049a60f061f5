package com.agentdeploy.orchestrator.events;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.store.JobSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process fan-out of committed job snapshots.
 *
 * Stores call {@link #publish} once per committed write. Listeners are keyed
 * by job id or by target id and are invoked on the writer's thread, so they
 * must be quick: SSE emitters and observer queues, nothing that blocks.
 *
 * A listener that throws is logged and skipped; it never affects the writer
 * or the other listeners.
 */
@Component
public class JobChangeBus {

    private static final Logger log = LoggerFactory.getLogger(JobChangeBus.class);

    private final ConcurrentMap<UUID, ConcurrentMap<Long, Consumer<JobRecord>>>   byJob    = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ConcurrentMap<Long, Consumer<JobRecord>>> byTarget = new ConcurrentHashMap<>();
    private final AtomicLong nextSubscriptionId = new AtomicLong();

    private volatile JobChangeRelay relay;

    // ------------------------------------------------------------------
    // Publishing
    // ------------------------------------------------------------------

    /** Local dispatch, then cross-instance forward when a relay is attached. */
    public void publish(JobRecord committed) {
        dispatch(committed);
        JobChangeRelay current = relay;
        if (current != null) {
            current.forward(committed);
        }
    }

    /** Local dispatch only. Used by relays for snapshots written elsewhere. */
    public void dispatch(JobRecord committed) {
        if (committed == null) {
            return;
        }
        deliver(byJob.get(committed.jobId()), committed);
        deliver(byTarget.get(committed.targetId()), committed);
    }

    public void attachRelay(JobChangeRelay relay) {
        this.relay = relay;
        log.info("Job change relay attached: {}", relay.getClass().getSimpleName());
    }

    // ------------------------------------------------------------------
    // Subscriptions
    // ------------------------------------------------------------------

    public JobSubscription subscribe(UUID jobId, Consumer<JobRecord> listener) {
        return register(byJob, jobId, listener);
    }

    public JobSubscription subscribeTarget(String targetId, Consumer<JobRecord> listener) {
        return register(byTarget, targetId, listener);
    }

    /** Number of live listeners across both indexes. */
    public int subscriberCount() {
        int total = 0;
        for (Map<Long, Consumer<JobRecord>> m : byJob.values())    total += m.size();
        for (Map<Long, Consumer<JobRecord>> m : byTarget.values()) total += m.size();
        return total;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <K> JobSubscription register(ConcurrentMap<K, ConcurrentMap<Long, Consumer<JobRecord>>> index,
                                         K key, Consumer<JobRecord> listener) {
        if (key == null || listener == null) {
            throw new IllegalArgumentException("subscription key and listener are required");
        }
        long id = nextSubscriptionId.incrementAndGet();
        index.computeIfAbsent(key, k -> new ConcurrentHashMap<>()).put(id, listener);
        return () -> {
            ConcurrentMap<Long, Consumer<JobRecord>> listeners = index.get(key);
            if (listeners == null) {
                return;
            }
            listeners.remove(id);
            if (listeners.isEmpty()) {
                index.remove(key, listeners);
            }
        };
    }

    private void deliver(Map<Long, Consumer<JobRecord>> listeners, JobRecord committed) {
        if (listeners == null || listeners.isEmpty()) {
            return;
        }
        for (Map.Entry<Long, Consumer<JobRecord>> entry : listeners.entrySet()) {
            try {
                entry.getValue().accept(committed);
            } catch (Exception e) {
                log.debug("Job change listener {} failed for job {} v{}: {}",
                        entry.getKey(), committed.jobId(), committed.version(), e.getMessage());
            }
        }
    }
}
