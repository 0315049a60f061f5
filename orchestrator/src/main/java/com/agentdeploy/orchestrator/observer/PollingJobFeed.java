package com.agentdeploy.orchestrator.observer;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.store.JobStore;
import com.agentdeploy.orchestrator.store.JobSubscription;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Feed for deployments without change notifications: reads the job every
 * poll interval and emits it whenever its version moved.
 */
@Component
@ConditionalOnProperty(name = "deployer.observer.feed", havingValue = "poll")
public class PollingJobFeed implements JobFeed {

    private static final Logger log = LoggerFactory.getLogger(PollingJobFeed.class);

    private final JobStore                 store;
    private final Duration                 interval;
    private final ScheduledExecutorService pollers;

    public PollingJobFeed(JobStore store,
                          @Value("${deployer.observer.poll-interval:2s}") Duration interval) {
        this.store    = store;
        this.interval = interval;
        this.pollers  = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "job-feed-poller");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        pollers.shutdownNow();
    }

    @Override
    public JobSubscription open(UUID jobId, Consumer<JobRecord> listener) {
        AtomicLong lastVersion = new AtomicLong(-1);
        ScheduledFuture<?> task = pollers.scheduleWithFixedDelay(() -> {
            try {
                Optional<JobRecord> job = store.get(jobId);
                if (job.isPresent() && job.get().version() != lastVersion.getAndSet(job.get().version())) {
                    listener.accept(job.get());
                }
            } catch (RuntimeException e) {
                log.debug("Polling job {} failed, will retry: {}", jobId, e.getMessage());
            }
        }, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        return () -> task.cancel(false);
    }
}
