package com.agentdeploy.orchestrator.observer;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.observer.WatchResult.Outcome;
import com.agentdeploy.orchestrator.store.JobStore;
import com.agentdeploy.orchestrator.store.JobSubscription;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Follows one job until it is terminal or the observer runs out of patience.
 *
 * On open (and on every {@link Watch#reconnect()}) the current record is
 * fetched, so a snapshot missed while disconnected is never lost; after that
 * the {@link JobFeed} delivers changes. Every snapshot goes through a
 * {@link ProgressTracker}, so the listener sees strictly increasing versions.
 *
 * Running out of time yields {@link Outcome#INDETERMINATE}, never a failure:
 * the job may still deploy after the observer stopped looking.
 */
@Component
public class JobWatcher {

    private static final Logger log = LoggerFactory.getLogger(JobWatcher.class);

    private final JobStore                 store;
    private final JobFeed                  feed;
    private final Duration                 defaultTimeout;
    private final ScheduledExecutorService timers;

    public JobWatcher(JobStore store,
                      JobFeed feed,
                      @Value("${deployer.observer.timeout:600s}") Duration defaultTimeout) {
        this.store          = store;
        this.feed           = feed;
        this.defaultTimeout = defaultTimeout;
        this.timers         = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "job-watch-timer");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        timers.shutdownNow();
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public Watch watch(UUID jobId, Consumer<JobRecord> listener) {
        return watch(jobId, defaultTimeout, -1L, listener);
    }

    public Watch watch(UUID jobId, Duration timeout, Consumer<JobRecord> listener) {
        return watch(jobId, timeout, -1L, listener);
    }

    /**
     * @param afterVersion snapshots at or below this version are not delivered
     *                     (resume after the last one a client saw)
     */
    public Watch watch(UUID jobId, Duration timeout, long afterVersion, Consumer<JobRecord> listener) {
        Watch watch = new Watch(jobId, afterVersion, listener);
        watch.start(timeout);
        return watch;
    }

    /** Blocking form of {@link #watch}. */
    public WatchResult await(UUID jobId, Duration timeout) {
        return watch(jobId, timeout, r -> {}).result().join();
    }

    // ------------------------------------------------------------------
    // Watch handle
    // ------------------------------------------------------------------

    public final class Watch implements AutoCloseable {

        private final UUID                          jobId;
        private final ProgressTracker               tracker;
        private final Consumer<JobRecord>           listener;
        private final CompletableFuture<WatchResult> result = new CompletableFuture<>();
        private volatile JobSubscription            subscription;
        private volatile ScheduledFuture<?>         timeoutTask;

        private Watch(UUID jobId, long afterVersion, Consumer<JobRecord> listener) {
            this.jobId    = jobId;
            this.tracker  = new ProgressTracker(afterVersion);
            this.listener = listener;
        }

        public CompletableFuture<WatchResult> result() {
            return result;
        }

        /** Drop the feed, open it again and refetch the current record. */
        public void reconnect() {
            if (result.isDone()) {
                return;
            }
            closeSubscription();
            connect();
        }

        /** Stop watching; completes the result as INDETERMINATE if still open. */
        @Override
        public void close() {
            finish(Outcome.INDETERMINATE, tracker.latest().orElse(null));
        }

        private void start(Duration timeout) {
            timeoutTask = timers.schedule(
                    () -> finish(Outcome.INDETERMINATE, tracker.latest().orElse(null)),
                    timeout.toMillis(), TimeUnit.MILLISECONDS);
            connect();
        }

        // Subscribe first, then fetch, so nothing written in between is missed.
        private void connect() {
            subscription = feed.open(jobId, this::onSnapshot);
            if (result.isDone()) {
                closeSubscription();
                return;
            }
            Optional<JobRecord> current;
            try {
                current = store.get(jobId);
            } catch (RuntimeException e) {
                log.warn("Fetching job {} for watch failed, waiting for the feed: {}", jobId, e.getMessage());
                return;
            }
            if (current.isEmpty()) {
                if (tracker.latest().isEmpty()) {
                    finish(Outcome.NOT_FOUND, null);
                }
                return;
            }
            onSnapshot(current.get());
        }

        private synchronized void onSnapshot(JobRecord snapshot) {
            if (result.isDone()) {
                return;
            }
            boolean fresh = tracker.accept(snapshot);
            if (fresh) {
                try {
                    listener.accept(snapshot);
                } catch (RuntimeException e) {
                    log.debug("Watch listener for job {} failed: {}", jobId, e.getMessage());
                }
            }
            if (snapshot.isTerminal() && snapshot.version() >= tracker.version()) {
                finish(Outcome.TERMINAL, snapshot);
            }
        }

        private void finish(Outcome outcome, JobRecord last) {
            if (!result.complete(new WatchResult(outcome, last))) {
                return;
            }
            closeSubscription();
            ScheduledFuture<?> t = timeoutTask;
            if (t != null) {
                t.cancel(false);
            }
            log.debug("Watch on job {} ended: {}", jobId, outcome);
        }

        private void closeSubscription() {
            JobSubscription s = subscription;
            if (s != null) {
                s.close();
            }
        }
    }
}
