package com.agentdeploy.orchestrator.events;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.store.JobStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Cross-instance change notification over Postgres LISTEN/NOTIFY.
 *
 * Every committed write on this instance sends
 * {@code pg_notify(channel, "<jobId>:<version>:<instanceId>")}. A daemon thread
 * LISTENs on the same channel, ignores its own payloads, reloads the job from
 * the store and dispatches it to local subscribers. Observers connected to
 * instance B therefore see writes made by the processor on instance A.
 *
 * NOTIFY is best effort: a missed notification only delays an observer until
 * its next refetch, which {@code JobWatcher} does on every reconnect.
 */
@Component
@ConditionalOnProperty(name = "deployer.events.pg-notify.enabled", havingValue = "true")
public class PgNotifyJobChangeRelay implements JobChangeRelay {

    private static final Logger log = LoggerFactory.getLogger(PgNotifyJobChangeRelay.class);

    private static final int LISTEN_TIMEOUT_MILLIS    = 3000;
    private static final int RECONNECT_BACKOFF_MILLIS = 1000;
    private static final int LOAD_RETRY_TIMES         = 3;
    private static final int LOAD_RETRY_BACKOFF_MILLIS = 60;

    private final DataSource     dataSource;
    private final JobStore       store;
    private final JobChangeBus   bus;
    private final String         channel;
    private final String         instanceId;
    private final ExecutorService listener;
    private volatile boolean     running;

    public PgNotifyJobChangeRelay(
            DataSource dataSource,
            JobStore store,
            JobChangeBus bus,
            @Value("${deployer.events.pg-notify.channel:deployment_job_changes}") String channel,
            @Value("${deployer.events.instance-id:}") String configuredInstanceId) {
        if (!channel.matches("[a-z_][a-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid notify channel name: " + channel);
        }
        this.dataSource = dataSource;
        this.store      = store;
        this.bus        = bus;
        this.channel    = channel;
        this.instanceId = resolveInstanceId(configuredInstanceId);
        this.listener   = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "job-change-notify-listener");
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void start() {
        running = true;
        listener.execute(this::listenLoop);
        bus.attachRelay(this);
        log.info("pg_notify relay started on channel '{}' as instance '{}'", channel, instanceId);
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        listener.shutdownNow();
    }

    @Override
    public void forward(JobRecord committed) {
        String payload = committed.jobId() + ":" + committed.version() + ":" + instanceId;
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT pg_notify(?, ?)")) {
            statement.setString(1, channel);
            statement.setString(2, payload);
            statement.execute();
        } catch (Exception e) {
            log.debug("pg_notify failed for job {} v{}: {}", committed.jobId(), committed.version(), e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // LISTEN side
    // ------------------------------------------------------------------

    private void listenLoop() {
        while (running) {
            try (Connection connection = dataSource.getConnection();
                 Statement statement = connection.createStatement()) {
                statement.execute("LISTEN " + channel);
                PGConnection pg = connection.unwrap(PGConnection.class);
                while (running && !connection.isClosed()) {
                    PGNotification[] notifications = pg.getNotifications(LISTEN_TIMEOUT_MILLIS);
                    if (notifications == null) {
                        continue;
                    }
                    for (PGNotification notification : notifications) {
                        handle(notification.getParameter());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                if (!running) {
                    return;
                }
                log.warn("Notify listener on '{}' failed, reconnecting: {}", channel, e.getMessage());
                try {
                    Thread.sleep(RECONNECT_BACKOFF_MILLIS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    void handle(String payload) throws InterruptedException {
        Notification n = Notification.parse(payload);
        if (n == null || instanceId.equals(n.instanceId())) {
            return;
        }
        // The notifying transaction has committed, but a replica or pool may lag briefly.
        for (int i = 0; i < LOAD_RETRY_TIMES; i++) {
            Optional<JobRecord> job = store.get(n.jobId());
            if (job.isPresent() && job.get().version() >= n.version()) {
                bus.dispatch(job.get());
                return;
            }
            if (i < LOAD_RETRY_TIMES - 1) {
                Thread.sleep(LOAD_RETRY_BACKOFF_MILLIS);
            }
        }
        log.debug("Job {} v{} not visible after notify, skipping", n.jobId(), n.version());
    }

    private static String resolveInstanceId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + ManagementFactory.getRuntimeMXBean().getName();
        } catch (Exception e) {
            return "instance-" + System.nanoTime();
        }
    }

    record Notification(UUID jobId, long version, String instanceId) {

        static Notification parse(String payload) {
            if (payload == null || payload.isBlank()) {
                return null;
            }
            String[] parts = payload.split(":", 3);
            if (parts.length < 3) {
                return null;
            }
            try {
                return new Notification(UUID.fromString(parts[0].trim()), Long.parseLong(parts[1].trim()), parts[2]);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
    }
}
