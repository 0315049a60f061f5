package com.agentdeploy.orchestrator.events;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.store.JobSubscription;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JobChangeBusTest {

    final JobChangeBus bus = new JobChangeBus();

    JobRecord job(String target) {
        return JobRecord.queued(UUID.randomUUID(), target, "{}", 5, Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Test
    void publish_reachesJobAndTargetSubscribers() {
        JobRecord job = job("agent-1");
        List<JobRecord> byJob = new ArrayList<>();
        List<JobRecord> byTarget = new ArrayList<>();
        bus.subscribe(job.jobId(), byJob::add);
        bus.subscribeTarget("agent-1", byTarget::add);
        bus.subscribeTarget("agent-2", r -> { throw new AssertionError("wrong target"); });

        bus.publish(job);

        assertThat(byJob).containsExactly(job);
        assertThat(byTarget).containsExactly(job);
    }

    @Test
    void failingListener_doesNotStopOthers() {
        JobRecord job = job("agent-1");
        List<JobRecord> seen = new ArrayList<>();
        bus.subscribe(job.jobId(), r -> { throw new IllegalStateException("emitter gone"); });
        bus.subscribe(job.jobId(), seen::add);

        bus.publish(job);

        assertThat(seen).containsExactly(job);
    }

    @Test
    void close_unregistersAndIsIdempotent() {
        JobRecord job = job("agent-1");
        List<JobRecord> seen = new ArrayList<>();
        JobSubscription sub = bus.subscribe(job.jobId(), seen::add);

        sub.close();
        sub.close();
        bus.publish(job);

        assertThat(seen).isEmpty();
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void publish_forwardsToRelay_butDispatchDoesNot() {
        List<JobRecord> forwarded = new ArrayList<>();
        bus.attachRelay(forwarded::add);
        JobRecord local = job("agent-1");
        JobRecord remote = job("agent-2");

        bus.publish(local);
        bus.dispatch(remote);

        assertThat(forwarded).containsExactly(local);
    }

    @Test
    void pgNotifyPayload_parses() {
        UUID id = UUID.randomUUID();
        PgNotifyJobChangeRelay.Notification n = PgNotifyJobChangeRelay.Notification.parse(id + ":7:node-a");

        assertThat(n).isNotNull();
        assertThat(n.jobId()).isEqualTo(id);
        assertThat(n.version()).isEqualTo(7L);
        assertThat(n.instanceId()).isEqualTo("node-a");
        assertThat(PgNotifyJobChangeRelay.Notification.parse("garbage")).isNull();
    }
}
