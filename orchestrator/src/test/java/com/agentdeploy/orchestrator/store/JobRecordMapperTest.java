package com.agentdeploy.orchestrator.store;

import com.agentdeploy.orchestrator.model.DeploymentJob;
import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.model.JobStep;
import com.agentdeploy.orchestrator.model.StepState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JobRecordMapperTest {

    static final Instant  T0    = Instant.parse("2026-01-01T10:00:00Z");
    static final Duration LEASE = Duration.ofMinutes(5);

    final JobRecordMapper mapper = new JobRecordMapper(new ObjectMapper());

    @Test
    void entityKeepsEveryFieldAndStepOutput() {
        JobRecord r = JobRecord.queued(UUID.randomUUID(), "agent-1", "{\"source\":\"s\"}", 3, T0)
                .claim("w1", T0, LEASE)
                .startStep(1, "validate", T0, LEASE)
                .completeStep(1, 10, Map.of("serviceName", "agent-1"), T0, LEASE)
                .startStep(2, "build", T0, LEASE);

        DeploymentJob entity = mapper.newEntity(r);

        assertThat(entity.getSteps()).hasSize(2);
        assertThat(entity.getSteps().get(0).getOutputJson()).isEqualTo("{\"serviceName\":\"agent-1\"}");
        assertThat(mapper.toRecord(entity)).isEqualTo(r);
    }

    @Test
    void copyInto_updatesStepsInPlace() {
        JobRecord running = JobRecord.queued(UUID.randomUUID(), "agent-1", "{}", 5, T0)
                .claim("w1", T0, LEASE)
                .startStep(1, "validate", T0, LEASE);
        DeploymentJob entity = mapper.newEntity(running);
        JobStep row = entity.getSteps().get(0);

        JobRecord failed = running.failStep(1, "config.source is required", T0).fail("config.source is required", T0);
        mapper.copyInto(failed, entity);

        assertThat(entity.getSteps()).containsExactly(row);
        assertThat(row.getState()).isEqualTo(StepState.FAILED);
        assertThat(entity.getErrorMessage()).isEqualTo("config.source is required");
        assertThat(entity.getCompletedAt()).isEqualTo(T0);
    }

    @Test
    void query_clampsLimit() {
        assertThat(new JobQuery(null, null, 0).limit()).isEqualTo(JobQuery.DEFAULT_LIMIT);
        assertThat(new JobQuery(" ", null, 1000).limit()).isEqualTo(JobQuery.MAX_LIMIT);
        assertThat(new JobQuery(" ", null, 10).targetId()).isNull();
    }
}
