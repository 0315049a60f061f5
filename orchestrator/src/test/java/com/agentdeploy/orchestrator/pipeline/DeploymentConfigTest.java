package com.agentdeploy.orchestrator.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploymentConfigTest {

    final ObjectMapper json = new ObjectMapper();

    @Test
    void minimalConfig_getsDefaults() {
        DeploymentConfig c = DeploymentConfig.parse("{\"source\":\"gs://agents/a1.tar.gz\"}", "A1", json);

        assertThat(c.serviceName()).isEqualTo("agent-a1");
        assertThat(c.imageName()).isEqualTo("agent-a1");
        assertThat(c.region()).isEqualTo("us-central1");
        assertThat(c.memory()).isEqualTo("2Gi");
        assertThat(c.cpu()).isEqualTo("1");
        assertThat(c.minInstances()).isZero();
        assertThat(c.maxInstances()).isEqualTo(10);
        assertThat(c.healthPath()).isEqualTo("/health");
        assertThat(c.env()).isEmpty();
    }

    @Test
    void explicitFields_override() {
        DeploymentConfig c = DeploymentConfig.parse("""
                {"source":"https://git.example.com/a.git","serviceName":"support-bot","region":"europe-west1",
                 "memory":"512Mi","minInstances":1,"maxInstances":3,"healthPath":"/ready",
                 "env":{"AGENT_ID":"a1","LOG_LEVEL":"debug"}}
                """, "a1", json);

        assertThat(c.serviceName()).isEqualTo("support-bot");
        assertThat(c.region()).isEqualTo("europe-west1");
        assertThat(c.memory()).isEqualTo("512Mi");
        assertThat(c.maxInstances()).isEqualTo(3);
        assertThat(c.env()).containsEntry("LOG_LEVEL", "debug");
    }

    @Test
    void defaultServiceName_isSanitized() {
        assertThat(DeploymentConfig.defaultServiceName("Team_7/Bot")).isEqualTo("agent-team-7-bot");
    }

    @Test
    void missingSource_isInvalidConfig() {
        assertInvalid("{\"region\":\"us-east1\"}", "config.source is required");
    }

    @Test
    void badFields_areRejectedWithFieldName() {
        assertInvalid("{\"source\":\"s\",\"memory\":\"2GB\"}", "config.memory");
        assertInvalid("{\"source\":\"s\",\"minInstances\":5,\"maxInstances\":2}", "instance bounds");
        assertInvalid("{\"source\":\"s\",\"healthPath\":\"health\"}", "config.healthPath");
        assertInvalid("{\"source\":\"s\",\"serviceName\":\"Bad_Name\"}", "config.serviceName");
        assertInvalid("{\"source\":\"s\",\"env\":{\"1X\":\"v\"}}", "config.env key");
        assertInvalid("[1,2]", "config must be a JSON object");
    }

    private void assertInvalid(String config, String messagePart) {
        assertThatThrownBy(() -> DeploymentConfig.parse(config, "a1", json))
                .isInstanceOf(StepException.class)
                .hasMessageContaining(messagePart)
                .satisfies(e -> assertThat(((StepException) e).getKind()).isEqualTo(StepException.Kind.INVALID_CONFIG));
    }
}
