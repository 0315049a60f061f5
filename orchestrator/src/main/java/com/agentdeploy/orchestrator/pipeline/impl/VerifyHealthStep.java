package com.agentdeploy.orchestrator.pipeline.impl;

import com.agentdeploy.orchestrator.pipeline.DeploymentConfig;
import com.agentdeploy.orchestrator.pipeline.PipelineStep;
import com.agentdeploy.orchestrator.pipeline.Poller;
import com.agentdeploy.orchestrator.pipeline.StepContext;
import com.agentdeploy.orchestrator.pipeline.StepException;
import com.agentdeploy.orchestrator.pipeline.StepManifest;
import com.agentdeploy.orchestrator.pipeline.StepOutput;
import com.agentdeploy.orchestrator.runtime.RuntimeClient;
import com.agentdeploy.orchestrator.runtime.dto.HealthCheck;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Polls the deployed service's health endpoint until it answers 2xx.
 *
 * A freshly deployed revision usually refuses connections or answers 502/503/504
 * for a while; those keep the step waiting. Any other non-2xx answer means the
 * service is up but unhealthy, and the step fails at once.
 */
@Component
public class VerifyHealthStep implements PipelineStep {

    private static final Logger log = LoggerFactory.getLogger(VerifyHealthStep.class);

    public static final String NAME = "verify";

    private static final Duration POLL_INITIAL = Duration.ofSeconds(1);
    private static final Duration POLL_MAX     = Duration.ofSeconds(10);

    private final RuntimeClient runtime;
    private final Poller        poller;
    private final ObjectMapper  json;
    private final StepManifest  manifest;

    public VerifyHealthStep(RuntimeClient runtime,
                            Poller poller,
                            ObjectMapper objectMapper,
                            @Value("${deployer.steps.verify.timeout:2m}") Duration timeout) {
        this.runtime  = runtime;
        this.poller   = poller;
        this.json     = objectMapper;
        this.manifest = new StepManifest(NAME, 100, timeout, "Wait for the service health endpoint to answer 2xx");
    }

    @Override
    public StepManifest manifest() {
        return manifest;
    }

    @Override
    public StepOutput execute(StepContext ctx) {
        String url  = ctx.requireOutput(DeployServiceStep.NAME, "serviceUrl");
        String path = DeploymentConfig.parse(ctx.config(), ctx.targetId(), json).healthPath();
        String what = "Health check on " + url + path;

        poller.until(what, manifest.timeout(), POLL_INITIAL, POLL_MAX, () -> {
            HealthCheck check = runtime.checkHealth(url, path);
            if (check.healthy()) {
                return Optional.of(check);
            }
            if (check.notReady()) {
                log.debug("{} not ready yet: {} {}", what, check.statusCode(), check.detail());
                return Optional.empty();
            }
            throw new StepException(StepException.Kind.FAILED,
                    what + " returned HTTP " + check.statusCode() + ": " + check.detail());
        });
        log.info("{} passed", what);
        return StepOutput.of(StepOutput.ENDPOINT, url);
    }
}
