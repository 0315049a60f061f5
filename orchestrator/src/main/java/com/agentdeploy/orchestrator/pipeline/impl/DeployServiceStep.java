package com.agentdeploy.orchestrator.pipeline.impl;

import com.agentdeploy.orchestrator.pipeline.DeploymentConfig;
import com.agentdeploy.orchestrator.pipeline.PipelineStep;
import com.agentdeploy.orchestrator.pipeline.Poller;
import com.agentdeploy.orchestrator.pipeline.StepContext;
import com.agentdeploy.orchestrator.pipeline.StepException;
import com.agentdeploy.orchestrator.pipeline.StepManifest;
import com.agentdeploy.orchestrator.pipeline.StepOutput;
import com.agentdeploy.orchestrator.runtime.RuntimeClient;
import com.agentdeploy.orchestrator.runtime.RuntimeClientException;
import com.agentdeploy.orchestrator.runtime.dto.ServiceRequest;
import com.agentdeploy.orchestrator.runtime.dto.ServiceStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Deploys the built image as a service and waits until the runtime reports it ready.
 *
 * Compensation deletes the service, which is how a deployment cancelled
 * during health verification is rolled back.
 */
@Component
public class DeployServiceStep implements PipelineStep {

    private static final Logger log = LoggerFactory.getLogger(DeployServiceStep.class);

    public static final String NAME = "deploy";

    private static final Duration POLL_INITIAL = Duration.ofSeconds(2);
    private static final Duration POLL_MAX     = Duration.ofSeconds(10);

    private final RuntimeClient runtime;
    private final Poller        poller;
    private final ObjectMapper  json;
    private final StepManifest  manifest;

    public DeployServiceStep(RuntimeClient runtime,
                             Poller poller,
                             ObjectMapper objectMapper,
                             @Value("${deployer.steps.deploy.timeout:10m}") Duration timeout) {
        this.runtime  = runtime;
        this.poller   = poller;
        this.json     = objectMapper;
        this.manifest = new StepManifest(NAME, 80, timeout, "Deploy the image as a service and wait for readiness");
    }

    @Override
    public StepManifest manifest() {
        return manifest;
    }

    @Override
    public StepOutput execute(StepContext ctx) {
        DeploymentConfig config = DeploymentConfig.parse(ctx.config(), ctx.targetId(), json);
        String imageUri = ctx.requireOutput(BuildImageStep.NAME, "imageUri");
        String name     = config.serviceName();

        ServiceStatus status;
        try {
            status = runtime.deployService(new ServiceRequest(name, imageUri, config.region(),
                    config.memory(), config.cpu(), config.minInstances(), config.maxInstances(), config.env()));
        } catch (RuntimeClientException e) {
            throw new StepException(StepException.Kind.FAILED, "Service deploy could not be started: " + e.getMessage(), e);
        }

        ServiceStatus ready = status.ready() || status.failed() ? status : poller.until(
                "Service " + name + " rollout", manifest.timeout(), POLL_INITIAL, POLL_MAX,
                () -> poll(name));

        if (ready.failed()) {
            throw new StepException(StepException.Kind.FAILED, ready.error() != null && !ready.error().isBlank()
                    ? ready.error()
                    : "Service " + name + " failed to deploy");
        }
        log.info("Service {} is ready at {}", name, ready.url());
        return StepOutput.of("serviceName", name, "serviceUrl", ready.url());
    }

    @Override
    public boolean compensate(StepContext ctx) {
        String name = ctx.priorOutputs().getOrDefault(NAME, Map.of()).get("serviceName");
        if (name == null) {
            name = DeploymentConfig.parse(ctx.config(), ctx.targetId(), json).serviceName();
        }
        runtime.deleteService(name);
        log.info("Compensated deploy for job {}: service {} deleted", ctx.jobId(), name);
        return true;
    }

    private Optional<ServiceStatus> poll(String name) {
        try {
            ServiceStatus s = runtime.getService(name);
            return s.ready() || s.failed() ? Optional.of(s) : Optional.empty();
        } catch (RuntimeClientException e) {
            log.warn("Polling service {} failed, will retry: {}", name, e.getMessage());
            return Optional.empty();
        }
    }
}
