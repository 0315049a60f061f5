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
import com.agentdeploy.orchestrator.runtime.dto.BuildStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Builds and pushes the container image, then waits for the build to finish.
 *
 * The builder's own failure reason (e.g. "image too large") is passed through
 * unchanged as the step error.
 */
@Component
public class BuildImageStep implements PipelineStep {

    private static final Logger log = LoggerFactory.getLogger(BuildImageStep.class);

    public static final String NAME = "build";

    private static final Duration POLL_INITIAL = Duration.ofSeconds(2);
    private static final Duration POLL_MAX     = Duration.ofSeconds(15);

    private final RuntimeClient runtime;
    private final Poller        poller;
    private final ObjectMapper  json;
    private final StepManifest  manifest;

    public BuildImageStep(RuntimeClient runtime,
                          Poller poller,
                          ObjectMapper objectMapper,
                          @Value("${deployer.steps.build.timeout:20m}") Duration timeout) {
        this.runtime  = runtime;
        this.poller   = poller;
        this.json     = objectMapper;
        this.manifest = new StepManifest(NAME, 50, timeout, "Build and push the container image");
    }

    @Override
    public StepManifest manifest() {
        return manifest;
    }

    @Override
    public StepOutput execute(StepContext ctx) {
        DeploymentConfig config = DeploymentConfig.parse(ctx.config(), ctx.targetId(), json);
        String image = ctx.requireOutput(ValidateConfigStep.NAME, "imageName");

        BuildStatus started;
        try {
            started = runtime.submitBuild(config.source(), image);
        } catch (RuntimeClientException e) {
            throw new StepException(StepException.Kind.FAILED, "Image build could not be started: " + e.getMessage(), e);
        }
        String buildId = started.buildId();
        log.info("Build {} started for image {}", buildId, image);

        BuildStatus done = started.finished() ? started : poller.until(
                "Image build " + buildId, manifest.timeout(), POLL_INITIAL, POLL_MAX,
                () -> poll(buildId));

        if (!done.succeeded()) {
            String reason = done.error() != null && !done.error().isBlank()
                    ? done.error()
                    : "Image build " + buildId + " ended with status " + done.status();
            throw new StepException(StepException.Kind.FAILED, reason);
        }
        String imageUri = done.imageUri() != null ? done.imageUri() : image;
        log.info("Build {} succeeded: {}", buildId, imageUri);
        return StepOutput.of("imageUri", imageUri, "buildId", buildId);
    }

    private Optional<BuildStatus> poll(String buildId) {
        try {
            BuildStatus status = runtime.getBuild(buildId);
            return status.finished() ? Optional.of(status) : Optional.empty();
        } catch (RuntimeClientException e) {
            // Transient lookup failures are retried until the step timeout.
            log.warn("Polling build {} failed, will retry: {}", buildId, e.getMessage());
            return Optional.empty();
        }
    }
}
