package com.agentdeploy.orchestrator.pipeline.impl;

import com.agentdeploy.orchestrator.pipeline.DeploymentConfig;
import com.agentdeploy.orchestrator.pipeline.PipelineStep;
import com.agentdeploy.orchestrator.pipeline.StepContext;
import com.agentdeploy.orchestrator.pipeline.StepManifest;
import com.agentdeploy.orchestrator.pipeline.StepOutput;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the job config and resolves the names later steps deploy under.
 *
 * Pure computation, no runtime calls. Any problem with the config surfaces here
 * as INVALID_CONFIG before anything is built.
 */
@Component
public class ValidateConfigStep implements PipelineStep {

    public static final String NAME = "validate";

    private static final StepManifest MANIFEST = new StepManifest(
            NAME, 10, Duration.ofSeconds(10), "Parse the deployment config and resolve service and image names");

    private final ObjectMapper json;

    public ValidateConfigStep(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    @Override
    public StepManifest manifest() {
        return MANIFEST;
    }

    @Override
    public StepOutput execute(StepContext ctx) {
        DeploymentConfig config = DeploymentConfig.parse(ctx.config(), ctx.targetId(), json);
        Map<String, String> out = new LinkedHashMap<>();
        out.put("serviceName", config.serviceName());
        out.put("imageName",   config.imageName());
        out.put("region",      config.region());
        return new StepOutput(out);
    }

    /** Nothing was created, so there is nothing to undo. */
    @Override
    public boolean compensate(StepContext ctx) {
        return true;
    }
}
