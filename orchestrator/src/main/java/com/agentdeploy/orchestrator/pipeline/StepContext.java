package com.agentdeploy.orchestrator.pipeline;

import java.util.Map;
import java.util.UUID;

/**
 * What a step gets to see of its job.
 *
 * @param config       the caller's JSON config, unparsed
 * @param priorOutputs outputs of the steps that already succeeded, keyed by step name
 */
public record StepContext(
        UUID   jobId,
        String targetId,
        String config,
        Map<String, Map<String, String>> priorOutputs) {

    public StepContext {
        priorOutputs = priorOutputs == null ? Map.of() : Map.copyOf(priorOutputs);
    }

    /**
     * A value produced by an earlier step.
     *
     * @throws StepException if the value is missing, which means the pipeline is miswired
     */
    public String requireOutput(String step, String key) {
        String value = priorOutputs.getOrDefault(step, Map.of()).get(key);
        if (value == null || value.isBlank()) {
            throw new StepException(StepException.Kind.FAILED,
                    "Missing '" + key + "' from step '" + step + "'");
        }
        return value;
    }
}
