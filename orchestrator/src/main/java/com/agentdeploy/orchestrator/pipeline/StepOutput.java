package com.agentdeploy.orchestrator.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values a step produced, stored on the job's step entry.
 *
 * If a step reports {@link #ENDPOINT}, the last such value becomes the job's
 * resultEndpoint once the pipeline succeeds.
 */
public record StepOutput(Map<String, String> values) {

    public static final String ENDPOINT = "endpoint";

    public StepOutput {
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    public static StepOutput empty() {
        return new StepOutput(Map.of());
    }

    public static StepOutput of(String key, String value) {
        return new StepOutput(Map.of(key, value));
    }

    public static StepOutput of(String k1, String v1, String k2, String v2) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put(k1, v1);
        m.put(k2, v2);
        return new StepOutput(m);
    }

    public String get(String key) {
        return values.get(key);
    }
}
