package com.agentdeploy.orchestrator.model;

import java.time.Instant;
import java.util.Map;

/**
 * One executed (or executing) pipeline step as recorded on a job.
 *
 * @param sequence     1-based position in the pipeline
 * @param name         step name, e.g. "build"
 * @param output       values the step produced (image uri, service url, ...); empty until it succeeds
 * @param errorMessage set only when state = FAILED
 */
public record StepRun(
        int       sequence,
        String    name,
        StepState state,
        Instant   startedAt,
        Instant   finishedAt,
        Map<String, String> output,
        String    errorMessage
) {
    public StepRun {
        output = output == null ? Map.of() : Map.copyOf(output);
    }

    public static StepRun running(int sequence, String name, Instant now) {
        return new StepRun(sequence, name, StepState.RUNNING, now, null, Map.of(), null);
    }

    public StepRun succeeded(Map<String, String> stepOutput, Instant now) {
        return new StepRun(sequence, name, StepState.SUCCEEDED, startedAt, now, stepOutput, null);
    }

    public StepRun failed(String error, Instant now) {
        return new StepRun(sequence, name, StepState.FAILED, startedAt, now, Map.of(), error);
    }
}
