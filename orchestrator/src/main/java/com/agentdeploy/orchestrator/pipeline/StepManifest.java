package com.agentdeploy.orchestrator.pipeline;

import java.time.Duration;

/**
 * Identity and scheduling contract for a pipeline step.
 *
 * @param name            stable identifier written to the job's currentStep (e.g. "build")
 * @param progressPercent progress reached once the step succeeds; strictly increasing across
 *                        the pipeline, the last step is 100
 * @param timeout         upper bound on the step's own polling; exceeded → TIMEOUT failure
 * @param description     one line, for logs and the step listing
 */
public record StepManifest(
        String   name,
        int      progressPercent,
        Duration timeout,
        String   description) {}
