package com.agentdeploy.orchestrator.model;

/**
 * Execution state of one pipeline step within a job.
 *
 * Transitions:
 *   RUNNING → SUCCEEDED (step returned an output)
 *   RUNNING → FAILED    (step raised an error or timed out)
 *
 * A step that was never reached has no StepRun at all.
 */
public enum StepState {
    RUNNING,
    SUCCEEDED,
    FAILED
}
