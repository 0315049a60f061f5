package com.agentdeploy.orchestrator.pipeline;

/**
 * One named stage of the deployment pipeline.
 *
 * Steps are Spring {@code @Component}s collected by {@link DeploymentPipeline}
 * and run strictly in order of {@link StepManifest#progressPercent()}. A step
 * reads the job's config and the outputs of the steps before it from the
 * {@link StepContext}, does its work against the runtime and returns what it
 * produced. It never touches the job record; the processor writes progress.
 *
 * <p>Failure contract: throw {@link StepException}. Any other exception is
 * wrapped as {@link StepException.Kind#FAILED} by the pipeline. The message
 * ends up verbatim in the job's errorMessage, so keep it human readable.
 */
public interface PipelineStep {

    /** Identity, progress weight and timeout. */
    StepManifest manifest();

    StepOutput execute(StepContext ctx) throws StepException;

    /**
     * Undo this step's side effect after a later cancellation.
     *
     * @return false if the step has nothing it can undo; the caller then logs
     *         that manual cleanup may be needed
     */
    default boolean compensate(StepContext ctx) {
        return false;
    }
}
