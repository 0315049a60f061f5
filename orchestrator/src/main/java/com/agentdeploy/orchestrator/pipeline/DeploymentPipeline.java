package com.agentdeploy.orchestrator.pipeline;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * The ordered set of pipeline steps.
 *
 * Every {@link PipelineStep} bean is collected at startup and sorted by its
 * progress weight. Startup fails if two steps share a weight or the last one
 * does not reach 100, since progress writes would otherwise stall or regress.
 *
 * <p>Execution is timed per step:
 * <pre>
 *   deployer.step.duration{step, outcome="success|failed|timeout|invalid_config"}
 * </pre>
 */
@Component
public class DeploymentPipeline {

    private static final Logger log = LoggerFactory.getLogger(DeploymentPipeline.class);

    private final List<PipelineStep> steps;
    private final MeterRegistry      meterRegistry;

    public DeploymentPipeline(List<PipelineStep> allSteps, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        List<PipelineStep> sorted = new ArrayList<>(allSteps);
        sorted.sort(Comparator.comparingInt(s -> s.manifest().progressPercent()));
        validate(sorted);
        this.steps = List.copyOf(sorted);
        for (PipelineStep step : steps) {
            StepManifest m = step.manifest();
            log.info("Pipeline step '{}' → {}% (timeout {})", m.name(), m.progressPercent(), m.timeout());
        }
    }

    /** Steps in execution order. */
    public List<PipelineStep> steps() {
        return steps;
    }

    public List<String> stepNames() {
        return steps.stream().map(s -> s.manifest().name()).toList();
    }

    /**
     * Run one step with timing.
     *
     * @throws StepException for every failure, including unexpected runtime errors
     */
    public StepOutput execute(PipelineStep step, StepContext ctx) {
        String name = step.manifest().name();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            StepOutput out = step.execute(ctx);
            return out == null ? StepOutput.empty() : out;
        } catch (StepException e) {
            outcome = e.getKind().name().toLowerCase(Locale.ROOT);
            throw e;
        } catch (RuntimeException e) {
            outcome = "failed";
            throw new StepException(StepException.Kind.FAILED,
                    "Unexpected error in step '" + name + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("deployer.step.duration", "step", name, "outcome", outcome));
        }
    }

    private static void validate(List<PipelineStep> sorted) {
        if (sorted.isEmpty()) {
            throw new IllegalStateException("Deployment pipeline has no steps");
        }
        int previous = 0;
        for (PipelineStep step : sorted) {
            int weight = step.manifest().progressPercent();
            if (weight <= previous) {
                throw new IllegalStateException("Step '" + step.manifest().name()
                        + "' weight " + weight + " must be greater than " + previous);
            }
            previous = weight;
        }
        if (previous != 100) {
            throw new IllegalStateException("Last pipeline step must reach 100%, got " + previous);
        }
    }
}
