package com.agentdeploy.orchestrator.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Bounded polling with exponential backoff, used by steps that wait on the runtime.
 *
 * The probe returns a value when the awaited condition holds, empty to keep
 * waiting, or throws {@link StepException} to stop immediately. Once the
 * timeout elapses the poller gives up with a TIMEOUT failure; it never waits
 * past the deadline by more than one capped delay.
 */
public class Poller {

    /** Blocking wait between probes. Swapped out in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Clock   clock;
    private final Sleeper sleeper;

    public Poller(Clock clock, Sleeper sleeper) {
        this.clock   = clock;
        this.sleeper = sleeper;
    }

    public static Poller system(Clock clock) {
        return new Poller(clock, d -> Thread.sleep(d.toMillis()));
    }

    /**
     * @param what         used in the timeout message, e.g. "Image build b-123"
     * @param timeout      total budget measured from the first probe
     * @param initialDelay wait after the first unsuccessful probe
     * @param maxDelay     cap for the doubling delay
     */
    public <T> T until(String what, Duration timeout, Duration initialDelay, Duration maxDelay,
                       Supplier<Optional<T>> probe) {
        Instant deadline = clock.instant().plus(timeout);
        Duration delay = initialDelay;
        while (true) {
            Optional<T> result = probe.get();
            if (result.isPresent()) {
                return result.get();
            }
            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                throw new StepException(StepException.Kind.TIMEOUT,
                        what + " did not complete within " + format(timeout));
            }
            Duration remaining = Duration.between(now, deadline);
            try {
                sleeper.sleep(delay.compareTo(remaining) < 0 ? delay : remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StepException(StepException.Kind.FAILED, what + " was interrupted", e);
            }
            Duration doubled = delay.multipliedBy(2);
            delay = doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
        }
    }

    private static String format(Duration d) {
        long seconds = d.getSeconds();
        if (seconds >= 60 && seconds % 60 == 0) {
            return (seconds / 60) + " min";
        }
        return seconds + " s";
    }
}
