package com.agentdeploy.orchestrator.service;

import com.agentdeploy.orchestrator.store.JobStoreException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded exponential retry around job-store calls.
 *
 * Only {@link JobStoreException} is retried. Domain outcomes (not found,
 * conflict, illegal transition, version mismatch) pass straight through.
 * When attempts are exhausted the last {@link JobStoreException} is rethrown.
 */
@Component
public class StoreRetry {

    private static final Logger log = LoggerFactory.getLogger(StoreRetry.class);

    private final Retry retry;

    public StoreRetry(
            @Value("${deployer.store.retry.max-attempts:5}") int maxAttempts,
            @Value("${deployer.store.retry.initial-backoff:200ms}") Duration initialBackoff,
            @Value("${deployer.store.retry.max-backoff:5s}") Duration maxBackoff) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1L, initialBackoff.toMillis()), 2.0, Math.max(1L, maxBackoff.toMillis())))
                .retryExceptions(JobStoreException.class)
                .build();
        this.retry = Retry.of("job-store", config);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Job store call failed (attempt {}/{}), retrying: {}",
                        event.getNumberOfRetryAttempts(), maxAttempts,
                        event.getLastThrowable() == null ? "?" : event.getLastThrowable().getMessage()));
    }

    public <T> T call(Supplier<T> storeCall) {
        return retry.executeSupplier(storeCall);
    }
}
