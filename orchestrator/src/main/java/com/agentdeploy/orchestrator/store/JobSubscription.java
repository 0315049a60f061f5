package com.agentdeploy.orchestrator.store;

/**
 * Handle for a change-notification registration. Closing it twice is harmless.
 */
@FunctionalInterface
public interface JobSubscription extends AutoCloseable {

    @Override
    void close();
}
