package com.agentdeploy.orchestrator.runtime.dto;

/**
 * Outcome of one GET on a service's health path.
 *
 * @param statusCode HTTP status, or -1 if the service could not be reached
 * @param detail     response body (truncated) or the connection error
 */
public record HealthCheck(int statusCode, String detail) {

    public static HealthCheck unreachable(String error) {
        return new HealthCheck(-1, error);
    }

    public boolean reachable() {
        return statusCode >= 0;
    }

    public boolean healthy() {
        return statusCode >= 200 && statusCode < 300;
    }

    /** Not up yet: connection refused, or the platform's front end answering for a cold revision. */
    public boolean notReady() {
        return !reachable() || statusCode == 502 || statusCode == 503 || statusCode == 504;
    }
}
