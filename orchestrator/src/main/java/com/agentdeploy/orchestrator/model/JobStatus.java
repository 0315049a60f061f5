package com.agentdeploy.orchestrator.model;

import java.util.Locale;

/**
 * Lifecycle of one deployment attempt.
 *
 * Transitions:
 *   QUEUED     → PROCESSING (claimed by a processor)
 *   QUEUED     → CANCELLED  (cancel observed before claim)
 *   PROCESSING → DEPLOYED | FAILED | CANCELLED
 *   PROCESSING → QUEUED     (lease reaper only, orphaned job)
 *
 * Terminal states never transition again.
 */
public enum JobStatus {
    QUEUED,
    PROCESSING,
    DEPLOYED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DEPLOYED || this == FAILED || this == CANCELLED;
    }

    /** Counts against the one-active-job-per-target rule. */
    public boolean isActive() {
        return this == QUEUED || this == PROCESSING;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED     -> next == PROCESSING || next == CANCELLED;
            case PROCESSING -> next == PROCESSING || next == QUEUED || next.isTerminal();
            case DEPLOYED, FAILED, CANCELLED -> false;
        };
    }

    /** Lower-case form used on the wire ("queued", "processing", ...). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
