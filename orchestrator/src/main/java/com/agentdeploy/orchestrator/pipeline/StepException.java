package com.agentdeploy.orchestrator.pipeline;

/**
 * A pipeline step could not complete.
 *
 * The message is what the caller will read as the job's errorMessage, so it is
 * kept exactly as given; the kind only drives metrics and logging.
 */
public class StepException extends RuntimeException {

    public enum Kind { FAILED, TIMEOUT, INVALID_CONFIG }

    private final Kind kind;

    public StepException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StepException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
