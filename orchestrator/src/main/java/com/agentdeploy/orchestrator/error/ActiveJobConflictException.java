package com.agentdeploy.orchestrator.error;

import java.util.UUID;

/**
 * Another job for the same target is already queued or processing.
 */
public class ActiveJobConflictException extends DeploymentException {

    private final String targetId;
    private final UUID activeJobId;

    public ActiveJobConflictException(String targetId, UUID activeJobId) {
        super(ErrorCode.CONFLICT, activeJobId == null
                ? "Target " + targetId + " already has an active deployment"
                : "Target " + targetId + " already has an active deployment: " + activeJobId);
        this.targetId    = targetId;
        this.activeJobId = activeJobId;
    }

    public String getTargetId()  { return targetId; }
    public UUID   getActiveJobId() { return activeJobId; }
}
