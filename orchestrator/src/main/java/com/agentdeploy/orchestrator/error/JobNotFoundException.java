package com.agentdeploy.orchestrator.error;

import java.util.UUID;

public class JobNotFoundException extends DeploymentException {

    public JobNotFoundException(UUID jobId) {
        super(ErrorCode.NOT_FOUND, "Deployment job not found: " + jobId);
    }

    public JobNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
