package com.agentdeploy.orchestrator.error;

/**
 * A deployment request was rejected before any job record was created.
 */
public class InvalidConfigException extends DeploymentException {

    public InvalidConfigException(String message) {
        super(ErrorCode.INVALID_CONFIG, message);
    }
}
