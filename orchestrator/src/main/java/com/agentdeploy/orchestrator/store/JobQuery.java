package com.agentdeploy.orchestrator.store;

import com.agentdeploy.orchestrator.model.JobStatus;

/**
 * Filter for {@link JobStore#find}. Null fields match everything.
 */
public record JobQuery(String targetId, JobStatus status, int limit) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT     = 200;

    public JobQuery {
        if (targetId != null && targetId.isBlank()) targetId = null;
        if (limit <= 0) limit = DEFAULT_LIMIT;
        if (limit > MAX_LIMIT) limit = MAX_LIMIT;
    }
}
