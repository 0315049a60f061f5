package com.agentdeploy.orchestrator.observer;

import com.agentdeploy.orchestrator.model.JobRecord;

import java.util.Optional;

/**
 * Observer-side view of one job, reconciled last-write-wins by version.
 *
 * Replayed, duplicated or late snapshots are rejected, so whatever renders
 * the tracked state never moves backwards.
 */
public class ProgressTracker {

    private JobRecord latest;
    private long      floorVersion;

    public ProgressTracker() {
        this(-1L);
    }

    /** Snapshots at or below {@code floorVersion} are treated as already seen. */
    public ProgressTracker(long floorVersion) {
        this.floorVersion = floorVersion;
    }

    /** @return true if {@code snapshot} is newer than anything seen so far */
    public synchronized boolean accept(JobRecord snapshot) {
        if (snapshot == null || snapshot.version() <= floorVersion) {
            return false;
        }
        latest       = snapshot;
        floorVersion = snapshot.version();
        return true;
    }

    public synchronized Optional<JobRecord> latest() {
        return Optional.ofNullable(latest);
    }

    public synchronized long version() {
        return floorVersion;
    }
}
