package com.libragraph.checkpoint.core.checkpoint;

import java.time.Instant;

/**
 * What the history view shows for one checkpoint.
 */
public record CheckpointSummary(long index, Instant timestamp, String description, int fileCount) {

    public CheckpointId id() {
        return CheckpointId.of(index);
    }
}
