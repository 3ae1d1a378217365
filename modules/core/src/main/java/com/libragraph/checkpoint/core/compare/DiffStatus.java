package com.libragraph.checkpoint.core.compare;

/**
 * The bucket a path falls into when a working tree is compared with a checkpoint.
 */
public enum DiffStatus {
    ONLY_IN_CHECKPOINT,
    ONLY_IN_WORKING,
    MODIFIED,
    UNCHANGED
}
