package com.libragraph.checkpoint.core.checkpoint;

/**
 * Thrown when a checkpoint id does not exist in the repository,
 * or when the repository has no checkpoints at all.
 */
public class CheckpointNotFoundException extends RuntimeException {

    private final CheckpointId id;

    public CheckpointNotFoundException(CheckpointId id) {
        super("Checkpoint not found: " + id);
        this.id = id;
    }

    private CheckpointNotFoundException(String message) {
        super(message);
        this.id = null;
    }

    public static CheckpointNotFoundException noCheckpoints() {
        return new CheckpointNotFoundException("No checkpoints found");
    }

    /** The requested id, or null when the repository is empty. */
    public CheckpointId id() {
        return id;
    }
}
