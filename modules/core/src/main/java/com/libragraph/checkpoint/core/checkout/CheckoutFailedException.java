package com.libragraph.checkpoint.core.checkout;

import com.libragraph.checkpoint.core.checkpoint.CheckpointId;

/**
 * Thrown when a checkout could not be staged or swapped in. The working tree
 * is unchanged.
 */
public class CheckoutFailedException extends RuntimeException {

    private final CheckpointId checkpoint;

    public CheckoutFailedException(CheckpointId checkpoint, Throwable cause) {
        super("Failed to check out checkpoint " + checkpoint + ": " + cause.getMessage(), cause);
        this.checkpoint = checkpoint;
    }

    public CheckpointId checkpoint() {
        return checkpoint;
    }
}
