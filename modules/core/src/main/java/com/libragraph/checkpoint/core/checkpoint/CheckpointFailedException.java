package com.libragraph.checkpoint.core.checkpoint;

/**
 * Thrown when writing a checkpoint fails. Nothing of the attempt is visible:
 * the staged record and any payloads it added were removed first.
 */
public class CheckpointFailedException extends RuntimeException {

    public CheckpointFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
