package com.libragraph.checkpoint.core.concurrent;

/**
 * Thrown when a checkpoint or checkout stops because its {@link CancellationToken}
 * was cancelled. Everything the operation had staged is already rolled back.
 */
public class OperationCancelledException extends RuntimeException {

    public OperationCancelledException(String operation) {
        super("Cancelled: " + operation);
    }
}
