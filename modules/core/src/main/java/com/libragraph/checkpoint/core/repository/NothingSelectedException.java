package com.libragraph.checkpoint.core.repository;

/**
 * Thrown when a management operation is invoked without any repository to act on.
 */
public class NothingSelectedException extends RuntimeException {

    public NothingSelectedException(String message) {
        super(message);
    }
}
