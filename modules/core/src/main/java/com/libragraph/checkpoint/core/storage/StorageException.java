package com.libragraph.checkpoint.core.storage;

/**
 * Wraps checked I/O exceptions from content store operations.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
