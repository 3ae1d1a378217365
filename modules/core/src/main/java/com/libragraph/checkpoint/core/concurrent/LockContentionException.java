package com.libragraph.checkpoint.core.concurrent;

import java.nio.file.Path;

/**
 * Thrown when the repository lock stays held by another process or thread
 * after every retry.
 */
public class LockContentionException extends RuntimeException {

    private final Path lockFile;
    private final int attempts;

    public LockContentionException(Path lockFile, int attempts) {
        super("Repository is locked by another writer: " + lockFile
                + " (gave up after " + attempts + " attempts)");
        this.lockFile = lockFile;
        this.attempts = attempts;
    }

    public Path lockFile() {
        return lockFile;
    }

    public int attempts() {
        return attempts;
    }
}
