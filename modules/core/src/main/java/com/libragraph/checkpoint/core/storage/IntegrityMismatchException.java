package com.libragraph.checkpoint.core.storage;

import com.libragraph.checkpoint.util.ContentRef;

/**
 * Thrown when a stored payload no longer matches its reference (on-disk corruption).
 */
public class IntegrityMismatchException extends StorageException {

    private final ContentRef expected;
    private final ContentRef actual;

    public IntegrityMismatchException(ContentRef expected, ContentRef actual) {
        super("Stored content does not match its reference: expected=" + expected
                + " actual=" + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public ContentRef expected() {
        return expected;
    }

    public ContentRef actual() {
        return actual;
    }
}
