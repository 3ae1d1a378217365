package com.libragraph.checkpoint.core.storage;

import com.libragraph.checkpoint.util.ContentRef;

/**
 * Thrown when a read targets a payload that is not in the store.
 * A checkpoint referencing it means the repository is corrupt.
 */
public class ContentNotFoundException extends StorageException {

    private final ContentRef ref;

    public ContentNotFoundException(ContentRef ref) {
        super("Content not found: ref=" + ref);
        this.ref = ref;
    }

    public ContentRef ref() {
        return ref;
    }
}
