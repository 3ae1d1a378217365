package com.libragraph.checkpoint.core.storage;

import com.libragraph.checkpoint.util.ContentRef;
import io.smallrye.mutiny.Multi;

/**
 * Content-addressed payload storage for one repository.
 *
 * <p>Payloads are keyed by {@link ContentRef}; identical bytes are stored once.
 * Implementations are safe to call from any thread.
 */
public interface ContentStore {

    /**
     * Stores a payload if it is not already present and returns its reference.
     * The payload is durable once this returns.
     *
     * @throws StorageException on I/O errors
     */
    ContentRef put(byte[] data);

    /**
     * Reads a payload and verifies it against its reference.
     *
     * @throws ContentNotFoundException if the payload does not exist
     * @throws IntegrityMismatchException if the stored bytes no longer match
     * @throws StorageException on I/O errors
     */
    byte[] get(ContentRef ref);

    /**
     * Checks whether a payload exists.
     */
    boolean contains(ContentRef ref);

    /**
     * Deletes a payload. Absent payloads are ignored.
     *
     * @throws StorageException on I/O errors
     */
    void delete(ContentRef ref);

    /**
     * Lists every stored reference. Each subscription rescans the store.
     */
    Multi<ContentRef> list();
}
