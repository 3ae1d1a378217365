package com.libragraph.checkpoint.core.checkpoint;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * An immutable, self-contained snapshot of a book's working tree.
 *
 * <p>{@code files} maps each relative path to its entry and is ordered by path.
 * {@code description} may be null.
 */
public record Checkpoint(
        long index,
        Instant timestamp,
        String description,
        BookMetadata metadata,
        SortedMap<String, FileEntry> files
) {

    public Checkpoint {
        if (index < 1) {
            throw new IllegalArgumentException("index must be >= 1, got: " + index);
        }
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        metadata = metadata != null ? metadata : BookMetadata.EMPTY;
        Objects.requireNonNull(files, "files cannot be null");
        for (Map.Entry<String, FileEntry> e : files.entrySet()) {
            if (!e.getKey().equals(e.getValue().path())) {
                throw new IllegalArgumentException("File set key " + e.getKey()
                        + " does not match entry path " + e.getValue().path());
            }
        }
        files = Collections.unmodifiableSortedMap(new TreeMap<>(files));
    }

    public CheckpointId id() {
        return CheckpointId.of(index);
    }

    public CheckpointSummary summary() {
        return new CheckpointSummary(index, timestamp, description, files.size());
    }

    public FileEntry file(String path) {
        return files.get(path);
    }
}
