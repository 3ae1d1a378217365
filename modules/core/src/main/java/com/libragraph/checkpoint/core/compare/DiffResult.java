package com.libragraph.checkpoint.core.compare;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Outcome of a comparison. The four path sets are disjoint and together cover every
 * path seen on either side. {@code differences} has one entry per modified path.
 */
public record DiffResult(
        SortedSet<String> onlyInCheckpoint,
        SortedSet<String> onlyInWorking,
        SortedSet<String> modified,
        SortedSet<String> unchanged,
        SortedMap<String, FileDifference> differences
) {

    public DiffResult {
        onlyInCheckpoint = freeze(onlyInCheckpoint);
        onlyInWorking = freeze(onlyInWorking);
        modified = freeze(modified);
        unchanged = freeze(unchanged);
        differences = Collections.unmodifiableSortedMap(
                new TreeMap<>(Objects.requireNonNull(differences, "differences cannot be null")));
    }

    private static SortedSet<String> freeze(SortedSet<String> paths) {
        return Collections.unmodifiableSortedSet(
                new TreeSet<>(Objects.requireNonNull(paths, "path set cannot be null")));
    }

    /**
     * False when the working tree matches the checkpoint exactly.
     */
    public boolean hasDifferences() {
        return !onlyInCheckpoint.isEmpty() || !onlyInWorking.isEmpty() || !modified.isEmpty();
    }

    /**
     * Returns the bucket of {@code path}, or null if neither side has it.
     */
    public DiffStatus statusOf(String path) {
        if (onlyInCheckpoint.contains(path)) return DiffStatus.ONLY_IN_CHECKPOINT;
        if (onlyInWorking.contains(path)) return DiffStatus.ONLY_IN_WORKING;
        if (modified.contains(path)) return DiffStatus.MODIFIED;
        if (unchanged.contains(path)) return DiffStatus.UNCHANGED;
        return null;
    }

    public int totalPaths() {
        return onlyInCheckpoint.size() + onlyInWorking.size() + modified.size() + unchanged.size();
    }

    public Map<DiffStatus, Integer> counts() {
        return Map.of(
                DiffStatus.ONLY_IN_CHECKPOINT, onlyInCheckpoint.size(),
                DiffStatus.ONLY_IN_WORKING, onlyInWorking.size(),
                DiffStatus.MODIFIED, modified.size(),
                DiffStatus.UNCHANGED, unchanged.size());
    }
}
