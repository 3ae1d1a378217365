package com.libragraph.checkpoint.core.compare;

import com.libragraph.checkpoint.core.checkpoint.Checkpoint;
import com.libragraph.checkpoint.core.checkpoint.FileEntry;
import com.libragraph.checkpoint.core.checkpoint.WorkingFile;
import com.libragraph.checkpoint.util.ContentHash;
import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Classifies every path of a working tree and a checkpoint into exactly one of
 * only-in-checkpoint, only-in-working, modified or unchanged.
 *
 * <p>Stateless and thread-safe. Never reads payloads from the content store:
 * checkpoint entries already carry size and hash.
 */
public class CheckpointComparator {

    private static final Logger log = Logger.getLogger(CheckpointComparator.class);

    /**
     * Compares working bytes against a checkpoint. Paths present on both sides are
     * modified if sizes differ (no hashing needed) or if the hashes differ.
     *
     * @throws IllegalArgumentException if {@code working} lists a path twice
     */
    public DiffResult compare(List<WorkingFile> working, Checkpoint checkpoint) {
        Objects.requireNonNull(working, "working cannot be null");
        Objects.requireNonNull(checkpoint, "checkpoint cannot be null");

        Map<String, WorkingFile> workingByPath = new HashMap<>();
        for (WorkingFile file : working) {
            if (workingByPath.put(file.path(), file) != null) {
                throw new IllegalArgumentException("Duplicate working path: " + file.path());
            }
        }

        Builder result = new Builder();
        for (FileEntry entry : checkpoint.files().values()) {
            WorkingFile current = workingByPath.get(entry.path());
            if (current == null) {
                result.onlyInCheckpoint.add(entry.path());
            } else if (differs(entry, current.content())) {
                result.modified(entry, current.content().length);
            } else {
                result.unchanged.add(entry.path());
            }
        }
        for (String path : workingByPath.keySet()) {
            if (!checkpoint.files().containsKey(path)) {
                result.onlyInWorking.add(path);
            }
        }

        DiffResult diff = result.build();
        log.debugf("Compared working tree with checkpoint %s: %s", checkpoint.id(), diff.counts());
        return diff;
    }

    /**
     * Compares two checkpoints by reference only. {@code older} plays the checkpoint
     * side, {@code newer} the working side.
     */
    public DiffResult compare(Checkpoint older, Checkpoint newer) {
        Objects.requireNonNull(older, "older cannot be null");
        Objects.requireNonNull(newer, "newer cannot be null");

        Builder result = new Builder();
        for (FileEntry entry : older.files().values()) {
            FileEntry other = newer.file(entry.path());
            if (other == null) {
                result.onlyInCheckpoint.add(entry.path());
            } else if (!entry.ref().equals(other.ref())) {
                result.modified(entry, other.size());
            } else {
                result.unchanged.add(entry.path());
            }
        }
        for (String path : newer.files().keySet()) {
            if (older.file(path) == null) {
                result.onlyInWorking.add(path);
            }
        }
        return result.build();
    }

    private static boolean differs(FileEntry entry, byte[] content) {
        if (content.length != entry.size()) {
            return true;
        }
        return !ContentHash.of(content).equals(entry.ref().hash());
    }

    private static final class Builder {
        final SortedSet<String> onlyInCheckpoint = new TreeSet<>();
        final SortedSet<String> onlyInWorking = new TreeSet<>();
        final SortedSet<String> modified = new TreeSet<>();
        final SortedSet<String> unchanged = new TreeSet<>();
        final SortedMap<String, FileDifference> differences = new TreeMap<>();

        void modified(FileEntry entry, long otherSize) {
            modified.add(entry.path());
            differences.put(entry.path(),
                    new FileDifference(entry.path(), entry.kind(), entry.size(), otherSize));
        }

        DiffResult build() {
            return new DiffResult(onlyInCheckpoint, onlyInWorking, modified, unchanged, differences);
        }
    }
}
