package com.libragraph.checkpoint.core.checkpoint;

/**
 * Identifies a checkpoint within its repository by its sequence index (1-based).
 */
public record CheckpointId(long index) implements Comparable<CheckpointId> {

    public CheckpointId {
        if (index < 1) {
            throw new IllegalArgumentException("index must be >= 1, got: " + index);
        }
    }

    public static CheckpointId of(long index) {
        return new CheckpointId(index);
    }

    /** Name of the published record file, e.g. {@code 00000042.json}. */
    String fileName() {
        return String.format("%08d.json", index);
    }

    @Override
    public int compareTo(CheckpointId other) {
        return Long.compare(index, other.index);
    }

    @Override
    public String toString() {
        return "#" + index;
    }
}
