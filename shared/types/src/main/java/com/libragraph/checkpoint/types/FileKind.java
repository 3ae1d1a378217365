package com.libragraph.checkpoint.types;

/**
 * Presentation hint recorded for every file in a checkpoint.
 *
 * <p>Decided once when the checkpoint is written and never re-derived, so diff
 * results stay deterministic. Correctness never depends on it.
 */
public enum FileKind {
    TEXT(0, "text"),
    BINARY(1, "binary");

    private final int id;
    private final String label;

    FileKind(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static FileKind fromId(int id) {
        for (FileKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown FileKind id: " + id);
    }

    public static FileKind fromLabel(String label) {
        for (FileKind k : values()) {
            if (k.label.equals(label)) return k;
        }
        throw new IllegalArgumentException("Unknown FileKind label: " + label);
    }
}
