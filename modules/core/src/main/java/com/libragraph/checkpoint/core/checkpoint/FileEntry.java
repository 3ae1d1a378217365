package com.libragraph.checkpoint.core.checkpoint;

import com.libragraph.checkpoint.types.FileKind;
import com.libragraph.checkpoint.util.ContentRef;

import java.util.Objects;

/**
 * One file in a checkpoint's file set.
 */
public record FileEntry(String path, ContentRef ref, FileKind kind) {

    public FileEntry {
        RelativePaths.validate(path);
        Objects.requireNonNull(ref, "ref cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    public long size() {
        return ref.size();
    }
}
