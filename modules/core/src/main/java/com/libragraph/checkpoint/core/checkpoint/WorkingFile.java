package com.libragraph.checkpoint.core.checkpoint;

import java.util.Objects;

/**
 * One file of a working-tree snapshot as handed over by the document model.
 */
public record WorkingFile(String path, byte[] content) {

    public WorkingFile {
        RelativePaths.validate(path);
        Objects.requireNonNull(content, "content cannot be null");
    }
}
