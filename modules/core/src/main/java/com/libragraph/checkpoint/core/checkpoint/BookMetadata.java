package com.libragraph.checkpoint.core.checkpoint;

/**
 * Book-level display metadata captured with each checkpoint. Every field may be null.
 *
 * <p>Display only: never part of the file set, never compared, never restored.
 */
public record BookMetadata(String title, String sourcePath, String formatVersion, String identifier) {

    public static final BookMetadata EMPTY = new BookMetadata(null, null, null, null);
}
