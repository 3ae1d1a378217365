package com.libragraph.checkpoint.core.compare;

import com.libragraph.checkpoint.types.FileKind;

/**
 * Detail for one modified path. Sizes are in bytes; the kind is the one recorded
 * in the checkpoint.
 */
public record FileDifference(String path, FileKind kind, long checkpointSize, long workingSize) {

    public boolean isBinary() {
        return kind == FileKind.BINARY;
    }

    public boolean sizeChanged() {
        return checkpointSize != workingSize;
    }

    /**
     * One-line description for a compare view. Binary files never get more than
     * "differ" plus sizes.
     */
    public String describe() {
        if (isBinary()) {
            return "Binary files differ: " + path + " (" + checkpointSize + " bytes -> "
                    + workingSize + " bytes)";
        }
        return "Text file modified: " + path + " (" + checkpointSize + " bytes -> "
                + workingSize + " bytes)";
    }
}
