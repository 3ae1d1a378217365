package com.libragraph.checkpoint.core.checkout;

import com.libragraph.checkpoint.core.checkpoint.CheckpointId;

import java.util.List;

/**
 * What a checkout did to the working tree: every path it wrote and every path
 * that existed before but is not part of the restored checkpoint.
 */
public record ReplacedFileList(CheckpointId checkpoint, List<String> restored, List<String> removed) {

    public ReplacedFileList {
        restored = List.copyOf(restored);
        removed = List.copyOf(removed);
    }
}
