package com.libragraph.checkpoint.core.checkpoint;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Called once everything is staged and before the single publishing step
 * (record rename for checkpoints, directory swap for checkout).
 * Throwing aborts the operation, which then rolls back.
 */
@FunctionalInterface
public interface PublishHook {

    PublishHook NONE = staged -> { };

    void beforePublish(Path staged) throws IOException;
}
