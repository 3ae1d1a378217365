package com.libragraph.checkpoint.core.repository;

import java.time.Instant;

/**
 * Read-only row of the repository management list.
 */
public record RepositorySummary(
        RepositoryId id,
        BookIdentity identity,
        String title,
        String sourcePath,
        Instant lastModified,
        String formatVersion,
        String bookIdentifier,
        int checkpointCount
) {}
