package com.libragraph.checkpoint.core.repository;

import com.libragraph.checkpoint.core.checkpoint.BookMetadata;

import java.time.Instant;

/**
 * Contents of {@code repository.json}: who the repository belongs to and the
 * metadata of its most recent checkpoint.
 */
public record RepositoryInfo(
        BookIdentity identity,
        BookMetadata metadata,
        Instant createdAt,
        Instant updatedAt
) {

    RepositoryInfo touched(BookMetadata newMetadata, Instant at) {
        return new RepositoryInfo(identity, newMetadata != null ? newMetadata : metadata,
                createdAt != null ? createdAt : at, at);
    }
}
