package com.libragraph.checkpoint.core.repository;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Name of a repository directory in the store: 32 lowercase hex characters.
 */
public record RepositoryId(String value) {

    private static final Pattern FORMAT = Pattern.compile("[0-9a-f]{32}");

    public RepositoryId {
        Objects.requireNonNull(value, "value cannot be null");
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid repository id: " + value);
        }
    }

    static boolean isValid(String value) {
        return value != null && FORMAT.matcher(value).matches();
    }

    @Override
    public String toString() {
        return value;
    }
}
