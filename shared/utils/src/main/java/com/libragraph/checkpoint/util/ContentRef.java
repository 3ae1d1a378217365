package com.libragraph.checkpoint.util;

import java.util.Objects;

/**
 * Content-addressable reference to a stored payload.
 *
 * Contains exactly the information needed to locate and verify a payload
 * with zero probing: hash and size. Empty payloads are legal (size 0).
 *
 * <p>String format: {@code {hash}-{size}}.
 */
public record ContentRef(ContentHash hash, long size) {

    public ContentRef {
        Objects.requireNonNull(hash, "hash cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0, got: " + size);
        }
    }

    /**
     * Computes the reference for a payload.
     */
    public static ContentRef of(byte[] data) {
        return new ContentRef(ContentHash.of(data), data.length);
    }

    /**
     * Parses a storage key back into a ContentRef.
     *
     * @param key format: {@code {hex32}-{size}}
     * @throws IllegalArgumentException if the format is invalid
     */
    public static ContentRef parse(String key) {
        Objects.requireNonNull(key, "key cannot be null");

        int dashIndex = key.indexOf('-');
        if (dashIndex < 0) {
            throw new IllegalArgumentException("Invalid ContentRef key (no '-' separator): " + key);
        }

        ContentHash hash = ContentHash.fromHex(key.substring(0, dashIndex));

        long size;
        try {
            size = Long.parseLong(key.substring(dashIndex + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid ContentRef key (bad size): " + key, e);
        }

        if (size < 0) {
            throw new IllegalArgumentException("Invalid ContentRef key (size must be >= 0): " + key);
        }

        return new ContentRef(hash, size);
    }

    /**
     * Returns true if {@code data} has this reference's size and hash.
     * The size check runs first and skips hashing on mismatch.
     */
    public boolean matches(byte[] data) {
        return data.length == size && ContentHash.of(data).equals(hash);
    }

    /**
     * Returns the storage key representation {@code {hash}-{size}}.
     */
    @Override
    public String toString() {
        return hash.toHex() + "-" + size;
    }
}
