package com.libragraph.checkpoint.core.repository;

import com.libragraph.checkpoint.util.ContentHash;

/**
 * Identifies a book across editor sessions: its persistent unique identifier
 * (e.g. a UUID from the package metadata) and its display title.
 *
 * <p>The identifier wins when present. The title is only the key for books that
 * have no identifier, so renaming such a book starts a new repository.
 */
public record BookIdentity(String identifier, String title) {

    public BookIdentity {
        identifier = blankToNull(identifier);
        title = blankToNull(title);
        if (identifier == null && title == null) {
            throw new IllegalArgumentException("A book needs an identifier or a title");
        }
    }

    public static BookIdentity of(String identifier, String title) {
        return new BookIdentity(identifier, title);
    }

    public static BookIdentity ofTitle(String title) {
        return new BookIdentity(null, title);
    }

    /**
     * The qualified key this identity is stored under. Identifier keys and title
     * keys live in separate namespaces, so a title can never shadow an identifier.
     */
    public String key() {
        return identifier != null ? "id:" + identifier : "title:" + title;
    }

    /**
     * Deterministic repository id: BLAKE3-128 of {@link #key()}.
     */
    public RepositoryId repositoryId() {
        return new RepositoryId(ContentHash.ofUtf8(key()).toHex());
    }

    public String displayTitle() {
        return title != null ? title : identifier;
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String trimmed = s.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
