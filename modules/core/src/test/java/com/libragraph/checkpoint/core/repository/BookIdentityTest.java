package com.libragraph.checkpoint.core.repository;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BookIdentityTest {

    @Test
    void identifierWinsOverTitle() {
        BookIdentity a = BookIdentity.of("urn:uuid:42", "Draft title");
        BookIdentity b = BookIdentity.of("urn:uuid:42", "Final title");

        assertThat(a.key()).isEqualTo("id:urn:uuid:42");
        assertThat(a.repositoryId()).isEqualTo(b.repositoryId());
    }

    @Test
    void titleIsKeyWithoutIdentifier() {
        BookIdentity book = BookIdentity.of("  ", "Moby Dick");

        assertThat(book.identifier()).isNull();
        assertThat(book.key()).isEqualTo("title:Moby Dick");
        assertThat(book.displayTitle()).isEqualTo("Moby Dick");
    }

    @Test
    void differentBooksGetDifferentRepositories() {
        assertThat(BookIdentity.ofTitle("One").repositoryId())
                .isNotEqualTo(BookIdentity.ofTitle("Two").repositoryId());
    }

    @Test
    void identifierAndTitleNamespacesDoNotCollide() {
        assertThat(BookIdentity.of("Same", null).repositoryId())
                .isNotEqualTo(BookIdentity.ofTitle("Same").repositoryId());
    }

    @Test
    void repositoryIdIsStable() {
        RepositoryId id = BookIdentity.ofTitle("Stable").repositoryId();

        assertThat(id.value()).matches("[0-9a-f]{32}");
        assertThat(BookIdentity.ofTitle("Stable").repositoryId()).isEqualTo(id);
    }

    @Test
    void needsIdentifierOrTitle() {
        assertThatThrownBy(() -> BookIdentity.of(null, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void repositoryIdValidatesFormat() {
        assertThatThrownBy(() -> new RepositoryId("../etc"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RepositoryId("ABCDEF0123456789ABCDEF0123456789"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
