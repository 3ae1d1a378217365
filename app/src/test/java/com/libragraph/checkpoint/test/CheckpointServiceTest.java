package com.libragraph.checkpoint.test;

import com.libragraph.checkpoint.core.checkout.ReplacedFileList;
import com.libragraph.checkpoint.core.checkpoint.BookMetadata;
import com.libragraph.checkpoint.core.checkpoint.CheckpointId;
import com.libragraph.checkpoint.core.checkpoint.CheckpointNotFoundException;
import com.libragraph.checkpoint.core.checkpoint.CheckpointSummary;
import com.libragraph.checkpoint.core.checkpoint.WorkingTree;
import com.libragraph.checkpoint.core.compare.DiffResult;
import com.libragraph.checkpoint.core.concurrent.CancellationToken;
import com.libragraph.checkpoint.core.repository.BookIdentity;
import com.libragraph.checkpoint.core.repository.NothingSelectedException;
import com.libragraph.checkpoint.core.repository.RepositoryManager;
import com.libragraph.checkpoint.core.repository.RepositorySummary;
import com.libragraph.checkpoint.core.service.CheckpointService;
import com.libragraph.checkpoint.core.storage.DurableFiles;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class CheckpointServiceTest {

    @Inject
    CheckpointService checkpointService;

    @Inject
    RepositoryManager repositoryManager;

    Path workspace;

    WorkingTree tree;
    BookIdentity book;

    @BeforeEach
    void setUp() throws IOException {
        workspace = Files.createTempDirectory("checkpoint-service");
        if (!repositoryManager.repositoryIds().isEmpty()) {
            repositoryManager.removeAll();
        }
        Path bookDir = Files.createDirectories(workspace.resolve("book"));
        tree = new WorkingTree(bookDir);
        book = BookIdentity.of("urn:uuid:" + UUID.randomUUID(), "Service Test Book");
    }

    @AfterEach
    void tearDown() throws IOException {
        DurableFiles.deleteRecursively(workspace);
    }

    private BookMetadata metadata() {
        return new BookMetadata("Service Test Book", workspace.resolve("book.epub").toString(), "3.0",
                book.identifier());
    }

    @Test
    void saveCompareRestoreFlow() throws IOException {
        Files.writeString(tree.resolve("a"), "x");
        Files.writeString(tree.resolve("b"), "y");
        CheckpointId c1 = checkpointService.save(book, tree, "C1", metadata(), CancellationToken.none())
                .await().indefinitely();

        Files.writeString(tree.resolve("a"), "x2");
        Files.delete(tree.resolve("b"));
        Files.writeString(tree.resolve("c"), "z");

        DiffResult diff = checkpointService.compare(book, tree, c1).await().indefinitely();
        assertThat(diff.onlyInCheckpoint()).containsExactly("b");
        assertThat(diff.onlyInWorking()).containsExactly("c");
        assertThat(diff.modified()).containsExactly("a");

        CheckpointId c2 = checkpointService.save(book, tree, "C2", metadata(), CancellationToken.none())
                .await().indefinitely();
        assertThat(checkpointService.compareLatest(book, tree).await().indefinitely().hasDifferences())
                .isFalse();

        ReplacedFileList replaced = checkpointService.restore(book, c1, tree, CancellationToken.none())
                .await().indefinitely();
        assertThat(replaced.removed()).containsExactly("c");
        assertThat(Files.readString(tree.resolve("a"))).isEqualTo("x");
        assertThat(Files.readString(tree.resolve("b"))).isEqualTo("y");

        List<CheckpointSummary> history = checkpointService.checkpoints(book)
                .collect().asList().await().indefinitely();
        assertThat(history).extracting(CheckpointSummary::id).containsExactly(c1, c2);
        assertThat(checkpointService.checkpoint(book, c2).await().indefinitely().description())
                .isEqualTo("C2");
    }

    @Test
    void compareWithoutCheckpointsFails() {
        assertThatThrownBy(() -> checkpointService.compareLatest(book, tree).await().indefinitely())
                .isInstanceOf(CheckpointNotFoundException.class);
    }

    @Test
    void repositoriesListingAndRemoval() throws IOException {
        Files.writeString(tree.resolve("a"), "x");
        checkpointService.save(book, tree, null, metadata(), CancellationToken.none()).await().indefinitely();

        List<RepositorySummary> repositories = checkpointService.repositories()
                .collect().asList().await().indefinitely();
        assertThat(repositories).singleElement()
                .satisfies(r -> {
                    assertThat(r.title()).isEqualTo("Service Test Book");
                    assertThat(r.bookIdentifier()).isEqualTo(book.identifier());
                    assertThat(r.checkpointCount()).isEqualTo(1);
                });

        assertThat(checkpointService.remove(book.repositoryId()).await().indefinitely()).isTrue();
        assertThat(checkpointService.checkpoints(book).collect().asList().await().indefinitely()).isEmpty();
        assertThatThrownBy(() -> checkpointService.removeAll().await().indefinitely())
                .isInstanceOf(NothingSelectedException.class);
    }
}
