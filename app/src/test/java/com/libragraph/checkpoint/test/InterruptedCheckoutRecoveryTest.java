package com.libragraph.checkpoint.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.checkpoint.core.checkpoint.WorkingFile;
import com.libragraph.checkpoint.core.concurrent.CancellationToken;
import com.libragraph.checkpoint.core.repository.BookIdentity;
import com.libragraph.checkpoint.core.repository.InterruptedCheckoutRecovery;
import com.libragraph.checkpoint.core.repository.Repository;
import com.libragraph.checkpoint.core.repository.RepositoryManager;
import com.libragraph.checkpoint.core.storage.DurableFiles;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class InterruptedCheckoutRecoveryTest {

    @Inject
    InterruptedCheckoutRecovery recovery;

    @Inject
    RepositoryManager repositoryManager;

    @Inject
    ObjectMapper objectMapper;

    Path workspace;

    @BeforeEach
    void setUp() throws IOException {
        workspace = Files.createTempDirectory("checkpoint-recovery");
    }

    @AfterEach
    void tearDown() throws IOException {
        DurableFiles.deleteRecursively(workspace);
    }

    @Test
    void halfFinishedSwapIsRolledBack() throws IOException {
        Repository repository = repositoryManager.openOrCreate(BookIdentity.ofTitle("Recovery Book"));
        repository.writeCheckpoint(List.of(new WorkingFile("a.txt", "x".getBytes(StandardCharsets.UTF_8))),
                null, null, CancellationToken.none());

        // State after "working -> backup" but before "staged -> working"
        Path working = workspace.resolve("book");
        Path staged = Files.createDirectories(workspace.resolve(".book.checkout.tmp-1"));
        Path backup = Files.createDirectories(workspace.resolve(".book.backup-1"));
        Files.writeString(staged.resolve("a.txt"), "x");
        Files.writeString(backup.resolve("a.txt"), "unsaved");
        Path journal = repository.directory().resolve("checkout.journal");
        Files.write(journal, objectMapper.writeValueAsBytes(Map.of(
                "checkpoint", 1,
                "working", working.toString(),
                "staged", staged.toString(),
                "backup", backup.toString())));

        assertThat(recovery.recover()).isEqualTo(1);

        assertThat(Files.readString(working.resolve("a.txt"))).isEqualTo("unsaved");
        assertThat(staged).doesNotExist();
        assertThat(backup).doesNotExist();
        assertThat(journal).doesNotExist();
    }

    @Test
    void nothingToRecover() {
        assertThat(recovery.recover()).isZero();
    }
}
