package com.libragraph.checkpoint.core.checkpoint;

import com.libragraph.checkpoint.core.concurrent.CancellationToken;
import com.libragraph.checkpoint.core.concurrent.LockPolicy;
import com.libragraph.checkpoint.core.concurrent.OperationCancelledException;
import com.libragraph.checkpoint.core.concurrent.RepositoryLock;
import com.libragraph.checkpoint.core.storage.FilesystemContentStore;
import com.libragraph.checkpoint.core.storage.JsonMappers;
import com.libragraph.checkpoint.types.FileKind;
import com.libragraph.checkpoint.util.ContentRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class CheckpointWriterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30.123Z");

    @TempDir
    Path repoDir;

    FilesystemContentStore store;
    CheckpointLog checkpointLog;
    RepositoryLock lock;
    List<Checkpoint> published;

    @BeforeEach
    void setUp() {
        store = new FilesystemContentStore(repoDir.resolve("objects"));
        checkpointLog = new CheckpointLog(repoDir.resolve("log"), repoDir.resolve("staging"),
                new CheckpointCodec(JsonMappers.create()));
        lock = new RepositoryLock(repoDir.resolve("repo.lock"), new LockPolicy(3, Duration.ofMillis(10)));
        published = new ArrayList<>();
    }

    private CheckpointWriter writer(PublishHook hook) {
        return new CheckpointWriter(store, checkpointLog, lock, hook, published::add,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static WorkingFile file(String path, String content) {
        return new WorkingFile(path, content.getBytes(StandardCharsets.UTF_8));
    }

    private Map<String, byte[]> repositoryFiles() throws IOException {
        Map<String, byte[]> files = new TreeMap<>();
        try (Stream<Path> walk = Files.walk(repoDir)) {
            for (Path p : walk.filter(Files::isRegularFile).toList()) {
                files.put(repoDir.relativize(p).toString(), Files.readAllBytes(p));
            }
        }
        return files;
    }

    @Test
    void firstCheckpointGetsIndexOne() {
        CheckpointId id = writer(PublishHook.NONE).write(
                List.of(file("chapter1.xhtml", "<p>One</p>"), file("styles/book.css", "p {}")),
                "first draft", new BookMetadata("My Book", "/books/my.epub", "3.0", "urn:uuid:1"),
                CancellationToken.none());

        assertThat(id).isEqualTo(CheckpointId.of(1));
        Checkpoint checkpoint = checkpointLog.get(id);
        assertThat(checkpoint.timestamp()).isEqualTo(NOW);
        assertThat(checkpoint.description()).isEqualTo("first draft");
        assertThat(checkpoint.metadata().title()).isEqualTo("My Book");
        assertThat(checkpoint.files()).containsOnlyKeys("chapter1.xhtml", "styles/book.css");
        assertThat(published).extracting(Checkpoint::index).containsExactly(1L);
    }

    @Test
    void indicesAreContiguous() {
        CheckpointWriter writer = writer(PublishHook.NONE);
        for (int i = 1; i <= 4; i++) {
            writer.write(List.of(file("a.txt", "v" + i)), null, null, CancellationToken.none());
        }

        assertThat(checkpointLog.indices()).containsExactly(1L, 2L, 3L, 4L);
        assertThat(checkpointLog.latestIndex()).isEqualTo(4);
    }

    @Test
    void payloadsAreStoredAndKindsSniffed() {
        byte[] image = {(byte) 0x89, 'P', 'N', 'G', 0, 0, 0, 13};
        CheckpointId id = writer(PublishHook.NONE).write(
                List.of(file("text.xhtml", "<p>café</p>"), new WorkingFile("images/cover.png", image)),
                null, null, CancellationToken.none());

        Checkpoint checkpoint = checkpointLog.get(id);
        FileEntry text = checkpoint.file("text.xhtml");
        FileEntry png = checkpoint.file("images/cover.png");
        assertThat(text.kind()).isEqualTo(FileKind.TEXT);
        assertThat(png.kind()).isEqualTo(FileKind.BINARY);
        assertThat(store.get(png.ref())).isEqualTo(image);
        assertThat(png.ref()).isEqualTo(ContentRef.of(image));
    }

    @Test
    void unchangedFilesShareStoredPayloads() throws IOException {
        CheckpointWriter writer = writer(PublishHook.NONE);
        writer.write(List.of(file("a.txt", "same")), null, null, CancellationToken.none());
        writer.write(List.of(file("a.txt", "same"), file("b.txt", "same")), null, null,
                CancellationToken.none());

        long payloads;
        try (Stream<Path> walk = Files.walk(store.root())) {
            payloads = walk.filter(Files::isRegularFile).count();
        }
        assertThat(payloads).isEqualTo(1);
    }

    @Test
    void emptyFileSetIsAValidCheckpoint() {
        CheckpointId id = writer(PublishHook.NONE).write(List.of(), "empty", null, CancellationToken.none());

        assertThat(checkpointLog.get(id).files()).isEmpty();
    }

    @Test
    void duplicatePathsAreRejected() {
        List<WorkingFile> files = List.of(file("a.txt", "one"), file("a.txt", "two"));

        assertThatThrownBy(() -> writer(PublishHook.NONE).write(files, null, null, CancellationToken.none()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("a.txt");
        assertThat(checkpointLog.isEmpty()).isTrue();
    }

    @Test
    void failureBeforePublishLeavesRepositoryUnchanged() throws IOException {
        writer(PublishHook.NONE).write(List.of(file("a.txt", "kept")), "base", null, CancellationToken.none());
        Map<String, byte[]> before = repositoryFiles();

        PublishHook failing = staged -> {
            assertThat(staged).isRegularFile();
            throw new IOException("disk full");
        };
        assertThatThrownBy(() -> writer(failing).write(
                List.of(file("a.txt", "kept"), file("b.txt", "new payload")), "doomed", null,
                CancellationToken.none()))
                .isInstanceOf(CheckpointFailedException.class)
                .hasRootCauseMessage("disk full");

        Map<String, byte[]> after = repositoryFiles();
        assertThat(after).containsOnlyKeys(before.keySet().toArray(String[]::new));
        before.forEach((path, bytes) -> assertThat(after.get(path)).as(path).isEqualTo(bytes));
        assertThat(checkpointLog.indices()).containsExactly(1L);
        assertThat(published).hasSize(1);
    }

    @Test
    void cancellationRollsBack() throws IOException {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThatThrownBy(() -> writer(PublishHook.NONE).write(
                List.of(file("a.txt", "never")), null, null, token))
                .isInstanceOf(OperationCancelledException.class);

        assertThat(checkpointLog.isEmpty()).isTrue();
        assertThat(repositoryFiles().keySet()).allMatch(p -> p.equals("repo.lock"));
    }

    @Test
    void cancellationAfterFirstFileRemovesItsPayload() {
        CancellationToken token = CancellationToken.create();
        List<WorkingFile> files = List.of(file("a.txt", "first"), file("b.txt", "second"));
        // Cancel right after the first payload is stored
        FilesystemContentStore cancellingStore = new FilesystemContentStore(repoDir.resolve("objects")) {
            @Override
            public ContentRef put(byte[] data) {
                ContentRef ref = super.put(data);
                token.cancel();
                return ref;
            }
        };
        CheckpointWriter writer = new CheckpointWriter(cancellingStore, checkpointLog, lock);

        assertThatThrownBy(() -> writer.write(files, null, null, token))
                .isInstanceOf(OperationCancelledException.class);

        assertThat(store.contains(ContentRef.of("first".getBytes(StandardCharsets.UTF_8)))).isFalse();
        assertThat(store.contains(ContentRef.of("second".getBytes(StandardCharsets.UTF_8)))).isFalse();
        assertThat(checkpointLog.isEmpty()).isTrue();
    }

    @Test
    void rollbackKeepsPayloadsOwnedByEarlierCheckpoints() {
        writer(PublishHook.NONE).write(List.of(file("a.txt", "shared")), null, null, CancellationToken.none());

        assertThatThrownBy(() -> writer(staged -> {
            throw new IOException("boom");
        }).write(List.of(file("a.txt", "shared")), null, null, CancellationToken.none()))
                .isInstanceOf(CheckpointFailedException.class);

        assertThat(store.contains(ContentRef.of("shared".getBytes(StandardCharsets.UTF_8)))).isTrue();
    }

    @Test
    void leftoverStagedRecordsAreCleared() throws IOException {
        Path staging = Files.createDirectories(repoDir.resolve("staging"));
        Files.writeString(staging.resolve(".00000001.json.tmp-crashed"), "{");

        writer(PublishHook.NONE).write(List.of(file("a.txt", "x")), null, null, CancellationToken.none());

        try (Stream<Path> entries = Files.list(staging)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void concurrentWritersGetContiguousUniqueIndices() throws Exception {
        RepositoryLock patientLock = new RepositoryLock(repoDir.resolve("repo.lock"),
                new LockPolicy(2000, Duration.ofMillis(5)));
        int writes = 40;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<CheckpointId>> futures = new ArrayList<>();
            for (int i = 0; i < writes; i++) {
                String content = "revision " + i;
                // Each task gets its own writer, like separate editor windows on one book
                futures.add(pool.submit(() -> new CheckpointWriter(store, checkpointLog, patientLock)
                        .write(List.of(file("a.txt", content)), content, null, CancellationToken.none())));
            }
            Set<Long> assigned = new HashSet<>();
            for (Future<CheckpointId> future : futures) {
                assigned.add(future.get(60, TimeUnit.SECONDS).index());
            }

            assertThat(assigned).hasSize(writes);
        } finally {
            pool.shutdownNow();
        }

        List<Long> expected = LongStream.rangeClosed(1, writes).boxed().toList();
        assertThat(checkpointLog.indices()).isEqualTo(expected);
        assertThat(checkpointLog.list().collect().asList().await().indefinitely())
                .extracting(CheckpointSummary::description)
                .doesNotHaveDuplicates()
                .hasSize(writes);
    }

    @Test
    void failingListenerDoesNotUndoPublishedCheckpoint() {
        CheckpointWriter writer = new CheckpointWriter(store, checkpointLog, lock, PublishHook.NONE,
                cp -> {
                    throw new IllegalStateException("listener broke");
                }, Clock.systemUTC());

        CheckpointId id = writer.write(List.of(file("a.txt", "x")), null, null, CancellationToken.none());

        assertThat(checkpointLog.get(id)).isNotNull();
    }
}
