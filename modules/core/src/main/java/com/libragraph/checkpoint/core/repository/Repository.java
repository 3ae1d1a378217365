package com.libragraph.checkpoint.core.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.checkpoint.core.checkout.CheckoutEngine;
import com.libragraph.checkpoint.core.checkout.ReplacedFileList;
import com.libragraph.checkpoint.core.checkpoint.BookMetadata;
import com.libragraph.checkpoint.core.checkpoint.Checkpoint;
import com.libragraph.checkpoint.core.checkpoint.CheckpointCodec;
import com.libragraph.checkpoint.core.checkpoint.CheckpointFailedException;
import com.libragraph.checkpoint.core.checkpoint.CheckpointId;
import com.libragraph.checkpoint.core.checkpoint.CheckpointLog;
import com.libragraph.checkpoint.core.checkpoint.CheckpointNotFoundException;
import com.libragraph.checkpoint.core.checkpoint.CheckpointWriter;
import com.libragraph.checkpoint.core.checkpoint.PublishHook;
import com.libragraph.checkpoint.core.checkpoint.WorkingFile;
import com.libragraph.checkpoint.core.checkpoint.WorkingTree;
import com.libragraph.checkpoint.core.compare.CheckpointComparator;
import com.libragraph.checkpoint.core.compare.DiffResult;
import com.libragraph.checkpoint.core.concurrent.CancellationToken;
import com.libragraph.checkpoint.core.concurrent.LockPolicy;
import com.libragraph.checkpoint.core.concurrent.RepositoryLock;
import com.libragraph.checkpoint.core.storage.ContentStore;
import com.libragraph.checkpoint.core.storage.DurableFiles;
import com.libragraph.checkpoint.core.storage.FilesystemContentStore;
import com.libragraph.checkpoint.core.storage.StorageException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * All checkpoints of one book.
 *
 * <p>Layout: {@code {dir}/repository.json}, {@code repo.lock}, {@code objects/},
 * {@code log/}, {@code staging/} and, only while a checkout swap is in flight,
 * {@code checkout.journal}. Nothing is written until the first checkpoint.
 */
public class Repository {

    private static final Logger log = Logger.getLogger(Repository.class);

    static final String INFO_FILE = "repository.json";
    static final String LOCK_FILE = "repo.lock";
    static final String OBJECTS_DIR = "objects";
    static final String LOG_DIR = "log";
    static final String STAGING_DIR = "staging";
    static final String JOURNAL_FILE = "checkout.journal";

    private final RepositoryId id;
    private final BookIdentity identity;
    private final Path dir;
    private final ObjectMapper mapper;
    private final Clock clock;

    private final FilesystemContentStore store;
    private final CheckpointLog checkpointLog;
    private final RepositoryLock lock;
    private final CheckpointWriter writer;
    private final CheckoutEngine checkoutEngine;
    private final CheckpointComparator comparator = new CheckpointComparator();

    public Repository(RepositoryId id, BookIdentity identity, Path dir, ObjectMapper mapper,
                      LockPolicy lockPolicy) {
        this(id, identity, dir, mapper, lockPolicy, PublishHook.NONE, Clock.systemUTC());
    }

    /**
     * @param identity may be null when opening by id; it is then read from {@code repository.json}
     */
    public Repository(RepositoryId id, BookIdentity identity, Path dir, ObjectMapper mapper,
                      LockPolicy lockPolicy, PublishHook publishHook, Clock clock) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.dir = Objects.requireNonNull(dir, "dir cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.store = new FilesystemContentStore(dir.resolve(OBJECTS_DIR));
        this.checkpointLog = new CheckpointLog(dir.resolve(LOG_DIR), dir.resolve(STAGING_DIR),
                new CheckpointCodec(mapper));
        this.lock = new RepositoryLock(dir.resolve(LOCK_FILE), lockPolicy);
        this.writer = new CheckpointWriter(store, checkpointLog, lock, publishHook,
                this::recordPublished, clock);
        this.checkoutEngine = new CheckoutEngine(store, checkpointLog, lock,
                dir.resolve(JOURNAL_FILE), mapper, publishHook);
        this.identity = identity != null ? identity : info().map(RepositoryInfo::identity).orElse(null);
    }

    public RepositoryId id() {
        return id;
    }

    /** The owning book, or null for a directory whose info file is gone. */
    public BookIdentity identity() {
        return identity;
    }

    public Path directory() {
        return dir;
    }

    public ContentStore store() {
        return store;
    }

    public CheckpointLog log() {
        return checkpointLog;
    }

    /**
     * True once the first checkpoint has been written.
     */
    public boolean exists() {
        return Files.isRegularFile(dir.resolve(INFO_FILE)) || !checkpointLog.isEmpty();
    }

    public Optional<RepositoryInfo> info() {
        Path file = dir.resolve(INFO_FILE);
        try {
            return Optional.of(mapper.readValue(Files.readAllBytes(file), RepositoryInfo.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read " + file, e);
        }
    }

    /**
     * Builds the management-list row. Falls back to the latest checkpoint when
     * {@code repository.json} is missing.
     */
    public RepositorySummary summary() {
        Optional<RepositoryInfo> info = info();
        Optional<Checkpoint> latest = checkpointLog.latest();
        BookMetadata metadata = info.map(RepositoryInfo::metadata)
                .or(() -> latest.map(Checkpoint::metadata))
                .orElse(BookMetadata.EMPTY);
        Instant lastModified = info.map(RepositoryInfo::updatedAt)
                .or(() -> latest.map(Checkpoint::timestamp))
                .orElse(null);
        String title = metadata.title() != null ? metadata.title()
                : identity != null ? identity.displayTitle() : null;
        return new RepositorySummary(id, identity, title, metadata.sourcePath(), lastModified,
                metadata.formatVersion(), metadata.identifier(), checkpointLog.size());
    }

    // -- operations --

    public CheckpointId writeCheckpoint(List<WorkingFile> files, String description,
                                        BookMetadata metadata, CancellationToken cancellation) {
        try {
            return writer.write(files, description, metadata, cancellation);
        } catch (RuntimeException e) {
            discardIfNeverPublished();
            throw e;
        }
    }

    /**
     * @throws CheckpointFailedException if the working tree cannot be read
     */
    public CheckpointId writeCheckpoint(WorkingTree tree, String description,
                                        BookMetadata metadata, CancellationToken cancellation) {
        List<WorkingFile> files;
        try {
            files = tree.snapshot();
        } catch (StorageException e) {
            throw new CheckpointFailedException("Failed to read working tree " + tree + ": " + e.getMessage(), e);
        }
        return writeCheckpoint(files, description, metadata, cancellation);
    }

    /**
     * @throws CheckpointNotFoundException if the repository has no checkpoints or lacks {@code id}
     */
    public DiffResult compare(List<WorkingFile> working, CheckpointId id) {
        requireCheckpoints();
        return comparator.compare(working, checkpointLog.get(id));
    }

    /**
     * Compares against the most recent checkpoint.
     *
     * @throws CheckpointNotFoundException if the repository has no checkpoints
     */
    public DiffResult compareLatest(List<WorkingFile> working) {
        Checkpoint latest = checkpointLog.latest().orElseThrow(CheckpointNotFoundException::noCheckpoints);
        return comparator.compare(working, latest);
    }

    /**
     * Compares two checkpoints of this repository; {@code older} is the baseline.
     */
    public DiffResult compare(CheckpointId older, CheckpointId newer) {
        requireCheckpoints();
        return comparator.compare(checkpointLog.get(older), checkpointLog.get(newer));
    }

    public ReplacedFileList checkout(CheckpointId id, WorkingTree tree, CancellationToken cancellation) {
        requireCheckpoints();
        return checkoutEngine.checkout(id, tree, cancellation);
    }

    // A failed first write must not leave a repository behind
    private void discardIfNeverPublished() {
        if (!Files.isDirectory(dir) || exists()) {
            return;
        }
        Path trash = dir.resolveSibling(RepositoryManager.TRASH_PREFIX + id.value() + "-" + UUID.randomUUID());
        try (RepositoryLock.Handle handle = lock.tryAcquire()) {
            if (handle == null || exists()) {
                return;
            }
            DurableFiles.moveAtomically(dir, trash, false);
        } catch (IOException | RuntimeException e) {
            log.warnf("Could not discard unpublished repository %s: %s", id, e.getMessage());
            return;
        }
        try {
            DurableFiles.deleteRecursively(trash);
            log.debugf("Discarded directories of unpublished repository %s", id);
        } catch (IOException e) {
            log.warnf("Could not delete %s yet, it is swept on next startup: %s", trash, e.getMessage());
        }
    }

    private void requireCheckpoints() {
        if (checkpointLog.isEmpty()) {
            throw CheckpointNotFoundException.noCheckpoints();
        }
    }

    // Runs under the writer's lock right after a checkpoint is committed
    private void recordPublished(Checkpoint checkpoint) {
        RepositoryInfo current = info().orElseGet(() ->
                new RepositoryInfo(identity, checkpoint.metadata(), checkpoint.timestamp(), null));
        RepositoryInfo updated = current.touched(checkpoint.metadata(), clock.instant());
        try {
            DurableFiles.replace(dir.resolve(INFO_FILE), mapper.writeValueAsBytes(updated));
        } catch (IOException e) {
            throw new StorageException("Failed to update " + INFO_FILE, e);
        }
    }

    @Override
    public String toString() {
        return "Repository[" + id + (identity != null ? ", " + identity.key() : "") + "]";
    }
}
