package com.libragraph.checkpoint.core.checkpoint;

import com.libragraph.checkpoint.core.concurrent.CancellationToken;
import com.libragraph.checkpoint.core.concurrent.OperationCancelledException;
import com.libragraph.checkpoint.core.concurrent.RepositoryLock;
import com.libragraph.checkpoint.core.storage.ContentStore;
import com.libragraph.checkpoint.util.ContentRef;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Turns a working-tree snapshot into a new, published checkpoint.
 *
 * <p>Sequence, all under the repository lock:
 * <ol>
 *   <li>store every payload (deduplicated) and sniff its kind</li>
 *   <li>assign index = latest + 1, stage the record</li>
 *   <li>rename the record into the log (commit point)</li>
 * </ol>
 * Any failure before step 3 removes the staged record and the payloads this call
 * added, leaving the repository exactly as it was.
 */
public class CheckpointWriter {

    private static final Logger log = Logger.getLogger(CheckpointWriter.class);

    private final ContentStore store;
    private final CheckpointLog checkpointLog;
    private final RepositoryLock lock;
    private final PublishHook publishHook;
    private final Consumer<Checkpoint> onPublished;
    private final Clock clock;

    public CheckpointWriter(ContentStore store, CheckpointLog checkpointLog, RepositoryLock lock) {
        this(store, checkpointLog, lock, PublishHook.NONE, cp -> { }, Clock.systemUTC());
    }

    public CheckpointWriter(ContentStore store, CheckpointLog checkpointLog, RepositoryLock lock,
                            PublishHook publishHook, Consumer<Checkpoint> onPublished, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.checkpointLog = Objects.requireNonNull(checkpointLog, "checkpointLog cannot be null");
        this.lock = Objects.requireNonNull(lock, "lock cannot be null");
        this.publishHook = Objects.requireNonNull(publishHook, "publishHook cannot be null");
        this.onPublished = Objects.requireNonNull(onPublished, "onPublished cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Writes a checkpoint of {@code files}.
     *
     * @param description free text, may be null
     * @param metadata    display metadata, may be null
     * @throws IllegalArgumentException    if two files share a path
     * @throws CheckpointFailedException   on I/O failure (nothing published)
     * @throws OperationCancelledException if cancelled before publishing (nothing published)
     * @throws com.libragraph.checkpoint.core.concurrent.LockContentionException if the lock stays busy
     */
    public CheckpointId write(List<WorkingFile> files, String description, BookMetadata metadata,
                              CancellationToken cancellation) {
        Objects.requireNonNull(files, "files cannot be null");
        Objects.requireNonNull(cancellation, "cancellation cannot be null");
        rejectDuplicatePaths(files);

        try (RepositoryLock.Handle ignored = lock.acquire()) {
            List<ContentRef> added = new ArrayList<>();
            Path staged = null;
            try {
                checkpointLog.clearStaging();

                SortedMap<String, FileEntry> entries = new TreeMap<>();
                for (WorkingFile file : files) {
                    cancellation.throwIfCancelled("checkpoint");
                    ContentRef expected = ContentRef.of(file.content());
                    boolean present = store.contains(expected);
                    ContentRef ref = store.put(file.content());
                    if (!present) {
                        added.add(ref);
                    }
                    entries.put(file.path(),
                            new FileEntry(file.path(), ref, FileKindSniffer.sniff(file.content())));
                }
                cancellation.throwIfCancelled("checkpoint");

                long index = checkpointLog.latestIndex() + 1;
                Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
                Checkpoint checkpoint = new Checkpoint(index, now, description, metadata, entries);

                staged = checkpointLog.stage(checkpoint);
                publishHook.beforePublish(staged);
                checkpointLog.publish(staged, checkpoint.id());
                staged = null;

                log.infof("Checkpoint %s written: %d files (%d new payloads)",
                        checkpoint.id(), entries.size(), added.size());
                notifyPublished(checkpoint);
                return checkpoint.id();
            } catch (OperationCancelledException e) {
                rollback(staged, added);
                log.infof("Checkpoint cancelled, rolled back %d payloads", added.size());
                throw e;
            } catch (IOException | RuntimeException e) {
                rollback(staged, added);
                log.warnf("Checkpoint failed, rolled back %d payloads: %s", added.size(), e.getMessage());
                throw new CheckpointFailedException("Failed to write checkpoint: " + e.getMessage(), e);
            }
        }
    }

    private void notifyPublished(Checkpoint checkpoint) {
        try {
            onPublished.accept(checkpoint);
        } catch (RuntimeException e) {
            // The checkpoint is already committed; listeners cannot undo it
            log.warnf(e, "Post-publish update failed for checkpoint %s", checkpoint.id());
        }
    }

    private void rollback(Path staged, List<ContentRef> added) {
        if (staged != null) {
            checkpointLog.discard(staged);
        }
        for (ContentRef ref : added) {
            try {
                store.delete(ref);
            } catch (RuntimeException e) {
                log.warnf("Could not roll back payload %s: %s", ref, e.getMessage());
            }
        }
    }

    private static void rejectDuplicatePaths(List<WorkingFile> files) {
        Set<String> seen = new HashSet<>();
        for (WorkingFile file : files) {
            if (!seen.add(file.path())) {
                throw new IllegalArgumentException("Duplicate path in working tree snapshot: " + file.path());
            }
        }
    }
}
