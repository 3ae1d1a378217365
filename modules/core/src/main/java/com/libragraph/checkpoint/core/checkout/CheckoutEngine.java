package com.libragraph.checkpoint.core.checkout;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.checkpoint.core.checkpoint.Checkpoint;
import com.libragraph.checkpoint.core.checkpoint.CheckpointId;
import com.libragraph.checkpoint.core.checkpoint.CheckpointLog;
import com.libragraph.checkpoint.core.checkpoint.FileEntry;
import com.libragraph.checkpoint.core.checkpoint.PublishHook;
import com.libragraph.checkpoint.core.checkpoint.WorkingTree;
import com.libragraph.checkpoint.core.concurrent.CancellationToken;
import com.libragraph.checkpoint.core.concurrent.OperationCancelledException;
import com.libragraph.checkpoint.core.concurrent.RepositoryLock;
import com.libragraph.checkpoint.core.storage.ContentStore;
import com.libragraph.checkpoint.core.storage.DurableFiles;
import com.libragraph.checkpoint.core.storage.StorageException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Replaces a working tree with the exact file set of a checkpoint.
 *
 * <p>All payloads are read and verified before anything is written. The new tree
 * is built in a sibling staging directory and swapped in with two renames. A
 * {@link CheckoutJournal} written before staging starts names both siblings; if
 * the second rename fails the first is undone. The working tree is therefore either the old one or the new one.
 */
public class CheckoutEngine {

    private static final Logger log = Logger.getLogger(CheckoutEngine.class);

    private final ContentStore store;
    private final CheckpointLog checkpointLog;
    private final RepositoryLock lock;
    private final Path journalFile;
    private final ObjectMapper mapper;
    private final PublishHook publishHook;

    public CheckoutEngine(ContentStore store, CheckpointLog checkpointLog, RepositoryLock lock,
                          Path journalFile, ObjectMapper mapper, PublishHook publishHook) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.checkpointLog = Objects.requireNonNull(checkpointLog, "checkpointLog cannot be null");
        this.lock = Objects.requireNonNull(lock, "lock cannot be null");
        this.journalFile = Objects.requireNonNull(journalFile, "journalFile cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.publishHook = Objects.requireNonNull(publishHook, "publishHook cannot be null");
    }

    /**
     * Checks out {@code id} over {@code tree}. Destructive for anything in the tree that
     * was never checkpointed; callers confirm with the user first.
     *
     * @throws com.libragraph.checkpoint.core.checkpoint.CheckpointNotFoundException if {@code id} does not exist
     * @throws com.libragraph.checkpoint.core.storage.ContentNotFoundException if a payload is missing
     * @throws com.libragraph.checkpoint.core.storage.IntegrityMismatchException if a payload is corrupt
     * @throws CheckoutFailedException on I/O failure while staging or swapping
     * @throws OperationCancelledException if cancelled while staging
     */
    public ReplacedFileList checkout(CheckpointId id, WorkingTree tree, CancellationToken cancellation) {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(tree, "tree cannot be null");
        Objects.requireNonNull(cancellation, "cancellation cannot be null");

        try (RepositoryLock.Handle ignored = lock.acquire()) {
            recoverInterrupted(id);

            Checkpoint checkpoint = checkpointLog.get(id);
            Map<String, byte[]> contents = resolve(checkpoint);

            Path working = tree.root();
            String name = working.getFileName().toString();
            Path staged = working.resolveSibling(DurableFiles.tempName(name + ".checkout"));
            Path backup = working.resolveSibling("." + name + ".backup-" + UUID.randomUUID());

            List<String> previous;
            try {
                previous = tree.paths();
            } catch (StorageException e) {
                throw new CheckoutFailedException(id, e);
            }

            // Journal first, so a crash while staging still leaves a record of the staged sibling
            CheckoutJournal journal = new CheckoutJournal(id.index(),
                    working.toString(), staged.toString(), backup.toString());
            try {
                journal.write(journalFile, mapper);
            } catch (IOException e) {
                throw new CheckoutFailedException(id, e);
            }
            stage(id, new WorkingTree(staged), contents, cancellation);
            swap(id, working, staged, backup);

            List<String> removed = new ArrayList<>();
            for (String path : previous) {
                if (!contents.containsKey(path)) {
                    removed.add(path);
                }
            }
            log.infof("Checked out checkpoint %s into %s: %d files restored, %d removed",
                    id, working, contents.size(), removed.size());
            return new ReplacedFileList(id, new ArrayList<>(contents.keySet()), removed);
        }
    }

    private void recoverInterrupted(CheckpointId id) {
        try {
            CheckoutJournal.recover(journalFile, mapper);
        } catch (IOException e) {
            throw new CheckoutFailedException(id, e);
        }
    }

    /**
     * Reads and verifies every payload up front, so a corrupt repository fails
     * before the working tree is touched.
     */
    private Map<String, byte[]> resolve(Checkpoint checkpoint) {
        Map<String, byte[]> contents = new LinkedHashMap<>();
        for (FileEntry entry : checkpoint.files().values()) {
            contents.put(entry.path(), store.get(entry.ref()));
        }
        return contents;
    }

    private void stage(CheckpointId id, WorkingTree staged, Map<String, byte[]> contents,
                       CancellationToken cancellation) {
        try {
            Files.createDirectories(staged.root());
            for (Map.Entry<String, byte[]> e : contents.entrySet()) {
                cancellation.throwIfCancelled("checkout");
                Path target = staged.resolve(e.getKey());
                Files.createDirectories(target.getParent());
                DurableFiles.writeNew(target, e.getValue());
            }
            cancellation.throwIfCancelled("checkout");
            publishHook.beforePublish(staged.root());
        } catch (OperationCancelledException e) {
            discard(staged.root());
            deleteJournal();
            throw e;
        } catch (IOException | RuntimeException e) {
            discard(staged.root());
            deleteJournal();
            throw new CheckoutFailedException(id, e);
        }
    }

    private void swap(CheckpointId id, Path working, Path staged, Path backup) {
        boolean hadWorking = Files.exists(working);
        try {
            if (hadWorking) {
                DurableFiles.moveAtomically(working, backup, false);
            }
            try {
                DurableFiles.moveAtomically(staged, working, false);
            } catch (IOException e) {
                if (hadWorking) {
                    DurableFiles.moveAtomically(backup, working, false);
                }
                throw e;
            }
            DurableFiles.syncDirectory(working.getParent());
        } catch (IOException e) {
            if (!hadWorking || Files.exists(working)) {
                discard(staged);
                deleteJournal();
            } else {
                log.errorf("Checkout %s left %s unrestored; the journal keeps the backup at %s",
                        id, working, backup);
            }
            throw new CheckoutFailedException(id, e);
        }

        // Committed. Leftovers here are cleaned up by journal recovery next time.
        try {
            DurableFiles.deleteRecursively(backup);
            Files.deleteIfExists(journalFile);
        } catch (IOException e) {
            log.warnf("Checkout %s committed but cleanup failed, will retry on recovery: %s",
                    id, e.getMessage());
        }
    }

    private void discard(Path dir) {
        try {
            DurableFiles.deleteRecursively(dir);
        } catch (IOException e) {
            log.warnf("Could not remove checkout staging %s: %s", dir, e.getMessage());
        }
    }

    private void deleteJournal() {
        try {
            Files.deleteIfExists(journalFile);
        } catch (IOException e) {
            log.warnf("Could not remove checkout journal %s: %s", journalFile, e.getMessage());
        }
    }
}
