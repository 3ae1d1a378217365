package com.libragraph.checkpoint.core.concurrent;

import com.libragraph.checkpoint.core.storage.StorageException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive, repository-scoped lock backed by an OS file lock on {@code repo.lock}.
 *
 * <p>The OS lock excludes other processes. Threads of one JVM are excluded by a
 * per-path claim taken before the lock file is even opened: POSIX drops every
 * lock a process holds on a file when any descriptor to it is closed, so a
 * losing thread must never open and close the file while a sibling holds it.
 * Either way two threads of one editor serialize exactly like two editor instances.
 *
 * <p>Usage:
 * <pre>
 *   try (RepositoryLock.Handle ignored = lock.acquire()) {
 *       // mutate the repository
 *   }
 * </pre>
 */
public class RepositoryLock {

    private static final Logger log = Logger.getLogger(RepositoryLock.class);

    // Paths currently locked by this JVM; an entry lives exactly as long as its Handle
    private static final Set<Path> HELD_IN_PROCESS = ConcurrentHashMap.newKeySet();

    private final Path lockFile;
    private final LockPolicy policy;

    public RepositoryLock(Path lockFile, LockPolicy policy) {
        this.lockFile = Objects.requireNonNull(lockFile, "lockFile cannot be null")
                .toAbsolutePath().normalize();
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    }

    public Path lockFile() {
        return lockFile;
    }

    /**
     * Acquires the lock, retrying up to {@link LockPolicy#maxAttempts()} times.
     *
     * @throws LockContentionException if the lock is still held after the last attempt
     * @throws StorageException if the lock file cannot be opened
     */
    public Handle acquire() {
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            Handle handle = tryAcquire();
            if (handle != null) {
                if (attempt > 1) {
                    log.debugf("Acquired %s after %d attempts", lockFile, attempt);
                }
                return handle;
            }
            if (attempt < policy.maxAttempts()) {
                sleep();
            }
        }
        log.warnf("Lock contention on %s after %d attempts", lockFile, policy.maxAttempts());
        throw new LockContentionException(lockFile, policy.maxAttempts());
    }

    /**
     * Makes one attempt. Returns null when someone else holds the lock.
     */
    public Handle tryAcquire() {
        if (!HELD_IN_PROCESS.add(lockFile)) {
            log.tracef("Lock %s already held inside this JVM", lockFile);
            return null;
        }
        FileChannel channel;
        try {
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            HELD_IN_PROCESS.remove(lockFile);
            throw new StorageException("Failed to open lock file: " + lockFile, e);
        }
        try {
            FileLock fileLock = channel.tryLock();
            if (fileLock != null) {
                return new Handle(lockFile, channel, fileLock);
            }
        } catch (OverlappingFileLockException e) {
            log.tracef("Lock %s already held inside this JVM", lockFile);
        } catch (IOException e) {
            closeQuietly(channel);
            HELD_IN_PROCESS.remove(lockFile);
            throw new StorageException("Failed to lock " + lockFile, e);
        }
        closeQuietly(channel);
        HELD_IN_PROCESS.remove(lockFile);
        return null;
    }

    private void sleep() {
        try {
            Thread.sleep(policy.retryDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockContentionException(lockFile, 0);
        }
    }

    static boolean isHeldInProcess(Path lockFile) {
        return HELD_IN_PROCESS.contains(lockFile.toAbsolutePath().normalize());
    }

    private static void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.debugf("Failed to close lock channel: %s", e.getMessage());
        }
    }

    /**
     * A held lock. Closing it releases the lock and the channel.
     */
    public static final class Handle implements AutoCloseable {

        private final Path lockFile;
        private final FileChannel channel;
        private final FileLock fileLock;
        private final AtomicBoolean closed = new AtomicBoolean();

        private Handle(Path lockFile, FileChannel channel, FileLock fileLock) {
            this.lockFile = lockFile;
            this.channel = channel;
            this.fileLock = fileLock;
        }

        public boolean isValid() {
            return fileLock.isValid();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                if (fileLock.isValid()) {
                    fileLock.release();
                }
            } catch (IOException e) {
                log.warnf("Failed to release repository lock: %s", e.getMessage());
            } finally {
                closeQuietly(channel);
                HELD_IN_PROCESS.remove(lockFile);
            }
        }
    }
}
