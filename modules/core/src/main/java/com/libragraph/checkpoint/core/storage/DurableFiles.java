package com.libragraph.checkpoint.core.storage;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.UUID;

/**
 * File primitives shared by the store, the log and the checkout engine:
 * forced writes, atomic renames and recursive deletes.
 */
public final class DurableFiles {

    private static final Logger log = Logger.getLogger(DurableFiles.class);

    private DurableFiles() {
    }

    /**
     * Writes {@code data} to a new file and forces it to the device.
     * Fails if {@code path} already exists.
     */
    public static void writeNew(Path path, byte[] data) throws IOException {
        try (FileChannel out = FileChannel.open(path,
                StandardOpenOption.CREATE_NEW,
                StandardOpenOption.WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(data);
            while (buf.hasRemaining()) {
                out.write(buf);
            }
            out.force(true);
        }
    }

    /**
     * Replaces {@code target} with {@code data} in one step: the bytes go to a
     * temp sibling first, which is then atomically renamed over the target.
     */
    public static void replace(Path target, byte[] data) throws IOException {
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path tmp = dir.resolve(tempName(target.getFileName().toString()));
        try {
            writeNew(tmp, data);
            moveAtomically(tmp, target, true);
        } finally {
            Files.deleteIfExists(tmp);
        }
        syncDirectory(dir);
    }

    /**
     * Renames {@code source} to {@code target} atomically.
     *
     * @param replaceExisting whether an existing target may be replaced
     * @throws AtomicMoveNotSupportedException if the filesystem cannot rename atomically
     */
    public static void moveAtomically(Path source, Path target, boolean replaceExisting)
            throws IOException {
        if (replaceExisting) {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } else {
            if (Files.exists(target)) {
                throw new FileAlreadyExistsException(target.toString());
            }
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        }
    }

    /**
     * Flushes directory metadata so a rename inside it survives a crash.
     * Not every platform can open a directory for sync; there the rename is
     * as durable as the filesystem makes it.
     */
    public static void syncDirectory(Path dir) {
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            log.tracef("Directory sync not supported for %s: %s", dir, e.getMessage());
        }
    }

    /**
     * Deletes a file tree bottom-up. A missing root is not an error.
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                    throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc)
                    throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc)
                    throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Returns a hidden, unique temp name derived from {@code base}.
     */
    public static String tempName(String base) {
        return "." + base + ".tmp-" + UUID.randomUUID();
    }
}
