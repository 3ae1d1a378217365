package com.libragraph.checkpoint.core.storage;

import com.libragraph.checkpoint.util.ContentRef;
import io.smallrye.mutiny.Multi;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Filesystem-backed ContentStore.
 *
 * <p>Layout: {@code {root}/{tier1}/{tier2}/{key}}
 * where tier1 = hash[0:2], tier2 = hash[2:4] and key = {@code ContentRef.toString()}.
 *
 * <p>No compression; payloads are stored as-is. Writes land in a temp file in the
 * target directory and are renamed into place, so a payload file is either absent
 * or complete.
 */
public class FilesystemContentStore implements ContentStore {

    private static final Logger log = Logger.getLogger(FilesystemContentStore.class);

    private final Path root;

    public FilesystemContentStore(Path root) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
    }

    public Path root() {
        return root;
    }

    private Path resolvePath(ContentRef ref) {
        String hex = ref.hash().toHex();
        String tier1 = hex.substring(0, 2);
        String tier2 = hex.substring(2, 4);
        return root.resolve(tier1).resolve(tier2).resolve(ref.toString());
    }

    @Override
    public ContentRef put(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        ContentRef ref = ContentRef.of(data);
        Path path = resolvePath(ref);
        if (Files.exists(path)) {
            log.tracef("Dedup hit: ref=%s", ref);
            return ref;
        }
        Path dir = path.getParent();
        Path tmp = dir.resolve(DurableFiles.tempName(ref.toString()));
        try {
            Files.createDirectories(dir);
            DurableFiles.writeNew(tmp, data);
            try {
                DurableFiles.moveAtomically(tmp, path, false);
            } catch (FileAlreadyExistsException e) {
                // Concurrent put of the same payload won the rename
                log.tracef("Payload appeared concurrently: ref=%s", ref);
            }
            DurableFiles.syncDirectory(dir);
            log.debugf("Stored payload: ref=%s", ref);
            return ref;
        } catch (IOException e) {
            throw new StorageException("Failed to write payload: " + ref, e);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warnf("Could not remove temp payload %s: %s", tmp, e.getMessage());
            }
        }
    }

    @Override
    public byte[] get(ContentRef ref) {
        Path path = resolvePath(ref);
        if (!Files.exists(path)) {
            throw new ContentNotFoundException(ref);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new ContentNotFoundException(ref);
        } catch (IOException e) {
            throw new StorageException("Failed to read payload: " + ref, e);
        }
        if (!ref.matches(bytes)) {
            throw new IntegrityMismatchException(ref, ContentRef.of(bytes));
        }
        return bytes;
    }

    @Override
    public boolean contains(ContentRef ref) {
        return Files.exists(resolvePath(ref));
    }

    @Override
    public void delete(ContentRef ref) {
        Path path = resolvePath(ref);
        try {
            if (Files.deleteIfExists(path)) {
                pruneEmptyParents(path.getParent());
                log.debugf("Deleted payload: ref=%s", ref);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to delete payload: " + ref, e);
        }
    }

    private void pruneEmptyParents(Path dir) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(root)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            }
            Files.delete(current);
            current = current.getParent();
        }
    }

    @Override
    public Multi<ContentRef> list() {
        return Multi.createFrom().items(() -> {
            if (!Files.isDirectory(root)) {
                return Stream.<ContentRef>empty();
            }
            try (Stream<Path> files = Files.walk(root)) {
                return files
                        .filter(Files::isRegularFile)
                        .map(p -> p.getFileName().toString())
                        .filter(name -> !name.startsWith("."))
                        .map(ContentRef::parse)
                        .toList()
                        .stream();
            } catch (IOException e) {
                throw new StorageException("Failed to list payloads under " + root, e);
            }
        });
    }
}
