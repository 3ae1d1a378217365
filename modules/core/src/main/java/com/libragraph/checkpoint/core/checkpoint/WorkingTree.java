package com.libragraph.checkpoint.core.checkpoint;

import com.libragraph.checkpoint.core.storage.StorageException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * The live file set of the open book: a directory owned by the editor.
 *
 * <p>Checkpoint code only reads it ({@link #snapshot()}) or replaces the whole
 * directory during checkout.
 */
public final class WorkingTree {

    private final Path root;

    public WorkingTree(Path root) {
        this.root = Objects.requireNonNull(root, "root cannot be null").toAbsolutePath().normalize();
        if (this.root.getParent() == null) {
            throw new IllegalArgumentException("Working tree cannot be a filesystem root: " + root);
        }
    }

    public Path root() {
        return root;
    }

    public boolean exists() {
        return Files.isDirectory(root);
    }

    /**
     * Returns every regular file under the root, sorted by path.
     * A missing root is an empty tree.
     *
     * @throws StorageException if the tree cannot be walked
     */
    public List<String> paths() {
        if (!exists()) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .map(f -> RelativePaths.of(root, f))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list working tree " + root, e);
        } catch (UncheckedIOException e) {
            throw new StorageException("Failed to list working tree " + root, e.getCause());
        }
    }

    /**
     * Reads the whole tree into memory.
     *
     * @throws StorageException if a file cannot be read
     */
    public List<WorkingFile> snapshot() {
        List<WorkingFile> files = new ArrayList<>();
        for (String path : paths()) {
            try {
                files.add(new WorkingFile(path, Files.readAllBytes(resolve(path))));
            } catch (IOException e) {
                throw new StorageException("Failed to read working file " + path, e);
            }
        }
        files.sort(Comparator.comparing(WorkingFile::path));
        return files;
    }

    /**
     * Resolves a checkpoint path against this tree.
     */
    public Path resolve(String path) {
        return RelativePaths.resolve(root, path);
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
