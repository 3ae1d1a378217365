package com.libragraph.checkpoint.core.checkpoint;

import com.libragraph.checkpoint.core.storage.DurableFiles;
import com.libragraph.checkpoint.core.storage.StorageException;
import io.smallrye.mutiny.Multi;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Append-only, ordered history of one repository's checkpoints.
 *
 * <p>Layout: {@code {logDir}/{index:08d}.json}, one record per checkpoint.
 * Records are prepared in {@code stagingDir} and renamed into the log in one
 * step, so readers never see a partial record and need no lock.
 */
public class CheckpointLog {

    private static final Logger log = Logger.getLogger(CheckpointLog.class);

    private static final Pattern RECORD_NAME = Pattern.compile("(\\d{8})\\.json");

    private final Path logDir;
    private final Path stagingDir;
    private final CheckpointCodec codec;

    public CheckpointLog(Path logDir, Path stagingDir, CheckpointCodec codec) {
        this.logDir = Objects.requireNonNull(logDir, "logDir cannot be null");
        this.stagingDir = Objects.requireNonNull(stagingDir, "stagingDir cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
    }

    /**
     * Lists checkpoint summaries in index order. Records are decoded as the
     * stream is consumed; each subscription rescans the log.
     */
    public Multi<CheckpointSummary> list() {
        return Multi.createFrom().items(() -> indices().stream()
                .map(index -> read(CheckpointId.of(index)).summary()));
    }

    /**
     * @throws CheckpointNotFoundException if no record exists for {@code id}
     * @throws StorageException if the record cannot be read or parsed
     */
    public Checkpoint get(CheckpointId id) {
        Objects.requireNonNull(id, "id cannot be null");
        return read(id);
    }

    public Optional<Checkpoint> latest() {
        long index = latestIndex();
        return index == 0 ? Optional.empty() : Optional.of(read(CheckpointId.of(index)));
    }

    /**
     * Returns the highest published index, or 0 for an empty log.
     */
    public long latestIndex() {
        List<Long> indices = indices();
        return indices.isEmpty() ? 0 : indices.get(indices.size() - 1);
    }

    public int size() {
        return indices().size();
    }

    public boolean isEmpty() {
        return indices().isEmpty();
    }

    /**
     * Published indices in ascending order.
     */
    public List<Long> indices() {
        if (!Files.isDirectory(logDir)) {
            return List.of();
        }
        List<Long> indices = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(logDir)) {
            for (Path entry : entries) {
                Matcher m = RECORD_NAME.matcher(entry.getFileName().toString());
                if (m.matches()) {
                    indices.add(Long.parseLong(m.group(1)));
                }
            }
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new StorageException("Failed to list checkpoint log " + logDir, e);
        }
        indices.sort(null);
        return indices;
    }

    private Checkpoint read(CheckpointId id) {
        Path record = logDir.resolve(id.fileName());
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(record);
        } catch (NoSuchFileException e) {
            throw new CheckpointNotFoundException(id);
        } catch (IOException e) {
            throw new StorageException("Failed to read checkpoint " + id, e);
        }
        try {
            Checkpoint checkpoint = codec.decode(bytes);
            if (checkpoint.index() != id.index()) {
                throw new StorageException("Checkpoint record " + record
                        + " carries index " + checkpoint.index());
            }
            return checkpoint;
        } catch (IOException e) {
            throw new StorageException("Failed to parse checkpoint " + id, e);
        }
    }

    // -- write side, used by CheckpointWriter under the repository lock --

    /**
     * Encodes a checkpoint into a forced temp file in the staging area.
     */
    Path stage(Checkpoint checkpoint) throws IOException {
        Files.createDirectories(stagingDir);
        Path staged = stagingDir.resolve(DurableFiles.tempName(checkpoint.id().fileName()));
        DurableFiles.writeNew(staged, codec.encode(checkpoint));
        return staged;
    }

    /**
     * Makes a staged record visible. This rename is the commit point.
     */
    void publish(Path staged, CheckpointId id) throws IOException {
        Files.createDirectories(logDir);
        Path target = logDir.resolve(id.fileName());
        DurableFiles.moveAtomically(staged, target, false);
        DurableFiles.syncDirectory(logDir);
        log.debugf("Published checkpoint %s to %s", id, target);
    }

    void discard(Path staged) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            log.warnf("Could not remove staged checkpoint %s: %s", staged, e.getMessage());
        }
    }

    /**
     * Removes staging leftovers of writers that crashed before publishing.
     */
    void clearStaging() throws IOException {
        if (!Files.isDirectory(stagingDir)) {
            return;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(stagingDir)) {
            for (Path entry : entries) {
                log.infof("Removing abandoned staged checkpoint %s", entry);
                Files.deleteIfExists(entry);
            }
        }
    }
}
