package com.libragraph.checkpoint.core.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.checkpoint.types.FileKind;
import com.libragraph.checkpoint.util.ContentRef;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Serializes checkpoints to the JSON records stored in the log.
 *
 * <p>Record layout:
 * <pre>
 * {"format":1,"index":3,"timestamp":"...","description":"...",
 *  "metadata":{"title":...},
 *  "files":[{"path":"a.txt","ref":"{hex32}-{size}","kind":"text"}]}
 * </pre>
 */
public class CheckpointCodec {

    static final int FORMAT = 1;

    private final ObjectMapper mapper;

    public CheckpointCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    record FileRecord(String path, String ref, String kind) {}

    record CheckpointRecord(int format, long index, Instant timestamp, String description,
                            BookMetadata metadata, List<FileRecord> files) {}

    public byte[] encode(Checkpoint checkpoint) throws IOException {
        List<FileRecord> files = new ArrayList<>(checkpoint.files().size());
        for (FileEntry entry : checkpoint.files().values()) {
            files.add(new FileRecord(entry.path(), entry.ref().toString(), entry.kind().label()));
        }
        CheckpointRecord record = new CheckpointRecord(FORMAT, checkpoint.index(),
                checkpoint.timestamp(), checkpoint.description(), checkpoint.metadata(), files);
        return mapper.writeValueAsBytes(record);
    }

    public Checkpoint decode(byte[] bytes) throws IOException {
        CheckpointRecord record = mapper.readValue(bytes, CheckpointRecord.class);
        if (record.format() != FORMAT) {
            throw new IOException("Unsupported checkpoint record format: " + record.format());
        }
        SortedMap<String, FileEntry> files = new TreeMap<>();
        List<FileRecord> fileRecords = record.files() != null ? record.files() : List.of();
        try {
            for (FileRecord f : fileRecords) {
                FileEntry entry = new FileEntry(f.path(), ContentRef.parse(f.ref()),
                        FileKind.fromLabel(f.kind()));
                if (files.put(entry.path(), entry) != null) {
                    throw new IOException("Duplicate path in checkpoint record: " + entry.path());
                }
            }
            return new Checkpoint(record.index(), record.timestamp(), record.description(),
                    record.metadata(), files);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IOException("Malformed checkpoint record " + record.index(), e);
        }
    }
}
