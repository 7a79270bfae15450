package org.dbsync.cli.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dbsync.model.SnapshotAssembler;
import org.dbsync.model.SnapshotModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes snapshot JSON files.
 */
public class SnapshotIoService {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Loads a snapshot and re-validates every table through {@link SnapshotAssembler},
     * so hand-edited files get the same table-level checks as introspected ones.
     *
     * @param path the snapshot JSON file
     * @return the validated snapshot
     * @throws IOException if the file cannot be read or parsed
     */
    public SnapshotModel read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Snapshot file not found: " + path);
        }
        SnapshotModel raw = objectMapper.readValue(path.toFile(), SnapshotModel.class);
        SnapshotAssembler assembler = new SnapshotAssembler(raw.getDatabaseName());
        raw.getRejectedTables().forEach(r -> assembler.reject(r.getTableName(), r.getReason()));
        raw.getTables().values().forEach(assembler::add);
        return assembler.build();
    }

    /**
     * Writes the snapshot as indented JSON, creating parent directories.
     *
     * @param snapshot the snapshot to write
     * @param path the target file
     * @throws IOException if an I/O error occurs
     */
    public void write(SnapshotModel snapshot, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), snapshot);
    }
}
