package org.dbsync.model;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Collects tables into a {@link SnapshotModel}. A table that fails validation
 * is excluded and reported instead of failing the whole snapshot.
 */
@Slf4j
public class SnapshotAssembler {
    private final String databaseName;
    private final Map<String, TableModel> tables = new LinkedHashMap<>();
    private final Map<String, String> seenKeys = new LinkedHashMap<>();
    private final List<RejectedTable> rejected = new ArrayList<>();

    public SnapshotAssembler(String databaseName) {
        this.databaseName = databaseName;
    }

    public SnapshotAssembler add(TableModel table) {
        try {
            table.validate();
            String key = table.getName().trim().toLowerCase(Locale.ROOT);
            String existing = seenKeys.putIfAbsent(key, table.getName());
            if (existing != null) {
                throw new MalformedMetadataException(table.getName(), "table name collides with " + existing);
            }
            tables.put(table.getName(), table);
        } catch (MalformedMetadataException e) {
            log.warn("Excluding table from snapshot of {}: {}", databaseName, e.getMessage());
            rejected.add(RejectedTable.builder()
                    .tableName(e.getTableName())
                    .reason(e.getMessage())
                    .build());
        }
        return this;
    }

    public SnapshotAssembler reject(String tableName, String reason) {
        log.warn("Excluding table {} from snapshot of {}: {}", tableName, databaseName, reason);
        rejected.add(RejectedTable.builder().tableName(tableName).reason(reason).build());
        return this;
    }

    public SnapshotModel build() {
        return SnapshotModel.builder()
                .databaseName(databaseName)
                .tables(tables)
                .rejectedTables(rejected)
                .build();
    }
}
