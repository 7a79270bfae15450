package org.dbsync.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One database's schema at introspection time. Build it through
 * {@link SnapshotAssembler} so that every table has been validated.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SnapshotModel {
    String databaseName;
    @Singular Map<String, TableModel> tables;
    @Singular List<RejectedTable> rejectedTables;

    public Optional<TableModel> findTable(String tableName) {
        if (tableName == null) {
            return Optional.empty();
        }
        TableModel exact = tables.get(tableName);
        if (exact != null) {
            return Optional.of(exact);
        }
        return tables.values().stream()
                .filter(t -> tableName.equalsIgnoreCase(t.getName()))
                .findFirst();
    }
}
