package org.dbsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class TableModel {
    String name;
    String engine;
    String charset;
    String collation;
    @Builder.Default long rowCount = 0L;
    @Singular List<ColumnModel> columns;
    @Singular("index") List<IndexModel> indexes;
    @Singular List<ForeignKeyModel> foreignKeys;

    @JsonIgnore
    public List<ColumnModel> getColumnsInOrdinalOrder() {
        return columns.stream()
                .sorted(Comparator.comparingInt(ColumnModel::getOrdinalPosition))
                .toList();
    }

    public Optional<ColumnModel> findColumn(String columnName) {
        if (columnName == null || columnName.isBlank()) {
            return Optional.empty();
        }
        return columns.stream()
                .filter(c -> columnName.trim().equalsIgnoreCase(c.getName()))
                .findFirst();
    }

    public boolean hasColumn(String columnName) {
        return findColumn(columnName).isPresent();
    }

    public Optional<ColumnModel> findColumnAt(int ordinalPosition) {
        return columns.stream()
                .filter(c -> c.getOrdinalPosition() == ordinalPosition)
                .findFirst();
    }

    /**
     * Checks the table-level invariants: a name, at least one column, unique
     * column/index/foreign-key names and ordinal positions forming 1..N.
     *
     * @throws MalformedMetadataException on the first violation found
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new MalformedMetadataException(String.valueOf(name), "table name must not be blank");
        }
        if (columns.isEmpty()) {
            throw new MalformedMetadataException(name, "table has no columns");
        }

        Set<String> columnNames = new HashSet<>();
        Set<Integer> ordinals = new TreeSet<>();
        for (ColumnModel column : columns) {
            if (column.getName() == null || column.getName().isBlank()) {
                throw new MalformedMetadataException(name, "column name must not be blank");
            }
            if (!columnNames.add(key(column.getName()))) {
                throw new MalformedMetadataException(name, "duplicate column name " + column.getName());
            }
            if (!ordinals.add(column.getOrdinalPosition())) {
                throw new MalformedMetadataException(name, "duplicate ordinal position " + column.getOrdinalPosition());
            }
        }
        int expected = 1;
        for (int ordinal : ordinals) {
            if (ordinal != expected) {
                throw new MalformedMetadataException(name,
                        "ordinal position gap: expected " + expected + " but found " + ordinal);
            }
            expected++;
        }

        Set<String> indexNames = new HashSet<>();
        for (IndexModel index : indexes) {
            if (!indexNames.add(key(index.getName()))) {
                throw new MalformedMetadataException(name, "duplicate index name " + index.getName());
            }
        }
        Set<String> fkNames = new HashSet<>();
        for (ForeignKeyModel fk : foreignKeys) {
            if (!fkNames.add(key(fk.getName()))) {
                throw new MalformedMetadataException(name, "duplicate foreign key name " + fk.getName());
            }
        }
    }

    private static String key(String identifier) {
        return identifier == null ? "" : identifier.trim().toLowerCase(Locale.ROOT);
    }
}
