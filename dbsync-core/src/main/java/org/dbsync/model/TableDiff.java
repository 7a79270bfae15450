package org.dbsync.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Structural delta for one table name between the source and the target
 * snapshot. New tables list their whole structure as "new"; removed tables
 * carry no sub-diffs.
 */
@Value
@Builder(toBuilder = true)
public class TableDiff {
    String tableName;
    DiffKind kind;
    TableModel sourceTable;
    TableModel targetTable;

    @Singular List<ColumnModel> newColumns;
    @Singular List<ColumnModel> removedColumns;
    @Singular List<ColumnChange> modifiedColumns;

    @Singular("newIndex") List<IndexModel> newIndexes;
    @Singular("removedIndex") List<IndexModel> removedIndexes;
    @Singular("modifiedIndex") List<IndexChange> modifiedIndexes;

    @Singular List<ForeignKeyModel> newForeignKeys;
    @Singular List<ForeignKeyModel> removedForeignKeys;
    @Singular List<ForeignKeyChange> modifiedForeignKeys;

    boolean engineChanged;
    boolean charsetChanged;

    Long sourceRowCount;
    Long targetRowCount;

    public boolean hasSubDiffs() {
        return !newColumns.isEmpty() || !removedColumns.isEmpty() || !modifiedColumns.isEmpty()
                || !newIndexes.isEmpty() || !removedIndexes.isEmpty() || !modifiedIndexes.isEmpty()
                || !newForeignKeys.isEmpty() || !removedForeignKeys.isEmpty() || !modifiedForeignKeys.isEmpty();
    }

    public boolean hasChanges() {
        return hasSubDiffs() || engineChanged || charsetChanged;
    }

    @Value
    @Builder
    public static class ColumnChange {
        ColumnModel sourceColumn;
        ColumnModel targetColumn;
        @Singular List<String> details;

        public String getName() {
            return sourceColumn.getName();
        }
    }

    @Value
    @Builder
    public static class IndexChange {
        IndexModel sourceIndex;
        IndexModel targetIndex;
        @Singular List<String> details;

        public String getName() {
            return sourceIndex.getName();
        }
    }

    @Value
    @Builder
    public static class ForeignKeyChange {
        ForeignKeyModel sourceForeignKey;
        ForeignKeyModel targetForeignKey;
        @Singular List<String> details;

        public String getName() {
            return sourceForeignKey.getName();
        }
    }
}
