package org.dbsync.migration;

import lombok.Builder;
import lombok.Value;
import org.dbsync.model.DiffKind;
import org.dbsync.model.TableDiff;

/**
 * Compact per-table view shown to the operator before a decision is asked.
 */
@Value
@Builder
public class TableSummary {
    String tableName;
    DiffKind kind;
    Long sourceRowCount;
    Long targetRowCount;
    long rowDelta;

    int newColumns;
    int removedColumns;
    int modifiedColumns;
    int newIndexes;
    int removedIndexes;
    int modifiedIndexes;
    int newForeignKeys;
    int removedForeignKeys;
    int modifiedForeignKeys;
    boolean engineChanged;
    boolean charsetChanged;

    /** Position of this table in the decision loop, 1-based. */
    int position;
    int total;

    TableDiff diff;

    public static TableSummary of(TableDiff diff, int position, int total) {
        return TableSummary.builder()
                .tableName(diff.getTableName())
                .kind(diff.getKind())
                .sourceRowCount(diff.getSourceRowCount())
                .targetRowCount(diff.getTargetRowCount())
                .rowDelta(DiffClassifier.rowDelta(diff))
                .newColumns(diff.getNewColumns().size())
                .removedColumns(diff.getRemovedColumns().size())
                .modifiedColumns(diff.getModifiedColumns().size())
                .newIndexes(diff.getNewIndexes().size())
                .removedIndexes(diff.getRemovedIndexes().size())
                .modifiedIndexes(diff.getModifiedIndexes().size())
                .newForeignKeys(diff.getNewForeignKeys().size())
                .removedForeignKeys(diff.getRemovedForeignKeys().size())
                .modifiedForeignKeys(diff.getModifiedForeignKeys().size())
                .engineChanged(diff.isEngineChanged())
                .charsetChanged(diff.isCharsetChanged())
                .position(position)
                .total(total)
                .diff(diff)
                .build();
    }
}
