package org.dbsync.migration;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.dbsync.model.TableDiff;

import java.util.List;
import java.util.Map;

/**
 * Table diffs partitioned by kind. Each list keeps the alphabetical order of
 * the differ output.
 */
@Value
@Builder
public class ClassifiedDiffs {
    @Singular List<TableDiff> newTables;
    @Singular List<TableDiff> removedTables;
    @Singular List<TableDiff> modifiedTables;
    @Singular List<TableDiff> identicalTables;

    /** Source rows minus target rows per table name; an absent side counts as zero. */
    @Singular Map<String, Long> rowDeltas;

    public boolean hasChanges() {
        return !newTables.isEmpty() || !removedTables.isEmpty() || !modifiedTables.isEmpty();
    }

    public long rowDelta(String tableName) {
        return rowDeltas.getOrDefault(tableName, 0L);
    }

    public int totalTables() {
        return newTables.size() + removedTables.size() + modifiedTables.size() + identicalTables.size();
    }
}
