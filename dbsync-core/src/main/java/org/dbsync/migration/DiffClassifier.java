package org.dbsync.migration;

import org.dbsync.model.TableDiff;

import java.util.List;
import java.util.Objects;

public class DiffClassifier {

    public ClassifiedDiffs classify(List<TableDiff> diffs) {
        Objects.requireNonNull(diffs, "diffs must not be null");
        ClassifiedDiffs.ClassifiedDiffsBuilder builder = ClassifiedDiffs.builder();
        for (TableDiff diff : diffs) {
            switch (diff.getKind()) {
                case NEW -> builder.newTable(diff);
                case REMOVED -> builder.removedTable(diff);
                case MODIFIED -> builder.modifiedTable(diff);
                case IDENTICAL -> builder.identicalTable(diff);
            }
            builder.rowDelta(diff.getTableName(), rowDelta(diff));
        }
        return builder.build();
    }

    static long rowDelta(TableDiff diff) {
        long source = diff.getSourceRowCount() == null ? 0L : diff.getSourceRowCount();
        long target = diff.getTargetRowCount() == null ? 0L : diff.getTargetRowCount();
        return source - target;
    }
}
