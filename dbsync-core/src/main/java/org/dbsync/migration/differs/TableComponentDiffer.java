package org.dbsync.migration.differs;

import org.dbsync.model.TableDiff;
import org.dbsync.model.TableModel;

/**
 * Compares one kind of table component (columns, indexes, foreign keys) of a
 * table present in both snapshots and records the result on the builder.
 */
public interface TableComponentDiffer {
    void diff(TableModel source, TableModel target, TableDiff.TableDiffBuilder result);
}
