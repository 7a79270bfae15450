package org.dbsync.migration.differs;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.dbsync.migration.SkippedTable;
import org.dbsync.model.TableDiff;

import java.util.List;

/**
 * Diffs for every comparable table plus the tables left out of the comparison:
 * rejected as malformed on either side, or failing a component differ.
 */
@Value
@Builder
public class SchemaComparison {
    @Singular List<TableDiff> diffs;
    @Singular List<SkippedTable> excludedTables;
}
