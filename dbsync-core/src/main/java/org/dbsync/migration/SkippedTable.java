package org.dbsync.migration;

import lombok.Value;

@Value
public class SkippedTable {
    String tableName;
    String reason;
}
