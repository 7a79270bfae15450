package org.dbsync.migration.selection;

import lombok.Getter;

/**
 * The operator quit the decision loop. Every decision made so far is discarded.
 */
@Getter
public class SelectionCancelledException extends RuntimeException {
    private final String tableName;

    public SelectionCancelledException(String tableName) {
        super("Selection cancelled by user at table " + tableName);
        this.tableName = tableName;
    }
}
