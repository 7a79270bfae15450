package org.dbsync.migration;

import lombok.Getter;

/**
 * DDL for one table cannot be produced from its definition. The table is left
 * out of the script; other tables are unaffected.
 */
@Getter
public class GenerationException extends RuntimeException {
    private final String tableName;

    public GenerationException(String tableName, String message) {
        super("Cannot generate DDL for table '" + tableName + "': " + message);
        this.tableName = tableName;
    }
}
