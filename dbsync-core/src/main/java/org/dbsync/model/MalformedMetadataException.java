package org.dbsync.model;

import lombok.Getter;

/**
 * A table's metadata is internally inconsistent. Scoped to one table: the
 * table is left out of its snapshot and the rest of the snapshot stays usable.
 */
@Getter
public class MalformedMetadataException extends RuntimeException {
    private final String tableName;

    public MalformedMetadataException(String tableName, String message) {
        super("Malformed metadata for table '" + tableName + "': " + message);
        this.tableName = tableName;
    }
}
