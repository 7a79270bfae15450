package org.dbsync.migration.spi;

import org.dbsync.model.ColumnModel;

/**
 * Renders a column default as it must appear after DEFAULT in a column
 * definition.
 */
public interface ValueTransformer {

    /**
     * @param value the default as reported by INFORMATION_SCHEMA
     * @param column the owning column, or null when its type is unknown
     */
    String quote(String value, ColumnModel column);

    default String quote(String value) {
        return quote(value, null);
    }
}
