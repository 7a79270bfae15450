package org.dbsync.migration;

import lombok.Value;

/**
 * A difference that is shown to the operator but never turned into DDL.
 */
@Value
public class ReportOnlyChange {
    public enum Kind {
        TABLE_REMOVED("table only exists on target"),
        COLUMN_REMOVED("column only exists on target"),
        FOREIGN_KEY_REMOVED("foreign key only exists on target"),
        FOREIGN_KEY_MODIFIED("foreign key differs");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    String tableName;
    /** Column or foreign key name; null for a whole table. */
    String objectName;
    Kind kind;

    public String qualifiedName() {
        return objectName == null ? tableName : tableName + "." + objectName;
    }

    @Override
    public String toString() {
        return qualifiedName() + " (" + kind.description() + ")";
    }
}
