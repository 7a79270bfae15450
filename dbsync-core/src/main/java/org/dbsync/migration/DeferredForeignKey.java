package org.dbsync.migration;

import lombok.Value;
import org.dbsync.model.ForeignKeyModel;

/**
 * A foreign key left out of its CREATE TABLE and added afterwards with
 * ALTER TABLE ... ADD CONSTRAINT.
 */
@Value
public class DeferredForeignKey {
    String tableName;
    ForeignKeyModel foreignKey;
}
