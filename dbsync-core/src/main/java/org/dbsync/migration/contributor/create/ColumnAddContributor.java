package org.dbsync.migration.contributor.create;

import org.dbsync.migration.contributor.DdlContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.ColumnModel;

import java.util.List;

/**
 * @param after the column the new one follows, null to add it FIRST
 */
public record ColumnAddContributor(String table, ColumnModel column, String after) implements DdlContributor {
    @Override
    public int priority() {
        return 10;
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getAddColumnSql(table, column, after));
    }
}
