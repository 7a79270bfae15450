package org.dbsync.migration.contributor.alter;

import org.dbsync.migration.contributor.DdlContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.ColumnModel;

import java.util.List;

public record ColumnModifyContributor(String table, ColumnModel column) implements DdlContributor {
    @Override
    public int priority() {
        return 20;
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getModifyColumnSql(table, column));
    }
}
