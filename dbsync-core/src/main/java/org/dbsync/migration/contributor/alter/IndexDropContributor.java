package org.dbsync.migration.contributor.alter;

import org.dbsync.migration.contributor.DdlContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.IndexModel;

import java.util.List;

public record IndexDropContributor(String table, IndexModel index) implements DdlContributor {
    @Override
    public int priority() {
        return 30;
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getDropIndexSql(table, index));
    }
}
