package org.dbsync.migration.contributor.create;

import org.dbsync.migration.contributor.DdlContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.IndexModel;

import java.util.List;

public record IndexAddContributor(String table, IndexModel index) implements DdlContributor {
    @Override
    public int priority() {
        return 40;
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getAddIndexSql(table, index));
    }
}
