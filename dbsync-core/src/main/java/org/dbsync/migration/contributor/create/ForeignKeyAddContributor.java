package org.dbsync.migration.contributor.create;

import org.dbsync.migration.contributor.DdlContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.ForeignKeyModel;

import java.util.List;

public record ForeignKeyAddContributor(String table, ForeignKeyModel foreignKey) implements DdlContributor {
    @Override
    public int priority() {
        return 50;
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getAddForeignKeySql(table, foreignKey));
    }
}
