package org.dbsync.migration.contributor.create;

import org.dbsync.migration.contributor.TableBodyContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.ForeignKeyModel;

import java.util.List;

public record ForeignKeyContributor(List<ForeignKeyModel> foreignKeys) implements TableBodyContributor {
    @Override
    public int priority() {
        return 60;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (ForeignKeyModel fk : foreignKeys) {
            sb.append("  ").append(dialect.getForeignKeyDefinitionSql(fk)).append(",\n");
        }
    }
}
