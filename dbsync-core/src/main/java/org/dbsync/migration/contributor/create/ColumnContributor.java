package org.dbsync.migration.contributor.create;

import org.dbsync.migration.contributor.TableBodyContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.ColumnModel;

import java.util.List;

public record ColumnContributor(List<ColumnModel> columns) implements TableBodyContributor {
    @Override
    public int priority() {
        return 40;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (ColumnModel c : columns) {
            sb.append("  ").append(dialect.getColumnDefinitionSql(c)).append(",\n");
        }
    }
}
