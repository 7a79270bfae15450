package org.dbsync.migration.contributor.create;

import org.dbsync.migration.contributor.TableBodyContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.IndexModel;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Primary key first, then unique and plain keys in name order.
 */
public record IndexContributor(List<IndexModel> indexes) implements TableBodyContributor {
    @Override
    public int priority() {
        return 50;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        indexes.stream()
                .sorted(Comparator.comparing((IndexModel i) -> !i.isPrimary())
                        .thenComparing(i -> !i.isUnique())
                        .thenComparing(i -> i.getName().toLowerCase(Locale.ROOT)))
                .forEach(i -> sb.append("  ").append(dialect.getIndexDefinitionSql(i)).append(",\n"));
    }
}
