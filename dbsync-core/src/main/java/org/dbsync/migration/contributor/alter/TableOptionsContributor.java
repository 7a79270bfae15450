package org.dbsync.migration.contributor.alter;

import org.dbsync.migration.contributor.DdlContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.TableModel;

import java.util.List;

/**
 * Aligns the target's engine and default charset/collation with the source
 * table. Runs after every column, index and foreign key change.
 */
public record TableOptionsContributor(String table, TableModel source, boolean engineChanged, boolean charsetChanged)
        implements DdlContributor {
    @Override
    public int priority() {
        return 60;
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        if (engineChanged && hasText(source.getEngine())) {
            statements.add(dialect.getAlterEngineSql(table, source.getEngine()));
        }
        if (charsetChanged && (hasText(source.getCharset()) || hasText(source.getCollation()))) {
            statements.add(dialect.getAlterCharsetSql(table, source.getCharset(), source.getCollation()));
        }
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
