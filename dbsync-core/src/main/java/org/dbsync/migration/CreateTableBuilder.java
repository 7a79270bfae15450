package org.dbsync.migration;

import org.dbsync.migration.contributor.SqlContributor;
import org.dbsync.migration.contributor.TableBodyContributor;
import org.dbsync.migration.contributor.create.ColumnContributor;
import org.dbsync.migration.contributor.create.ForeignKeyContributor;
import org.dbsync.migration.contributor.create.IndexContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.ForeignKeyModel;
import org.dbsync.model.TableModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class CreateTableBuilder {
    private final TableModel table;
    private final DdlDialect dialect;
    private final List<TableBodyContributor> body = new ArrayList<>();

    public CreateTableBuilder(TableModel table, DdlDialect dialect) {
        this.table = table;
        this.dialect = dialect;
    }

    public CreateTableBuilder add(TableBodyContributor c) {
        body.add(c);
        return this;
    }

    public String build() {
        StringBuilder sb = new StringBuilder(dialect.openCreateTable(table.getName()));

        body.stream()
                .sorted(Comparator.comparingInt(SqlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        trimTrailingComma(sb);

        sb.append(dialect.closeCreateTable(table));
        return sb.toString();
    }

    private void trimTrailingComma(StringBuilder sb) {
        int last = sb.lastIndexOf(",\n");
        if (last != -1 && last == sb.length() - 2) sb.delete(last, last + 2);
    }

    /**
     * Columns in ordinal order, every index and the given foreign keys.
     * Foreign keys left out here are expected to be added later with ALTER TABLE.
     */
    public CreateTableBuilder defaultsFrom(List<ForeignKeyModel> inlineForeignKeys) {
        this.add(new ColumnContributor(table.getColumnsInOrdinalOrder()));
        this.add(new IndexContributor(table.getIndexes()));
        if (!inlineForeignKeys.isEmpty()) {
            this.add(new ForeignKeyContributor(inlineForeignKeys));
        }
        return this;
    }
}
