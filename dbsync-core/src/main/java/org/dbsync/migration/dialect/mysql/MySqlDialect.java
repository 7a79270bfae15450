package org.dbsync.migration.dialect.mysql;

import org.dbsync.migration.AbstractDialect;
import org.dbsync.migration.spi.ValueTransformer;
import org.dbsync.model.ColumnModel;
import org.dbsync.model.ForeignKeyModel;
import org.dbsync.model.IndexModel;
import org.dbsync.model.TableModel;

import java.util.List;

public class MySqlDialect extends AbstractDialect {

    public MySqlDialect() {
        super();
    }

    // for tests
    public MySqlDialect(ValueTransformer valueTransformer) {
        this.valueTransformer = valueTransformer;
    }

    @Override
    protected ValueTransformer initializeValueTransformer() {
        return new MySqlValueTransformer();
    }

    @Override
    public String quoteIdentifier(String raw) {
        return "`" + raw.replace("`", "``") + "`";
    }

    @Override
    public String useDatabase(String database) {
        return "USE " + quoteIdentifier(database) + ";";
    }

    @Override
    public String foreignKeyChecks(boolean enabled) {
        return "SET FOREIGN_KEY_CHECKS = " + (enabled ? 1 : 0) + ";";
    }

    // Table

    @Override
    public String openCreateTable(String table) {
        return "CREATE TABLE " + quoteIdentifier(table) + " (\n";
    }

    @Override
    public String closeCreateTable(TableModel table) {
        StringBuilder sb = new StringBuilder("\n)");
        if (hasText(table.getEngine())) {
            sb.append(" ENGINE=").append(table.getEngine());
        }
        if (hasText(table.getCharset())) {
            sb.append(" DEFAULT CHARSET=").append(table.getCharset());
        }
        if (hasText(table.getCollation())) {
            sb.append(" COLLATE=").append(table.getCollation());
        }
        return sb.append(";").toString();
    }

    @Override
    public String getAlterEngineSql(String table, String engine) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ENGINE=" + engine + ";";
    }

    @Override
    public String getAlterCharsetSql(String table, String charset, String collation) {
        StringBuilder sb = new StringBuilder("ALTER TABLE ").append(quoteIdentifier(table));
        if (hasText(charset)) {
            sb.append(" DEFAULT CHARSET=").append(charset);
        }
        if (hasText(collation)) {
            sb.append(" COLLATE=").append(collation);
        }
        return sb.append(";").toString();
    }

    // Column

    @Override
    public String getColumnDefinitionSql(ColumnModel c) {
        StringBuilder sb = new StringBuilder();
        sb.append(quoteIdentifier(c.getName())).append(" ").append(c.getType());
        sb.append(c.isNullable() ? " NULL" : " NOT NULL");
        if (c.getDefaultValue() != null) {
            sb.append(" DEFAULT ").append(valueTransformer.quote(c.getDefaultValue(), c));
        }
        String extra = cleanExtra(c.getExtra());
        if (!extra.isEmpty()) {
            sb.append(" ").append(extra);
        }
        return sb.toString();
    }

    @Override
    public String getAddColumnSql(String table, ColumnModel column, String afterColumn) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD COLUMN " + getColumnDefinitionSql(column)
                + (afterColumn == null ? " FIRST" : " AFTER " + quoteIdentifier(afterColumn)) + ";";
    }

    @Override
    public String getModifyColumnSql(String table, ColumnModel column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " MODIFY COLUMN " + getColumnDefinitionSql(column) + ";";
    }

    // Keys & Indexes

    @Override
    public String getPrimaryKeyDefinitionSql(List<String> pkColumns) {
        return "PRIMARY KEY (" + quoteAll(pkColumns) + ")";
    }

    @Override
    public String getIndexDefinitionSql(IndexModel index) {
        if (index.isPrimary()) {
            return getPrimaryKeyDefinitionSql(index.getColumns());
        }
        return (index.isUnique() ? "UNIQUE KEY " : "KEY ") + quoteIdentifier(index.getName())
                + " (" + quoteAll(index.getColumns()) + ")";
    }

    @Override
    public String getAddIndexSql(String table, IndexModel index) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD " + getIndexDefinitionSql(index) + ";";
    }

    @Override
    public String getDropIndexSql(String table, IndexModel index) {
        if (index.isPrimary()) {
            return "ALTER TABLE " + quoteIdentifier(table) + " DROP PRIMARY KEY;";
        }
        return "ALTER TABLE " + quoteIdentifier(table) + " DROP INDEX " + quoteIdentifier(index.getName()) + ";";
    }

    // Foreign keys

    @Override
    public String getForeignKeyDefinitionSql(ForeignKeyModel fk) {
        return "CONSTRAINT " + quoteIdentifier(fk.getName())
                + " FOREIGN KEY (" + quoteAll(fk.getColumns()) + ")"
                + " REFERENCES " + quoteIdentifier(fk.getReferencedTable())
                + " (" + quoteAll(fk.getReferencedColumns()) + ")"
                + " ON DELETE " + fk.getOnDelete().sql()
                + " ON UPDATE " + fk.getOnUpdate().sql();
    }

    @Override
    public String getAddForeignKeySql(String table, ForeignKeyModel fk) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD " + getForeignKeyDefinitionSql(fk) + ";";
    }

    static String cleanExtra(String extra) {
        if (extra == null) return "";
        return extra.replaceAll("(?i)\\bDEFAULT_GENERATED\\b", "")
                .replaceAll("\\s{2,}", " ")
                .trim();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
