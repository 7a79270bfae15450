package org.dbsync.migration.spi.dialect;

import org.dbsync.migration.spi.ValueTransformer;
import org.dbsync.model.ColumnModel;
import org.dbsync.model.ForeignKeyModel;
import org.dbsync.model.IndexModel;
import org.dbsync.model.TableModel;

import java.util.List;

public interface DdlDialect {
    String quoteIdentifier(String raw);
    ValueTransformer getValueTransformer();

    // Script framing
    String useDatabase(String database);
    String foreignKeyChecks(boolean enabled);

    // Table
    String openCreateTable(String tableName);
    String closeCreateTable(TableModel table);
    String getAlterEngineSql(String table, String engine);
    String getAlterCharsetSql(String table, String charset, String collation);

    // Column
    String getColumnDefinitionSql(ColumnModel column);
    /** @param afterColumn column to place the new one after, or null for FIRST */
    String getAddColumnSql(String table, ColumnModel column, String afterColumn);
    String getModifyColumnSql(String table, ColumnModel column);

    // Keys & Indexes
    String getPrimaryKeyDefinitionSql(List<String> pkColumns);
    String getIndexDefinitionSql(IndexModel index);
    String getAddIndexSql(String table, IndexModel index);
    String getDropIndexSql(String table, IndexModel index);

    // Foreign keys
    String getForeignKeyDefinitionSql(ForeignKeyModel fk);
    String getAddForeignKeySql(String table, ForeignKeyModel fk);
}
