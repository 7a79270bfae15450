package org.dbsync.cli.service;

import lombok.extern.slf4j.Slf4j;
import org.dbsync.model.ColumnModel;
import org.dbsync.model.ForeignKeyModel;
import org.dbsync.model.IndexModel;
import org.dbsync.model.ReferentialAction;
import org.dbsync.model.SnapshotAssembler;
import org.dbsync.model.SnapshotModel;
import org.dbsync.model.TableModel;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads one schema's tables, columns, indexes and foreign keys from
 * INFORMATION_SCHEMA and assembles them into a {@link SnapshotModel}.
 */
@Slf4j
public class JdbcSnapshotIntrospector {

    static final String TABLES_SQL = """
            SELECT t.TABLE_NAME, t.ENGINE, t.TABLE_COLLATION, t.TABLE_ROWS, c.CHARACTER_SET_NAME
            FROM INFORMATION_SCHEMA.TABLES t
            LEFT JOIN INFORMATION_SCHEMA.COLLATION_CHARACTER_SET_APPLICABILITY c
              ON c.COLLATION_NAME = t.TABLE_COLLATION
            WHERE t.TABLE_SCHEMA = ? AND t.TABLE_TYPE = 'BASE TABLE'
            ORDER BY t.TABLE_NAME""";

    static final String COLUMNS_SQL = """
            SELECT TABLE_NAME, COLUMN_NAME, ORDINAL_POSITION, COLUMN_TYPE, IS_NULLABLE, COLUMN_DEFAULT, EXTRA
            FROM INFORMATION_SCHEMA.COLUMNS
            WHERE TABLE_SCHEMA = ?
            ORDER BY TABLE_NAME, ORDINAL_POSITION""";

    static final String INDEXES_SQL = """
            SELECT TABLE_NAME, INDEX_NAME, NON_UNIQUE, SEQ_IN_INDEX, COLUMN_NAME
            FROM INFORMATION_SCHEMA.STATISTICS
            WHERE TABLE_SCHEMA = ?
            ORDER BY TABLE_NAME, INDEX_NAME, SEQ_IN_INDEX""";

    static final String FOREIGN_KEYS_SQL = """
            SELECT k.TABLE_NAME, k.CONSTRAINT_NAME, k.COLUMN_NAME,
                   k.REFERENCED_TABLE_NAME, k.REFERENCED_COLUMN_NAME,
                   COALESCE(r.DELETE_RULE, 'RESTRICT') AS DELETE_RULE,
                   COALESCE(r.UPDATE_RULE, 'RESTRICT') AS UPDATE_RULE
            FROM INFORMATION_SCHEMA.KEY_COLUMN_USAGE k
            LEFT JOIN INFORMATION_SCHEMA.REFERENTIAL_CONSTRAINTS r
              ON r.CONSTRAINT_SCHEMA = k.CONSTRAINT_SCHEMA
             AND r.CONSTRAINT_NAME = k.CONSTRAINT_NAME
             AND r.TABLE_NAME = k.TABLE_NAME
            WHERE k.TABLE_SCHEMA = ? AND k.REFERENCED_TABLE_NAME IS NOT NULL
            ORDER BY k.TABLE_NAME, k.CONSTRAINT_NAME, k.ORDINAL_POSITION""";

    /**
     * Opens a JDBC connection for the given settings.
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        Connection open(ConnectionSettings settings) throws SQLException;
    }

    private final ConnectionFactory connectionFactory;

    public JdbcSnapshotIntrospector() {
        this(settings -> DriverManager.getConnection(settings.jdbcUrl(), settings.getUser(), settings.getPassword()));
    }

    public JdbcSnapshotIntrospector(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    /**
     * @throws IntrospectionException when the server cannot be reached or queried
     */
    public SnapshotModel introspect(ConnectionSettings settings) {
        log.debug("Introspecting {}", settings.describe());
        try (Connection connection = connectionFactory.open(settings)) {
            return read(connection, settings.getDatabase());
        } catch (SQLException e) {
            throw new IntrospectionException("Failed to read schema " + settings.describe() + ": " + e.getMessage(), e);
        }
    }

    SnapshotModel read(Connection connection, String database) throws SQLException {
        Map<String, TableModel.TableModelBuilder> tables = new LinkedHashMap<>();
        Map<String, Map<String, IndexModel.IndexModelBuilder>> indexes = new LinkedHashMap<>();
        Map<String, Map<String, ForeignKeyModel.ForeignKeyModelBuilder>> foreignKeys = new LinkedHashMap<>();
        Map<String, String> invalid = new LinkedHashMap<>();

        query(connection, TABLES_SQL, database, rs -> {
            String name = rs.getString("TABLE_NAME");
            long rows = rs.getLong("TABLE_ROWS");
            if (rs.wasNull()) rows = 0L;
            tables.put(name, TableModel.builder()
                    .name(name)
                    .engine(rs.getString("ENGINE"))
                    .collation(rs.getString("TABLE_COLLATION"))
                    .charset(rs.getString("CHARACTER_SET_NAME"))
                    .rowCount(rows));
        });

        query(connection, COLUMNS_SQL, database, rs -> {
            TableModel.TableModelBuilder table = tables.get(rs.getString("TABLE_NAME"));
            if (table == null) return; // views
            String extra = rs.getString("EXTRA");
            table.column(ColumnModel.builder()
                    .name(rs.getString("COLUMN_NAME"))
                    .ordinalPosition(rs.getInt("ORDINAL_POSITION"))
                    .type(rs.getString("COLUMN_TYPE"))
                    .nullable("YES".equalsIgnoreCase(rs.getString("IS_NULLABLE")))
                    .defaultValue(rs.getString("COLUMN_DEFAULT"))
                    .extra(extra == null ? "" : extra)
                    .build());
        });

        query(connection, INDEXES_SQL, database, rs -> {
            String table = rs.getString("TABLE_NAME");
            if (!tables.containsKey(table)) return;
            String indexName = rs.getString("INDEX_NAME");
            boolean unique = rs.getInt("NON_UNIQUE") == 0;
            indexes.computeIfAbsent(table, k -> new LinkedHashMap<>())
                    .computeIfAbsent(indexName, k -> IndexModel.builder().name(indexName).unique(unique))
                    .column(rs.getString("COLUMN_NAME"));
        });

        query(connection, FOREIGN_KEYS_SQL, database, rs -> {
            String table = rs.getString("TABLE_NAME");
            if (!tables.containsKey(table)) return;
            String constraint = rs.getString("CONSTRAINT_NAME");
            String referencedTable = rs.getString("REFERENCED_TABLE_NAME");
            ForeignKeyModel.ForeignKeyModelBuilder fk = foreignKeys
                    .computeIfAbsent(table, k -> new LinkedHashMap<>())
                    .computeIfAbsent(constraint, k -> ForeignKeyModel.builder()
                            .name(constraint)
                            .referencedTable(referencedTable));
            fk.column(rs.getString("COLUMN_NAME"))
                    .referencedColumn(rs.getString("REFERENCED_COLUMN_NAME"));
            try {
                fk.onDelete(ReferentialAction.fromSql(rs.getString("DELETE_RULE")))
                        .onUpdate(ReferentialAction.fromSql(rs.getString("UPDATE_RULE")));
            } catch (IllegalArgumentException e) {
                invalid.putIfAbsent(table, "foreign key " + constraint + ": " + e.getMessage());
            }
        });

        SnapshotAssembler assembler = new SnapshotAssembler(database);
        tables.forEach((name, builder) -> {
            if (invalid.containsKey(name)) {
                assembler.reject(name, invalid.get(name));
                return;
            }
            indexes.getOrDefault(name, Map.of()).values().forEach(i -> builder.index(i.build()));
            foreignKeys.getOrDefault(name, Map.of()).values().forEach(f -> builder.foreignKey(f.build()));
            assembler.add(builder.build());
        });
        log.debug("Read {} tables from {}", tables.size(), database);
        return assembler.build();
    }

    /**
     * Runs a schema-scoped query, handing each row to {@code handler}. The statement is
     * closed even when binding the schema name fails.
     */
    private static void query(Connection connection, String sql, String database, RowHandler handler)
            throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, database);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    handler.accept(rs);
                }
            }
        }
    }

    @FunctionalInterface
    private interface RowHandler {
        void accept(ResultSet rs) throws SQLException;
    }
}
