package org.dbsync.migration;

import org.dbsync.migration.dialect.mysql.MySqlDialect;
import org.dbsync.model.ColumnModel;
import org.dbsync.model.TableModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.dbsync.testing.SchemaFixtures.column;
import static org.dbsync.testing.SchemaFixtures.foreignKey;
import static org.dbsync.testing.SchemaFixtures.index;
import static org.dbsync.testing.SchemaFixtures.table;

class CreateTableBuilderTest {

    private static final Pattern COLUMN_LINE = Pattern.compile(
            "^ {2}`([^`]+)` (\\S+(?: unsigned)?) (NULL|NOT NULL)(?: DEFAULT ('(?:[^']|'')*'|\\S+))?(?: (.+?))?,?$");

    private final MySqlDialect dialect = new MySqlDialect();

    private TableModel orders() {
        return table("orders")
                .column(ColumnModel.builder().name("status").ordinalPosition(3).type("varchar(20)")
                        .nullable(false).defaultValue("new").build())
                .column(column("customer_id", 2, "int(11) unsigned"))
                .column(ColumnModel.builder().name("note").ordinalPosition(4).type("text").build())
                .index(index("idx_status", false, "status"))
                .index(index("uq_customer_status", true, "customer_id", "status"))
                .foreignKey(foreignKey("fk_customer", "customer_id", "customers", "id"))
                .build();
    }

    @Test
    @DisplayName("CREATE TABLE lists columns by position, then keys, then constraints")
    void layout() {
        String sql = new CreateTableBuilder(orders(), dialect).defaultsFrom(orders().getForeignKeys()).build();

        assertThat(sql).isEqualTo("""
                CREATE TABLE `orders` (
                  `id` int(11) NOT NULL auto_increment,
                  `customer_id` int(11) unsigned NULL,
                  `status` varchar(20) NOT NULL DEFAULT 'new',
                  `note` text NULL,
                  PRIMARY KEY (`id`),
                  UNIQUE KEY `uq_customer_status` (`customer_id`, `status`),
                  KEY `idx_status` (`status`),
                  CONSTRAINT `fk_customer` FOREIGN KEY (`customer_id`) REFERENCES `customers` (`id`) ON DELETE RESTRICT ON UPDATE RESTRICT
                ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 COLLATE=utf8mb4_general_ci;""");
    }

    @Test
    @DisplayName("Parsing the generated column definitions gives back the source columns")
    void roundTrip() {
        TableModel table = orders().toBuilder()
                .column(ColumnModel.builder().name("code").ordinalPosition(5).type("varchar(10)").defaultValue("007").build())
                .column(ColumnModel.builder().name("label").ordinalPosition(6).type("varchar(10)").defaultValue("now").build())
                .column(ColumnModel.builder().name("qty").ordinalPosition(7).type("int(11)").defaultValue("007").build())
                .build();
        String sql = new CreateTableBuilder(table, dialect).defaultsFrom(List.of()).build();

        List<ColumnModel> parsed = new ArrayList<>();
        int ordinal = 1;
        for (String line : sql.split("\n")) {
            Matcher m = COLUMN_LINE.matcher(line);
            if (!m.matches()) continue;
            String rawDefault = m.group(4);
            parsed.add(ColumnModel.builder()
                    .name(m.group(1))
                    .ordinalPosition(ordinal++)
                    .type(m.group(2))
                    .nullable(m.group(3).equals("NULL"))
                    .defaultValue(rawDefault == null ? null : unquote(rawDefault))
                    .extra(m.group(5) == null ? "" : m.group(5))
                    .build());
        }

        assertThat(parsed).containsExactlyElementsOf(table.getColumnsInOrdinalOrder());
        assertThat(sql).contains("`code` varchar(10) NULL DEFAULT '007'", "`label` varchar(10) NULL DEFAULT 'now'",
                "`qty` int(11) NULL DEFAULT 007");
        assertThat(sql).doesNotContain("CONSTRAINT");
    }

    private static String unquote(String literal) {
        if (literal.startsWith("'") && literal.endsWith("'")) {
            return literal.substring(1, literal.length() - 1).replace("''", "'");
        }
        return literal;
    }
}
