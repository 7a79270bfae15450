package org.dbsync.cli.service;

import org.dbsync.model.ColumnModel;
import org.dbsync.model.ForeignKeyModel;
import org.dbsync.model.IndexModel;
import org.dbsync.model.ReferentialAction;
import org.dbsync.model.RejectedTable;
import org.dbsync.model.SnapshotModel;
import org.dbsync.model.TableModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotIoServiceTest {

    @TempDir
    Path tempDir;

    private final SnapshotIoService service = new SnapshotIoService();

    private static TableModel orders() {
        return TableModel.builder()
                .name("orders")
                .engine("InnoDB")
                .charset("utf8mb4")
                .collation("utf8mb4_general_ci")
                .rowCount(42L)
                .column(ColumnModel.builder().name("id").ordinalPosition(1).type("int(11)").nullable(false).extra("auto_increment").build())
                .column(ColumnModel.builder().name("customer_id").ordinalPosition(2).type("int(11)").build())
                .column(ColumnModel.builder().name("status").ordinalPosition(3).type("varchar(20)").defaultValue("new").build())
                .index(IndexModel.builder().name("PRIMARY").unique(true).column("id").build())
                .index(IndexModel.builder().name("fk_customer").unique(false).column("customer_id").build())
                .foreignKey(ForeignKeyModel.builder()
                        .name("fk_customer")
                        .column("customer_id")
                        .referencedTable("customers")
                        .referencedColumn("id")
                        .onDelete(ReferentialAction.SET_NULL)
                        .onUpdate(ReferentialAction.CASCADE)
                        .build())
                .build();
    }

    @Test
    void writesAndReadsBack() throws IOException {
        SnapshotModel snapshot = SnapshotModel.builder()
                .databaseName("shop")
                .table("orders", orders())
                .rejectedTable(RejectedTable.builder().tableName("broken").reason("table has no columns").build())
                .build();
        Path file = tempDir.resolve("nested/dir/shop.json");

        service.write(snapshot, file);
        SnapshotModel read = service.read(file);

        assertThat(file).exists();
        assertThat(read).isEqualTo(snapshot);
    }

    @Test
    void missingFile() {
        Path file = tempDir.resolve("nope.json");

        assertThatThrownBy(() -> service.read(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Snapshot file not found");
    }

    @Test
    void malformedJson() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{ \"databaseName\": ");

        assertThatThrownBy(() -> service.read(file)).isInstanceOf(IOException.class);
    }

    @Test
    void revalidatesTablesOnRead() throws IOException {
        TableModel gap = TableModel.builder()
                .name("gap")
                .column(ColumnModel.builder().name("id").ordinalPosition(1).type("int").build())
                .column(ColumnModel.builder().name("name").ordinalPosition(3).type("text").build())
                .build();
        SnapshotModel unchecked = SnapshotModel.builder()
                .databaseName("shop")
                .table("orders", orders())
                .table("gap", gap)
                .build();
        Path file = tempDir.resolve("edited.json");
        service.write(unchecked, file);

        SnapshotModel read = service.read(file);

        assertThat(read.getTables()).containsOnlyKeys("orders");
        assertThat(read.getRejectedTables()).singleElement().satisfies(r -> {
            assertThat(r.getTableName()).isEqualTo("gap");
            assertThat(r.getReason()).contains("ordinal position gap");
        });
    }
}
