package org.dbsync.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.dbsync.testing.SchemaFixtures.column;
import static org.dbsync.testing.SchemaFixtures.table;

class SnapshotAssemblerTest {

    @Test
    @DisplayName("A malformed table is excluded and reported without failing the snapshot")
    void excludesMalformedTable() {
        SnapshotModel snapshot = new SnapshotAssembler("shop")
                .add(table("users").build())
                .add(TableModel.builder().name("broken").build())
                .build();

        assertThat(snapshot.getDatabaseName()).isEqualTo("shop");
        assertThat(snapshot.getTables()).containsOnlyKeys("users");
        assertThat(snapshot.getRejectedTables())
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.getTableName()).isEqualTo("broken");
                    assertThat(r.getReason()).contains("no columns");
                });
    }

    @Test
    @DisplayName("Two tables whose names differ only by case collide")
    void caseCollision() {
        SnapshotModel snapshot = new SnapshotAssembler("shop")
                .add(table("Users").build())
                .add(table("users").column(column("email", 2, "text")).build())
                .build();

        assertThat(snapshot.getTables()).containsOnlyKeys("Users");
        assertThat(snapshot.getRejectedTables()).extracting(RejectedTable::getReason)
                .singleElement().asString().contains("collides with Users");
    }

    @Test
    @DisplayName("Explicit rejections are kept alongside validated tables")
    void explicitReject() {
        SnapshotModel snapshot = new SnapshotAssembler("shop")
                .reject("orders", "foreign key fk_x: Unknown referential action: BOGUS")
                .build();

        assertThat(snapshot.getTables()).isEmpty();
        assertThat(snapshot.getRejectedTables()).extracting(RejectedTable::getTableName).containsExactly("orders");
        assertThat(snapshot.findTable("ORDERS")).isEmpty();
    }

    @Test
    @DisplayName("findTable falls back to a case-insensitive match")
    void findTableIgnoringCase() {
        SnapshotModel snapshot = new SnapshotAssembler("shop").add(table("Users").build()).build();
        assertThat(snapshot.findTable("users")).map(TableModel::getName).hasValue("Users");
        assertThat(snapshot.findTable(null)).isEmpty();
    }
}
