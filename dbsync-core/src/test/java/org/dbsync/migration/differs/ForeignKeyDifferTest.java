package org.dbsync.migration.differs;

import org.dbsync.model.DiffKind;
import org.dbsync.model.ForeignKeyModel;
import org.dbsync.model.ReferentialAction;
import org.dbsync.model.TableDiff;
import org.dbsync.model.TableModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.dbsync.testing.SchemaFixtures.column;
import static org.dbsync.testing.SchemaFixtures.foreignKey;
import static org.dbsync.testing.SchemaFixtures.table;

class ForeignKeyDifferTest {

    private final ForeignKeyDiffer differ = new ForeignKeyDiffer();

    private TableDiff run(ForeignKeyModel sourceFk, ForeignKeyModel targetFk) {
        TableModel.TableModelBuilder source = table("orders").column(column("customer_id", 2, "int(11)"));
        TableModel.TableModelBuilder target = table("orders").column(column("customer_id", 2, "int(11)"));
        if (sourceFk != null) source.foreignKey(sourceFk);
        if (targetFk != null) target.foreignKey(targetFk);

        TableDiff.TableDiffBuilder builder = TableDiff.builder().tableName("orders").kind(DiffKind.MODIFIED);
        differ.diff(source.build(), target.build(), builder);
        return builder.build();
    }

    @Test
    @DisplayName("A foreign key only in the source is new")
    void newForeignKey() {
        TableDiff diff = run(foreignKey("fk_customer", "customer_id", "customers", "id"), null);

        assertThat(diff.getNewForeignKeys()).extracting(ForeignKeyModel::getName).containsExactly("fk_customer");
        assertThat(diff.getRemovedForeignKeys()).isEmpty();
    }

    @Test
    @DisplayName("A foreign key only in the target is removed")
    void removedForeignKey() {
        TableDiff diff = run(null, foreignKey("fk_customer", "customer_id", "customers", "id"));

        assertThat(diff.getRemovedForeignKeys()).extracting(ForeignKeyModel::getName).containsExactly("fk_customer");
    }

    @Test
    @DisplayName("Referenced table and rule changes make a foreign key modified")
    void modifiedForeignKey() {
        ForeignKeyModel target = foreignKey("fk_customer", "customer_id", "customers", "id");
        ForeignKeyModel source = target.toBuilder()
                .referencedTable("clients")
                .onDelete(ReferentialAction.CASCADE)
                .build();

        TableDiff diff = run(source, target);

        assertThat(diff.getModifiedForeignKeys()).singleElement().satisfies(change ->
                assertThat(change.getDetails()).containsExactly(
                        "referenced table: customers -> clients",
                        "on delete: RESTRICT -> CASCADE"));
    }

    @Test
    @DisplayName("Referenced table names are compared ignoring case")
    void referencedTableCase() {
        ForeignKeyModel target = foreignKey("fk_customer", "customer_id", "customers", "id");
        ForeignKeyModel source = foreignKey("FK_CUSTOMER", "customer_id", "Customers", "ID");

        assertThat(run(source, target).hasSubDiffs()).isFalse();
    }
}
