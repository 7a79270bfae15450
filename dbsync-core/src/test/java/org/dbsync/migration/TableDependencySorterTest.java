package org.dbsync.migration;

import org.dbsync.model.TableModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.dbsync.testing.SchemaFixtures.column;
import static org.dbsync.testing.SchemaFixtures.foreignKey;
import static org.dbsync.testing.SchemaFixtures.table;

class TableDependencySorterTest {

    private final TableDependencySorter sorter = new TableDependencySorter();

    private static TableModel referencing(String name, String referenced) {
        return table(name)
                .column(column(referenced + "_id", 2, "int(11)"))
                .foreignKey(foreignKey("fk_" + name + "_" + referenced, referenced + "_id", referenced, "id"))
                .build();
    }

    private static List<String> names(DependencyOrder order) {
        return order.getTables().stream().map(TableModel::getName).toList();
    }

    @Test
    @DisplayName("Referenced tables come first, independent tables alphabetically")
    void referencedFirst() {
        DependencyOrder order = sorter.strictOrder(List.of(
                referencing("orders", "customers"),
                referencing("order_items", "orders"),
                table("customers").build(),
                table("audit").build()));

        assertThat(names(order)).containsExactly("audit", "customers", "orders", "order_items");
        assertThat(order.getDeferred()).isEmpty();
    }

    @Test
    @DisplayName("References to tables outside the set and self references are ignored")
    void externalAndSelfReferences() {
        TableModel employees = table("employees")
                .column(column("manager_id", 2, "int(11)"))
                .foreignKey(foreignKey("fk_manager", "manager_id", "employees", "id"))
                .build();

        DependencyOrder order = sorter.strictOrder(List.of(referencing("orders", "existing_table"), employees));

        assertThat(names(order)).containsExactly("employees", "orders");
    }

    @Test
    @DisplayName("A cycle is rejected by the strict order")
    void strictRejectsCycle() {
        List<TableModel> tables = List.of(referencing("a", "b"), referencing("b", "a"));

        assertThatThrownBy(() -> sorter.strictOrder(tables))
                .isInstanceOf(DependencyCycleException.class)
                .satisfies(e -> assertThat(((DependencyCycleException) e).getCycles())
                        .containsExactly(List.of("a", "b")));
    }

    @Test
    @DisplayName("Deferral moves every foreign key inside a cycle out of CREATE TABLE")
    void deferralBreaksCycle() {
        DependencyOrder order = sorter.orderWithDeferral(List.of(
                referencing("b", "a"), referencing("a", "b"), referencing("c", "a")));

        assertThat(names(order)).containsExactly("a", "b", "c");
        assertThat(order.getDeferred())
                .extracting(d -> d.getTableName() + ":" + d.getForeignKey().getName())
                .containsExactlyInAnyOrder("a:fk_a_b", "b:fk_b_a");
        assertThat(order.getCycles()).containsExactly(List.of("a", "b"));
        assertThat(order.isDeferred("A", foreignKey("FK_A_B", "b_id", "b", "id"))).isTrue();
        assertThat(order.deferredFor("c")).isEmpty();
    }
}
