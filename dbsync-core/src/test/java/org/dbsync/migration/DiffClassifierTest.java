package org.dbsync.migration;

import org.dbsync.migration.differs.SchemaDiffer;
import org.dbsync.model.TableDiff;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.dbsync.testing.SchemaFixtures.column;
import static org.dbsync.testing.SchemaFixtures.snapshot;
import static org.dbsync.testing.SchemaFixtures.table;

class DiffClassifierTest {

    private final DiffClassifier classifier = new DiffClassifier();

    @Test
    @DisplayName("Diffs are partitioned by kind and each table gets a row delta")
    void partitions() {
        List<TableDiff> diffs = new SchemaDiffer().diff(
                snapshot("s",
                        table("a_new").rowCount(100).build(),
                        table("b_same").rowCount(30).build(),
                        table("c_changed").column(column("x", 2, "int")).rowCount(10).build()),
                snapshot("t",
                        table("b_same").rowCount(50).build(),
                        table("c_changed").rowCount(4).build(),
                        table("d_gone").rowCount(7).build()));

        ClassifiedDiffs classified = classifier.classify(diffs);

        assertThat(classified.getNewTables()).extracting(TableDiff::getTableName).containsExactly("a_new");
        assertThat(classified.getIdenticalTables()).extracting(TableDiff::getTableName).containsExactly("b_same");
        assertThat(classified.getModifiedTables()).extracting(TableDiff::getTableName).containsExactly("c_changed");
        assertThat(classified.getRemovedTables()).extracting(TableDiff::getTableName).containsExactly("d_gone");
        assertThat(classified.totalTables()).isEqualTo(4);
        assertThat(classified.hasChanges()).isTrue();

        assertThat(classified.rowDelta("a_new")).isEqualTo(100L);
        assertThat(classified.rowDelta("b_same")).isEqualTo(-20L);
        assertThat(classified.rowDelta("c_changed")).isEqualTo(6L);
        assertThat(classified.rowDelta("d_gone")).isEqualTo(-7L);
    }

    @Test
    @DisplayName("Only identical tables means nothing to synchronize")
    void nothingToDo() {
        List<TableDiff> diffs = new SchemaDiffer().diff(
                snapshot("s", table("t").build()),
                snapshot("t", table("t").build()));

        assertThat(classifier.classify(diffs).hasChanges()).isFalse();
        assertThat(classifier.classify(List.of()).totalTables()).isZero();
    }

    @Test
    void nullDiffsRejected() {
        assertThatThrownBy(() -> classifier.classify(null)).isInstanceOf(NullPointerException.class);
    }
}
