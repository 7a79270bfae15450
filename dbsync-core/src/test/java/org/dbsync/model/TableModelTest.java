package org.dbsync.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.dbsync.testing.SchemaFixtures.column;
import static org.dbsync.testing.SchemaFixtures.index;
import static org.dbsync.testing.SchemaFixtures.table;

class TableModelTest {

    @Test
    @DisplayName("A well-formed table passes validation")
    void validTable() {
        TableModel t = table("users").column(column("email", 2, "varchar(255)")).build();
        assertThatCode(t::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("A table without columns is malformed")
    void noColumns() {
        TableModel t = TableModel.builder().name("empty").build();
        assertThatThrownBy(t::validate)
                .isInstanceOf(MalformedMetadataException.class)
                .hasMessageContaining("no columns")
                .extracting(e -> ((MalformedMetadataException) e).getTableName())
                .isEqualTo("empty");
    }

    @Test
    @DisplayName("Column names are unique regardless of case")
    void duplicateColumnNameIgnoringCase() {
        TableModel t = table("users").column(column("ID", 2, "int")).build();
        assertThatThrownBy(t::validate)
                .isInstanceOf(MalformedMetadataException.class)
                .hasMessageContaining("duplicate column name");
    }

    @Test
    @DisplayName("Ordinal positions must form 1..N without gaps")
    void ordinalGap() {
        TableModel t = table("users").column(column("email", 3, "varchar(255)")).build();
        assertThatThrownBy(t::validate)
                .isInstanceOf(MalformedMetadataException.class)
                .hasMessageContaining("expected 2 but found 3");
    }

    @Test
    @DisplayName("Duplicate ordinal positions are rejected")
    void duplicateOrdinal() {
        TableModel t = table("users").column(column("email", 1, "varchar(255)")).build();
        assertThatThrownBy(t::validate)
                .isInstanceOf(MalformedMetadataException.class)
                .hasMessageContaining("duplicate ordinal position 1");
    }

    @Test
    @DisplayName("Index names are unique within a table")
    void duplicateIndexName() {
        TableModel t = table("users")
                .column(column("email", 2, "varchar(255)"))
                .index(index("idx_email", false, "email"))
                .index(index("IDX_EMAIL", true, "email"))
                .build();
        assertThatThrownBy(t::validate).hasMessageContaining("duplicate index name");
    }

    @Test
    @DisplayName("Column lookup ignores case and ordinal lookup finds the exact position")
    void lookups() {
        TableModel t = table("users").column(column("Email", 2, "varchar(255)")).build();

        assertThat(t.findColumn("email")).isPresent();
        assertThat(t.hasColumn(" EMAIL ")).isTrue();
        assertThat(t.hasColumn(null)).isFalse();
        assertThat(t.findColumnAt(2)).map(ColumnModel::getName).hasValue("Email");
        assertThat(t.findColumnAt(3)).isEmpty();
    }

    @Test
    @DisplayName("Columns come back in ordinal order whatever the insertion order")
    void ordinalOrder() {
        TableModel t = TableModel.builder()
                .name("t")
                .column(column("c", 3, "int"))
                .column(column("a", 1, "int"))
                .column(column("b", 2, "int"))
                .build();
        assertThat(t.getColumnsInOrdinalOrder()).extracting(ColumnModel::getName).containsExactly("a", "b", "c");
    }
}
