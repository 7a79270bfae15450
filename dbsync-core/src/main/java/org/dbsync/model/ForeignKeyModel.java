package org.dbsync.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ForeignKeyModel {
    String name;
    @Singular("column") List<String> columns;
    String referencedTable;
    @Singular("referencedColumn") List<String> referencedColumns;
    @Builder.Default ReferentialAction onDelete = ReferentialAction.RESTRICT;
    @Builder.Default ReferentialAction onUpdate = ReferentialAction.RESTRICT;
}
