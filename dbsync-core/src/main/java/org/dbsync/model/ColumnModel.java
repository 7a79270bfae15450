package org.dbsync.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ColumnModel {
    String name;
    int ordinalPosition;
    String type;
    @Builder.Default boolean nullable = true;
    String defaultValue;
    @Builder.Default String extra = "";
}
