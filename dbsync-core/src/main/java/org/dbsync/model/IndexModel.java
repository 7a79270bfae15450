package org.dbsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class IndexModel {
    public static final String PRIMARY = "PRIMARY";

    String name;
    boolean unique;
    @Singular("column") List<String> columns;

    @JsonIgnore
    public boolean isPrimary() {
        return PRIMARY.equalsIgnoreCase(name);
    }
}
