package org.dbsync.migration;

import lombok.Getter;

import java.util.List;

/**
 * The tables to create reference each other in a cycle, so no CREATE TABLE
 * order satisfies every inline foreign key.
 */
@Getter
public class DependencyCycleException extends RuntimeException {
    private final List<List<String>> cycles;

    public DependencyCycleException(List<List<String>> cycles) {
        super("Foreign key cycle between new tables: " + cycles);
        this.cycles = List.copyOf(cycles);
    }
}
