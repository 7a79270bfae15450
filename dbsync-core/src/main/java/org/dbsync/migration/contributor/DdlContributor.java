package org.dbsync.migration.contributor;

import org.dbsync.migration.spi.dialect.DdlDialect;

import java.util.List;

/**
 * Emits complete statements against an existing table.
 */
public interface DdlContributor extends SqlContributor {
    void contribute(List<String> statements, DdlDialect dialect);
}
