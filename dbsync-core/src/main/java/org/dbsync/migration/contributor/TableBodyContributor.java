package org.dbsync.migration.contributor;

import org.dbsync.migration.spi.dialect.DdlDialect;

/**
 * Appends definition lines inside a CREATE TABLE body. Every line ends with
 * ",\n"; the builder trims the last comma.
 */
public interface TableBodyContributor extends SqlContributor {
    void contribute(StringBuilder sb, DdlDialect dialect);
}
