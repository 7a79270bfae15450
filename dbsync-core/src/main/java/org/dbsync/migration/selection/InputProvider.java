package org.dbsync.migration.selection;

import org.dbsync.migration.TableSummary;

/**
 * Supplies one raw choice token for the table being presented. Blocks until
 * the token is available.
 */
@FunctionalInterface
public interface InputProvider {
    String nextToken(TableSummary summary);
}
