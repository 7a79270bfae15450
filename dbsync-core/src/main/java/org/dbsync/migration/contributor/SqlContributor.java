package org.dbsync.migration.contributor;

public interface SqlContributor {
    /** Lower runs first; contributors with equal priority keep insertion order. */
    int priority();
}
