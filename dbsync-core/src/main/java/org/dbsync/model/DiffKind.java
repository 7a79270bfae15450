package org.dbsync.model;

public enum DiffKind {
    /** Present only in the source. */
    NEW,
    /** Present only in the target. */
    REMOVED,
    MODIFIED,
    IDENTICAL
}
