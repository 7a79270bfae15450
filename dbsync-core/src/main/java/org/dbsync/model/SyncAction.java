package org.dbsync.model;

public enum SyncAction {
    STRUCTURE_ONLY("Structure only"),
    STRUCTURE_AND_DATA("Structure + data"),
    SKIP("Skipped");

    private final String label;

    SyncAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean includesStructure() {
        return this != SKIP;
    }
}
