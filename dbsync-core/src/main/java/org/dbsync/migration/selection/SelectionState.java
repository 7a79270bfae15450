package org.dbsync.migration.selection;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.dbsync.model.SyncAction;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SelectionState {
    public enum Phase { IDLE, PRESENTING, RECORDED, DONE, CANCELLED }

    Phase phase;
    String tableName;
    SyncAction action;

    public static SelectionState idle() {
        return new SelectionState(Phase.IDLE, null, null);
    }

    public static SelectionState presenting(String tableName) {
        return new SelectionState(Phase.PRESENTING, tableName, null);
    }

    public static SelectionState recorded(String tableName, SyncAction action) {
        return new SelectionState(Phase.RECORDED, tableName, action);
    }

    public static SelectionState done() {
        return new SelectionState(Phase.DONE, null, null);
    }

    public static SelectionState cancelled(String tableName) {
        return new SelectionState(Phase.CANCELLED, tableName, null);
    }

    public boolean isTerminal() {
        return phase == Phase.DONE || phase == Phase.CANCELLED;
    }
}
