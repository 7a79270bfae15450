package org.dbsync.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class Decision {
    @NonNull String tableName;
    @NonNull SyncAction action;

    public static Decision of(String tableName, SyncAction action) {
        return new Decision(tableName, action);
    }
}
