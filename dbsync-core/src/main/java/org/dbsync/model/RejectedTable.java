package org.dbsync.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RejectedTable {
    String tableName;
    String reason;
}
