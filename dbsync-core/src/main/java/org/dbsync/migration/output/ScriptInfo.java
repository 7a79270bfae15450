package org.dbsync.migration.output;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Header information for generated script files.
 */
@Value
@Builder
public class ScriptInfo {
    String sourceDatabase;
    String targetDatabase;
    @Builder.Default String baseName = "sync_database";
    @Builder.Default LocalDateTime generatedAt = LocalDateTime.now();
}
