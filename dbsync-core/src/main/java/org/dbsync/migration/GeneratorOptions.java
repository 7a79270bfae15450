package org.dbsync.migration;

import lombok.Builder;
import lombok.Value;

/**
 * Script-level settings for {@link MigrationGenerator}. The source fields only
 * feed the export command suggested in data guidance and may be left unset.
 */
@Value
@Builder
public class GeneratorOptions {
    String targetDatabase;
    String sourceHost;
    String sourceUser;
    String sourceDatabase;

    public boolean hasExportHint() {
        return sourceHost != null && sourceUser != null && sourceDatabase != null;
    }
}
