package org.dbsync.migration;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GenerationResult {
    /** Ordered DDL; the last entry always re-enables foreign key checks. */
    @Singular List<String> statements;
    @Singular("guidanceLine") List<String> guidance;
    @Singular("userSkip") List<String> skippedByUser;
    @Singular("errorSkip") List<SkippedTable> skippedWithError;
    @Singular("reportOnlyChange") List<ReportOnlyChange> reportOnly;

    /** Statements other than the database selector and the foreign key check toggles. */
    int changeCount;

    public boolean hasStructureChanges() {
        return changeCount > 0;
    }
}
