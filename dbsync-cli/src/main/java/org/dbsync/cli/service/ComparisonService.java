package org.dbsync.cli.service;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.dbsync.migration.ClassifiedDiffs;
import org.dbsync.migration.DiffClassifier;
import org.dbsync.migration.SkippedTable;
import org.dbsync.migration.differs.SchemaComparison;
import org.dbsync.migration.differs.SchemaDiffer;
import org.dbsync.model.SnapshotModel;
import org.dbsync.model.TableDiff;
import org.dbsync.options.DbSyncOptions;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Loads both snapshots, from JSON files or live connections, and diffs them.
 */
@Slf4j
public class ComparisonService {

    @Value
    public static class Comparison {
        SnapshotModel source;
        SnapshotModel target;
        List<TableDiff> diffs;
        /** Tables left out of the diff; they surface as skipped due to error. */
        List<SkippedTable> excludedTables;
        ClassifiedDiffs classified;
    }

    private final JdbcSnapshotIntrospector introspector;
    private final SnapshotIoService snapshotIo;
    private final SnapshotLoader loader;
    private final SchemaDiffer differ;
    private final DiffClassifier classifier;

    public ComparisonService() {
        this(new JdbcSnapshotIntrospector());
    }

    public ComparisonService(JdbcSnapshotIntrospector introspector) {
        this.introspector = introspector;
        this.snapshotIo = new SnapshotIoService();
        this.loader = new SnapshotLoader();
        this.differ = new SchemaDiffer();
        this.classifier = new DiffClassifier();
    }

    /**
     * @param config flattened configuration, used for any side without a snapshot file
     * @param sourceSnapshot source snapshot JSON, or null to introspect the configured source
     * @param targetSnapshot target snapshot JSON, or null to introspect the configured target
     * @throws IllegalArgumentException when a side has neither a snapshot file nor a connection
     * @throws IntrospectionException when a side cannot be loaded
     */
    public Comparison compare(Map<String, String> config, Path sourceSnapshot, Path targetSnapshot) {
        Callable<SnapshotModel> source = side(config, DbSyncOptions.Connection.SOURCE, sourceSnapshot);
        Callable<SnapshotModel> target = side(config, DbSyncOptions.Connection.TARGET, targetSnapshot);

        SnapshotLoader.Snapshots snapshots = loader.load(source, target);
        SchemaComparison schema = differ.compare(snapshots.getSource(), snapshots.getTarget());
        List<TableDiff> diffs = schema.getDiffs();
        log.debug("{} table diffs and {} excluded tables between {} and {}", diffs.size(),
                schema.getExcludedTables().size(),
                snapshots.getSource().getDatabaseName(), snapshots.getTarget().getDatabaseName());
        return new Comparison(snapshots.getSource(), snapshots.getTarget(), diffs,
                schema.getExcludedTables(), classifier.classify(diffs));
    }

    private Callable<SnapshotModel> side(Map<String, String> config, String side, Path snapshot) {
        if (snapshot != null) {
            return () -> snapshotIo.read(snapshot);
        }
        ConnectionSettings settings = ConnectionSettings.fromConfiguration(config, side);
        return () -> introspector.introspect(settings);
    }
}
