package org.dbsync.cli;

import org.dbsync.cli.service.ConnectionSettings;
import org.dbsync.cli.service.IntrospectionException;
import org.dbsync.cli.service.JdbcSnapshotIntrospector;
import org.dbsync.cli.service.SnapshotIoService;
import org.dbsync.model.RejectedTable;
import org.dbsync.model.SnapshotModel;
import org.dbsync.options.DbSyncOptions;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Introspects one configured side and stores it as snapshot JSON.
 */
@CommandLine.Command(
        name = "snapshot",
        mixinStandardHelpOptions = true,
        description = "Reads the schema of one side and writes it as a snapshot JSON file."
)
public class SnapshotCommand implements Callable<Integer> {

    @CommandLine.Mixin
    ProfileOptions profileOptions;

    @CommandLine.Option(names = "--side", description = "Which configured connection to read: source or target", defaultValue = "source")
    private String side;
    @CommandLine.Option(names = "--out", required = true, description = "Snapshot JSON file to write")
    private Path outputFile;

    private final JdbcSnapshotIntrospector introspector;

    public SnapshotCommand() {
        this(new JdbcSnapshotIntrospector());
    }

    SnapshotCommand(JdbcSnapshotIntrospector introspector) {
        this.introspector = introspector;
    }

    @Override
    public Integer call() {
        String normalizedSide = side == null ? "" : side.trim().toLowerCase(Locale.ROOT);
        if (!normalizedSide.equals(DbSyncOptions.Connection.SOURCE) && !normalizedSide.equals(DbSyncOptions.Connection.TARGET)) {
            System.err.println("Invalid side '" + side + "'. Expected source or target.");
            return 2;
        }

        try {
            Map<String, String> config = profileOptions.loadConfiguration();
            ConnectionSettings settings = ConnectionSettings.fromConfiguration(config, normalizedSide);
            SnapshotModel snapshot = introspector.introspect(settings);
            new SnapshotIoService().write(snapshot, outputFile);

            for (RejectedTable rejected : snapshot.getRejectedTables()) {
                System.err.println("Warning: table '" + rejected.getTableName() + "' ignored: " + rejected.getReason());
            }
            System.out.println("Snapshot of " + settings.describe() + " (" + snapshot.getTables().size()
                    + " tables) written to " + outputFile);
            return 0;
        } catch (IntrospectionException | IllegalArgumentException e) {
            System.err.println("Snapshot failed: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Failed to write snapshot: " + e.getMessage());
            return 1;
        }
    }
}
