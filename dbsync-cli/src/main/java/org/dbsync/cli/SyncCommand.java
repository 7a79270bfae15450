package org.dbsync.cli;

import org.dbsync.cli.service.ComparisonService;
import org.dbsync.cli.service.ConsoleInputProvider;
import org.dbsync.cli.service.ConsolePresenter;
import org.dbsync.cli.service.IntrospectionException;
import org.dbsync.cli.service.SyncSummaryPrinter;
import org.dbsync.migration.GenerationResult;
import org.dbsync.migration.GeneratorOptions;
import org.dbsync.migration.MigrationGenerator;
import org.dbsync.migration.output.ScriptInfo;
import org.dbsync.migration.output.SqlScriptHandler;
import org.dbsync.migration.selection.SelectionCancelledException;
import org.dbsync.migration.selection.SelectionStateMachine;
import org.dbsync.model.Decision;
import org.dbsync.options.DbSyncOptions;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import static org.dbsync.options.DbSyncOptions.Connection.key;

/**
 * Interactive synchronization: compare, ask per table, generate the scripts.
 */
@CommandLine.Command(
        name = "sync",
        mixinStandardHelpOptions = true,
        description = "Walks through every new and modified table and generates the synchronization scripts."
)
public class SyncCommand implements Callable<Integer> {

    @CommandLine.Mixin
    ProfileOptions profileOptions;

    @CommandLine.Mixin
    SnapshotOptions snapshotOptions;

    @CommandLine.Option(names = "--threshold", description = "Row count above which an external bulk export is recommended (default: 50000)")
    private Long threshold;
    @CommandLine.Option(names = "--out", description = "Directory for the generated scripts (default: configuration or working directory)")
    private Path outputDir;
    @CommandLine.Option(names = "--name", description = "Base name of the generated files (default: sync_database)")
    private String baseName;
    @CommandLine.Option(names = "--dry-run", description = "Print the preview and summary without writing any file")
    private boolean dryRun;

    private final InputStream in;
    private final PrintStream out;
    private final ComparisonService comparisonService;

    public SyncCommand() {
        this(System.in, System.out, new ComparisonService());
    }

    SyncCommand(InputStream in, PrintStream out, ComparisonService comparisonService) {
        this.in = in;
        this.out = out;
        this.comparisonService = comparisonService;
    }

    @Override
    public Integer call() {
        try {
            Map<String, String> config = profileOptions.loadConfiguration();
            long rowCountThreshold = resolveThreshold(config);

            ComparisonService.Comparison comparison = comparisonService.compare(
                    config, snapshotOptions.sourceSnapshot, snapshotOptions.targetSnapshot);

            PrintWriter writer = new PrintWriter(out, true);
            SyncSummaryPrinter printer = new SyncSummaryPrinter(writer);
            printer.printAnalysis(comparison.getClassified());
            printer.printExcluded(comparison.getExcludedTables());

            if (!comparison.getClassified().hasChanges()) {
                out.println();
                out.println(comparison.getExcludedTables().isEmpty()
                        ? "Databases are already synchronized!"
                        : "No applicable changes; " + comparison.getExcludedTables().size()
                                + " table(s) could not be compared.");
                return 0;
            }

            List<Decision> decisions;
            try {
                BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
                SelectionStateMachine selection = new SelectionStateMachine(
                        comparison.getClassified(), new ConsolePresenter(writer));
                decisions = selection.run(new ConsoleInputProvider(reader, writer));
            } catch (SelectionCancelledException e) {
                out.println();
                out.println("Operation cancelled by user.");
                return 0;
            }
            printer.printSelection(decisions);

            GeneratorOptions generatorOptions = GeneratorOptions.builder()
                    .targetDatabase(comparison.getTarget().getDatabaseName())
                    .sourceDatabase(comparison.getSource().getDatabaseName())
                    .sourceHost(config.get(key(DbSyncOptions.Connection.SOURCE, DbSyncOptions.Connection.HOST)))
                    .sourceUser(config.get(key(DbSyncOptions.Connection.SOURCE, DbSyncOptions.Connection.USER)))
                    .build();
            GenerationResult result = new MigrationGenerator(generatorOptions)
                    .generate(comparison.getDiffs(), comparison.getExcludedTables(), decisions, rowCountThreshold);

            printer.printPreview(result);
            printer.printFinalSummary(result);

            if (dryRun) {
                out.println();
                out.println("Dry run: no files written.");
                return 0;
            }

            ScriptInfo info = ScriptInfo.builder()
                    .sourceDatabase(comparison.getSource().getDatabaseName())
                    .targetDatabase(comparison.getTarget().getDatabaseName())
                    .baseName(resolveBaseName(config))
                    .build();
            List<Path> files = new SqlScriptHandler().handle(result, info, resolveOutputDir(config));

            out.println();
            out.println("Generated files:");
            files.forEach(f -> out.println("   * " + f));
            out.println();
            out.println("Review the scripts before running them against " + info.getTargetDatabase() + ".");
            return 0;

        } catch (IntrospectionException | IllegalArgumentException e) {
            System.err.println("Synchronization failed: " + e.getMessage());
            return 1;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("Failed to write scripts: " + e.getMessage());
            return 1;
        }
    }

    /**
     * CLI value first, then configuration, then the built-in default.
     */
    long resolveThreshold(Map<String, String> config) {
        if (threshold != null) {
            return threshold;
        }
        String configured = config.get(DbSyncOptions.Sync.ROW_COUNT_THRESHOLD_KEY);
        if (configured != null) {
            try {
                return Long.parseLong(configured.trim());
            } catch (NumberFormatException e) {
                System.err.println("Warning: Invalid rowCountThreshold in configuration: " + configured +
                        ". Using default: " + DbSyncOptions.Sync.ROW_COUNT_THRESHOLD_DEFAULT);
            }
        }
        return DbSyncOptions.Sync.ROW_COUNT_THRESHOLD_DEFAULT;
    }

    private Path resolveOutputDir(Map<String, String> config) {
        if (outputDir != null) {
            return outputDir;
        }
        return Path.of(config.getOrDefault(DbSyncOptions.Output.DIRECTORY_KEY, DbSyncOptions.Output.DIRECTORY_DEFAULT));
    }

    private String resolveBaseName(Map<String, String> config) {
        if (baseName != null && !baseName.isBlank()) {
            return baseName.trim();
        }
        return config.getOrDefault(DbSyncOptions.Output.BASE_NAME_KEY, DbSyncOptions.Output.BASE_NAME_DEFAULT);
    }
}
