package org.dbsync.cli;

import org.dbsync.cli.service.ComparisonService;
import org.dbsync.cli.service.ConsolePresenter;
import org.dbsync.cli.service.IntrospectionException;
import org.dbsync.cli.service.SyncSummaryPrinter;
import org.dbsync.model.TableDiff;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Prints the differences between source and target without generating anything.
 */
@CommandLine.Command(
        name = "compare",
        mixinStandardHelpOptions = true,
        description = "Analyzes the differences between the source and target schemas."
)
public class CompareCommand implements Callable<Integer> {

    @CommandLine.Mixin
    ProfileOptions profileOptions;

    @CommandLine.Mixin
    SnapshotOptions snapshotOptions;

    @CommandLine.Option(names = "--details", description = "Also print the full differences of every new and modified table")
    private boolean details;

    private final ComparisonService comparisonService;

    public CompareCommand() {
        this(new ComparisonService());
    }

    CompareCommand(ComparisonService comparisonService) {
        this.comparisonService = comparisonService;
    }

    @Override
    public Integer call() {
        try {
            Map<String, String> config = profileOptions.loadConfiguration();
            ComparisonService.Comparison comparison = comparisonService.compare(
                    config, snapshotOptions.sourceSnapshot, snapshotOptions.targetSnapshot);

            PrintWriter out = new PrintWriter(System.out, true);
            SyncSummaryPrinter printer = new SyncSummaryPrinter(out);
            printer.printAnalysis(comparison.getClassified());
            printer.printExcluded(comparison.getExcludedTables());

            if (!comparison.getClassified().hasChanges()) {
                System.out.println();
                System.out.println(comparison.getExcludedTables().isEmpty()
                        ? "Databases are already synchronized!"
                        : "No applicable changes; " + comparison.getExcludedTables().size()
                                + " table(s) could not be compared.");
                return 0;
            }

            if (details) {
                ConsolePresenter presenter = new ConsolePresenter(out);
                comparison.getClassified().getNewTables().forEach(presenter::presentDetails);
                for (TableDiff diff : comparison.getClassified().getModifiedTables()) {
                    presenter.presentDetails(diff);
                }
            }
            return 0;
        } catch (IntrospectionException | IllegalArgumentException e) {
            System.err.println("Comparison failed: " + e.getMessage());
            return 1;
        }
    }
}
