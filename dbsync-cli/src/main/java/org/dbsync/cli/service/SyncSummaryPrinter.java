package org.dbsync.cli.service;

import org.dbsync.migration.ClassifiedDiffs;
import org.dbsync.migration.GenerationResult;
import org.dbsync.migration.ReportOnlyChange;
import org.dbsync.migration.SkippedTable;
import org.dbsync.model.Decision;
import org.dbsync.model.SyncAction;
import org.dbsync.model.TableDiff;

import java.io.PrintWriter;
import java.text.NumberFormat;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text reports printed around the decision loop.
 */
public class SyncSummaryPrinter {
    static final int IDENTICAL_LIMIT = 10;
    static final int PREVIEW_LIMIT = 10;

    private static final String RULE = "=".repeat(80);

    private final PrintWriter out;
    private final NumberFormat numbers = NumberFormat.getIntegerInstance(Locale.US);

    public SyncSummaryPrinter(PrintWriter out) {
        this.out = out;
    }

    public void printAnalysis(ClassifiedDiffs classified) {
        banner("DATABASE DIFFERENCES ANALYSIS");

        if (!classified.getNewTables().isEmpty()) {
            out.printf("%nNEW TABLES (%d tables):%n", classified.getNewTables().size());
            out.println("   (Exist only in source database)");
            classified.getNewTables().forEach(d ->
                    out.printf("   * %s (%s records)%n", d.getTableName(), rows(d.getSourceRowCount())));
        }

        if (!classified.getRemovedTables().isEmpty()) {
            out.printf("%nTABLES ONLY IN TARGET (%d tables, report only):%n", classified.getRemovedTables().size());
            classified.getRemovedTables().forEach(d ->
                    out.printf("   * %s (%s records)%n", d.getTableName(), rows(d.getTargetRowCount())));
        }

        if (!classified.getModifiedTables().isEmpty()) {
            out.printf("%nMODIFIED TABLES (%d tables):%n", classified.getModifiedTables().size());
            out.println("   (Structural differences detected)");
            for (TableDiff d : classified.getModifiedTables()) {
                out.printf("   * %s (source: %s -> target: %s records)%n",
                        d.getTableName(), rows(d.getSourceRowCount()), rows(d.getTargetRowCount()));
                changeLine("New columns", d.getNewColumns().stream().map(c -> c.getName()).toList());
                changeLine("Removed columns", d.getRemovedColumns().stream().map(c -> c.getName()).toList());
                changeLine("Modified columns", d.getModifiedColumns().stream().map(TableDiff.ColumnChange::getName).toList());
                int indexChanges = d.getNewIndexes().size() + d.getRemovedIndexes().size() + d.getModifiedIndexes().size();
                if (indexChanges > 0) {
                    out.printf("     -> Index changes: %d%n", indexChanges);
                }
                int fkChanges = d.getNewForeignKeys().size() + d.getRemovedForeignKeys().size() + d.getModifiedForeignKeys().size();
                if (fkChanges > 0) {
                    out.printf("     -> Foreign key changes: %d%n", fkChanges);
                }
            }
        }

        List<TableDiff> identical = classified.getIdenticalTables();
        if (!identical.isEmpty()) {
            out.printf("%nIDENTICAL TABLES (%d tables):%n", identical.size());
            identical.stream().limit(IDENTICAL_LIMIT).forEach(d -> out.println("   * " + d.getTableName()));
            if (identical.size() > IDENTICAL_LIMIT) {
                out.printf("   * ... and %d more tables%n", identical.size() - IDENTICAL_LIMIT);
            }
        }
        out.flush();
    }

    /**
     * Lists tables left out of the comparison: malformed on either side, or
     * failing a component differ.
     */
    public void printExcluded(List<SkippedTable> excluded) {
        if (!excluded.isEmpty()) {
            out.printf("%nEXCLUDED TABLES (%d tables, not compared):%n", excluded.size());
            excluded.forEach(t -> out.println("   * " + t.getTableName() + " - " + t.getReason()));
        }
        out.flush();
    }

    public void printSelection(List<Decision> decisions) {
        banner("SELECTION SUMMARY");
        selectionGroup("STRUCTURE ONLY", decisions, SyncAction.STRUCTURE_ONLY);
        selectionGroup("STRUCTURE + DATA", decisions, SyncAction.STRUCTURE_AND_DATA);
        selectionGroup("SKIPPED TABLES", decisions, SyncAction.SKIP);
        out.flush();
    }

    public void printPreview(GenerationResult result) {
        List<String> statements = result.getStatements();
        out.printf("%nSQL preview (first %d of %d statements):%n", Math.min(PREVIEW_LIMIT, statements.size()), statements.size());
        statements.stream().limit(PREVIEW_LIMIT).forEach(s -> out.println("   " + s.replace("\n", "\n   ")));
        if (statements.size() > PREVIEW_LIMIT) {
            out.printf("   ... and %d more statements%n", statements.size() - PREVIEW_LIMIT);
        }
        out.flush();
    }

    public void printFinalSummary(GenerationResult result) {
        banner("FINAL SUMMARY");

        out.printf("%nSkipped by user choice (%d):%n", result.getSkippedByUser().size());
        result.getSkippedByUser().forEach(t -> out.println("   * " + t + " - will remain divergent"));

        out.printf("%nSkipped due to error (%d):%n", result.getSkippedWithError().size());
        for (SkippedTable skipped : result.getSkippedWithError()) {
            out.println("   * " + skipped.getTableName() + " - " + skipped.getReason());
        }

        out.printf("%nReported but never auto-applied (%d):%n", result.getReportOnly().size());
        for (ReportOnlyChange change : result.getReportOnly()) {
            out.println("   * " + change);
        }

        if (!result.getGuidance().isEmpty()) {
            out.printf("%nGuidance:%n");
            result.getGuidance().forEach(g -> out.println("   * " + g));
        }
        out.flush();
    }

    private void selectionGroup(String title, List<Decision> decisions, SyncAction action) {
        List<String> tables = decisions.stream()
                .filter(d -> d.getAction() == action)
                .map(Decision::getTableName)
                .toList();
        if (!tables.isEmpty()) {
            out.printf("%n%s (%d tables):%n", title, tables.size());
            tables.forEach(t -> out.println("   * " + t));
        }
    }

    private void changeLine(String label, List<String> names) {
        if (!names.isEmpty()) {
            out.printf("     -> %s: %s%n", label, String.join(", ", names));
        }
    }

    private void banner(String title) {
        out.println();
        out.println(RULE);
        out.println(title);
        out.println(RULE);
    }

    private String rows(Long count) {
        return count == null ? "0" : numbers.format(count);
    }
}
