package org.dbsync.cli.service;

import org.dbsync.migration.TableSummary;
import org.dbsync.migration.selection.DiffPresenter;
import org.dbsync.model.ColumnModel;
import org.dbsync.model.Decision;
import org.dbsync.model.DiffKind;
import org.dbsync.model.ForeignKeyModel;
import org.dbsync.model.IndexModel;
import org.dbsync.model.SyncAction;
import org.dbsync.model.TableDiff;
import org.dbsync.model.TableModel;

import java.io.PrintWriter;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * Renders table summaries and full table diffs as plain text.
 */
public class ConsolePresenter implements DiffPresenter {
    private static final String RULE = "-".repeat(60);

    private final PrintWriter out;
    private final NumberFormat numbers = NumberFormat.getIntegerInstance(Locale.US);

    public ConsolePresenter(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void presentSummary(TableSummary s) {
        out.println();
        out.println(RULE);
        out.printf("[%d/%d] %s (%s)%n", s.getPosition(), s.getTotal(), s.getTableName(),
                s.getKind() == DiffKind.NEW ? "new table" : "modified table");
        out.println(RULE);
        out.printf("   Records: source %s -> target %s%n", rows(s.getSourceRowCount()), rows(s.getTargetRowCount()));
        out.printf("   Columns: +%d -%d ~%d | Indexes: +%d -%d ~%d | Foreign keys: +%d -%d ~%d%n",
                s.getNewColumns(), s.getRemovedColumns(), s.getModifiedColumns(),
                s.getNewIndexes(), s.getRemovedIndexes(), s.getModifiedIndexes(),
                s.getNewForeignKeys(), s.getRemovedForeignKeys(), s.getModifiedForeignKeys());
        if (s.isEngineChanged()) {
            out.println("   Engine differs");
        }
        if (s.isCharsetChanged()) {
            out.println("   Charset/collation differs");
        }
        out.flush();
    }

    @Override
    public void presentDetails(TableDiff diff) {
        out.println();
        out.println("TABLE DETAILS: " + diff.getTableName());
        if (diff.getKind() == DiffKind.NEW) {
            TableModel table = diff.getSourceTable();
            out.println("   New table (does not exist in target)");
            out.println("   Engine: " + orNa(table.getEngine()) + ", charset: " + orNa(table.getCharset())
                    + ", collation: " + orNa(table.getCollation()));
            out.println("   Records: " + numbers.format(table.getRowCount()));
            out.println("   Columns (" + table.getColumns().size() + "):");
            table.getColumnsInOrdinalOrder().forEach(c -> out.println("     * " + describe(c)));
        } else {
            section("New columns", diff.getNewColumns().size());
            diff.getNewColumns().forEach(c -> out.println("     * " + describe(c)));
            section("Removed columns (report only)", diff.getRemovedColumns().size());
            diff.getRemovedColumns().forEach(c -> out.println("     * " + c.getName() + ": " + c.getType()));
            section("Modified columns", diff.getModifiedColumns().size());
            diff.getModifiedColumns().forEach(change -> {
                out.println("     * " + change.getName() + ":");
                change.getDetails().forEach(d -> out.println("       - " + d));
            });
        }

        section("New indexes", diff.getNewIndexes().size());
        diff.getNewIndexes().forEach(i -> out.println("     * " + describe(i)));
        section("Removed indexes", diff.getRemovedIndexes().size());
        diff.getRemovedIndexes().forEach(i -> out.println("     * " + describe(i)));
        section("Modified indexes", diff.getModifiedIndexes().size());
        diff.getModifiedIndexes().forEach(change -> {
            out.println("     * " + change.getName() + ":");
            change.getDetails().forEach(d -> out.println("       - " + d));
        });

        section("New foreign keys", diff.getNewForeignKeys().size());
        diff.getNewForeignKeys().forEach(fk -> out.println("     * " + describe(fk)));
        section("Removed foreign keys (report only)", diff.getRemovedForeignKeys().size());
        diff.getRemovedForeignKeys().forEach(fk -> out.println("     * " + describe(fk)));
        section("Modified foreign keys (report only)", diff.getModifiedForeignKeys().size());
        diff.getModifiedForeignKeys().forEach(change -> {
            out.println("     * " + change.getName() + ":");
            change.getDetails().forEach(d -> out.println("       - " + d));
        });

        if (diff.isEngineChanged()) {
            out.println("   Engine: " + orNa(diff.getTargetTable().getEngine()) + " -> " + orNa(diff.getSourceTable().getEngine()));
        }
        if (diff.isCharsetChanged()) {
            out.println("   Charset: " + orNa(diff.getTargetTable().getCharset()) + "/" + orNa(diff.getTargetTable().getCollation())
                    + " -> " + orNa(diff.getSourceTable().getCharset()) + "/" + orNa(diff.getSourceTable().getCollation()));
        }
        if (diff.getKind() == DiffKind.MODIFIED && !diff.hasChanges()) {
            out.println("   Identical structures (difference only in data)");
        }
        out.flush();
    }

    @Override
    public void rejectInput(TableSummary summary, String message) {
        out.println("    " + message);
        out.flush();
    }

    @Override
    public void recorded(Decision decision) {
        if (decision.getAction() == SyncAction.SKIP) {
            out.println("    " + decision.getTableName() + ": Skipped");
        } else {
            out.println("    " + decision.getTableName() + ": " + decision.getAction().label());
        }
        out.flush();
    }

    private void section(String title, int count) {
        if (count > 0) {
            out.println("   " + title + " (" + count + "):");
        }
    }

    private String rows(Long count) {
        return count == null ? "-" : numbers.format(count);
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : value;
    }

    static String describe(ColumnModel c) {
        StringBuilder sb = new StringBuilder(c.getName()).append(": ").append(c.getType())
                .append(c.isNullable() ? " NULL" : " NOT NULL");
        if (c.getDefaultValue() != null) {
            sb.append(" DEFAULT ").append(c.getDefaultValue());
        }
        if (c.getExtra() != null && !c.getExtra().isBlank()) {
            sb.append(' ').append(c.getExtra());
        }
        return sb.toString();
    }

    static String describe(IndexModel i) {
        return i.getName() + (i.isUnique() ? " UNIQUE" : "") + " (" + String.join(", ", i.getColumns()) + ")";
    }

    static String describe(ForeignKeyModel fk) {
        return fk.getName() + " (" + String.join(", ", fk.getColumns()) + ") -> "
                + fk.getReferencedTable() + " (" + String.join(", ", fk.getReferencedColumns()) + ")"
                + " ON DELETE " + fk.getOnDelete().sql() + " ON UPDATE " + fk.getOnUpdate().sql();
    }
}
