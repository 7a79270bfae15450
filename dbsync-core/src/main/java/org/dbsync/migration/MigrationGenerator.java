package org.dbsync.migration;

import lombok.extern.slf4j.Slf4j;
import org.dbsync.migration.contributor.alter.ColumnModifyContributor;
import org.dbsync.migration.contributor.alter.IndexDropContributor;
import org.dbsync.migration.contributor.alter.TableOptionsContributor;
import org.dbsync.migration.contributor.create.ColumnAddContributor;
import org.dbsync.migration.contributor.create.ForeignKeyAddContributor;
import org.dbsync.migration.contributor.create.IndexAddContributor;
import org.dbsync.migration.dialect.mysql.MySqlDialect;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.ColumnModel;
import org.dbsync.model.Decision;
import org.dbsync.model.DiffKind;
import org.dbsync.model.ForeignKeyModel;
import org.dbsync.model.IndexModel;
import org.dbsync.model.SyncAction;
import org.dbsync.model.TableDiff;
import org.dbsync.model.TableModel;
import org.dbsync.model.naming.CaseNormalizer;

import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns table diffs and the operator's decisions into an ordered DDL script
 * plus data guidance.
 *
 * <p>Phases, in order:
 * <ol>
 *   <li>database selector and {@code SET FOREIGN_KEY_CHECKS = 0}</li>
 *   <li>CREATE TABLE for new tables, referenced tables first, followed by the
 *       foreign keys deferred to break reference cycles</li>
 *   <li>ALTER TABLE for modified tables (add column, modify column, drop/add
 *       index, add foreign key, table options)</li>
 *   <li>{@code SET FOREIGN_KEY_CHECKS = 1}, always last</li>
 * </ol>
 * Removed tables, removed columns and removed or changed foreign keys are
 * reported and never emitted.
 */
@Slf4j
public class MigrationGenerator {
    private final DdlDialect dialect;
    private final GeneratorOptions options;
    private final CaseNormalizer normalizer;
    private final TableDependencySorter sorter;

    public MigrationGenerator(GeneratorOptions options) {
        this(new MySqlDialect(), options);
    }

    public MigrationGenerator(DdlDialect dialect, GeneratorOptions options) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.normalizer = CaseNormalizer.lower();
        this.sorter = new TableDependencySorter(normalizer);
    }

    public GenerationResult generate(List<TableDiff> diffs, List<Decision> decisions, long rowCountThreshold) {
        return generate(diffs, List.of(), decisions, rowCountThreshold);
    }

    /**
     * @param excluded tables the comparison could not diff; they are reported as
     *                 skipped due to error and never touched
     */
    public GenerationResult generate(List<TableDiff> diffs, List<SkippedTable> excluded,
                                     List<Decision> decisions, long rowCountThreshold) {
        Objects.requireNonNull(diffs, "diffs must not be null");
        Objects.requireNonNull(excluded, "excluded must not be null");
        Objects.requireNonNull(decisions, "decisions must not be null");
        if (rowCountThreshold < 0) {
            throw new IllegalArgumentException("rowCountThreshold must not be negative: " + rowCountThreshold);
        }

        Map<String, TableDiff> diffsByKey = indexDiffs(diffs);
        Map<String, SyncAction> actions = indexDecisions(decisions, diffsByKey);

        GenerationResult.GenerationResultBuilder result = GenerationResult.builder();
        excluded.forEach(result::errorSkip);
        List<String> statements = new ArrayList<>();
        Set<String> failed = new HashSet<>();
        int framing = 0;

        if (options.getTargetDatabase() != null && !options.getTargetDatabase().isBlank()) {
            statements.add(dialect.useDatabase(options.getTargetDatabase()));
            framing++;
        }
        statements.add(dialect.foreignKeyChecks(false));
        framing++;
        Map<String, TableModel> created = tablesToCreate(diffsByKey, actions);
        try {
            createNewTables(diffsByKey, actions, created, statements, failed, result);
            alterModifiedTables(diffsByKey, actions, created, statements, failed, result);
        } finally {
            statements.add(dialect.foreignKeyChecks(true));
            framing++;
        }

        reportOnlyChanges(diffsByKey, result);
        dataGuidance(diffsByKey, actions, failed, rowCountThreshold, result);

        return result
                .statements(statements)
                .changeCount(statements.size() - framing)
                .build();
    }

    // --- new tables ---

    /** Source definitions of the new tables this run creates, keyed by normalized name. */
    private Map<String, TableModel> tablesToCreate(Map<String, TableDiff> diffs, Map<String, SyncAction> actions) {
        Map<String, TableModel> created = new TreeMap<>();
        diffs.forEach((key, diff) -> {
            if (diff.getKind() == DiffKind.NEW && actions.get(key).includesStructure()) {
                created.put(key, diff.getSourceTable());
            }
        });
        return created;
    }

    private void createNewTables(Map<String, TableDiff> diffs, Map<String, SyncAction> actions,
                                 Map<String, TableModel> created, List<String> statements, Set<String> failed,
                                 GenerationResult.GenerationResultBuilder result) {
        List<TableModel> toCreate = new ArrayList<>();
        for (Map.Entry<String, TableDiff> e : diffs.entrySet()) {
            TableDiff diff = e.getValue();
            if (diff.getKind() != DiffKind.NEW) continue;
            if (!actions.get(e.getKey()).includesStructure()) {
                result.userSkip(diff.getTableName());
                continue;
            }
            try {
                validateTable(diff.getSourceTable(), created);
                toCreate.add(diff.getSourceTable());
            } catch (RuntimeException ex) {
                recordFailure(diff.getTableName(), ex, failed, result);
            }
        }
        if (toCreate.isEmpty()) {
            return;
        }

        DependencyOrder order;
        try {
            order = sorter.strictOrder(toCreate);
        } catch (DependencyCycleException ex) {
            log.warn("{}; deferring the foreign keys inside each cycle", ex.getMessage());
            order = sorter.orderWithDeferral(toCreate);
        }

        for (TableModel table : order.getTables()) {
            try {
                final DependencyOrder o = order;
                List<ForeignKeyModel> inline = sortedForeignKeys(table.getForeignKeys()).stream()
                        .filter(fk -> !o.isDeferred(table.getName(), fk))
                        .toList();
                statements.add(new CreateTableBuilder(table, dialect).defaultsFrom(inline).build());
            } catch (RuntimeException ex) {
                recordFailure(table.getName(), ex, failed, result);
            }
        }

        for (DeferredForeignKey deferred : order.getDeferred()) {
            if (failed.contains(normalizer.normalize(deferred.getTableName()))) {
                log.debug("Dropping deferred foreign key {} of failed table {}",
                        deferred.getForeignKey().getName(), deferred.getTableName());
                continue;
            }
            statements.add(dialect.getAddForeignKeySql(deferred.getTableName(), deferred.getForeignKey()));
        }
    }

    // --- modified tables ---

    private void alterModifiedTables(Map<String, TableDiff> diffs, Map<String, SyncAction> actions,
                                     Map<String, TableModel> created, List<String> statements, Set<String> failed,
                                     GenerationResult.GenerationResultBuilder result) {
        for (Map.Entry<String, TableDiff> e : diffs.entrySet()) {
            TableDiff diff = e.getValue();
            if (diff.getKind() != DiffKind.MODIFIED) continue;
            if (!actions.get(e.getKey()).includesStructure()) {
                result.userSkip(diff.getTableName());
                continue;
            }
            try {
                statements.addAll(alterStatements(diff, created));
            } catch (RuntimeException ex) {
                recordFailure(diff.getTableName(), ex, failed, result);
            }
        }
    }

    List<String> alterStatements(TableDiff diff, Map<String, TableModel> created) {
        TableModel source = diff.getSourceTable();
        String table = diff.getTargetTable().getName();
        validateTable(source, created);

        AlterTableBuilder builder = new AlterTableBuilder(table, dialect);

        diff.getNewColumns().stream()
                .sorted(Comparator.comparingInt(ColumnModel::getOrdinalPosition))
                .forEach(c -> builder.add(new ColumnAddContributor(table, c, precedingColumn(source, c))));

        diff.getModifiedColumns().forEach(change ->
                builder.add(new ColumnModifyContributor(table, change.getSourceColumn())));

        diff.getRemovedIndexes().forEach(i -> builder.add(new IndexDropContributor(table, i)));
        diff.getModifiedIndexes().forEach(change -> {
            builder.add(new IndexDropContributor(table, change.getTargetIndex()));
            builder.add(new IndexAddContributor(table, change.getSourceIndex()));
        });
        diff.getNewIndexes().forEach(i -> builder.add(new IndexAddContributor(table, i)));

        diff.getNewForeignKeys().forEach(fk -> builder.add(new ForeignKeyAddContributor(table, fk)));

        if (diff.isEngineChanged() || diff.isCharsetChanged()) {
            builder.add(new TableOptionsContributor(table, source, diff.isEngineChanged(), diff.isCharsetChanged()));
        }
        return builder.build();
    }

    private String precedingColumn(TableModel source, ColumnModel column) {
        if (column.getOrdinalPosition() <= 1) {
            return null;
        }
        return source.findColumnAt(column.getOrdinalPosition() - 1)
                .map(ColumnModel::getName)
                .orElseThrow(() -> new GenerationException(source.getName(),
                        "no column at ordinal " + (column.getOrdinalPosition() - 1) + " before " + column.getName()));
    }

    // --- report & guidance ---

    private void reportOnlyChanges(Map<String, TableDiff> diffs, GenerationResult.GenerationResultBuilder result) {
        for (TableDiff diff : diffs.values()) {
            if (diff.getKind() == DiffKind.REMOVED) {
                result.reportOnlyChange(new ReportOnlyChange(diff.getTableName(), null, ReportOnlyChange.Kind.TABLE_REMOVED));
                result.guidanceLine("Table `" + diff.getTableName() + "` exists only on the target; it is not dropped. Review manually.");
                continue;
            }
            for (ColumnModel c : diff.getRemovedColumns()) {
                result.reportOnlyChange(new ReportOnlyChange(diff.getTableName(), c.getName(), ReportOnlyChange.Kind.COLUMN_REMOVED));
                result.guidanceLine("Column `" + diff.getTableName() + "`.`" + c.getName()
                        + "` exists only on the target; it is not dropped. Review manually.");
            }
            for (ForeignKeyModel fk : diff.getRemovedForeignKeys()) {
                result.reportOnlyChange(new ReportOnlyChange(diff.getTableName(), fk.getName(), ReportOnlyChange.Kind.FOREIGN_KEY_REMOVED));
                result.guidanceLine("Foreign key `" + fk.getName() + "` on `" + diff.getTableName()
                        + "` exists only on the target; it is not dropped. Review manually.");
            }
            for (TableDiff.ForeignKeyChange change : diff.getModifiedForeignKeys()) {
                result.reportOnlyChange(new ReportOnlyChange(diff.getTableName(), change.getName(), ReportOnlyChange.Kind.FOREIGN_KEY_MODIFIED));
                result.guidanceLine("Foreign key `" + change.getName() + "` on `" + diff.getTableName()
                        + "` differs (" + String.join("; ", change.getDetails()) + "); it is not altered. Review manually.");
            }
        }
    }

    private void dataGuidance(Map<String, TableDiff> diffs, Map<String, SyncAction> actions, Set<String> failed,
                              long threshold, GenerationResult.GenerationResultBuilder result) {
        NumberFormat format = NumberFormat.getIntegerInstance(Locale.US);
        actions.forEach((key, action) -> {
            if (action != SyncAction.STRUCTURE_AND_DATA || failed.contains(key)) return;
            TableDiff diff = diffs.get(key);
            long rows = diff.getSourceRowCount() == null ? 0L : diff.getSourceRowCount();
            String table = diff.getTableName();
            if (rows > threshold) {
                StringBuilder sb = new StringBuilder()
                        .append("Table `").append(table).append("` has ").append(format.format(rows))
                        .append(" rows (threshold ").append(format.format(threshold))
                        .append("): export the data with an external bulk tool instead of row-level statements.");
                if (options.hasExportHint()) {
                    sb.append(" Use: mysqldump -h ").append(options.getSourceHost())
                            .append(" -u ").append(options.getSourceUser())
                            .append(" -p ").append(options.getSourceDatabase())
                            .append(' ').append(table).append(" --no-create-info");
                }
                result.guidanceLine(sb.toString());
            } else {
                result.guidanceLine("Table `" + table + "` has " + format.format(rows)
                        + " rows: small enough for direct row-level synchronization.");
            }
        });
    }

    // --- validation ---

    private Map<String, TableDiff> indexDiffs(List<TableDiff> diffs) {
        Map<String, TableDiff> byKey = new TreeMap<>();
        for (TableDiff diff : diffs) {
            Objects.requireNonNull(diff, "diffs must not contain null");
            String key = normalizer.normalize(diff.getTableName());
            if (byKey.putIfAbsent(key, diff) != null) {
                throw new IllegalArgumentException("Duplicate diff for table " + diff.getTableName());
            }
        }
        return byKey;
    }

    /** Keyed by normalized table name, in diff order. */
    private Map<String, SyncAction> indexDecisions(List<Decision> decisions, Map<String, TableDiff> diffs) {
        Map<String, SyncAction> given = new TreeMap<>();
        for (Decision decision : decisions) {
            Objects.requireNonNull(decision, "decisions must not contain null");
            String key = normalizer.normalize(decision.getTableName());
            if (!diffs.containsKey(key)) {
                throw new IllegalArgumentException("Decision for unknown table " + decision.getTableName());
            }
            if (given.putIfAbsent(key, decision.getAction()) != null) {
                throw new IllegalArgumentException("Duplicate decision for table " + decision.getTableName());
            }
        }

        Map<String, SyncAction> actions = new LinkedHashMap<>();
        diffs.forEach((key, diff) -> {
            if (diff.getKind() != DiffKind.NEW && diff.getKind() != DiffKind.MODIFIED) return;
            SyncAction action = given.get(key);
            if (action == null) {
                throw new IllegalArgumentException("Missing decision for table " + diff.getTableName());
            }
            actions.put(key, action);
        });
        return actions;
    }

    /**
     * @param created new tables of this run; a foreign key referencing one of them
     *                must name columns that table defines
     */
    void validateTable(TableModel table, Map<String, TableModel> created) {
        for (IndexModel index : table.getIndexes()) {
            if (index.getColumns().isEmpty()) {
                throw new GenerationException(table.getName(), "index " + index.getName() + " has no columns");
            }
            for (String column : index.getColumns()) {
                if (!table.hasColumn(column)) {
                    throw new GenerationException(table.getName(),
                            "index " + index.getName() + " references missing column " + column);
                }
            }
        }
        for (ForeignKeyModel fk : table.getForeignKeys()) {
            if (fk.getColumns().isEmpty()) {
                throw new GenerationException(table.getName(), "foreign key " + fk.getName() + " has no columns");
            }
            if (fk.getReferencedTable() == null || fk.getReferencedTable().isBlank()) {
                throw new GenerationException(table.getName(), "foreign key " + fk.getName() + " has no referenced table");
            }
            if (fk.getColumns().size() != fk.getReferencedColumns().size()) {
                throw new GenerationException(table.getName(), "foreign key " + fk.getName() + " maps "
                        + fk.getColumns().size() + " columns onto " + fk.getReferencedColumns().size());
            }
            for (String column : fk.getColumns()) {
                if (!table.hasColumn(column)) {
                    throw new GenerationException(table.getName(),
                            "foreign key " + fk.getName() + " references missing column " + column);
                }
            }
            TableModel referenced = created.get(normalizer.normalize(fk.getReferencedTable()));
            if (referenced != null) {
                for (String column : fk.getReferencedColumns()) {
                    if (!referenced.hasColumn(column)) {
                        throw new GenerationException(table.getName(), "foreign key " + fk.getName()
                                + " references missing column " + referenced.getName() + "." + column);
                    }
                }
            }
        }
    }

    private void recordFailure(String tableName, RuntimeException ex, Set<String> failed,
                               GenerationResult.GenerationResultBuilder result) {
        log.warn("Skipping table {}: {}", tableName, ex.getMessage(), ex);
        failed.add(normalizer.normalize(tableName));
        result.errorSkip(new SkippedTable(tableName, ex.getMessage()));
    }

    private List<ForeignKeyModel> sortedForeignKeys(List<ForeignKeyModel> fks) {
        return fks.stream()
                .sorted(Comparator.comparing(fk -> normalizer.normalize(fk.getName())))
                .toList();
    }
}
