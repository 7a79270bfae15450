package org.dbsync.migration.differs;

import lombok.extern.slf4j.Slf4j;
import org.dbsync.migration.SkippedTable;
import org.dbsync.model.ColumnModel;
import org.dbsync.model.DiffKind;
import org.dbsync.model.ForeignKeyModel;
import org.dbsync.model.IndexModel;
import org.dbsync.model.RejectedTable;
import org.dbsync.model.SnapshotModel;
import org.dbsync.model.TableDiff;
import org.dbsync.model.TableModel;
import org.dbsync.model.naming.CaseNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Produces one {@link TableDiff} per comparable table name found in either
 * snapshot, ordered by normalized table name. The result depends only on the
 * two snapshots.
 */
@Slf4j
public class SchemaDiffer {
    private final CaseNormalizer normalizer;
    private final List<TableComponentDiffer> componentDiffers;

    public SchemaDiffer() {
        this(CaseNormalizer.lower());
    }

    public SchemaDiffer(CaseNormalizer normalizer) {
        this(normalizer, createDefaultDiffers(normalizer));
    }

    public SchemaDiffer(CaseNormalizer normalizer, List<TableComponentDiffer> componentDiffers) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.componentDiffers = List.copyOf(Objects.requireNonNull(componentDiffers, "componentDiffers must not be null"));
    }

    private static List<TableComponentDiffer> createDefaultDiffers(CaseNormalizer normalizer) {
        return List.of(
                new ColumnDiffer(normalizer),
                new IndexDiffer(normalizer),
                new ForeignKeyDiffer(normalizer)
        );
    }

    public List<TableDiff> diff(SnapshotModel source, SnapshotModel target) {
        return compare(source, target).getDiffs();
    }

    /**
     * Diffs every table name found in either snapshot. A name rejected as
     * malformed on either side, or whose comparison fails, gets no diff and is
     * listed in {@link SchemaComparison#getExcludedTables()} instead.
     */
    public SchemaComparison compare(SnapshotModel source, SnapshotModel target) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");

        Map<String, TableModel> sourceTables = byKey(source);
        Map<String, TableModel> targetTables = byKey(target);

        Map<String, SkippedTable> excluded = new TreeMap<>();
        rejected(source, "source", excluded);
        rejected(target, "target", excluded);

        Map<String, TableModel[]> union = new TreeMap<>();
        sourceTables.forEach((key, table) -> union.computeIfAbsent(key, k -> new TableModel[2])[0] = table);
        targetTables.forEach((key, table) -> union.computeIfAbsent(key, k -> new TableModel[2])[1] = table);

        SchemaComparison.SchemaComparisonBuilder result = SchemaComparison.builder();
        union.forEach((key, pair) -> {
            if (excluded.containsKey(key)) {
                log.warn("Table {} is not compared: {}", key, excluded.get(key).getReason());
                return;
            }
            List<String> failures = new ArrayList<>();
            TableDiff diff = diffTable(pair[0], pair[1], failures);
            if (!failures.isEmpty()) {
                excluded.put(key, new SkippedTable(diff.getTableName(), String.join("; ", failures)));
                return;
            }
            log.debug("Table {}: {}", diff.getTableName(), diff.getKind());
            result.diff(diff);
        });
        return result.excludedTables(excluded.values()).build();
    }

    private void rejected(SnapshotModel snapshot, String side, Map<String, SkippedTable> excluded) {
        for (RejectedTable rejected : snapshot.getRejectedTables()) {
            String reason = "malformed on the " + side + ": " + rejected.getReason();
            excluded.merge(normalizer.normalize(rejected.getTableName()),
                    new SkippedTable(rejected.getTableName(), reason),
                    (first, second) -> new SkippedTable(first.getTableName(), first.getReason() + "; " + reason));
        }
    }

    TableDiff diffTable(TableModel source, TableModel target, List<String> failures) {
        if (target == null) {
            return TableDiff.builder()
                    .tableName(source.getName())
                    .kind(DiffKind.NEW)
                    .sourceTable(source)
                    .newColumns(sortedByName(source.getColumns(), ColumnModel::getName))
                    .newIndexes(sortedByName(source.getIndexes(), IndexModel::getName))
                    .newForeignKeys(sortedByName(source.getForeignKeys(), ForeignKeyModel::getName))
                    .sourceRowCount(source.getRowCount())
                    .build();
        }
        if (source == null) {
            return TableDiff.builder()
                    .tableName(target.getName())
                    .kind(DiffKind.REMOVED)
                    .targetTable(target)
                    .targetRowCount(target.getRowCount())
                    .build();
        }

        TableDiff.TableDiffBuilder builder = TableDiff.builder()
                .tableName(source.getName())
                .sourceTable(source)
                .targetTable(target)
                .sourceRowCount(source.getRowCount())
                .targetRowCount(target.getRowCount())
                .engineChanged(!sameOption(source.getEngine(), target.getEngine()))
                .charsetChanged(!sameOption(source.getCharset(), target.getCharset())
                        || !sameOption(source.getCollation(), target.getCollation()));

        for (TableComponentDiffer differ : componentDiffers) {
            executeDifferSafely(differ, source, target, builder, failures);
        }

        TableDiff diff = builder.kind(DiffKind.MODIFIED).build();
        return diff.hasChanges() ? diff : diff.toBuilder().kind(DiffKind.IDENTICAL).build();
    }

    private void executeDifferSafely(TableComponentDiffer differ, TableModel source, TableModel target,
                                     TableDiff.TableDiffBuilder builder, List<String> failures) {
        try {
            differ.diff(source, target, builder);
        } catch (RuntimeException e) {
            log.warn("{} failed for table {}", differ.getClass().getSimpleName(), source.getName(), e);
            failures.add(String.format("Differ failed: %s (%s: %s)",
                    differ.getClass().getSimpleName(),
                    e.getClass().getSimpleName(),
                    e.getMessage()));
        }
    }

    private Map<String, TableModel> byKey(SnapshotModel snapshot) {
        Map<String, TableModel> map = new TreeMap<>();
        snapshot.getTables().values().stream()
                .sorted(Comparator.comparing(TableModel::getName))
                .forEach(t -> map.putIfAbsent(normalizer.normalize(t.getName()), t));
        return map;
    }

    private <T> List<T> sortedByName(List<T> items, Function<T, String> name) {
        return items.stream()
                .sorted(Comparator.comparing(item -> normalizer.normalize(name.apply(item))))
                .toList();
    }

    private static boolean sameOption(String a, String b) {
        String left = a == null ? "" : a.trim().toLowerCase(Locale.ROOT);
        String right = b == null ? "" : b.trim().toLowerCase(Locale.ROOT);
        return left.equals(right);
    }
}
