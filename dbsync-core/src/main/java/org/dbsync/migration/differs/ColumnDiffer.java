package org.dbsync.migration.differs;

import org.dbsync.model.ColumnModel;
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

/**
 * Aligns columns by normalized name. Ordinal position is informational only
 * and never makes a column modified.
 */
public class ColumnDiffer implements TableComponentDiffer {
    private static final String DEFAULT_GENERATED = "DEFAULT_GENERATED";

    private final CaseNormalizer normalizer;

    public ColumnDiffer() {
        this(CaseNormalizer.lower());
    }

    public ColumnDiffer(CaseNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public void diff(TableModel source, TableModel target, TableDiff.TableDiffBuilder result) {
        Map<String, ColumnModel> sourceColumns = byKey(source.getColumns());
        Map<String, ColumnModel> targetColumns = byKey(target.getColumns());

        List<TableDiff.ColumnChange> modified = new ArrayList<>();
        sourceColumns.forEach((key, sourceColumn) -> {
            ColumnModel targetColumn = targetColumns.get(key);
            if (targetColumn == null) {
                result.newColumn(sourceColumn);
                return;
            }
            List<String> details = describeChanges(targetColumn, sourceColumn);
            if (!details.isEmpty()) {
                modified.add(TableDiff.ColumnChange.builder()
                        .sourceColumn(sourceColumn)
                        .targetColumn(targetColumn)
                        .details(details)
                        .build());
            }
        });
        modified.forEach(result::modifiedColumn);

        targetColumns.forEach((key, targetColumn) -> {
            if (!sourceColumns.containsKey(key)) {
                result.removedColumn(targetColumn);
            }
        });
    }

    /**
     * Lists attribute differences in "target -> source" form; empty when the
     * columns are structurally the same apart from their position.
     */
    List<String> describeChanges(ColumnModel target, ColumnModel source) {
        List<String> details = new ArrayList<>();
        if (!normalizeType(target.getType()).equals(normalizeType(source.getType()))) {
            details.add("type: " + target.getType() + " -> " + source.getType());
        }
        if (target.isNullable() != source.isNullable()) {
            details.add("nullable: " + nullability(target) + " -> " + nullability(source));
        }
        if (!Objects.equals(target.getDefaultValue(), source.getDefaultValue())) {
            details.add("default: " + orNone(target.getDefaultValue(), "NULL") + " -> " + orNone(source.getDefaultValue(), "NULL"));
        }
        if (!normalizeExtra(target.getExtra()).equals(normalizeExtra(source.getExtra()))) {
            details.add("extra: " + orNone(target.getExtra(), "(none)") + " -> " + orNone(source.getExtra(), "(none)"));
        }
        return details;
    }

    private Map<String, ColumnModel> byKey(List<ColumnModel> columns) {
        Map<String, ColumnModel> map = new TreeMap<>();
        columns.stream()
                .sorted(Comparator.comparing(ColumnModel::getName))
                .forEach(c -> map.putIfAbsent(normalizer.normalize(c.getName()), c));
        return map;
    }

    private static String normalizeType(String type) {
        return type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
    }

    static String normalizeExtra(String extra) {
        if (extra == null) return "";
        return extra.replaceAll("(?i)\\b" + DEFAULT_GENERATED + "\\b", "")
                .replaceAll("\\s{2,}", " ")
                .trim()
                .toLowerCase(Locale.ROOT);
    }

    private static String nullability(ColumnModel column) {
        return column.isNullable() ? "NULL" : "NOT NULL";
    }

    private static String orNone(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
