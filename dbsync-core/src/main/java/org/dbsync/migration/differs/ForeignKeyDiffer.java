package org.dbsync.migration.differs;

import org.dbsync.model.ForeignKeyModel;
import org.dbsync.model.TableDiff;
import org.dbsync.model.TableModel;
import org.dbsync.model.naming.CaseNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class ForeignKeyDiffer implements TableComponentDiffer {

    private final CaseNormalizer normalizer;

    public ForeignKeyDiffer() {
        this(CaseNormalizer.lower());
    }

    public ForeignKeyDiffer(CaseNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public void diff(TableModel source, TableModel target, TableDiff.TableDiffBuilder result) {
        Map<String, ForeignKeyModel> sourceKeys = byKey(source.getForeignKeys());
        Map<String, ForeignKeyModel> targetKeys = byKey(target.getForeignKeys());

        sourceKeys.forEach((key, sourceFk) -> {
            ForeignKeyModel targetFk = targetKeys.get(key);
            if (targetFk == null) {
                result.newForeignKey(sourceFk);
                return;
            }
            List<String> details = describeChanges(targetFk, sourceFk);
            if (!details.isEmpty()) {
                result.modifiedForeignKey(TableDiff.ForeignKeyChange.builder()
                        .sourceForeignKey(sourceFk)
                        .targetForeignKey(targetFk)
                        .details(details)
                        .build());
            }
        });

        targetKeys.forEach((key, targetFk) -> {
            if (!sourceKeys.containsKey(key)) {
                result.removedForeignKey(targetFk);
            }
        });
    }

    private List<String> describeChanges(ForeignKeyModel target, ForeignKeyModel source) {
        List<String> details = new ArrayList<>();
        if (!normalizeAll(target.getColumns()).equals(normalizeAll(source.getColumns()))) {
            details.add("columns: " + target.getColumns() + " -> " + source.getColumns());
        }
        if (!normalizer.same(target.getReferencedTable(), source.getReferencedTable())) {
            details.add("referenced table: " + target.getReferencedTable() + " -> " + source.getReferencedTable());
        }
        if (!normalizeAll(target.getReferencedColumns()).equals(normalizeAll(source.getReferencedColumns()))) {
            details.add("referenced columns: " + target.getReferencedColumns() + " -> " + source.getReferencedColumns());
        }
        if (target.getOnDelete() != source.getOnDelete()) {
            details.add("on delete: " + target.getOnDelete().sql() + " -> " + source.getOnDelete().sql());
        }
        if (target.getOnUpdate() != source.getOnUpdate()) {
            details.add("on update: " + target.getOnUpdate().sql() + " -> " + source.getOnUpdate().sql());
        }
        return details;
    }

    private List<String> normalizeAll(List<String> names) {
        return names.stream().map(normalizer::normalize).toList();
    }

    private Map<String, ForeignKeyModel> byKey(List<ForeignKeyModel> keys) {
        Map<String, ForeignKeyModel> map = new TreeMap<>();
        keys.stream()
                .sorted(Comparator.comparing(ForeignKeyModel::getName))
                .forEach(fk -> map.putIfAbsent(normalizer.normalize(fk.getName()), fk));
        return map;
    }
}
