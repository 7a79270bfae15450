package org.dbsync.migration.differs;

import org.dbsync.model.IndexModel;
import org.dbsync.model.TableDiff;
import org.dbsync.model.TableModel;
import org.dbsync.model.naming.CaseNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aligns indexes by normalized name and compares the unique flag and the
 * ordered column list.
 */
public class IndexDiffer implements TableComponentDiffer {

    private final CaseNormalizer normalizer;

    public IndexDiffer() {
        this(CaseNormalizer.lower());
    }

    public IndexDiffer(CaseNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public void diff(TableModel source, TableModel target, TableDiff.TableDiffBuilder result) {
        Map<String, IndexModel> sourceIndexes = byKey(source.getIndexes());
        Map<String, IndexModel> targetIndexes = byKey(target.getIndexes());

        sourceIndexes.forEach((key, sourceIndex) -> {
            IndexModel targetIndex = targetIndexes.get(key);
            if (targetIndex == null) {
                result.newIndex(sourceIndex);
                return;
            }
            List<String> details = getIndexChangeDetail(targetIndex, sourceIndex);
            if (!details.isEmpty()) {
                result.modifiedIndex(TableDiff.IndexChange.builder()
                        .sourceIndex(sourceIndex)
                        .targetIndex(targetIndex)
                        .details(details)
                        .build());
            }
        });

        targetIndexes.forEach((key, targetIndex) -> {
            if (!sourceIndexes.containsKey(key)) {
                result.removedIndex(targetIndex);
            }
        });
    }

    private List<String> getIndexChangeDetail(IndexModel target, IndexModel source) {
        List<String> details = new ArrayList<>();
        if (target.isUnique() != source.isUnique()) {
            details.add("unique: " + target.isUnique() + " -> " + source.isUnique());
        }
        // column order matters for an index
        if (!normalizeAll(target.getColumns()).equals(normalizeAll(source.getColumns()))) {
            details.add("columns: " + target.getColumns() + " -> " + source.getColumns());
        }
        return details;
    }

    private List<String> normalizeAll(List<String> names) {
        return names.stream().map(normalizer::normalize).toList();
    }

    private Map<String, IndexModel> byKey(List<IndexModel> indexes) {
        Map<String, IndexModel> map = new TreeMap<>();
        indexes.stream()
                .sorted(Comparator.comparing(IndexModel::getName))
                .forEach(i -> map.putIfAbsent(normalizer.normalize(i.getName()), i));
        return map;
    }
}
