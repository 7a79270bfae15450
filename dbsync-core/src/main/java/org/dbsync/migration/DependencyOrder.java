package org.dbsync.migration;

import lombok.Value;
import org.dbsync.model.ForeignKeyModel;
import org.dbsync.model.TableModel;

import java.util.List;
import java.util.Locale;

@Value
public class DependencyOrder {
    List<TableModel> tables;
    List<DeferredForeignKey> deferred;
    List<List<String>> cycles;

    public boolean isDeferred(String tableName, ForeignKeyModel fk) {
        return deferred.stream().anyMatch(d ->
                d.getTableName().equalsIgnoreCase(tableName)
                        && d.getForeignKey().getName().toLowerCase(Locale.ROOT)
                        .equals(fk.getName().toLowerCase(Locale.ROOT)));
    }

    public List<DeferredForeignKey> deferredFor(String tableName) {
        return deferred.stream().filter(d -> d.getTableName().equalsIgnoreCase(tableName)).toList();
    }
}
