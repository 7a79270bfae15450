package org.dbsync.migration.selection;

import org.dbsync.migration.TableSummary;
import org.dbsync.model.Decision;
import org.dbsync.model.TableDiff;

public interface DiffPresenter {
    void presentSummary(TableSummary summary);

    void presentDetails(TableDiff diff);

    void rejectInput(TableSummary summary, String message);

    default void recorded(Decision decision) {
    }
}
