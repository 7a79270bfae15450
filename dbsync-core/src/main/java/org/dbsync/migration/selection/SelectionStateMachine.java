package org.dbsync.migration.selection;

import lombok.extern.slf4j.Slf4j;
import org.dbsync.migration.ClassifiedDiffs;
import org.dbsync.migration.TableSummary;
import org.dbsync.model.Decision;
import org.dbsync.model.SyncAction;
import org.dbsync.model.TableDiff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Walks the new and modified tables one at a time and records exactly one
 * {@link Decision} per table.
 *
 * <pre>
 * IDLE -> PRESENTING(t)
 * PRESENTING(t) --1/2/s--> RECORDED(t, action) -> PRESENTING(next) | DONE
 * PRESENTING(t) --d-->     PRESENTING(t)
 * PRESENTING(t) --bad-->   PRESENTING(t)   (rejected, asked again)
 * PRESENTING(t) --q-->     CANCELLED       (all decisions discarded)
 * </pre>
 *
 * Identical tables need no decision; removed tables are only reported.
 */
@Slf4j
public class SelectionStateMachine {
    private final List<TableDiff> tables;
    private final DiffPresenter presenter;
    private final List<Decision> decisions = new ArrayList<>();
    private final List<SelectionState> history = new ArrayList<>();

    private SelectionState state = SelectionState.idle();
    private int cursor = -1;
    private TableSummary current;

    public SelectionStateMachine(ClassifiedDiffs classified, DiffPresenter presenter) {
        Objects.requireNonNull(classified, "classified must not be null");
        this.presenter = Objects.requireNonNull(presenter, "presenter must not be null");

        List<TableDiff> pending = new ArrayList<>(classified.getNewTables());
        pending.addAll(classified.getModifiedTables());
        pending.sort(Comparator.comparing(d -> d.getTableName().toLowerCase(Locale.ROOT)));
        this.tables = List.copyOf(pending);
        history.add(state);
    }

    /**
     * Runs the whole loop against the given provider.
     *
     * @return one decision per presented table, in presentation order
     * @throws SelectionCancelledException when the operator quits
     */
    public List<Decision> run(InputProvider input) {
        Objects.requireNonNull(input, "input must not be null");
        if (state.getPhase() == SelectionState.Phase.IDLE && cursor < 0) {
            start();
        }
        while (state.getPhase() == SelectionState.Phase.PRESENTING) {
            accept(input.nextToken(current));
        }
        return getDecisions();
    }

    public SelectionState start() {
        if (cursor >= 0 || state.getPhase() != SelectionState.Phase.IDLE) {
            throw new IllegalStateException("Selection already started");
        }
        advance();
        return state;
    }

    /**
     * Feeds one raw token to the table being presented.
     *
     * @return the state after the token and any automatic transitions
     */
    public SelectionState accept(String token) {
        if (state.getPhase() != SelectionState.Phase.PRESENTING) {
            throw new IllegalStateException("No table is being presented (state " + state.getPhase() + ")");
        }

        SelectionInput input;
        try {
            input = SelectionInput.parse(token);
        } catch (InvalidSelectionInputException e) {
            log.debug("Rejected input for {}: {}", current.getTableName(), e.getToken());
            presenter.rejectInput(current, e.getMessage());
            return state;
        }

        switch (input) {
            case SHOW_DETAILS -> presenter.presentDetails(current.getDiff());
            case QUIT -> {
                String table = current.getTableName();
                decisions.clear();
                transition(SelectionState.cancelled(table));
                throw new SelectionCancelledException(table);
            }
            default -> record(input.action());
        }
        return state;
    }

    private void record(SyncAction action) {
        Decision decision = Decision.of(current.getTableName(), action);
        decisions.add(decision);
        transition(SelectionState.recorded(decision.getTableName(), action));
        presenter.recorded(decision);
        transition(SelectionState.idle());
        advance();
    }

    private void advance() {
        cursor++;
        if (cursor >= tables.size()) {
            current = null;
            transition(SelectionState.done());
            return;
        }
        TableDiff diff = tables.get(cursor);
        current = TableSummary.of(diff, cursor + 1, tables.size());
        transition(SelectionState.presenting(diff.getTableName()));
        presenter.presentSummary(current);
    }

    private void transition(SelectionState next) {
        state = next;
        history.add(next);
    }

    public SelectionState getState() {
        return state;
    }

    public boolean isDone() {
        return state.getPhase() == SelectionState.Phase.DONE;
    }

    public List<Decision> getDecisions() {
        return List.copyOf(decisions);
    }

    public List<SelectionState> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /** Tables that will be presented, in order. */
    public List<String> getTableOrder() {
        return tables.stream().map(TableDiff::getTableName).toList();
    }
}
