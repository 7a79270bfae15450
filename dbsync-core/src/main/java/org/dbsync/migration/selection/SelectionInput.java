package org.dbsync.migration.selection;

import org.dbsync.model.SyncAction;

import java.util.Locale;

public enum SelectionInput {
    STRUCTURE_ONLY(SyncAction.STRUCTURE_ONLY),
    STRUCTURE_AND_DATA(SyncAction.STRUCTURE_AND_DATA),
    SKIP(SyncAction.SKIP),
    SHOW_DETAILS(null),
    QUIT(null);

    private final SyncAction action;

    SelectionInput(SyncAction action) {
        this.action = action;
    }

    /** The decision this input records, or null when it does not record one. */
    public SyncAction action() {
        return action;
    }

    /**
     * A null or blank token is the default choice, {@link #SKIP}.
     *
     * @throws InvalidSelectionInputException for any unknown token
     */
    public static SelectionInput parse(String token) {
        if (token == null || token.isBlank()) {
            return SKIP;
        }
        return switch (token.trim().toLowerCase(Locale.ROOT)) {
            case "1", "structure-only" -> STRUCTURE_ONLY;
            case "2", "structure-and-data" -> STRUCTURE_AND_DATA;
            case "s", "skip" -> SKIP;
            case "d", "show-details" -> SHOW_DETAILS;
            case "q", "quit" -> QUIT;
            default -> throw new InvalidSelectionInputException(token.trim());
        };
    }
}
