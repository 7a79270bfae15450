package org.dbsync.migration.selection;

import lombok.Getter;

@Getter
public class InvalidSelectionInputException extends RuntimeException {
    private final String token;

    public InvalidSelectionInputException(String token) {
        super("Invalid choice '" + token + "'. Expected 1, 2, s, d or q.");
        this.token = token;
    }
}
