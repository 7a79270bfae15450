package org.dbsync.model;

import java.util.Locale;

public enum ReferentialAction {
    RESTRICT, CASCADE, SET_NULL, NO_ACTION, SET_DEFAULT;

    /**
     * Parses the rule text reported by INFORMATION_SCHEMA ("SET NULL", "NO ACTION", ...).
     * A missing rule reads as RESTRICT, the server default.
     */
    public static ReferentialAction fromSql(String rule) {
        if (rule == null || rule.isBlank()) {
            return RESTRICT;
        }
        String normalized = rule.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown referential action: " + rule, e);
        }
    }

    public String sql() {
        return name().replace('_', ' ');
    }
}
