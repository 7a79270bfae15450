package org.dbsync.migration.dialect.mysql;

import org.dbsync.migration.spi.ValueTransformer;
import org.dbsync.model.ColumnModel;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * INFORMATION_SCHEMA reports defaults both as bare text (MySQL) and as SQL
 * literals (MariaDB 10.2+).
 *
 * <p>For character, enum and set columns bare text is the string itself, so
 * only a quoted literal, MariaDB's {@code NULL} or a {@code DEFAULT_GENERATED}
 * expression passes through. Temporal columns additionally keep the
 * current-time functions. For other types, and when the column is unknown,
 * literals, numbers, NULL and expressions pass through and anything else is
 * quoted as a string.
 */
public class MySqlValueTransformer implements ValueTransformer {
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern QUOTED = Pattern.compile("'(?:[^']|'')*'");
    private static final Pattern BIT_OR_HEX = Pattern.compile("(?i)[bx]'[0-9a-f]*'|0x[0-9a-f]+");
    private static final Pattern EXPRESSION = Pattern.compile(
            "(?i)(current_timestamp|current_date|current_time|localtime|localtimestamp|now|uuid|null)(\\(\\d*\\))?|\\w+\\(.*\\)|\\(.*\\)");
    private static final Pattern CURRENT_TIME = Pattern.compile(
            "(?i)(current_timestamp|current_date|current_time|localtime|localtimestamp|now)(\\(\\d*\\))?");

    private static final Set<String> STRING_TYPES = Set.of(
            "char", "varchar", "tinytext", "text", "mediumtext", "longtext", "enum", "set");
    private static final Set<String> TEMPORAL_TYPES = Set.of(
            "date", "datetime", "timestamp", "time", "year");

    @Override
    public String quote(String value, ColumnModel column) {
        if (value == null) return "NULL";
        String trimmed = value.trim();
        if (QUOTED.matcher(trimmed).matches()) {
            return trimmed;
        }

        String baseType = column == null ? "" : baseType(column.getType());
        if (STRING_TYPES.contains(baseType) || TEMPORAL_TYPES.contains(baseType)) {
            if (isGenerated(column) || (column.isNullable() && "NULL".equals(trimmed))) {
                return trimmed;
            }
            if (TEMPORAL_TYPES.contains(baseType) && CURRENT_TIME.matcher(trimmed).matches()) {
                return trimmed;
            }
            return literal(value);
        }

        if (NUMBER.matcher(trimmed).matches()
                || BIT_OR_HEX.matcher(trimmed).matches()
                || EXPRESSION.matcher(trimmed).matches()) {
            return trimmed;
        }
        return literal(value);
    }

    private static String literal(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static boolean isGenerated(ColumnModel column) {
        return column.getExtra() != null
                && column.getExtra().toUpperCase(Locale.ROOT).contains("DEFAULT_GENERATED");
    }

    static String baseType(String type) {
        if (type == null) return "";
        String lower = type.trim().toLowerCase(Locale.ROOT);
        int end = 0;
        while (end < lower.length() && Character.isLetter(lower.charAt(end))) {
            end++;
        }
        return lower.substring(0, end);
    }
}
