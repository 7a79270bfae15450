package org.dbsync.model.naming;

import java.util.Locale;

/**
 * Turns a raw identifier into the key used to match tables, columns, indexes
 * and foreign keys across two snapshots.
 */
@FunctionalInterface
public interface CaseNormalizer {
    String normalize(String raw);

    default boolean same(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    static CaseNormalizer lower()   { return s -> s == null ? "" : s.trim().toLowerCase(Locale.ROOT); }
    static CaseNormalizer preserve(){ return s -> s == null ? "" : s.trim(); }
}
