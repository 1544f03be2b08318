package org.schemasync.filter;

import java.util.List;

/**
 * Decides whether a table is hidden by the configured exclusion patterns.
 * A pattern is either an exact table name or a prefix followed by a single trailing {@code *}.
 */
public final class TableFilter {

    public static final String WILDCARD = "*";

    private TableFilter() {}

    public static boolean isExcluded(String tableName, List<String> patterns) {
        if (tableName == null || patterns == null) return false;
        for (String pattern : patterns) {
            if (pattern == null) continue;
            if (pattern.endsWith(WILDCARD)) {
                String prefix = pattern.substring(0, pattern.length() - WILDCARD.length());
                if (tableName.startsWith(prefix)) {
                    return true;
                }
            } else if (pattern.equals(tableName)) {
                return true;
            }
        }
        return false;
    }
}
