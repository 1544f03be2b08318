package org.schemasync.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.schemasync.filter.TableFilter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tables and columns the caller wants synthesized.
 * <p>
 * Table order is kept and drives the order of the generated script. A table without a column
 * entry has no columns selected; it does not mean "all columns".
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SelectionSpec {
    private final List<String> tables;
    private final Map<String, Set<String>> columns;

    private SelectionSpec(Collection<String> tables, Map<String, ? extends Collection<String>> columns) {
        this.tables = List.copyOf(new LinkedHashSet<>(tables));
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        columns.forEach((table, cols) ->
                copy.put(table, Collections.unmodifiableSet(new LinkedHashSet<>(cols))));
        this.columns = Collections.unmodifiableMap(copy);
    }

    public static SelectionSpec of(Collection<String> tables, Map<String, ? extends Collection<String>> columns) {
        return new SelectionSpec(
                tables != null ? tables : List.of(),
                columns != null ? columns : Map.of());
    }

    public static SelectionSpec none() {
        return of(List.of(), Map.of());
    }

    /**
     * Selects every table that has something to synchronize or report (missing, changed or extra)
     * and is not excluded, together with all of its source columns.
     */
    public static SelectionSpec allOf(DiffResult diff, SchemaSnapshot source, List<String> exclusionPatterns) {
        List<String> tables = new ArrayList<>();
        Map<String, List<String>> columns = new LinkedHashMap<>();

        List<String> candidates = new ArrayList<>(diff.getMissingTables());
        candidates.addAll(diff.getChangedTables());
        candidates.addAll(diff.getExtraTables());

        for (String table : candidates) {
            if (TableFilter.isExcluded(table, exclusionPatterns)) continue;
            tables.add(table);
            source.findTable(table)
                    .map(TableDefinition::getColumns)
                    .ifPresent(cols -> columns.put(table, new ArrayList<>(cols.keySet())));
        }
        return of(tables, columns);
    }

    public boolean isTableSelected(String table) {
        return tables.contains(table);
    }

    public Set<String> columnsOf(String table) {
        return columns.getOrDefault(table, Set.of());
    }

    public boolean isColumnSelected(String table, String column) {
        return columnsOf(table).contains(column);
    }
}
