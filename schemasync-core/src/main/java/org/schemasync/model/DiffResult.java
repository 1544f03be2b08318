package org.schemasync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Structural difference between a source and a target snapshot.
 * <p>
 * Table name lists are sorted lexicographically. A table has an entry in {@link #getColumns()}
 * exactly when it is listed in {@link #getChangedTables()}.
 */
@Getter
public class DiffResult {
    private final List<String> missingTables;
    private final List<String> extraTables;
    private final List<String> changedTables;
    private final SortedMap<String, TableDiff> columns;
    private final List<String> warnings;

    @Builder
    private DiffResult(@Singular Set<String> missingTables,
                       @Singular Set<String> extraTables,
                       @Singular Map<String, TableDiff> tableDiffs,
                       @Singular List<String> warnings) {
        this.missingTables = List.copyOf(new TreeSet<>(missingTables));
        this.extraTables = List.copyOf(new TreeSet<>(extraTables));
        this.columns = Collections.unmodifiableSortedMap(new TreeMap<>(tableDiffs));
        this.changedTables = List.copyOf(this.columns.keySet());
        this.warnings = List.copyOf(warnings);
    }

    public static DiffResult empty() {
        return DiffResult.builder().build();
    }

    public Optional<TableDiff> findTableDiff(String tableName) {
        return Optional.ofNullable(columns.get(tableName));
    }

    public boolean isMissing(String tableName) {
        return Collections.binarySearch(missingTables, tableName) >= 0;
    }

    public boolean isExtra(String tableName) {
        return Collections.binarySearch(extraTables, tableName) >= 0;
    }

    public boolean isChanged(String tableName) {
        return columns.containsKey(tableName);
    }

    /**
     * @return true when there is nothing to synchronize in either direction
     */
    @JsonIgnore
    public boolean isEmpty() {
        return missingTables.isEmpty() && extraTables.isEmpty() && changedTables.isEmpty();
    }
}
