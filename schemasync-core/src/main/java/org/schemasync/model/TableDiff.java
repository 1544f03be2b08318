package org.schemasync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Column-level difference of one table present in both snapshots.
 */
@Getter
@ToString
public class TableDiff {
    private final String tableName;
    private final List<String> missingColumns;
    private final List<String> extraColumns;
    private final SortedMap<String, ColumnChange> changedColumns;
    private final boolean commentChanged;

    @Builder
    private TableDiff(String tableName,
                      @Singular Set<String> missingColumns,
                      @Singular Set<String> extraColumns,
                      @Singular Map<String, ColumnChange> changedColumns,
                      boolean commentChanged) {
        this.tableName = tableName;
        this.missingColumns = List.copyOf(new TreeSet<>(missingColumns));
        this.extraColumns = List.copyOf(new TreeSet<>(extraColumns));
        this.changedColumns = Collections.unmodifiableSortedMap(new TreeMap<>(changedColumns));
        this.commentChanged = commentChanged;
    }

    public Optional<ColumnChange> findChange(String columnName) {
        return Optional.ofNullable(changedColumns.get(columnName));
    }

    public boolean isMissing(String columnName) {
        return Collections.binarySearch(missingColumns, columnName) >= 0;
    }

    public boolean isExtra(String columnName) {
        return Collections.binarySearch(extraColumns, columnName) >= 0;
    }

    public boolean isChanged(String columnName) {
        return changedColumns.containsKey(columnName);
    }

    @JsonIgnore
    public boolean hasColumnDifferences() {
        return !missingColumns.isEmpty() || !extraColumns.isEmpty() || !changedColumns.isEmpty();
    }
}
