package org.schemasync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A table's columns (in declaration order), its primary key (in key order) and its comment.
 * <p>
 * {@code columns} and {@code primaryKey} stay {@code null} when the provider did not supply them,
 * so that {@link org.schemasync.diff.SnapshotValidator} can reject the snapshot instead of
 * silently treating them as empty.
 */
@Getter
@EqualsAndHashCode
@ToString
public class TableDefinition {
    private final Map<String, ColumnDefinition> columns;
    private final List<String> primaryKey;
    private final String comment;

    @Builder(toBuilder = true)
    @JsonCreator
    public TableDefinition(
            @JsonProperty("columns")    @Singular Map<String, ColumnDefinition> columns,
            @JsonProperty("primaryKey") @Singular("primaryKeyColumn") List<String> primaryKey,
            @JsonProperty("comment")    String comment) {
        this.columns = columns != null ? Collections.unmodifiableMap(new LinkedHashMap<>(columns)) : null;
        this.primaryKey = primaryKey != null ? List.copyOf(primaryKey) : null;
        this.comment = comment != null ? comment : "";
    }

    public Optional<ColumnDefinition> findColumn(String columnName) {
        if (columns == null) return Optional.empty();
        return Optional.ofNullable(columns.get(columnName));
    }

    public boolean hasColumn(String columnName) {
        return findColumn(columnName).isPresent();
    }
}
