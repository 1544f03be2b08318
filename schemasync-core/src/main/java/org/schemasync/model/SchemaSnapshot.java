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
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Point-in-time structural description of one database. Immutable once built.
 */
@Getter
@EqualsAndHashCode
@ToString
public class SchemaSnapshot {
    private final Map<String, TableDefinition> tables;

    @Builder(toBuilder = true)
    @JsonCreator
    public SchemaSnapshot(@JsonProperty("tables") @Singular Map<String, TableDefinition> tables) {
        this.tables = tables != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(tables))
                : Map.of();
    }

    public static SchemaSnapshot empty() {
        return new SchemaSnapshot(Map.of());
    }

    public Optional<TableDefinition> findTable(String tableName) {
        return Optional.ofNullable(tables.get(tableName));
    }

    public boolean hasTable(String tableName) {
        return tables.containsKey(tableName);
    }

    public Set<String> tableNames() {
        return tables.keySet();
    }
}
