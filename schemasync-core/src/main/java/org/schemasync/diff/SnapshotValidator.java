package org.schemasync.diff;

import org.schemasync.exception.MalformedSnapshotException;
import org.schemasync.model.ColumnDefinition;
import org.schemasync.model.SchemaSnapshot;
import org.schemasync.model.TableDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects snapshots that break the provider contract instead of treating missing fields as empty.
 * Absent comments are the only field allowed to be missing.
 */
public class SnapshotValidator {

    public void validate(String side, SchemaSnapshot snapshot) {
        if (snapshot == null) {
            throw new MalformedSnapshotException(side, List.of("snapshot is null"));
        }
        List<String> problems = new ArrayList<>();
        snapshot.getTables().forEach((tableName, table) -> collectProblems(tableName, table, problems));
        if (!problems.isEmpty()) {
            throw new MalformedSnapshotException(side, problems);
        }
    }

    private void collectProblems(String tableName, TableDefinition table, List<String> problems) {
        if (tableName == null || tableName.isBlank()) {
            problems.add("table with blank name");
            return;
        }
        if (table == null) {
            problems.add("table '" + tableName + "' has no definition");
            return;
        }
        if (table.getColumns() == null) {
            problems.add("table '" + tableName + "' has no columns mapping");
        } else {
            table.getColumns().forEach((columnName, column) ->
                    collectColumnProblems(tableName, columnName, column, problems));
        }
        if (table.getPrimaryKey() == null) {
            problems.add("table '" + tableName + "' has no primaryKey sequence");
        } else if (table.getColumns() != null) {
            for (String keyColumn : table.getPrimaryKey()) {
                if (!table.hasColumn(keyColumn)) {
                    problems.add("table '" + tableName + "' primary key references unknown column '" + keyColumn + "'");
                }
            }
        }
    }

    private void collectColumnProblems(String tableName, String columnName, ColumnDefinition column, List<String> problems) {
        String where = "column '" + tableName + "." + columnName + "'";
        if (column == null) {
            problems.add(where + " has no definition");
            return;
        }
        if (column.getType() == null || column.getType().isBlank()) {
            problems.add(where + " has no type");
        }
        if (column.getNullable() == null) {
            problems.add(where + " has no nullable flag");
        }
        Object defaultValue = column.getDefaultValue();
        if (defaultValue != null
                && !(defaultValue instanceof String)
                && !(defaultValue instanceof Number)
                && !(defaultValue instanceof Boolean)) {
            problems.add(where + " has a non-literal default of type " + defaultValue.getClass().getSimpleName());
        }
    }
}
