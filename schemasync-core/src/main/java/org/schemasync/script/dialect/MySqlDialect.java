package org.schemasync.script.dialect;

import org.schemasync.model.ColumnDefinition;

import java.util.List;

/**
 * MySQL-flavoured DDL ({@code ADD COLUMN} / {@code MODIFY COLUMN}). Identifiers are emitted as given.
 */
public class MySqlDialect implements DdlDialect {
    private final DefaultValueFormatter defaultValueFormatter;

    public MySqlDialect() {
        this(new DefaultValueFormatter());
    }

    public MySqlDialect(DefaultValueFormatter defaultValueFormatter) {
        this.defaultValueFormatter = defaultValueFormatter;
    }

    @Override
    public String quoteIdentifier(String raw) {
        return raw;
    }

    @Override
    public String openCreateTable(String tableName) {
        return "CREATE TABLE " + quoteIdentifier(tableName) + " (\n";
    }

    @Override
    public String closeCreateTable() {
        return "\n);";
    }

    @Override
    public String getDropTableAdvisory(String tableName) {
        return "-- table exists only in target: " + tableName + "\n"
                + "-- DROP TABLE " + quoteIdentifier(tableName) + ";  -- caution: drops target-only table\n";
    }

    @Override
    public String getColumnDefinitionSql(String columnName, ColumnDefinition column) {
        StringBuilder sb = new StringBuilder();
        sb.append(quoteIdentifier(columnName)).append(' ').append(column.getType());
        if (!column.allowsNull()) {
            sb.append(" NOT NULL");
        }
        if (column.hasDefault()) {
            sb.append(" DEFAULT ").append(getDefaultValueFormatter().format(column.getDefaultValue()));
        }
        return sb.toString();
    }

    @Override
    public String getAddColumnSql(String table, String columnName, ColumnDefinition column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD COLUMN "
                + getColumnDefinitionSql(columnName, column) + ";\n";
    }

    @Override
    public String getModifyColumnSql(String table, String columnName, ColumnDefinition column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " MODIFY COLUMN "
                + getColumnDefinitionSql(columnName, column) + ";\n";
    }

    @Override
    public String getDropColumnAdvisory(String table, String columnName) {
        return "-- ALTER TABLE " + quoteIdentifier(table) + " DROP COLUMN " + quoteIdentifier(columnName)
                + ";  -- caution: drops target-only column\n";
    }

    @Override
    public String getPrimaryKeyDefinitionSql(List<String> pkColumns) {
        return "PRIMARY KEY (" + String.join(", ", pkColumns.stream().map(this::quoteIdentifier).toList()) + ")";
    }

    @Override
    public DefaultValueFormatter getDefaultValueFormatter() {
        return defaultValueFormatter;
    }
}
