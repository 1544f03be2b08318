package org.schemasync.script.dialect;

import org.schemasync.model.ColumnDefinition;

import java.util.List;

/**
 * Renders individual DDL fragments. Destructive operations only exist as commented advisories.
 */
public interface DdlDialect {
    String quoteIdentifier(String raw);

    // Table
    String openCreateTable(String tableName);
    String closeCreateTable();
    String getDropTableAdvisory(String tableName);

    // Column
    String getColumnDefinitionSql(String columnName, ColumnDefinition column);
    String getAddColumnSql(String table, String columnName, ColumnDefinition column);
    String getModifyColumnSql(String table, String columnName, ColumnDefinition column);
    String getDropColumnAdvisory(String table, String columnName);

    // Primary Key
    String getPrimaryKeyDefinitionSql(List<String> pkColumns);

    DefaultValueFormatter getDefaultValueFormatter();
}
