package org.schemasync.script.contributor;

import org.schemasync.model.ColumnDefinition;
import org.schemasync.script.dialect.DdlDialect;

public record ColumnAddContributor(String table, String columnName, ColumnDefinition column) implements DdlContributor {
    @Override
    public int priority() {
        return 40;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.getAddColumnSql(table, columnName, column));
    }
}
