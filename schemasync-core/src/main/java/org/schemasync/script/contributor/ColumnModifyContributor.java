package org.schemasync.script.contributor;

import org.schemasync.model.ColumnChange;
import org.schemasync.script.dialect.DdlDialect;

/**
 * Rewrites a column to its source definition; the target side of the change is never rendered.
 */
public record ColumnModifyContributor(String table, String columnName, ColumnChange change) implements DdlContributor {
    @Override
    public int priority() {
        return 50; // after every ADD COLUMN of the table
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.getModifyColumnSql(table, columnName, change.source()));
    }
}
