package org.schemasync.script.contributor;

import org.schemasync.script.dialect.DdlDialect;

import java.util.List;

public record PrimaryKeyContributor(List<String> pkColumns) implements TableBodyContributor {
    @Override
    public int priority() {
        return 50; // after all column definitions
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        if (pkColumns == null || pkColumns.isEmpty()) return;
        sb.append("    ").append(dialect.getPrimaryKeyDefinitionSql(pkColumns)).append(",\n");
    }
}
