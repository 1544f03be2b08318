package org.schemasync.script.contributor;

import org.schemasync.script.dialect.DdlDialect;

public record ColumnDropAdvisoryContributor(String table, String columnName) implements DdlContributor {
    @Override
    public int priority() {
        return 90; // advisories go last
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.getDropColumnAdvisory(table, columnName));
    }
}
