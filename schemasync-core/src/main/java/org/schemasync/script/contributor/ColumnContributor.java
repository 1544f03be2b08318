package org.schemasync.script.contributor;

import org.schemasync.model.ColumnDefinition;
import org.schemasync.script.dialect.DdlDialect;

import java.util.LinkedHashMap;
import java.util.Map;

public record ColumnContributor(Map<String, ColumnDefinition> columns) implements TableBodyContributor {

    public ColumnContributor {
        columns = new LinkedHashMap<>(columns);
    }

    @Override
    public int priority() {
        return 40;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        columns.forEach((name, column) ->
                sb.append("    ").append(dialect.getColumnDefinitionSql(name, column)).append(",\n"));
    }
}
