package org.schemasync.script;

import org.schemasync.model.ColumnDefinition;
import org.schemasync.script.contributor.ColumnContributor;
import org.schemasync.script.contributor.DdlContributor;
import org.schemasync.script.contributor.PrimaryKeyContributor;
import org.schemasync.script.contributor.TableBodyContributor;
import org.schemasync.script.dialect.DdlDialect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

public class CreateTableBuilder {
    private final String table;
    private final DdlDialect dialect;
    private final List<DdlContributor> body = new ArrayList<>();

    public CreateTableBuilder(String table, DdlDialect dialect) {
        this.table = table;
        this.dialect = dialect;
    }

    public <T extends DdlContributor> CreateTableBuilder add(T c) {
        if (c instanceof TableBodyContributor) {
            body.add(c);
        } else {
            throw new IllegalArgumentException("Unsupported contributor type: " + c.getClass().getName());
        }
        return this;
    }

    public CreateTableBuilder columns(Map<String, ColumnDefinition> columns, List<String> primaryKey) {
        this.add(new ColumnContributor(columns));
        this.add(new PrimaryKeyContributor(primaryKey));
        return this;
    }

    public String build() {
        StringBuilder sb = new StringBuilder(dialect.openCreateTable(table));

        body.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        trimTrailingComma(sb);

        sb.append(dialect.closeCreateTable()).append('\n');
        return sb.toString();
    }

    private void trimTrailingComma(StringBuilder sb) {
        int last = sb.lastIndexOf(",\n");
        if (last != -1 && last == sb.length() - 2) sb.delete(last, last + 2);
    }
}
