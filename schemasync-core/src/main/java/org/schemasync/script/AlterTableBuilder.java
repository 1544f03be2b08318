package org.schemasync.script;

import org.schemasync.model.ColumnChange;
import org.schemasync.model.ColumnDefinition;
import org.schemasync.script.contributor.ColumnAddContributor;
import org.schemasync.script.contributor.ColumnDropAdvisoryContributor;
import org.schemasync.script.contributor.ColumnModifyContributor;
import org.schemasync.script.contributor.CommentContributor;
import org.schemasync.script.contributor.DdlContributor;
import org.schemasync.script.dialect.DdlDialect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects the statements that bring one existing table in line with its source definition and
 * renders them as a single block under a {@code -- Sync table structure: <table>} header.
 * <p>
 * Statements come out grouped by contributor priority (ADD, then MODIFY, then advisories and notes);
 * within a group they keep the order they were added in.
 */
public class AlterTableBuilder {
    private final String tableName;
    private final DdlDialect dialect;
    private final List<DdlContributor> units = new ArrayList<>();

    public AlterTableBuilder(String tableName, DdlDialect dialect) {
        this.tableName = tableName;
        this.dialect = dialect;
    }

    public AlterTableBuilder addColumn(String columnName, ColumnDefinition column) {
        return add(new ColumnAddContributor(tableName, columnName, column));
    }

    public AlterTableBuilder modifyColumn(String columnName, ColumnChange change) {
        return add(new ColumnModifyContributor(tableName, columnName, change));
    }

    public AlterTableBuilder dropColumnAdvisory(String columnName) {
        return add(new ColumnDropAdvisoryContributor(tableName, columnName));
    }

    public AlterTableBuilder note(String text) {
        return add(new CommentContributor(text, 95));
    }

    public AlterTableBuilder add(DdlContributor unit) {
        units.add(unit);
        return this;
    }

    public String build() {
        StringBuilder sb = new StringBuilder("-- Sync table structure: ").append(tableName).append('\n');
        units.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));
        return sb.toString();
    }
}
