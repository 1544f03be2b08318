package org.schemasync.script;

import org.schemasync.model.ColumnDefinition;
import org.schemasync.model.DiffResult;
import org.schemasync.model.SchemaSnapshot;
import org.schemasync.model.SelectionSpec;
import org.schemasync.model.TableDefinition;
import org.schemasync.model.TableDiff;
import org.schemasync.script.dialect.DdlDialect;
import org.schemasync.script.dialect.MySqlDialect;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders a {@link DiffResult} into a forward migration script, restricted to a {@link SelectionSpec}.
 * <p>
 * Tables are visited in selection order and columns in source-snapshot order, so the output only
 * varies with the generation timestamp. Nothing destructive is emitted as an executable statement:
 * target-only tables and columns appear as commented advisories.
 */
public class ScriptSynthesizer {
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final DdlDialect dialect;
    private final Clock clock;

    public ScriptSynthesizer() {
        this(new MySqlDialect(), Clock.systemDefaultZone());
    }

    public ScriptSynthesizer(DdlDialect dialect, Clock clock) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String synthesize(String identifier,
                             SchemaSnapshot source,
                             SchemaSnapshot target,
                             DiffResult diff,
                             List<String> selectedTables,
                             Map<String, ? extends Collection<String>> selectedColumns) {
        return synthesize(ScriptRequest.builder()
                .identifier(identifier)
                .source(source)
                .target(target)
                .diff(diff)
                .selection(SelectionSpec.of(selectedTables, selectedColumns))
                .build());
    }

    public String synthesize(ScriptRequest request) {
        List<TableScript> fragments = renderTables(request);

        StringBuilder script = new StringBuilder(header(request));
        fragments.stream()
                .filter(f -> f.kind() != TableScript.Kind.TARGET_ONLY)
                .forEach(f -> script.append('\n').append(f.text()));

        List<TableScript> targetOnly = fragments.stream()
                .filter(f -> f.kind() == TableScript.Kind.TARGET_ONLY)
                .toList();
        if (!targetOnly.isEmpty()) {
            script.append("\n-- Tables that exist only in target\n");
            targetOnly.forEach(f -> script.append(f.text()));
        }

        script.append("\n-- Sync complete --\n");
        return script.toString();
    }

    /**
     * Renders one fragment per selected table that has something to say; unknown or unchanged
     * tables produce nothing.
     */
    public List<TableScript> renderTables(ScriptRequest request) {
        DiffResult diff = request.diff();
        SelectionSpec selection = request.selection();
        List<TableScript> fragments = new ArrayList<>();

        for (String table : selection.getTables()) {
            if (diff.isMissing(table)) {
                renderCreate(table, request.source(), selection).ifPresent(fragments::add);
            } else if (diff.isChanged(table)) {
                diff.findTableDiff(table)
                        .flatMap(tableDiff -> renderAlter(table, tableDiff, request.source(), selection))
                        .ifPresent(fragments::add);
            } else if (diff.isExtra(table)) {
                fragments.add(new TableScript(table, TableScript.Kind.TARGET_ONLY, dialect.getDropTableAdvisory(table)));
            }
        }
        return fragments;
    }

    Optional<TableScript> renderCreate(String table, SchemaSnapshot source, SelectionSpec selection) {
        Optional<TableDefinition> definition = source.findTable(table);
        if (definition.isEmpty()) {
            return Optional.empty();
        }
        TableDefinition sourceTable = definition.get();

        Map<String, ColumnDefinition> columns = new LinkedHashMap<>();
        sourceTable.getColumns().forEach((name, column) -> {
            if (selection.isColumnSelected(table, name)) {
                columns.put(name, column);
            }
        });

        StringBuilder sb = new StringBuilder("-- Create missing table: ").append(table).append('\n');
        if (columns.isEmpty()) {
            sb.append("-- no columns selected for ").append(table).append("; CREATE TABLE skipped\n");
        } else {
            sb.append(new CreateTableBuilder(table, dialect)
                    .columns(columns, sourceTable.getPrimaryKey())
                    .build());
        }
        return Optional.of(new TableScript(table, TableScript.Kind.CREATE, sb.toString()));
    }

    Optional<TableScript> renderAlter(String table, TableDiff tableDiff, SchemaSnapshot source, SelectionSpec selection) {
        Optional<TableDefinition> definition = source.findTable(table);
        if (definition.isEmpty()) {
            return Optional.empty();
        }

        AlterTableBuilder alter = new AlterTableBuilder(table, dialect);
        definition.get().getColumns().forEach((name, column) -> {
            if (!selection.isColumnSelected(table, name)) return;
            if (tableDiff.isMissing(name)) {
                alter.addColumn(name, column);
            } else {
                tableDiff.findChange(name).ifPresent(change -> alter.modifyColumn(name, change));
            }
        });
        tableDiff.getExtraColumns().forEach(alter::dropColumnAdvisory);
        if (tableDiff.isCommentChanged()) {
            alter.note("table comment differs; not synchronized");
        }

        String text = alter.build();
        return Optional.of(new TableScript(table, TableScript.Kind.ALTER, text));
    }

    private String header(ScriptRequest request) {
        return String.format("""
                -- Schema sync script: %s
                -- Generated at: %s
                -- Sync mode: structure

                -- Tables selected: %d
                """,
                request.identifier(),
                LocalDateTime.now(clock).format(TIMESTAMP_FORMAT),
                request.selection().getTables().size());
    }
}
