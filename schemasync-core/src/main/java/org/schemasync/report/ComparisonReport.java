package org.schemasync.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.schemasync.diff.ColumnDiffer;
import org.schemasync.filter.TableFilter;
import org.schemasync.model.DiffResult;
import org.schemasync.model.SchemaSnapshot;
import org.schemasync.model.TableDiff;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Side-by-side view of a comparison: overall counts plus per-table and per-column statuses for
 * both snapshots, with excluded tables hidden. Counts always cover the full diff.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComparisonReport {
    private final String identifier;
    private final Stats stats;
    @Singular private final List<TableView> sourceTables;
    @Singular private final List<TableView> targetTables;
    @Singular private final List<String> warnings;

    public enum Status { NORMAL, MISSING, CHANGED, EXTRA }

    @Getter
    @Builder
    public static class Stats {
        private final int tableDiff;
        private final int columnDiff;
        private final int missingTables;
        private final int extraTables;
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TableView {
        private final String name;
        private final Status status;
        @Singular private final List<ColumnView> columns;
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ColumnView {
        private final String name;
        private final String type;
        private final Status status;
        private final String changeDetail;
    }

    public static ComparisonReport of(String identifier,
                                      SchemaSnapshot source,
                                      SchemaSnapshot target,
                                      DiffResult diff,
                                      List<String> exclusionPatterns) {
        return ComparisonReport.builder()
                .identifier(identifier)
                .stats(statsOf(diff))
                .sourceTables(sourceViews(source, diff, exclusionPatterns))
                .targetTables(targetViews(target, diff, exclusionPatterns))
                .warnings(diff.getWarnings())
                .build();
    }

    static Stats statsOf(DiffResult diff) {
        int columnDiff = diff.getColumns().values().stream()
                .mapToInt(t -> t.getMissingColumns().size() + t.getChangedColumns().size())
                .sum();
        return Stats.builder()
                .tableDiff(diff.getMissingTables().size() + diff.getChangedTables().size())
                .columnDiff(columnDiff)
                .missingTables(diff.getMissingTables().size())
                .extraTables(diff.getExtraTables().size())
                .build();
    }

    private static List<TableView> sourceViews(SchemaSnapshot source, DiffResult diff, List<String> patterns) {
        List<TableView> views = new ArrayList<>();
        source.getTables().forEach((tableName, table) -> {
            if (TableFilter.isExcluded(tableName, patterns)) return;

            Status tableStatus = diff.isMissing(tableName) ? Status.MISSING
                    : diff.isChanged(tableName) ? Status.CHANGED
                    : Status.NORMAL;
            Optional<TableDiff> tableDiff = diff.findTableDiff(tableName);

            TableView.TableViewBuilder view = TableView.builder().name(tableName).status(tableStatus);
            table.getColumns().forEach((columnName, column) -> {
                ColumnView.ColumnViewBuilder columnView = ColumnView.builder()
                        .name(columnName)
                        .type(column.getType())
                        .status(Status.NORMAL);
                tableDiff.ifPresent(td -> {
                    if (td.isMissing(columnName)) {
                        columnView.status(Status.MISSING);
                    } else {
                        td.findChange(columnName).ifPresent(change -> columnView
                                .status(Status.CHANGED)
                                .changeDetail(ColumnDiffer.describe(change)));
                    }
                });
                view.column(columnView.build());
            });
            views.add(view.build());
        });
        return views;
    }

    private static List<TableView> targetViews(SchemaSnapshot target, DiffResult diff, List<String> patterns) {
        List<TableView> views = new ArrayList<>();
        target.getTables().forEach((tableName, table) -> {
            if (TableFilter.isExcluded(tableName, patterns)) return;

            Optional<TableDiff> tableDiff = diff.findTableDiff(tableName);
            TableView.TableViewBuilder view = TableView.builder()
                    .name(tableName)
                    .status(diff.isExtra(tableName) ? Status.EXTRA : Status.NORMAL);
            table.getColumns().forEach((columnName, column) -> view.column(ColumnView.builder()
                    .name(columnName)
                    .type(column.getType())
                    .status(tableDiff.filter(td -> td.isExtra(columnName)).isPresent() ? Status.EXTRA : Status.NORMAL)
                    .build()));
            views.add(view.build());
        });
        return views;
    }
}
