package org.schemasync.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Formats a {@link ComparisonReport} for the console, as plain text or JSON.
 */
public class ReportRenderer {
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(ComparisonReport report) throws JsonProcessingException {
        return objectMapper.writeValueAsString(report);
    }

    public String toText(ComparisonReport report) {
        StringBuilder sb = new StringBuilder();
        ComparisonReport.Stats stats = report.getStats();
        sb.append("Comparison: ").append(report.getIdentifier()).append('\n');
        sb.append(String.format("Tables to sync: %d (missing %d), extra tables: %d, columns to sync: %d%n",
                stats.getTableDiff(), stats.getMissingTables(), stats.getExtraTables(), stats.getColumnDiff()));

        sb.append("\n[source]\n");
        report.getSourceTables().forEach(t -> appendTable(sb, t));
        sb.append("\n[target]\n");
        report.getTargetTables().forEach(t -> appendTable(sb, t));

        if (!report.getWarnings().isEmpty()) {
            sb.append('\n');
            report.getWarnings().forEach(w -> sb.append("WARNING: ").append(w).append('\n'));
        }
        return sb.toString();
    }

    private void appendTable(StringBuilder sb, ComparisonReport.TableView table) {
        sb.append(marker(table.getStatus())).append(' ').append(table.getName()).append('\n');
        for (ComparisonReport.ColumnView column : table.getColumns()) {
            sb.append("    ").append(marker(column.getStatus())).append(' ')
                    .append(column.getName()).append(' ').append(column.getType());
            if (column.getChangeDetail() != null) {
                sb.append("  (").append(column.getChangeDetail()).append(')');
            }
            sb.append('\n');
        }
    }

    private String marker(ComparisonReport.Status status) {
        return switch (status) {
            case NORMAL -> " ";
            case MISSING -> "+";
            case CHANGED -> "~";
            case EXTRA -> "-";
        };
    }
}
