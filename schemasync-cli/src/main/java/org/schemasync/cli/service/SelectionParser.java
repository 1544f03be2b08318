package org.schemasync.cli.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import org.schemasync.model.SelectionSpec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a {@link SelectionSpec} from a selection file and/or {@code table=col1,col2} arguments.
 */
public class SelectionParser {
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Selection file layout: {@code {"tables": ["orders"], "columns": {"orders": ["id", "total"]}}}.
     */
    @Data
    public static class SelectionFile {
        @JsonProperty("tables")
        private List<String> tables = new ArrayList<>();

        @JsonProperty("columns")
        private Map<String, List<String>> columns = new LinkedHashMap<>();
    }

    public SelectionSpec parse(Path selectionFile, List<String> tableArgs, List<String> columnArgs) throws IOException {
        List<String> tables = new ArrayList<>();
        Map<String, Set<String>> columns = new LinkedHashMap<>();

        if (selectionFile != null) {
            if (!Files.exists(selectionFile)) {
                throw new IOException("Selection file not found: " + selectionFile);
            }
            SelectionFile file = objectMapper.readValue(selectionFile.toFile(), SelectionFile.class);
            if (file.getTables() != null) {
                file.getTables().stream().filter(Objects::nonNull).forEach(tables::add);
            }
            if (file.getColumns() != null) {
                file.getColumns().forEach((table, cols) -> {
                    Set<String> selected = columns.computeIfAbsent(table, t -> new LinkedHashSet<>());
                    // a null list selects no columns, the same as an absent entry
                    if (cols != null) {
                        cols.stream().filter(Objects::nonNull).forEach(selected::add);
                    }
                });
            }
        }

        if (tableArgs != null) tables.addAll(tableArgs);
        if (columnArgs != null) {
            for (String arg : columnArgs) {
                parseColumnArgument(arg, columns);
            }
        }
        return SelectionSpec.of(tables, columns);
    }

    /**
     * Parses {@code table=col1,col2}; the table is not implicitly added to the table selection.
     */
    void parseColumnArgument(String arg, Map<String, Set<String>> columns) {
        int eq = arg.indexOf('=');
        if (eq <= 0) {
            throw new IllegalArgumentException("Invalid column selection '" + arg + "', expected table=col1,col2");
        }
        String table = arg.substring(0, eq).trim();
        Set<String> target = columns.computeIfAbsent(table, t -> new LinkedHashSet<>());
        for (String column : arg.substring(eq + 1).split(",")) {
            String trimmed = column.trim();
            if (!trimmed.isEmpty()) {
                target.add(trimmed);
            }
        }
    }
}
