package org.schemasync.diff;

import org.schemasync.model.SchemaSnapshot;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Partitions the table names of two snapshots into source-only, target-only and common.
 */
public class TableDiffer {

    public TablePartition diff(SchemaSnapshot source, SchemaSnapshot target) {
        Set<String> missing = source.tableNames().stream()
                .filter(name -> !target.hasTable(name))
                .collect(Collectors.toCollection(TreeSet::new));
        Set<String> extra = target.tableNames().stream()
                .filter(name -> !source.hasTable(name))
                .collect(Collectors.toCollection(TreeSet::new));
        Set<String> common = source.tableNames().stream()
                .filter(target::hasTable)
                .collect(Collectors.toCollection(TreeSet::new));
        return new TablePartition(missing, extra, common);
    }

    public record TablePartition(Set<String> missing, Set<String> extra, Set<String> common) {
        public TablePartition {
            missing = Collections.unmodifiableSet(new TreeSet<>(missing));
            extra = Collections.unmodifiableSet(new TreeSet<>(extra));
            common = Collections.unmodifiableSet(new TreeSet<>(common));
        }
    }
}
