package org.schemasync.diff;

import org.schemasync.model.TableDefinition;
import org.schemasync.model.TableDiff;

/**
 * Compares one aspect of a table present in both snapshots and records it on the table's diff fragment.
 */
@FunctionalInterface
public interface TableComponentDiffer {
    void diff(TableDefinition source, TableDefinition target, TableDiff.TableDiffBuilder result);
}
