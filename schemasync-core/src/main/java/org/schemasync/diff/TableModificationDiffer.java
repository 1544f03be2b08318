package org.schemasync.diff;

import org.schemasync.model.DiffResult;
import org.schemasync.model.TableDefinition;
import org.schemasync.model.TableDiff;

import java.util.List;
import java.util.Objects;

/**
 * Compares a table that exists on both sides and contributes a {@link TableDiff} fragment
 * when anything differs.
 */
public class TableModificationDiffer {
    private final List<TableComponentDiffer> componentDiffers;

    public TableModificationDiffer() {
        this(List.of(
                new ColumnDiffer(),
                new TableCommentDiffer()
        ));
    }

    public TableModificationDiffer(List<TableComponentDiffer> componentDiffers) {
        this.componentDiffers = List.copyOf(Objects.requireNonNull(componentDiffers, "componentDiffers must not be null"));
    }

    public void diff(String tableName, TableDefinition source, TableDefinition target, DiffResult.DiffResultBuilder result) {
        TableDiff tableDiff = compareTables(tableName, source, target);
        if (isModified(tableDiff)) {
            result.tableDiff(tableName, tableDiff);
        }
        if (!Objects.equals(source.getPrimaryKey(), target.getPrimaryKey())) {
            result.warning("Primary key differs on table " + tableName + ": source=" + source.getPrimaryKey()
                    + " target=" + target.getPrimaryKey() + "; primary keys of existing tables are not altered.");
        }
    }

    public TableDiff compareTables(String tableName, TableDefinition source, TableDefinition target) {
        TableDiff.TableDiffBuilder builder = TableDiff.builder().tableName(tableName);
        for (TableComponentDiffer differ : componentDiffers) {
            differ.diff(source, target, builder);
        }
        return builder.build();
    }

    private boolean isModified(TableDiff tableDiff) {
        return tableDiff.hasColumnDifferences() || tableDiff.isCommentChanged();
    }
}
