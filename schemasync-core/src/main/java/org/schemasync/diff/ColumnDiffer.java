package org.schemasync.diff;

import org.schemasync.model.ColumnAttribute;
import org.schemasync.model.ColumnChange;
import org.schemasync.model.ColumnDefinition;
import org.schemasync.model.TableDefinition;
import org.schemasync.model.TableDiff;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Splits the column names of two tables into missing, extra and changed.
 * Each column lands in at most one of the three groups.
 */
public class ColumnDiffer implements TableComponentDiffer {

    @Override
    public void diff(TableDefinition source, TableDefinition target, TableDiff.TableDiffBuilder result) {
        Map<String, ColumnDefinition> sourceColumns = source.getColumns();
        Map<String, ColumnDefinition> targetColumns = target.getColumns();

        sourceColumns.forEach((name, sourceColumn) -> target.findColumn(name).ifPresentOrElse(
                targetColumn -> {
                    Set<ColumnAttribute> changes = compare(sourceColumn, targetColumn);
                    if (!changes.isEmpty()) {
                        result.changedColumn(name, new ColumnChange(sourceColumn, targetColumn, changes));
                    }
                },
                () -> result.missingColumn(name)));

        targetColumns.keySet().stream()
                .filter(name -> !source.hasColumn(name))
                .forEach(result::extraColumn);
    }

    /**
     * Compares the attributes of two columns independently.
     * Types are compared as plain strings, so {@code INT} and {@code INTEGER} differ.
     */
    public Set<ColumnAttribute> compare(ColumnDefinition source, ColumnDefinition target) {
        Set<ColumnAttribute> changes = EnumSet.noneOf(ColumnAttribute.class);
        if (!Objects.equals(source.getType(), target.getType())) {
            changes.add(ColumnAttribute.TYPE);
        }
        if (source.allowsNull() != target.allowsNull()) {
            changes.add(ColumnAttribute.NULLABLE);
        }
        if (!Objects.equals(source.getDefaultValue(), target.getDefaultValue())) {
            changes.add(ColumnAttribute.DEFAULT);
        }
        if (!Objects.equals(source.getComment(), target.getComment())) {
            changes.add(ColumnAttribute.COMMENT);
        }
        return changes;
    }

    public static String describe(ColumnChange change) {
        ColumnDefinition src = change.source();
        ColumnDefinition tgt = change.target();
        List<String> details = new ArrayList<>();
        for (ColumnAttribute attribute : change.changes()) {
            switch (attribute) {
                case TYPE -> details.add("type changed from " + tgt.getType() + " to " + src.getType());
                case NULLABLE -> details.add("nullable changed from " + tgt.allowsNull() + " to " + src.allowsNull());
                case DEFAULT -> details.add("default changed from " + literal(tgt.getDefaultValue())
                        + " to " + literal(src.getDefaultValue()));
                case COMMENT -> details.add("comment changed from '" + tgt.getComment() + "' to '" + src.getComment() + "'");
            }
        }
        return String.join(", ", details);
    }

    private static String literal(Object value) {
        if (value == null) return "<none>";
        if (value instanceof String s) return "\"" + s + "\"";
        return String.valueOf(value);
    }
}
