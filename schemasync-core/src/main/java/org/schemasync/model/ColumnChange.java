package org.schemasync.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A column present on both sides whose attributes differ. Only {@code source} is ever rendered.
 */
public record ColumnChange(ColumnDefinition source, ColumnDefinition target, Set<ColumnAttribute> changes) {

    public ColumnChange {
        changes = changes.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ColumnAttribute.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(changes));
    }
}
