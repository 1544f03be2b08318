package org.schemasync.snapshot;

import org.schemasync.model.SchemaSnapshot;

import java.io.IOException;

/**
 * Source of a schema snapshot, e.g. a file exported earlier or a live introspection.
 */
@FunctionalInterface
public interface SnapshotProvider {
    SchemaSnapshot load() throws IOException;
}
