package org.schemasync.snapshot;

import org.schemasync.model.SchemaSnapshot;

import java.io.IOException;
import java.nio.file.Path;

public class JsonSnapshotProvider implements SnapshotProvider {
    private final Path path;
    private final SnapshotIo snapshotIo;

    public JsonSnapshotProvider(Path path) {
        this(path, new SnapshotIo());
    }

    public JsonSnapshotProvider(Path path, SnapshotIo snapshotIo) {
        this.path = path;
        this.snapshotIo = snapshotIo;
    }

    @Override
    public SchemaSnapshot load() throws IOException {
        return snapshotIo.read(path);
    }
}
