package org.schemasync.snapshot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.schemasync.model.SchemaSnapshot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads snapshots in their JSON form:
 * <pre>
 * { "tables": { "orders": { "columns": { "id": { "type": "INTEGER", "nullable": false } },
 *                           "primaryKey": ["id"], "comment": "" } } }
 * </pre>
 * Column order in the file is preserved. Fractional defaults are read as {@link java.math.BigDecimal}
 * so that their digits survive into the generated DDL.
 */
public class SnapshotIo {
    private final ObjectMapper objectMapper;

    public SnapshotIo() {
        this(new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }

    public SnapshotIo(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SchemaSnapshot read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Snapshot file not found: " + path);
        }
        return objectMapper.readValue(path.toFile(), SchemaSnapshot.class);
    }

    public SchemaSnapshot read(String json) throws IOException {
        return objectMapper.readValue(json, SchemaSnapshot.class);
    }
}
