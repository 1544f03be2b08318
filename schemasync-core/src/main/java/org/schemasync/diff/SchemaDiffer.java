package org.schemasync.diff;

import org.schemasync.model.DiffResult;
import org.schemasync.model.SchemaSnapshot;
import org.schemasync.model.TableDefinition;

import java.util.Objects;

/**
 * Computes the structural difference between a source and a target snapshot.
 * <p>
 * Pipeline order is fixed:
 * <ol>
 *   <li>{@link SnapshotValidator} on both sides (fails fast on malformed input)</li>
 *   <li>{@link TableDiffer} (missing / extra / common tables)</li>
 *   <li>{@link TableModificationDiffer} for every common table</li>
 * </ol>
 * Stateless and safe to share between threads.
 */
public class SchemaDiffer {
    private final SnapshotValidator validator;
    private final TableDiffer tableDiffer;
    private final TableModificationDiffer modificationDiffer;

    public SchemaDiffer() {
        this(new SnapshotValidator(), new TableDiffer(), new TableModificationDiffer());
    }

    public SchemaDiffer(SnapshotValidator validator, TableDiffer tableDiffer, TableModificationDiffer modificationDiffer) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.tableDiffer = Objects.requireNonNull(tableDiffer, "tableDiffer must not be null");
        this.modificationDiffer = Objects.requireNonNull(modificationDiffer, "modificationDiffer must not be null");
    }

    public DiffResult compare(SchemaSnapshot source, SchemaSnapshot target) {
        validator.validate("source", source);
        validator.validate("target", target);

        TableDiffer.TablePartition partition = tableDiffer.diff(source, target);
        DiffResult.DiffResultBuilder result = DiffResult.builder()
                .missingTables(partition.missing())
                .extraTables(partition.extra());

        for (String tableName : partition.common()) {
            TableDefinition sourceTable = source.findTable(tableName).orElseThrow();
            TableDefinition targetTable = target.findTable(tableName).orElseThrow();
            modificationDiffer.diff(tableName, sourceTable, targetTable, result);
        }
        return result.build();
    }
}
