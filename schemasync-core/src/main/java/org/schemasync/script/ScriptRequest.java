package org.schemasync.script;

import lombok.Builder;
import org.schemasync.model.DiffResult;
import org.schemasync.model.SchemaSnapshot;
import org.schemasync.model.SelectionSpec;

import java.util.Objects;

/**
 * Inputs of one synthesis run. {@code identifier} names the comparison in the script header.
 */
@Builder
public record ScriptRequest(String identifier,
                            SchemaSnapshot source,
                            SchemaSnapshot target,
                            DiffResult diff,
                            SelectionSpec selection) {

    public ScriptRequest {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(diff, "diff must not be null");
        identifier = identifier != null ? identifier : "schema-sync";
        selection = selection != null ? selection : SelectionSpec.none();
    }
}
