package org.schemasync.diff;

import org.schemasync.model.TableDefinition;
import org.schemasync.model.TableDiff;

import java.util.Objects;

public class TableCommentDiffer implements TableComponentDiffer {
    @Override
    public void diff(TableDefinition source, TableDefinition target, TableDiff.TableDiffBuilder result) {
        result.commentChanged(!Objects.equals(source.getComment(), target.getComment()));
    }
}
