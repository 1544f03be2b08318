package org.schemasync.script.contributor;

import org.schemasync.script.dialect.DdlDialect;

public record CommentContributor(String text, int priority) implements DdlContributor {
    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append("-- ").append(text).append('\n');
    }
}
