package org.schemasync.script.contributor;

import org.schemasync.script.dialect.DdlDialect;

public interface DdlContributor {
    int priority();

    void contribute(StringBuilder sb, DdlDialect dialect);
}
