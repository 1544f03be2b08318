package org.schemasync.script;

/**
 * DDL fragment rendered for a single selected table.
 */
public record TableScript(String tableName, Kind kind, String text) {
    public enum Kind { CREATE, ALTER, TARGET_ONLY }
}
