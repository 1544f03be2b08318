package org.schemasync.exception;

import java.util.List;

/**
 * Raised when a snapshot breaks the structural contract expected from a snapshot provider,
 * e.g. a table without a column mapping or a column without a type.
 */
public class MalformedSnapshotException extends RuntimeException {
    private final String side;
    private final List<String> problems;

    public MalformedSnapshotException(String side, List<String> problems) {
        super("Malformed " + side + " snapshot: " + String.join("; ", problems));
        this.side = side;
        this.problems = List.copyOf(problems);
    }

    public String getSide() {
        return side;
    }

    public List<String> getProblems() {
        return problems;
    }
}
