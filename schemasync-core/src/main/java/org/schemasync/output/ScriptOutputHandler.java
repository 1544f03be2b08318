package org.schemasync.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Persists a generated script. The core never decides where a script goes; callers do.
 */
public class ScriptOutputHandler {
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Clock clock;

    public ScriptOutputHandler() {
        this(Clock.systemDefaultZone());
    }

    public ScriptOutputHandler(Clock clock) {
        this.clock = clock;
    }

    public Path write(String script, Path outputFile) throws IOException {
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputFile, script, StandardCharsets.UTF_8);
        return outputFile;
    }

    /**
     * Writes into {@code outputDir} as {@code sync-<identifier>-<yyyyMMddHHmmss>.sql}.
     */
    public Path writeToDirectory(String script, Path outputDir, String identifier) throws IOException {
        return write(script, outputDir.resolve(fileName(identifier)));
    }

    String fileName(String identifier) {
        String safeId = identifier.replaceAll("[^A-Za-z0-9._-]", "_");
        return String.format("sync-%s-%s.sql", safeId, LocalDateTime.now(clock).format(FILE_TIMESTAMP));
    }
}
