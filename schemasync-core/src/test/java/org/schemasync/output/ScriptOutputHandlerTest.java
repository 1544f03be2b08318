package org.schemasync.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptOutputHandlerTest {

    private final ScriptOutputHandler handler =
            new ScriptOutputHandler(Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC));

    @Test
    void writesIntoTimestampedFile(@TempDir Path dir) throws IOException {
        Path written = handler.writeToDirectory("-- script\n", dir.resolve("out"), "prod-vs-staging");

        assertThat(written.getFileName().toString()).isEqualTo("sync-prod-vs-staging-20240301101530.sql");
        assertThat(Files.readString(written)).isEqualTo("-- script\n");
    }

    @Test
    void unsafeIdentifierCharactersAreReplaced() {
        assertThat(handler.fileName("a/b c")).isEqualTo("sync-a_b_c-20240301101530.sql");
    }
}
