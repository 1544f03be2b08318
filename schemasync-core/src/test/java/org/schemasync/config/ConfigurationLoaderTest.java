package org.schemasync.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.schemasync.options.SchemaSyncOptions;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationLoaderTest {

    private static final String YAML = """
            profiles:
              dev:
                exclude:
                  tables: [logs, "users_backup_*"]
                output:
                  directory: build/sync
              prod:
                dialect: mysql
            """;

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private ConfigurationLoader loader(Path dir) {
        return new ConfigurationLoader(dir, new PrintStream(err, true));
    }

    @Test
    void readsSelectedProfile(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("schemasync.yaml"), YAML);

        Map<String, String> config = loader(dir).loadConfiguration("dev");

        assertThat(ConfigurationLoader.exclusionPatterns(config)).containsExactly("logs", "users_backup_*");
        assertThat(config).containsEntry(SchemaSyncOptions.Output.DIRECTORY_KEY, "build/sync")
                .containsEntry(SchemaSyncOptions.Dialect.KEY, "mysql");
    }

    @Test
    void findsConfigurationInParentDirectory(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("schemasync.yaml"), YAML);
        Path nested = Files.createDirectories(dir.resolve("a/b"));

        Map<String, String> config = loader(nested).loadConfiguration("dev");

        assertThat(config).containsKey(SchemaSyncOptions.Exclude.TABLES_KEY);
    }

    @Test
    void unknownProfileFallsBackToDefaults(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("schemasync.yaml"), YAML);

        Map<String, String> config = loader(dir).loadConfiguration("qa");

        assertThat(config).containsOnlyKeys(SchemaSyncOptions.Dialect.KEY);
        assertThat(err.toString()).contains("Profile 'qa' not found");
    }

    @Test
    void unreadableFileIsWarnedAbout(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("schemasync.yaml"), "profiles: [not, a, map]");

        Map<String, String> config = loader(dir).loadConfiguration("dev");

        assertThat(ConfigurationLoader.exclusionPatterns(config)).isEmpty();
        assertThat(err.toString()).contains("Warning: Failed to parse");
    }

    @Test
    void blankExclusionSettingYieldsNoPatterns() {
        assertThat(ConfigurationLoader.exclusionPatterns(Map.of(SchemaSyncOptions.Exclude.TABLES_KEY, " , "))).isEmpty();
        assertThat(ConfigurationLoader.exclusionPatterns(Map.of())).isEmpty();
    }
}
