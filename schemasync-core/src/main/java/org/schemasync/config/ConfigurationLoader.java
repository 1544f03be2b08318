package org.schemasync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.schemasync.options.SchemaSyncOptions;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = SchemaSyncOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = SchemaSyncOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = SchemaSyncOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final PrintStream warnings;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System.err);
    }

    public ConfigurationLoader(Path startDirectory, PrintStream warnings) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.warnings = warnings;
    }

    /**
     * Loads the configuration and resolves the active profile.
     * <p>
     * Precedence: CLI profile, then environment variable, then {@code dev}.
     *
     * @param cliProfile profile given on the command line, may be null
     * @return resolved key/value settings
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<SchemaSyncConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    /**
     * Splits the comma separated exclusion setting back into patterns.
     */
    public static List<String> exclusionPatterns(Map<String, String> config) {
        String raw = config.get(SchemaSyncOptions.Exclude.TABLES_KEY);
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = System.getenv(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * Walks from the start directory up to the filesystem root looking for schemasync.yaml.
     */
    private Optional<SchemaSyncConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    SchemaSyncConfiguration config = yamlMapper.readValue(configFile.toFile(), SchemaSyncConfiguration.class);
                    return Optional.of(config);
                } catch (IOException e) {
                    warnings.println("Warning: Failed to parse " + configFile + ": " + e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(SchemaSyncConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            warnings.println("Warning: Profile '" + profile + "' not found in configuration. Using defaults.");
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        if (profileConfig.getExclude() != null && profileConfig.getExclude().getTables() != null) {
            configMap.put(SchemaSyncOptions.Exclude.TABLES_KEY,
                    String.join(",", profileConfig.getExclude().getTables()));
        }
        if (profileConfig.getOutput() != null && profileConfig.getOutput().getDirectory() != null) {
            configMap.put(SchemaSyncOptions.Output.DIRECTORY_KEY, profileConfig.getOutput().getDirectory());
        }
        if (profileConfig.getDialect() != null && !profileConfig.getDialect().isBlank()) {
            configMap.put(SchemaSyncOptions.Dialect.KEY, profileConfig.getDialect());
        }

        return configMap;
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                SchemaSyncOptions.Dialect.KEY, SchemaSyncOptions.Dialect.DEFAULT
        );
    }
}
