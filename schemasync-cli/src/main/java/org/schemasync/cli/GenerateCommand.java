package org.schemasync.cli;

import org.schemasync.cli.service.ComparisonService;
import org.schemasync.cli.service.SelectionParser;
import org.schemasync.config.ConfigurationLoader;
import org.schemasync.exception.MalformedSnapshotException;
import org.schemasync.model.SelectionSpec;
import org.schemasync.options.SchemaSyncOptions;
import org.schemasync.output.ScriptOutputHandler;
import org.schemasync.script.ScriptRequest;
import org.schemasync.script.ScriptSynthesizer;
import org.schemasync.script.dialect.DdlDialect;
import org.schemasync.script.dialect.MySqlDialect;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Generates the DDL script that brings the target structure in line with the source,
 * restricted to the selected tables and columns.
 */
@CommandLine.Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "Generates a structure sync script for the selected tables and columns."
)
public class GenerateCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private ComparisonOptions options;

    @CommandLine.Option(names = {"-t", "--table"}, description = "Table to synchronize. Repeatable; order is kept in the script.")
    private List<String> tables = new ArrayList<>();

    @CommandLine.Option(names = {"-c", "--columns"}, description = "Columns to synchronize as table=col1,col2. Repeatable.")
    private List<String> columns = new ArrayList<>();

    @CommandLine.Option(names = "--selection", description = "Selection JSON file: {\"tables\": [...], \"columns\": {\"t\": [...]}}")
    private Path selectionFile;

    @CommandLine.Option(names = "--all", description = "Select every differing table that is not excluded, with all of its columns.")
    private boolean selectAll;

    @CommandLine.Option(names = {"-d", "--dialect"}, description = "DDL dialect (mysql)")
    private String dialectName;

    @CommandLine.Option(names = "--out", description = "Write the script to this file")
    private Path outputFile;

    @CommandLine.Option(names = "--out-dir", description = "Write the script into this directory as sync-<id>-<timestamp>.sql")
    private Path outputDir;

    @Override
    public Integer call() {
        try {
            Map<String, String> config = new ConfigurationLoader().loadConfiguration(options.profile);
            applyConfiguration(config);
            List<String> patterns = ComparisonService.mergePatterns(
                    ConfigurationLoader.exclusionPatterns(config), options.excludes);

            ComparisonService.Comparison comparison = new ComparisonService().compare(options.source, options.target);

            SelectionSpec selection = selectAll
                    ? SelectionSpec.allOf(comparison.diff(), comparison.source(), patterns)
                    : new SelectionParser().parse(selectionFile, tables, columns);
            if (selection.getTables().isEmpty()) {
                System.err.println("Warning: no tables selected; the script will only contain its header.");
            }

            String script = new ScriptSynthesizer(resolveDialect(dialectName), Clock.systemDefaultZone())
                    .synthesize(ScriptRequest.builder()
                            .identifier(options.identifier)
                            .source(comparison.source())
                            .target(comparison.target())
                            .diff(comparison.diff())
                            .selection(selection)
                            .build());

            writeScript(script);
            return 0;

        } catch (MalformedSnapshotException e) {
            System.err.println("Script generation aborted: " + e.getSide() + " snapshot is malformed.");
            e.getProblems().forEach(problem -> System.err.println("   - " + problem));
            return 1;
        } catch (Exception e) {
            System.err.println("Script generation failed: " + e.getMessage());
            return 1;
        }
    }

    private void writeScript(String script) throws IOException {
        ScriptOutputHandler handler = new ScriptOutputHandler();
        if (outputFile != null) {
            Path written = handler.write(script, outputFile);
            System.out.println("Sync script written to " + written);
        } else if (outputDir != null) {
            Path written = handler.writeToDirectory(script, outputDir, options.identifier);
            System.out.println("Sync script written to " + written);
        } else {
            System.out.print(script);
        }
    }

    /**
     * Configuration values only fill in options that were not given on the command line.
     */
    private void applyConfiguration(Map<String, String> config) {
        if (dialectName == null) {
            dialectName = config.getOrDefault(SchemaSyncOptions.Dialect.KEY, SchemaSyncOptions.Dialect.DEFAULT);
        }
        if (outputFile == null && outputDir == null) {
            String configuredDir = config.get(SchemaSyncOptions.Output.DIRECTORY_KEY);
            if (configuredDir != null && !configuredDir.isBlank()) {
                outputDir = Paths.get(configuredDir);
            }
        }
    }

    private DdlDialect resolveDialect(String name) {
        return switch (name.toLowerCase()) {
            case "mysql" -> new MySqlDialect();
            default -> throw new IllegalArgumentException("Unsupported dialect: " + name);
        };
    }
}
