package org.schemasync.cli;

import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options shared by every command that compares two snapshots.
 */
public class ComparisonOptions {

    @CommandLine.Option(names = "--source", required = true, description = "Source snapshot JSON (desired structure)")
    Path source;

    @CommandLine.Option(names = "--target", required = true, description = "Target snapshot JSON (structure to bring in line)")
    Path target;

    @CommandLine.Option(names = {"-x", "--exclude"}, description = "Exclusion pattern: exact table name or prefix ending in '*'. Repeatable.")
    List<String> excludes = new ArrayList<>();

    @CommandLine.Option(names = "--profile", description = "Configuration profile (dev, prod, test ...)")
    String profile;

    @CommandLine.Option(names = "--id", description = "Identifier written into reports and script headers", defaultValue = "schema-sync")
    String identifier;
}
