package org.schemasync.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for schemasync.
 * Compares two schema snapshots and generates structure synchronization scripts.
 */
@CommandLine.Command(
        name = "schemasync",
        mixinStandardHelpOptions = true,
        version = "schemasync 1.0",
        description = "Compares two database schema snapshots and generates a forward sync script",
        subcommands = {
                CompareCommand.class,
                GenerateCommand.class
        }
)
public class SchemaSyncCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SchemaSyncCli()).execute(args);
        System.exit(exitCode);
    }
}
