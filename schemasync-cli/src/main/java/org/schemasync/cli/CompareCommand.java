package org.schemasync.cli;

import org.schemasync.cli.service.ComparisonService;
import org.schemasync.config.ConfigurationLoader;
import org.schemasync.exception.MalformedSnapshotException;
import org.schemasync.report.ComparisonReport;
import org.schemasync.report.ReportRenderer;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Prints the differences between two snapshots, hiding excluded tables.
 */
@CommandLine.Command(
        name = "compare",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "Compares the source and target snapshots and prints the differences."
)
public class CompareCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private ComparisonOptions options;

    @CommandLine.Option(names = "--format", description = "Report format: text or json", defaultValue = "text")
    private String format;

    @Override
    public Integer call() {
        try {
            Map<String, String> config = new ConfigurationLoader().loadConfiguration(options.profile);
            List<String> patterns = ComparisonService.mergePatterns(
                    ConfigurationLoader.exclusionPatterns(config), options.excludes);

            ComparisonService.Comparison comparison = new ComparisonService().compare(options.source, options.target);
            ComparisonReport report = ComparisonReport.of(options.identifier,
                    comparison.source(), comparison.target(), comparison.diff(), patterns);

            ReportRenderer renderer = new ReportRenderer();
            switch (format.toLowerCase()) {
                case "json" -> System.out.println(renderer.toJson(report));
                case "text" -> {
                    System.out.print(renderer.toText(report));
                    if (comparison.diff().isEmpty()) {
                        System.out.println("No differences detected.");
                    }
                }
                default -> throw new IllegalArgumentException("Unsupported format: " + format);
            }
            return 0;

        } catch (MalformedSnapshotException e) {
            System.err.println("Comparison aborted: " + e.getSide() + " snapshot is malformed.");
            e.getProblems().forEach(problem -> System.err.println("   - " + problem));
            return 1;
        } catch (Exception e) {
            System.err.println("Comparison failed: " + e.getMessage());
            return 1;
        }
    }
}
