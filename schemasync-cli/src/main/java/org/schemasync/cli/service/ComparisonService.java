package org.schemasync.cli.service;

import org.schemasync.diff.SchemaDiffer;
import org.schemasync.model.DiffResult;
import org.schemasync.model.SchemaSnapshot;
import org.schemasync.snapshot.JsonSnapshotProvider;
import org.schemasync.snapshot.SnapshotProvider;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Loads both snapshots and runs the schema differ over them.
 */
public class ComparisonService {

    private final Function<Path, SnapshotProvider> providerFactory;
    private final SchemaDiffer schemaDiffer;

    public ComparisonService() {
        this(JsonSnapshotProvider::new, new SchemaDiffer());
    }

    /**
     * @param providerFactory creates the snapshot provider for a given location
     * @param schemaDiffer differ used for the comparison
     */
    public ComparisonService(Function<Path, SnapshotProvider> providerFactory, SchemaDiffer schemaDiffer) {
        this.providerFactory = Objects.requireNonNull(providerFactory, "providerFactory must not be null");
        this.schemaDiffer = Objects.requireNonNull(schemaDiffer, "schemaDiffer must not be null");
    }

    /**
     * Loads the snapshots and compares them.
     *
     * @param sourcePath snapshot holding the desired structure
     * @param targetPath snapshot of the database to bring in line
     * @return both snapshots together with their diff
     * @throws IOException if a snapshot cannot be read
     */
    public Comparison compare(Path sourcePath, Path targetPath) throws IOException {
        SchemaSnapshot source = providerFactory.apply(sourcePath).load();
        SchemaSnapshot target = providerFactory.apply(targetPath).load();
        return new Comparison(source, target, schemaDiffer.compare(source, target));
    }

    /**
     * Configured patterns first, then the ones given on the command line, without duplicates.
     */
    public static List<String> mergePatterns(Collection<String> configured, Collection<String> cli) {
        LinkedHashSet<String> merged = new LinkedHashSet<>();
        if (configured != null) merged.addAll(configured);
        if (cli != null) merged.addAll(cli);
        return new ArrayList<>(merged);
    }

    public record Comparison(SchemaSnapshot source, SchemaSnapshot target, DiffResult diff) {}
}
