package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.classification.domain.FileClassification;
import co.fanki.dirrollup.estimation.domain.CostEstimator;
import co.fanki.dirrollup.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link RollupReport} of a set of file records.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RollupReportAssembler {

    private final RollupAggregator aggregator;
    private final CostEstimator costEstimator;

    /**
     * Creates a new assembler.
     *
     * @param theAggregator computes the directory stats
     * @param theCostEstimator estimates the cost of the code base
     */
    public RollupReportAssembler(final RollupAggregator theAggregator,
            final CostEstimator theCostEstimator) {
        this.aggregator = Preconditions.requireNonNull(theAggregator,
                "Rollup aggregator is required");
        this.costEstimator = Preconditions.requireNonNull(theCostEstimator,
                "Cost estimator is required");
    }

    /**
     * Assembles the report.
     *
     * @param records the records, with unique paths, in input order
     * @param strategy how recursive stats are gathered
     * @return the report
     */
    public RollupReport assemble(final List<FileRecord> records,
            final RollupStrategy strategy) {
        Preconditions.requireNonNull(records, "Records are required");

        final DirectoryTree tree = new DirectoryTreeBuilder()
                .addAll(records)
                .build();
        final List<DirectoryEntry> directories =
                aggregator.aggregate(tree, strategy);

        final Map<RepositoryPath, FileClassification> classifications =
                aggregator.classify(records);
        final List<FileEntry> files = new ArrayList<>(records.size());
        for (final FileRecord fileRecord : records) {
            files.add(FileEntry.from(fileRecord,
                    classifications.get(fileRecord.path())));
        }

        final DirectoryStats root = directories.get(0).recursive();
        final double kloc = root.total(WellKnownMetrics.LINES_CODE) / 1000;
        final RepositorySummary summary = RepositorySummary.of(root,
                StructureStats.of(directories, records.size()),
                directories.size(), costEstimator.estimateAll(kloc));

        return new RollupReport(RollupReport.SCHEMA_VERSION, directories,
                files, summary);
    }

}
