package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.estimation.domain.CocomoEstimate;
import co.fanki.dirrollup.metrics.domain.MetricDistribution;
import co.fanki.dirrollup.shared.ValueObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Repository-wide view of the report.
 *
 * @param totalFiles number of files
 * @param totalDirectories number of directories, root included
 * @param totalLoc summed lines of code
 * @param totals summed metric values, in tracked-metric order
 * @param structure shape of the directory tree
 * @param ratios ratios derived from the totals
 * @param fileClassifications file count and LOC per classification
 * @param languages the language mix
 * @param distributions one distribution per tracked metric
 * @param commentRatioDistribution distribution of the per-file comment
 *        line share
 * @param byLanguage per-language sub-totals
 * @param cocomo cost estimate per preset, in preset table order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RepositorySummary(
        int totalFiles,
        int totalDirectories,
        double totalLoc,
        Map<String, Double> totals,
        StructureStats structure,
        DerivedRatios ratios,
        ClassificationCounts fileClassifications,
        LanguageMix languages,
        Map<String, MetricDistribution> distributions,
        MetricDistribution commentRatioDistribution,
        Map<String, LanguageTotals> byLanguage,
        Map<String, CocomoEstimate> cocomo) implements ValueObject {

    /** Copies every map. */
    public RepositorySummary {
        totals = Collections.unmodifiableMap(new LinkedHashMap<>(totals));
        distributions = Collections.unmodifiableMap(
                new LinkedHashMap<>(distributions));
        byLanguage = Collections.unmodifiableMap(new TreeMap<>(byLanguage));
        cocomo = Collections.unmodifiableMap(new LinkedHashMap<>(cocomo));
    }

    /**
     * Summarizes a repository from the recursive stats of its root.
     *
     * @param root the root stats
     * @param structure the tree structure
     * @param totalDirectories the number of directories
     * @param cocomo the cost estimates
     * @return the summary
     */
    public static RepositorySummary of(final DirectoryStats root,
            final StructureStats structure, final int totalDirectories,
            final Map<String, CocomoEstimate> cocomo) {
        return new RepositorySummary(
                root.fileCount(),
                totalDirectories,
                root.total(WellKnownMetrics.LINES_CODE),
                root.totals(),
                structure,
                root.ratios(),
                root.classifications(),
                LanguageMix.of(root.byLanguage()),
                root.distributions(),
                root.commentRatioDistribution(),
                root.byLanguage(),
                cocomo);
    }

}
