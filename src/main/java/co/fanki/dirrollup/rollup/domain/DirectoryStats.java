package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.classification.domain.FileClassification;
import co.fanki.dirrollup.metrics.domain.DistributionCalculator;
import co.fanki.dirrollup.metrics.domain.MetricDistribution;
import co.fanki.dirrollup.shared.Preconditions;
import co.fanki.dirrollup.shared.ValueObject;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Aggregate view of a set of files: the direct or the recursive scope of
 * a directory, or the whole repository.
 *
 * @param fileCount number of files
 * @param totals summed metric values, in tracked-metric order
 * @param byLanguage per-language sub-totals, sorted by language
 * @param classifications file count and LOC per classification
 * @param distributions one distribution per tracked metric
 * @param commentRatioDistribution distribution of the per-file comment
 *        line share, 0 for files without lines
 * @param minifiedCount number of minified files
 * @param generatedCount number of generated files
 * @param binaryCount number of binary files
 * @param languageCount number of distinct languages
 * @param ratios ratios derived from the totals
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DirectoryStats(
        int fileCount,
        Map<String, Double> totals,
        Map<String, LanguageTotals> byLanguage,
        ClassificationCounts classifications,
        Map<String, MetricDistribution> distributions,
        MetricDistribution commentRatioDistribution,
        int minifiedCount,
        int generatedCount,
        int binaryCount,
        int languageCount,
        DerivedRatios ratios) implements ValueObject {

    /** Creates the stats, copying every map. */
    public DirectoryStats {
        totals = Collections.unmodifiableMap(new LinkedHashMap<>(totals));
        byLanguage = Collections.unmodifiableMap(new TreeMap<>(byLanguage));
        distributions = Collections.unmodifiableMap(
                new LinkedHashMap<>(distributions));
    }

    /**
     * Aggregates a set of records.
     *
     * <p>The result depends only on the multiset of records: they are put
     * in path order before anything is summed.</p>
     *
     * @param records the records
     * @param metrics the tracked metric names, in report order
     * @param classification resolves the classification of a record
     * @return the stats
     */
    public static DirectoryStats of(final Collection<FileRecord> records,
            final List<String> metrics,
            final Function<FileRecord, FileClassification> classification) {

        Preconditions.requireNonNull(records, "Records are required");
        Preconditions.requireNonNull(metrics, "Metrics are required");
        Preconditions.requireNonNull(classification,
                "Classification resolver is required");

        final List<FileRecord> sorted = new ArrayList<>(records);
        sorted.sort(DirectoryTree.RECORD_ORDER);

        final Map<String, Double> totals = new LinkedHashMap<>();
        final Map<String, MetricDistribution> distributions =
                new LinkedHashMap<>();
        for (final String metric : metrics) {
            final double[] values = values(sorted, metric);
            totals.put(metric, DistributionCalculator.total(values));
            distributions.put(metric,
                    DistributionCalculator.fromValues(values));
        }

        final Map<String, List<FileRecord>> perLanguage = new TreeMap<>();
        int minified = 0;
        int generated = 0;
        int binary = 0;
        for (final FileRecord fileRecord : sorted) {
            perLanguage.computeIfAbsent(fileRecord.language(),
                    k -> new ArrayList<>()).add(fileRecord);
            if (fileRecord.flags().minified()) {
                minified++;
            }
            if (fileRecord.flags().generated()) {
                generated++;
            }
            if (fileRecord.flags().binary()) {
                binary++;
            }
        }

        final Map<String, LanguageTotals> byLanguage = new TreeMap<>();
        for (final Map.Entry<String, List<FileRecord>> entry
                : perLanguage.entrySet()) {
            final Map<String, Double> languageTotals = new LinkedHashMap<>();
            for (final String metric : metrics) {
                languageTotals.put(metric, DistributionCalculator.total(
                        values(entry.getValue(), metric)));
            }
            byLanguage.put(entry.getKey(), new LanguageTotals(
                    entry.getValue().size(), languageTotals));
        }

        final ClassificationCounts classifications =
                ClassificationCounts.of(sorted, classification);

        return new DirectoryStats(
                sorted.size(),
                totals,
                byLanguage,
                classifications,
                distributions,
                DistributionCalculator.fromValues(commentRatios(sorted)),
                minified,
                generated,
                binary,
                byLanguage.size(),
                DerivedRatios.of(totals, sorted.size(), generated, minified,
                        classifications));
    }

    /**
     * Returns the total of one metric.
     *
     * @param metric the metric name
     * @return the total, 0 if the metric is not tracked
     */
    public double total(final String metric) {
        return totals.getOrDefault(metric, 0.0);
    }

    /**
     * Returns the distribution of one metric.
     *
     * @param metric the metric name
     * @return the distribution, {@link MetricDistribution#EMPTY} if the
     *         metric is not tracked
     */
    public MetricDistribution distribution(final String metric) {
        return distributions.getOrDefault(metric, MetricDistribution.EMPTY);
    }

    private static double[] commentRatios(final List<FileRecord> records) {
        final double[] ratios = new double[records.size()];
        for (int i = 0; i < ratios.length; i++) {
            final FileRecord fileRecord = records.get(i);
            ratios[i] = DerivedRatios.ratio(
                    fileRecord.metric(WellKnownMetrics.LINES_COMMENT),
                    fileRecord.metric(WellKnownMetrics.LINES_TOTAL));
        }
        return ratios;
    }

    private static double[] values(final List<FileRecord> records,
            final String metric) {
        final double[] values = new double[records.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = records.get(i).metric(metric);
        }
        return values;
    }

}
