package co.fanki.dirrollup.validation.domain;

import co.fanki.dirrollup.estimation.domain.CocomoEstimate;
import co.fanki.dirrollup.estimation.domain.CocomoPreset;
import co.fanki.dirrollup.estimation.domain.CocomoPresetTable;
import co.fanki.dirrollup.metrics.domain.MetricDistribution;
import co.fanki.dirrollup.rollup.domain.DirectoryEntry;
import co.fanki.dirrollup.rollup.domain.DirectoryStats;
import co.fanki.dirrollup.rollup.domain.LanguageTotals;
import co.fanki.dirrollup.rollup.domain.RepositoryPath;
import co.fanki.dirrollup.rollup.domain.RepositorySummary;
import co.fanki.dirrollup.rollup.domain.RollupReport;
import co.fanki.dirrollup.rollup.domain.WellKnownMetrics;
import co.fanki.dirrollup.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-checks a finished {@link RollupReport} for internal consistency.
 *
 * <p>Every check runs independently and reports each failure as an
 * {@link InvariantViolation}; validation never throws on a bad report.
 * Floating point values are compared with a relative tolerance of
 * {@value #TOLERANCE}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ReportValidator {

    /** Relative tolerance of floating point comparisons. */
    public static final double TOLERANCE = 1e-9;

    private final CocomoPresetTable presetTable;

    /**
     * Creates a new validator.
     *
     * @param thePresetTable the presets the report was estimated with
     */
    public ReportValidator(final CocomoPresetTable thePresetTable) {
        this.presetTable = Preconditions.requireNonNull(thePresetTable,
                "Preset table is required");
    }

    /**
     * Runs every check.
     *
     * @param report the report
     * @return the violations, empty for a consistent report
     */
    public List<InvariantViolation> validate(final RollupReport report) {
        Preconditions.requireNonNull(report, "Report is required");

        final List<InvariantViolation> violations = new ArrayList<>();
        for (final DirectoryEntry entry : report.directories()) {
            checkRecursiveCovers(entry, violations);
            checkDistributions(entry.path(), entry.direct(), violations);
            checkDistributions(entry.path(), entry.recursive(), violations);
            checkNonNegative(entry.path(), entry.direct(), violations);
            checkNonNegative(entry.path(), entry.recursive(), violations);
        }
        checkStructure(report.directories(), violations);
        checkDirectFileTotal(report, violations);
        checkClassificationTotal(report.summary(), violations);
        checkLanguageTotal(report.summary(), violations);
        checkCostMonotonic(report.summary(), violations);
        return Collections.unmodifiableList(violations);
    }

    private static void checkRecursiveCovers(final DirectoryEntry entry,
            final List<InvariantViolation> violations) {
        final DirectoryStats direct = entry.direct();
        final DirectoryStats recursive = entry.recursive();

        if (recursive.fileCount() < direct.fileCount()) {
            violations.add(violation(CheckId.RECURSIVE_FILE_COUNT,
                    entry.path(), ">= " + direct.fileCount(),
                    recursive.fileCount(),
                    "recursive file count is below the direct file count"));
        }
        for (final Map.Entry<String, Double> total
                : direct.totals().entrySet()) {
            final double recursiveTotal = recursive.total(total.getKey());
            if (!atMost(total.getValue(), recursiveTotal)) {
                violations.add(violation(CheckId.RECURSIVE_METRIC_SUM,
                        entry.path(), ">= " + total.getValue(),
                        recursiveTotal, "recursive " + total.getKey()
                                + " is below the direct total"));
            }
        }
    }

    private static void checkDistributions(final String path,
            final DirectoryStats stats,
            final List<InvariantViolation> violations) {
        for (final Map.Entry<String, MetricDistribution> entry
                : stats.distributions().entrySet()) {
            checkDistribution(path, entry.getKey(), entry.getValue(),
                    violations);
        }
        checkDistribution(path, "comment_ratio",
                stats.commentRatioDistribution(), violations);
    }

    private static void checkDistribution(final String path,
            final String metric, final MetricDistribution d,
            final List<InvariantViolation> violations) {
        if (d.count() == 0) {
            return;
        }

        final double[] ordered = {d.min(), d.p25(), d.median(), d.p75(),
                d.p90(), d.p95(), d.p99(), d.max()};
        for (int i = 1; i < ordered.length; i++) {
            if (!atMost(ordered[i - 1], ordered[i])) {
                violations.add(violation(CheckId.PERCENTILE_ORDER, path,
                        ">= " + ordered[i - 1], ordered[i],
                        metric + " percentiles are out of order"));
                break;
            }
        }

        if (!atMost(d.min(), d.mean()) || !atMost(d.mean(), d.max())) {
            violations.add(violation(CheckId.MEAN_BOUNDS, path,
                    "[" + d.min() + ", " + d.max() + "]", d.mean(),
                    metric + " mean is outside [min, max]"));
        }

        checkUnit(path, metric, "gini", d.gini(), violations);
        checkUnit(path, metric, "hoover", d.hoover(), violations);
        checkUnit(path, metric, "top_10_pct_share", d.top10PctShare(),
                violations);
        checkUnit(path, metric, "top_20_pct_share", d.top20PctShare(),
                violations);
        checkUnit(path, metric, "bottom_50_pct_share", d.bottom50PctShare(),
                violations);
        if (!(d.theil() >= 0)) {
            violations.add(violation(CheckId.INEQUALITY_BOUNDS, path, ">= 0",
                    d.theil(), metric + " theil is negative"));
        }
        if (!(d.palma() >= 0)) {
            violations.add(violation(CheckId.INEQUALITY_BOUNDS, path, ">= 0",
                    d.palma(), metric + " palma is negative"));
        }
    }

    private static void checkUnit(final String path, final String metric,
            final String name, final double value,
            final List<InvariantViolation> violations) {
        if (!atMost(0, value) || !atMost(value, 1)) {
            violations.add(violation(CheckId.INEQUALITY_BOUNDS, path,
                    "[0, 1]", value, metric + " " + name
                            + " is outside [0, 1]"));
        }
    }

    private static void checkNonNegative(final String path,
            final DirectoryStats stats,
            final List<InvariantViolation> violations) {
        if (stats.fileCount() < 0) {
            violations.add(violation(CheckId.NON_NEGATIVE, path, ">= 0",
                    stats.fileCount(), "file count is negative"));
        }
        for (final Map.Entry<String, Double> total
                : stats.totals().entrySet()) {
            if (total.getValue() < 0) {
                violations.add(violation(CheckId.NON_NEGATIVE, path, ">= 0",
                        total.getValue(), total.getKey()
                                + " total is negative"));
            }
        }
    }

    private static void checkStructure(final List<DirectoryEntry> directories,
            final List<InvariantViolation> violations) {
        final Map<String, DirectoryEntry> byPath = new HashMap<>();
        for (final DirectoryEntry entry : directories) {
            byPath.put(entry.path(), entry);
        }
        if (!byPath.containsKey(RepositoryPath.ROOT)) {
            violations.add(violation(CheckId.STRUCTURE, RepositoryPath.ROOT,
                    "present", "missing", "the root directory is missing"));
        }

        for (final DirectoryEntry entry : directories) {
            if (entry.leaf() != (entry.childCount() == 0)) {
                violations.add(violation(CheckId.STRUCTURE, entry.path(),
                        "is_leaf=" + (entry.childCount() == 0),
                        "is_leaf=" + entry.leaf(),
                        "leaf flag disagrees with the child count"));
            }
            if (entry.childCount() != entry.subdirectories().size()) {
                violations.add(violation(CheckId.STRUCTURE, entry.path(),
                        String.valueOf(entry.subdirectories().size()),
                        entry.childCount(),
                        "child count disagrees with the subdirectories"));
            }
            for (final String child : entry.subdirectories()) {
                final DirectoryEntry childEntry = byPath.get(child);
                if (childEntry == null) {
                    violations.add(violation(CheckId.STRUCTURE, entry.path(),
                            child, "missing",
                            "subdirectory " + child + " has no entry"));
                } else if (childEntry.depth() != entry.depth() + 1) {
                    violations.add(violation(CheckId.STRUCTURE, child,
                            String.valueOf(entry.depth() + 1),
                            childEntry.depth(),
                            "depth is not the parent depth plus one"));
                }
            }
        }
    }

    private static void checkDirectFileTotal(final RollupReport report,
            final List<InvariantViolation> violations) {
        final int totalFiles = report.summary().totalFiles();

        long direct = 0;
        for (final DirectoryEntry entry : report.directories()) {
            direct += entry.direct().fileCount();
        }
        if (direct != totalFiles) {
            violations.add(violation(CheckId.DIRECT_FILE_TOTAL,
                    RepositoryPath.ROOT, String.valueOf(totalFiles), direct,
                    "direct file counts do not add up to the total"));
        }

        report.directory(RepositoryPath.ROOT).ifPresent(root -> {
            if (root.recursive().fileCount() != totalFiles) {
                violations.add(violation(CheckId.DIRECT_FILE_TOTAL,
                        RepositoryPath.ROOT, String.valueOf(totalFiles),
                        root.recursive().fileCount(),
                        "root recursive file count differs from the total"));
            }
        });
    }

    private static void checkClassificationTotal(
            final RepositorySummary summary,
            final List<InvariantViolation> violations) {
        final int classified =
                summary.fileClassifications().totalFileCount();
        if (classified != summary.totalFiles()) {
            violations.add(violation(CheckId.CLASSIFICATION_TOTAL,
                    RepositoryPath.ROOT,
                    String.valueOf(summary.totalFiles()), classified,
                    "classification counts do not add up to the total"));
        }
    }

    private static void checkLanguageTotal(final RepositorySummary summary,
            final List<InvariantViolation> violations) {
        long files = 0;
        double loc = 0;
        for (final LanguageTotals totals : summary.byLanguage().values()) {
            files += totals.fileCount();
            loc += totals.total(WellKnownMetrics.LINES_CODE);
        }
        if (files != summary.totalFiles()) {
            violations.add(violation(CheckId.LANGUAGE_TOTAL,
                    RepositoryPath.ROOT,
                    String.valueOf(summary.totalFiles()), files,
                    "language file counts do not add up to the total"));
        }
        if (!near(loc, summary.totalLoc())) {
            violations.add(violation(CheckId.LANGUAGE_TOTAL,
                    RepositoryPath.ROOT,
                    String.valueOf(summary.totalLoc()), loc,
                    "language lines of code do not add up to the total"));
        }
    }

    private void checkCostMonotonic(final RepositorySummary summary,
            final List<InvariantViolation> violations) {
        for (final CocomoPreset preset : presetTable.presets()) {
            final CocomoEstimate estimate = summary.cocomo().get(
                    preset.name());
            if (estimate == null) {
                violations.add(violation(CheckId.COST_MONOTONIC,
                        RepositoryPath.ROOT, "an estimate", "none",
                        "preset " + preset.name() + " has no estimate"));
            } else if (preset.unpaid() && estimate.cost() != 0) {
                violations.add(violation(CheckId.COST_MONOTONIC,
                        RepositoryPath.ROOT, "0", estimate.cost(),
                        "unpaid preset " + preset.name() + " has a cost"));
            }
        }

        CocomoPreset previous = null;
        double previousCost = 0;
        for (final CocomoPreset preset : presetTable.paidByRate()) {
            final CocomoEstimate estimate = summary.cocomo().get(
                    preset.name());
            if (estimate == null) {
                continue;
            }
            if (previous != null && !atMost(previousCost, estimate.cost())) {
                violations.add(violation(CheckId.COST_MONOTONIC,
                        RepositoryPath.ROOT, ">= " + previousCost,
                        estimate.cost(), preset.name()
                                + " costs less than the cheaper-rate preset "
                                + previous.name()));
            }
            previous = preset;
            previousCost = estimate.cost();
        }
    }

    private static boolean atMost(final double a, final double b) {
        if (a <= b) {
            return true;
        }
        return a - b <= TOLERANCE * Math.max(1, Math.max(Math.abs(a),
                Math.abs(b)));
    }

    private static boolean near(final double a, final double b) {
        return atMost(a, b) && atMost(b, a);
    }

    private static InvariantViolation violation(final CheckId checkId,
            final String path, final String expected, final Object actual,
            final String message) {
        return new InvariantViolation(checkId, path, expected,
                String.valueOf(actual), message);
    }

}
