package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.classification.domain.FileClassification;
import co.fanki.dirrollup.shared.ValueObject;

import java.util.Map;

/**
 * Ratios derived from the totals of a set of files.
 *
 * <p>A ratio whose denominator is zero is 0.</p>
 *
 * @param avgFileLoc lines of code per file
 * @param avgComplexity complexity per file
 * @param commentRatio comment lines over total lines
 * @param blankRatio blank lines over total lines
 * @param complexityDensity complexity per line of code
 * @param dryness unique lines of code over lines of code
 * @param generatedRatio share of generated files
 * @param minifiedRatio share of minified files
 * @param testRatio share of test files
 * @param testToCodeRatio test lines of code over source lines of code
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DerivedRatios(
        double avgFileLoc,
        double avgComplexity,
        double commentRatio,
        double blankRatio,
        double complexityDensity,
        double dryness,
        double generatedRatio,
        double minifiedRatio,
        double testRatio,
        double testToCodeRatio) implements ValueObject {

    /** Ratios of an empty file set. */
    public static final DerivedRatios NONE = new DerivedRatios(
            0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    /**
     * Derives the ratios.
     *
     * @param totals summed metrics by name
     * @param fileCount number of files
     * @param generatedCount number of generated files
     * @param minifiedCount number of minified files
     * @param classifications the classification counts
     * @return the ratios
     */
    public static DerivedRatios of(final Map<String, Double> totals,
            final int fileCount, final int generatedCount,
            final int minifiedCount,
            final ClassificationCounts classifications) {

        if (fileCount == 0) {
            return NONE;
        }

        final double lines = totals.getOrDefault(
                WellKnownMetrics.LINES_TOTAL, 0.0);
        final double code = totals.getOrDefault(
                WellKnownMetrics.LINES_CODE, 0.0);
        final double complexity = totals.getOrDefault(
                WellKnownMetrics.COMPLEXITY, 0.0);

        return new DerivedRatios(
                code / fileCount,
                complexity / fileCount,
                ratio(totals.getOrDefault(WellKnownMetrics.LINES_COMMENT, 0.0),
                        lines),
                ratio(totals.getOrDefault(WellKnownMetrics.LINES_BLANK, 0.0),
                        lines),
                ratio(complexity, code),
                ratio(totals.getOrDefault(WellKnownMetrics.ULOC, 0.0), code),
                (double) generatedCount / fileCount,
                (double) minifiedCount / fileCount,
                (double) classifications.fileCount(FileClassification.TEST)
                        / fileCount,
                ratio(classifications.loc(FileClassification.TEST),
                        classifications.loc(FileClassification.SOURCE)));
    }

    static double ratio(final double numerator, final double denominator) {
        return denominator > 0 ? numerator / denominator : 0;
    }

}
