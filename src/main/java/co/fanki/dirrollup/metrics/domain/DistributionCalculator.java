package co.fanki.dirrollup.metrics.domain;

import co.fanki.dirrollup.shared.Preconditions;

import java.util.Arrays;
import java.util.Collection;

/**
 * Turns a sequence of metric values into a {@link MetricDistribution}.
 *
 * <p>Stateless and thread-safe. Every method sorts a private copy of its
 * input and sums over the sorted copy, so results never depend on the
 * order the values arrive in.</p>
 *
 * <p>Edge cases follow one convention throughout: a computation that has
 * no meaningful answer for the input (too few values, a zero total, a
 * zero variance) yields 0 rather than NaN. The only non-finite output is
 * the palma sentinel, see {@link #palma(double[])}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DistributionCalculator {

    /** Below this many values p90, p95 and p99 fall back to the max. */
    static final int TAIL_PERCENTILE_MIN_COUNT = 10;

    /** Below this many values the palma ratio is reported as 0. */
    static final int PALMA_MIN_COUNT = 4;

    private DistributionCalculator() {
    }

    /**
     * Computes the full distribution profile of the given values.
     *
     * @param values the values, never null, may be empty
     * @return the distribution, {@link MetricDistribution#EMPTY} for no
     *         values
     */
    public static MetricDistribution fromValues(final double[] values) {
        Preconditions.requireNonNull(values, "Values are required");

        if (values.length == 0) {
            return MetricDistribution.EMPTY;
        }

        final double[] sorted = sortedCopy(values);
        final int n = sorted.length;
        final double min = sorted[0];
        final double max = sorted[n - 1];
        final boolean constant = min == max;

        final double mean = constant ? min : clamp(sum(sorted) / n, min, max);
        final double stddev = constant ? 0 : sampleStddev(sorted, mean);

        final double p25 = percentile(sorted, 0.25);
        final double p75 = percentile(sorted, 0.75);
        final boolean tail = n >= TAIL_PERCENTILE_MIN_COUNT;

        return new MetricDistribution(
                n,
                min,
                max,
                mean,
                medianOfSorted(sorted),
                stddev,
                p25,
                p75,
                tail ? percentile(sorted, 0.90) : max,
                tail ? percentile(sorted, 0.95) : max,
                tail ? percentile(sorted, 0.99) : max,
                constant ? 0 : skewnessOfSorted(sorted, mean),
                constant ? 0 : kurtosisOfSorted(sorted, mean),
                mean > 0 ? stddev / mean : 0,
                p75 - p25,
                giniOfSorted(sorted),
                theilOfSorted(sorted),
                hooverOfSorted(sorted),
                palmaOfSorted(sorted),
                topShareOfSorted(sorted, 0.10),
                topShareOfSorted(sorted, 0.20),
                bottomShareOfSorted(sorted, 0.50));
    }

    /**
     * Computes the distribution of a collection of numbers.
     *
     * @param values the values, never null
     * @return the distribution
     */
    public static MetricDistribution fromValues(
            final Collection<? extends Number> values) {
        Preconditions.requireNonNull(values, "Values are required");
        final double[] array = new double[values.size()];
        int i = 0;
        for (final Number value : values) {
            array[i++] = value.doubleValue();
        }
        return fromValues(array);
    }

    /**
     * Sums the values in ascending order, so that equal multisets give
     * bit-identical totals.
     *
     * @param values the values
     * @return the total, 0 for no values
     */
    public static double total(final double[] values) {
        return sum(sortedCopy(values));
    }

    /**
     * Returns the value at the given quantile using the integer index
     * convention {@code sorted[floor(n * q)]}, without interpolation.
     *
     * @param values the values, not empty
     * @param quantile the quantile in [0, 1]
     * @return the percentile value
     */
    public static double percentile(final double[] values,
            final double quantile) {
        Preconditions.require(values.length > 0,
                "Percentile of an empty sequence is undefined");
        Preconditions.require(quantile >= 0 && quantile <= 1,
                "Quantile must be in [0, 1]");
        return percentileOfSorted(sortedCopy(values), quantile);
    }

    /**
     * Returns the median: the middle value, or the average of the two
     * middle values for an even count. Zero for no values.
     *
     * @param values the values
     * @return the median
     */
    public static double median(final double[] values) {
        if (values.length == 0) {
            return 0;
        }
        return medianOfSorted(sortedCopy(values));
    }

    /**
     * Gini coefficient: 0 for perfect equality, approaching 1 as a single
     * value concentrates the whole total.
     *
     * @param values the values
     * @return the coefficient in [0, 1], 0 for fewer than two values or a
     *         zero total
     */
    public static double gini(final double[] values) {
        return giniOfSorted(sortedCopy(values));
    }

    /**
     * Theil T index, the entropy distance from perfect equality.
     *
     * <p>Values of zero or less contribute nothing to the log term but
     * still count towards n and the mean.</p>
     *
     * @param values the values
     * @return the index, never negative
     */
    public static double theil(final double[] values) {
        return theilOfSorted(sortedCopy(values));
    }

    /**
     * Hoover index, the share of the total that would have to move for
     * every value to equal the mean.
     *
     * @param values the values
     * @return the index in [0, 1]
     */
    public static double hoover(final double[] values) {
        return hooverOfSorted(sortedCopy(values));
    }

    /**
     * Palma ratio, the top 10% sum over the bottom 40% sum.
     *
     * @param values the values
     * @return the ratio; 0 for fewer than four values or when both sums
     *         are zero; {@link Double#POSITIVE_INFINITY} when only the
     *         bottom sum is zero
     */
    public static double palma(final double[] values) {
        return palmaOfSorted(sortedCopy(values));
    }

    /**
     * Share of the total held by the largest {@code fraction} of the
     * values, at least one value.
     *
     * @param values the values
     * @param fraction the fraction of values, e.g. 0.10
     * @return the share in [0, 1], 0 for no values or a zero total
     */
    public static double topShare(final double[] values,
            final double fraction) {
        return topShareOfSorted(sortedCopy(values), fraction);
    }

    /**
     * Share of the total held by the smallest {@code fraction} of the
     * values, at least one value.
     *
     * @param values the values
     * @param fraction the fraction of values, e.g. 0.50
     * @return the share in [0, 1], 0 for no values or a zero total
     */
    public static double bottomShare(final double[] values,
            final double fraction) {
        return bottomShareOfSorted(sortedCopy(values), fraction);
    }

    /**
     * Population skewness (third standardized moment).
     *
     * @param values the values
     * @return the skewness, 0 for fewer than three values or no variance
     */
    public static double skewness(final double[] values) {
        final double[] sorted = sortedCopy(values);
        if (sorted.length == 0 || sorted[0] == sorted[sorted.length - 1]) {
            return 0;
        }
        return skewnessOfSorted(sorted, sum(sorted) / sorted.length);
    }

    /**
     * Population excess kurtosis (fourth standardized moment minus 3).
     *
     * @param values the values
     * @return the kurtosis, 0 for fewer than four values or no variance
     */
    public static double kurtosis(final double[] values) {
        final double[] sorted = sortedCopy(values);
        if (sorted.length == 0 || sorted[0] == sorted[sorted.length - 1]) {
            return 0;
        }
        return kurtosisOfSorted(sorted, sum(sorted) / sorted.length);
    }

    // -- sorted-input implementations -------------------------------------

    private static double percentileOfSorted(final double[] sorted,
            final double quantile) {
        final int index = (int) Math.floor(sorted.length * quantile);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    private static double medianOfSorted(final double[] sorted) {
        final int n = sorted.length;
        final int middle = n / 2;
        if (n % 2 == 1) {
            return sorted[middle];
        }
        return (sorted[middle - 1] + sorted[middle]) / 2.0;
    }

    private static double sampleStddev(final double[] sorted,
            final double mean) {
        final int n = sorted.length;
        if (n < 2) {
            return 0;
        }
        double squares = 0;
        for (final double value : sorted) {
            final double deviation = value - mean;
            squares += deviation * deviation;
        }
        return Math.sqrt(squares / (n - 1));
    }

    private static double skewnessOfSorted(final double[] sorted,
            final double mean) {
        final int n = sorted.length;
        if (n < 3) {
            return 0;
        }
        double m2 = 0;
        double m3 = 0;
        for (final double value : sorted) {
            final double deviation = value - mean;
            final double squared = deviation * deviation;
            m2 += squared;
            m3 += squared * deviation;
        }
        m2 /= n;
        m3 /= n;
        if (m2 == 0) {
            return 0;
        }
        return m3 / Math.pow(m2, 1.5);
    }

    private static double kurtosisOfSorted(final double[] sorted,
            final double mean) {
        final int n = sorted.length;
        if (n < 4) {
            return 0;
        }
        double m2 = 0;
        double m4 = 0;
        for (final double value : sorted) {
            final double deviation = value - mean;
            final double squared = deviation * deviation;
            m2 += squared;
            m4 += squared * squared;
        }
        m2 /= n;
        m4 /= n;
        if (m2 == 0) {
            return 0;
        }
        return m4 / (m2 * m2) - 3;
    }

    private static double giniOfSorted(final double[] sorted) {
        final int n = sorted.length;
        if (n < 2) {
            return 0;
        }
        final double total = sum(sorted);
        if (total <= 0) {
            return 0;
        }
        double weighted = 0;
        for (int i = 0; i < n; i++) {
            weighted += (i + 1) * sorted[i];
        }
        final double gini = (2 * weighted) / (n * total)
                - (n + 1) / (double) n;
        return clamp(gini, 0, 1);
    }

    private static double theilOfSorted(final double[] sorted) {
        final int n = sorted.length;
        if (n < 2) {
            return 0;
        }
        final double mean = sum(sorted) / n;
        if (mean <= 0) {
            return 0;
        }
        double theil = 0;
        for (final double value : sorted) {
            if (value > 0) {
                final double ratio = value / mean;
                theil += ratio * Math.log(ratio);
            }
        }
        return Math.max(0, theil / n);
    }

    private static double hooverOfSorted(final double[] sorted) {
        final int n = sorted.length;
        if (n < 2) {
            return 0;
        }
        final double total = sum(sorted);
        if (total <= 0) {
            return 0;
        }
        final double mean = total / n;
        double deviations = 0;
        for (final double value : sorted) {
            deviations += Math.abs(value - mean);
        }
        return clamp(0.5 * deviations / total, 0, 1);
    }

    private static double palmaOfSorted(final double[] sorted) {
        final int n = sorted.length;
        if (n < PALMA_MIN_COUNT) {
            return 0;
        }
        final double bottom = sumRange(sorted, 0, (int) (n * 0.4));
        final double top = sumRange(sorted, (int) (n * 0.9), n);

        if (bottom == 0) {
            return top > 0 ? Double.POSITIVE_INFINITY : 0;
        }
        return top / bottom;
    }

    private static double topShareOfSorted(final double[] sorted,
            final double fraction) {
        final int n = sorted.length;
        final double total = sum(sorted);
        if (n == 0 || total == 0) {
            return 0;
        }
        final int count = Math.max(1, (int) (n * fraction));
        return sumRange(sorted, n - count, n) / total;
    }

    private static double bottomShareOfSorted(final double[] sorted,
            final double fraction) {
        final int n = sorted.length;
        final double total = sum(sorted);
        if (n == 0 || total == 0) {
            return 0;
        }
        final int count = Math.max(1, (int) (n * fraction));
        return sumRange(sorted, 0, count) / total;
    }

    // -- helpers -------------------------------------------------------------

    private static double[] sortedCopy(final double[] values) {
        Preconditions.requireNonNull(values, "Values are required");
        final double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }

    private static double sum(final double[] sorted) {
        return sumRange(sorted, 0, sorted.length);
    }

    private static double sumRange(final double[] sorted, final int from,
            final int to) {
        double total = 0;
        for (int i = from; i < to; i++) {
            total += sorted[i];
        }
        return total;
    }

    private static double clamp(final double value, final double low,
            final double high) {
        return Math.max(low, Math.min(high, value));
    }

}
