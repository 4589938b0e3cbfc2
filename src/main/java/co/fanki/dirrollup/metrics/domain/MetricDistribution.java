package co.fanki.dirrollup.metrics.domain;

import co.fanki.dirrollup.shared.ValueObject;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistical profile of one metric over one set of files.
 *
 * <p>Fully determined by the multiset of input values: the same values in
 * any order produce an equal distribution. Built by
 * {@link DistributionCalculator#fromValues(double[])}.</p>
 *
 * <p>{@code palma} is {@link Double#POSITIVE_INFINITY} when the bottom
 * 40% of the values sum to zero while the top 10% do not.</p>
 *
 * @param count number of values
 * @param min smallest value
 * @param max largest value
 * @param mean arithmetic mean, kept within [min, max]
 * @param median median of the sorted values
 * @param stddev sample standard deviation
 * @param p25 25th percentile, {@code sorted[floor(n * 0.25)]}
 * @param p75 75th percentile
 * @param p90 90th percentile, max below ten values
 * @param p95 95th percentile, max below ten values
 * @param p99 99th percentile, max below ten values
 * @param skewness population skewness
 * @param kurtosis population excess kurtosis
 * @param cv coefficient of variation (stddev / mean)
 * @param iqr interquartile range (p75 - p25)
 * @param gini Gini coefficient in [0, 1]
 * @param theil Theil T index, never negative
 * @param hoover Hoover index in [0, 1]
 * @param palma Palma ratio
 * @param top10PctShare share of the total held by the top 10% values
 * @param top20PctShare share of the total held by the top 20% values
 * @param bottom50PctShare share of the total held by the bottom 50% values
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MetricDistribution(
        int count,
        double min,
        double max,
        double mean,
        double median,
        double stddev,
        double p25,
        double p75,
        double p90,
        double p95,
        double p99,
        double skewness,
        double kurtosis,
        double cv,
        double iqr,
        double gini,
        double theil,
        double hoover,
        double palma,
        @JsonProperty("top_10_pct_share") double top10PctShare,
        @JsonProperty("top_20_pct_share") double top20PctShare,
        @JsonProperty("bottom_50_pct_share") double bottom50PctShare)
        implements ValueObject {

    /** The distribution of an empty value sequence, every field zero. */
    public static final MetricDistribution EMPTY = new MetricDistribution(
            0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0,
            0, 0, 0);

    /**
     * Checks whether the palma ratio holds the infinity sentinel.
     *
     * @return true if the bottom 40% share is zero and the top 10% is not
     */
    public boolean hasUnboundedPalma() {
        return Double.isInfinite(palma);
    }

}
