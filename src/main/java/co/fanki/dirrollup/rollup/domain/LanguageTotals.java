package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.ValueObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-language sub-totals of a set of files: sums, not distributions.
 *
 * @param fileCount number of files in the language
 * @param totals summed metric values, in tracked-metric order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LanguageTotals(int fileCount, Map<String, Double> totals)
        implements ValueObject {

    /** Creates the totals, copying the map. */
    public LanguageTotals {
        totals = Collections.unmodifiableMap(new LinkedHashMap<>(totals));
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

}
