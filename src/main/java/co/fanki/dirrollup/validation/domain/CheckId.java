package co.fanki.dirrollup.validation.domain;

/**
 * Names of the consistency checks run over a rollup report.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum CheckId {

    /** A directory's recursive file count is at least its direct count. */
    RECURSIVE_FILE_COUNT,

    /** A directory's recursive metric totals are at least its direct ones. */
    RECURSIVE_METRIC_SUM,

    /** Percentiles grow with their rank and never exceed the max. */
    PERCENTILE_ORDER,

    /** The mean lies between min and max. */
    MEAN_BOUNDS,

    /** Inequality measures and shares stay within their ranges. */
    INEQUALITY_BOUNDS,

    /** Direct file counts add up to the repository file count. */
    DIRECT_FILE_TOTAL,

    /** Cost does not decrease with the monthly rate of a preset. */
    COST_MONOTONIC,

    /** Leaf flags, child counts and depths describe a consistent tree. */
    STRUCTURE,

    /** Classification counts add up to the repository file count. */
    CLASSIFICATION_TOTAL,

    /** Per-language totals add up to the repository totals. */
    LANGUAGE_TOTAL,

    /** Counts and totals are not negative. */
    NON_NEGATIVE

}
