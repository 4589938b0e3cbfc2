package co.fanki.dirrollup.rollup.domain;

import java.util.List;

/**
 * Metric names the derived ratios read.
 *
 * <p>The rollup itself is metric-agnostic; these names only matter for
 * ratios such as comment ratio or complexity density, and a record
 * without one of them counts it as 0.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class WellKnownMetrics {

    /** Physical lines, code plus comments plus blanks. */
    public static final String LINES_TOTAL = "lines_total";

    /** Lines of code. */
    public static final String LINES_CODE = "lines_code";

    /** Comment lines. */
    public static final String LINES_COMMENT = "lines_comment";

    /** Blank lines. */
    public static final String LINES_BLANK = "lines_blank";

    /** File size in bytes. */
    public static final String BYTES = "bytes";

    /** Cyclomatic complexity. */
    public static final String COMPLEXITY = "complexity";

    /** Unique lines of code. */
    public static final String ULOC = "uloc";

    /** The default tracked metrics, in report order. */
    public static final List<String> DEFAULTS = List.of(LINES_TOTAL,
            LINES_CODE, LINES_COMMENT, LINES_BLANK, BYTES, COMPLEXITY, ULOC);

    private WellKnownMetrics() {
    }

}
