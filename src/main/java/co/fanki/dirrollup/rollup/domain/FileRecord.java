package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.Preconditions;
import co.fanki.dirrollup.shared.ValueObject;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Metrics the collector measured for one file.
 *
 * <p>Immutable. Metric values are finite numbers; a metric the record
 * does not carry reads as 0.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FileRecord implements ValueObject {

    private static final long serialVersionUID = 1L;

    /** Language reported when the collector did not detect one. */
    public static final String UNKNOWN_LANGUAGE = "Unknown";

    private final RepositoryPath path;
    private final String language;
    private final Map<String, Double> metrics;
    private final FileFlags flags;

    private FileRecord(
            final RepositoryPath thePath,
            final String theLanguage,
            final Map<String, Double> theMetrics,
            final FileFlags theFlags) {
        this.path = Preconditions.requireNonNull(thePath, "Path is required");
        this.language = theLanguage == null || theLanguage.isBlank()
                ? UNKNOWN_LANGUAGE : theLanguage;
        Preconditions.requireNonNull(theMetrics, "Metrics are required");
        final Map<String, Double> copy = new TreeMap<>();
        for (final Map.Entry<String, Double> entry : theMetrics.entrySet()) {
            Preconditions.requireNonBlank(entry.getKey(),
                    "Metric name is required");
            final Double value = Preconditions.requireNonNull(
                    entry.getValue(),
                    "Metric " + entry.getKey() + " has no value");
            Preconditions.require(Double.isFinite(value),
                    "Metric " + entry.getKey() + " is not a finite number");
            copy.put(entry.getKey(), value);
        }
        this.metrics = Collections.unmodifiableMap(copy);
        this.flags = theFlags == null ? FileFlags.NONE : theFlags;
    }

    /**
     * Creates a file record.
     *
     * @param path the repository-relative path
     * @param language the detected language, null for unknown
     * @param metrics the metric values by name
     * @param flags the collector flags, null for none
     * @return the record
     * @throws InvalidPathException if the path is not normalized
     */
    public static FileRecord of(final String path, final String language,
            final Map<String, Double> metrics, final FileFlags flags) {
        return new FileRecord(RepositoryPath.of(path), language, metrics,
                flags);
    }

    /**
     * Creates a record with an unknown language and no flags.
     *
     * @param path the repository-relative path
     * @param metrics the metric values by name
     * @return the record
     */
    public static FileRecord of(final String path,
            final Map<String, Double> metrics) {
        return of(path, null, metrics, FileFlags.NONE);
    }

    /**
     * Returns the repository path of the file.
     *
     * @return the path
     */
    public RepositoryPath path() {
        return path;
    }

    /**
     * Returns the language of the file.
     *
     * @return the language, {@link #UNKNOWN_LANGUAGE} if not detected
     */
    public String language() {
        return language;
    }

    /**
     * Returns the metric values, sorted by name.
     *
     * @return unmodifiable map of metric name to value
     */
    public Map<String, Double> metrics() {
        return metrics;
    }

    /**
     * Returns the value of a metric.
     *
     * @param name the metric name
     * @return the value, 0 if the record does not carry the metric
     */
    public double metric(final String name) {
        final Double value = metrics.get(name);
        return value == null ? 0 : value;
    }

    /**
     * Returns the collector flags.
     *
     * @return the flags, never null
     */
    public FileFlags flags() {
        return flags;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final FileRecord that = (FileRecord) obj;
        return path.equals(that.path)
                && language.equals(that.language)
                && metrics.equals(that.metrics)
                && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        int result = path.hashCode();
        result = 31 * result + language.hashCode();
        result = 31 * result + metrics.hashCode();
        result = 31 * result + flags.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "FileRecord{" + path + ", " + language + ", " + metrics + "}";
    }

}
