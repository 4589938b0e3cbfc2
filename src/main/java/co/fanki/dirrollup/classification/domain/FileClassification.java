package co.fanki.dirrollup.classification.domain;

import java.util.Locale;

/**
 * Role of a file in the repository, as decided by {@link FileClassifier}.
 *
 * <p>{@link #SOURCE} stands for "no classification": the classifier never
 * returns it from {@link FileClassifier#classify}, callers fall back to it
 * when no rule matched.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum FileClassification {

    /** Production source, no rule matched. */
    SOURCE("source"),

    /** Test code or test fixtures. */
    TEST("test"),

    /** Configuration and dependency manifests. */
    CONFIG("config"),

    /** Documentation. */
    DOCS("docs"),

    /** Build scripts and project files. */
    BUILD("build"),

    /** Continuous integration pipelines. */
    CI("ci");

    private final String tag;

    FileClassification(final String theTag) {
        this.tag = theTag;
    }

    /**
     * Returns the lowercase tag used in reports.
     *
     * @return the tag, e.g. "test"
     */
    public String tag() {
        return tag;
    }

    /**
     * Parses a report tag back into a classification.
     *
     * @param value the tag, may be null
     * @return the classification, SOURCE for null, blank or unknown tags
     */
    public static FileClassification fromTag(final String value) {
        if (value == null || value.isBlank()) {
            return SOURCE;
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (final FileClassification classification : values()) {
            if (classification.tag.equals(normalized)) {
                return classification;
            }
        }
        return SOURCE;
    }

}
