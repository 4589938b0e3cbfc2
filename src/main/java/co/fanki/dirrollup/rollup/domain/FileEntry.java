package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.classification.domain.FileClassification;
import co.fanki.dirrollup.shared.Preconditions;
import co.fanki.dirrollup.shared.ValueObject;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-file view of the report.
 *
 * <p>Carries everything needed to rebuild the {@link FileRecord} it was
 * made from, so a report's files can be rolled up again.</p>
 *
 * @param path the repository-relative path
 * @param filename the last path segment
 * @param directory the directory holding the file, {@code /} at the top
 * @param language the detected language
 * @param extension the extension including the dot, empty if none
 * @param metrics the raw metric values, sorted by name
 * @param minified the minified flag
 * @param generated the generated flag
 * @param binary the binary flag
 * @param classification the classification tag, null for source files
 * @param commentRatio comment lines over total lines
 * @param blankRatio blank lines over total lines
 * @param codeRatio code lines over total lines
 * @param complexityDensity complexity per line of code
 * @param dryness unique lines of code over lines of code
 * @param bytesPerLoc bytes per line of code
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileEntry(
        String path,
        String filename,
        String directory,
        String language,
        String extension,
        Map<String, Double> metrics,
        @JsonProperty("is_minified") boolean minified,
        @JsonProperty("is_generated") boolean generated,
        @JsonProperty("is_binary") boolean binary,
        String classification,
        double commentRatio,
        double blankRatio,
        double codeRatio,
        double complexityDensity,
        double dryness,
        double bytesPerLoc) implements ValueObject {

    /** Creates the entry, copying the metrics. */
    public FileEntry {
        Preconditions.requireNonBlank(path, "Path is required");
        metrics = Collections.unmodifiableMap(new TreeMap<>(metrics));
    }

    /**
     * Creates the entry of a record.
     *
     * @param fileRecord the record
     * @param classification the record classification
     * @return the entry
     */
    public static FileEntry from(final FileRecord fileRecord,
            final FileClassification classification) {
        Preconditions.requireNonNull(fileRecord, "File record is required");
        Preconditions.requireNonNull(classification,
                "Classification is required");

        final RepositoryPath path = fileRecord.path();
        final double lines = fileRecord.metric(WellKnownMetrics.LINES_TOTAL);
        final double code = fileRecord.metric(WellKnownMetrics.LINES_CODE);

        return new FileEntry(
                path.value(),
                path.fileName(),
                path.directory(),
                fileRecord.language(),
                path.extension(),
                fileRecord.metrics(),
                fileRecord.flags().minified(),
                fileRecord.flags().generated(),
                fileRecord.flags().binary(),
                classification == FileClassification.SOURCE
                        ? null : classification.tag(),
                DerivedRatios.ratio(fileRecord.metric(
                        WellKnownMetrics.LINES_COMMENT), lines),
                DerivedRatios.ratio(fileRecord.metric(
                        WellKnownMetrics.LINES_BLANK), lines),
                DerivedRatios.ratio(code, lines),
                DerivedRatios.ratio(fileRecord.metric(
                        WellKnownMetrics.COMPLEXITY), code),
                DerivedRatios.ratio(fileRecord.metric(WellKnownMetrics.ULOC),
                        code),
                DerivedRatios.ratio(fileRecord.metric(WellKnownMetrics.BYTES),
                        code));
    }

    /**
     * Rebuilds the record this entry describes.
     *
     * @return the record
     */
    public FileRecord toRecord() {
        return FileRecord.of(path, language, metrics,
                new FileFlags(minified, generated, binary));
    }

}
