package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.classification.domain.FileClassification;
import co.fanki.dirrollup.shared.ValueObject;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * File count and lines of code per {@link FileClassification}.
 *
 * <p>The key set is fixed: every classification is always present, with
 * zeros when no file matched, so the report shape does not depend on
 * what the repository contains. Serialized flat as
 * {@code <tag>_file_count} and {@code <tag>_loc}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ClassificationCounts implements ValueObject {

    private static final long serialVersionUID = 1L;

    private final EnumMap<FileClassification, Integer> fileCounts;
    private final EnumMap<FileClassification, Double> loc;

    private ClassificationCounts(
            final EnumMap<FileClassification, Integer> theFileCounts,
            final EnumMap<FileClassification, Double> theLoc) {
        this.fileCounts = theFileCounts;
        this.loc = theLoc;
    }

    /**
     * Counts the classifications of a set of records.
     *
     * @param records the records, in a canonical order
     * @param classification resolves the classification of a record
     * @return the counts
     */
    public static ClassificationCounts of(
            final Collection<FileRecord> records,
            final Function<FileRecord, FileClassification> classification) {

        final EnumMap<FileClassification, Integer> counts =
                new EnumMap<>(FileClassification.class);
        final EnumMap<FileClassification, Double> lines =
                new EnumMap<>(FileClassification.class);
        for (final FileClassification each : FileClassification.values()) {
            counts.put(each, 0);
            lines.put(each, 0.0);
        }
        for (final FileRecord fileRecord : records) {
            final FileClassification each = classification.apply(fileRecord);
            counts.merge(each, 1, Integer::sum);
            lines.merge(each, fileRecord.metric(WellKnownMetrics.LINES_CODE),
                    Double::sum);
        }
        return new ClassificationCounts(counts, lines);
    }

    /**
     * Returns the number of files with a classification.
     *
     * @param classification the classification
     * @return the file count
     */
    public int fileCount(final FileClassification classification) {
        return fileCounts.get(classification);
    }

    /**
     * Returns the lines of code of files with a classification.
     *
     * @param classification the classification
     * @return the summed lines of code
     */
    public double loc(final FileClassification classification) {
        return loc.get(classification);
    }

    /**
     * Returns the number of classified files, source included.
     *
     * @return the file count over every classification
     */
    public int totalFileCount() {
        int total = 0;
        for (final int count : fileCounts.values()) {
            total += count;
        }
        return total;
    }

    /**
     * Returns the flat report view of the counts.
     *
     * @return map of {@code <tag>_file_count} and {@code <tag>_loc}
     */
    @JsonValue
    public Map<String, Number> asMap() {
        final Map<String, Number> result = new LinkedHashMap<>();
        for (final FileClassification each : FileClassification.values()) {
            result.put(each.tag() + "_file_count", fileCounts.get(each));
            result.put(each.tag() + "_loc", loc.get(each));
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ClassificationCounts that = (ClassificationCounts) obj;
        return fileCounts.equals(that.fileCounts) && loc.equals(that.loc);
    }

    @Override
    public int hashCode() {
        return 31 * fileCounts.hashCode() + loc.hashCode();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }

}
