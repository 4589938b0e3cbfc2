package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.ValueObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How the code of a repository splits across languages.
 *
 * <p>The dominant language is the one with the most lines of code, the
 * alphabetically first on a tie. The polyglot score is the share of code
 * outside the dominant language.</p>
 *
 * @param byFiles file count per language, sorted by language
 * @param byLoc lines of code per language, sorted by language
 * @param dominantLanguage the language with the most lines of code
 * @param dominantLanguagePct the dominant language share of all code
 * @param polyglotScore one minus the dominant share, 0 without code
 * @param singleFileLanguages languages seen in exactly one file
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LanguageMix(
        Map<String, Integer> byFiles,
        Map<String, Double> byLoc,
        String dominantLanguage,
        double dominantLanguagePct,
        double polyglotScore,
        List<String> singleFileLanguages) implements ValueObject {

    /** Copies the collections. */
    public LanguageMix {
        byFiles = Collections.unmodifiableMap(new LinkedHashMap<>(byFiles));
        byLoc = Collections.unmodifiableMap(new LinkedHashMap<>(byLoc));
        singleFileLanguages = List.copyOf(singleFileLanguages);
    }

    /**
     * Derives the mix from per-language totals.
     *
     * @param byLanguage the totals, sorted by language
     * @return the mix
     */
    public static LanguageMix of(final Map<String, LanguageTotals> byLanguage) {
        final Map<String, Integer> files = new LinkedHashMap<>();
        final Map<String, Double> loc = new LinkedHashMap<>();
        final List<String> single = new ArrayList<>();

        String dominant = FileRecord.UNKNOWN_LANGUAGE;
        double dominantLoc = -1;
        double totalLoc = 0;

        for (final Map.Entry<String, LanguageTotals> entry
                : byLanguage.entrySet()) {
            final String language = entry.getKey();
            final LanguageTotals totals = entry.getValue();
            final double code = totals.total(WellKnownMetrics.LINES_CODE);

            files.put(language, totals.fileCount());
            loc.put(language, code);
            totalLoc += code;
            if (totals.fileCount() == 1) {
                single.add(language);
            }
            if (code > dominantLoc) {
                dominant = language;
                dominantLoc = code;
            }
        }

        final double share = totalLoc > 0 ? dominantLoc / totalLoc : 0;
        return new LanguageMix(files, loc, dominant, share,
                totalLoc > 0 ? 1 - share : 0, single);
    }

}
