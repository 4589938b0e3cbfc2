package co.fanki.dirrollup.rollup.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for LanguageMix.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class LanguageMixTest {

    @Test
    void whenDeriving_givenSeveralLanguages_shouldPickTheLargestByLoc() {
        final Map<String, LanguageTotals> byLanguage = new TreeMap<>();
        byLanguage.put("Go", totals(1, 25));
        byLanguage.put("Python", totals(3, 75));

        final LanguageMix mix = LanguageMix.of(byLanguage);

        assertEquals("Python", mix.dominantLanguage());
        assertEquals(0.75, mix.dominantLanguagePct(), 1e-12);
        assertEquals(0.25, mix.polyglotScore(), 1e-12);
        assertEquals(List.of("Go"), mix.singleFileLanguages());
        assertEquals(3, mix.byFiles().get("Python"));
        assertEquals(25.0, mix.byLoc().get("Go"));
    }

    @Test
    void whenDeriving_givenTie_shouldPickTheAlphabeticallyFirst() {
        final Map<String, LanguageTotals> byLanguage = new TreeMap<>();
        byLanguage.put("Rust", totals(2, 50));
        byLanguage.put("C", totals(2, 50));

        assertEquals("C", LanguageMix.of(byLanguage).dominantLanguage());
    }

    @Test
    void whenDeriving_givenNoCode_shouldScoreZero() {
        final LanguageMix mix = LanguageMix.of(
                new TreeMap<>(Map.of("Markdown", totals(2, 0))));

        assertEquals("Markdown", mix.dominantLanguage());
        assertEquals(0.0, mix.dominantLanguagePct());
        assertEquals(0.0, mix.polyglotScore());
    }

    private static LanguageTotals totals(final int files, final double loc) {
        return new LanguageTotals(files,
                Map.of(WellKnownMetrics.LINES_CODE, loc));
    }

}
