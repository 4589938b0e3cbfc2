package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for RollupStrategy.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RollupStrategyTest {

    @Test
    void whenParsing_givenLowercaseName_shouldReturnStrategy() {
        assertEquals(RollupStrategy.CLOSURE,
                RollupStrategy.fromString(" closure ", RollupStrategy.BOTTOM_UP));
    }

    @Test
    void whenParsing_givenBlankName_shouldReturnFallback() {
        assertEquals(RollupStrategy.CLOSURE,
                RollupStrategy.fromString("  ", RollupStrategy.CLOSURE));
        assertEquals(RollupStrategy.BOTTOM_UP,
                RollupStrategy.fromString(null, RollupStrategy.BOTTOM_UP));
    }

    @Test
    void whenParsing_givenUnknownName_shouldThrowDomainException() {
        final DomainException e = assertThrows(DomainException.class,
                () -> RollupStrategy.fromString("sideways",
                        RollupStrategy.BOTTOM_UP));

        assertEquals("INVALID_INPUT", e.getErrorCode());
    }

    @Test
    void whenParsing_givenTurkishDefaultLocale_shouldReturnStrategy() {
        final Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(RollupStrategy.BOTTOM_UP,
                    RollupStrategy.fromString("bottom_up",
                            RollupStrategy.CLOSURE));
        } finally {
            Locale.setDefault(previous);
        }
    }

}
