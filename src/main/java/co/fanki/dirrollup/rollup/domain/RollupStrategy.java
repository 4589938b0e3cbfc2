package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.DomainException;

import java.util.Locale;

/**
 * How the recursive record set of each directory is gathered.
 *
 * <p>Both strategies produce identical reports.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum RollupStrategy {

    /**
     * Post-order traversal: a directory's subtree is its direct files plus
     * the subtrees of its children, one depth level at a time from the
     * deepest up.
     */
    BOTTOM_UP,

    /**
     * Ancestor closure: every file is attributed to each ancestor of its
     * directory, the in-memory form of a recursive ancestor/descendant
     * query.
     */
    CLOSURE;

    /**
     * Parses a strategy name.
     *
     * @param value the name, case-insensitive
     * @param fallback the strategy to use for a null or blank value
     * @return the strategy
     * @throws DomainException if the name is unknown
     */
    public static RollupStrategy fromString(final String value,
            final RollupStrategy fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new DomainException("Unknown rollup strategy: " + value,
                    "INVALID_INPUT", e);
        }
    }

}
