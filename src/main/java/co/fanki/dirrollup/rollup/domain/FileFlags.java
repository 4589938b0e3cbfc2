package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.ValueObject;

/**
 * Flags the collector attaches to a file.
 *
 * @param minified the file holds minified code
 * @param generated the file was produced by a generator
 * @param binary the file is not text
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileFlags(boolean minified, boolean generated, boolean binary)
        implements ValueObject {

    /** No flag set. */
    public static final FileFlags NONE = new FileFlags(false, false, false);

}
