package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.DomainException;

/**
 * Thrown when a file path is not a normalized repository-relative path.
 *
 * <p>Paths are rejected, never corrected: an absolute path, a
 * {@code ..} segment or a backslash separator means the upstream
 * collector did not strip or normalize the path.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InvalidPathException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code reported for malformed paths. */
    public static final String ERROR_CODE = "INVALID_PATH";

    private final String path;
    private final String reason;

    /**
     * Creates a new invalid path exception.
     *
     * @param thePath the rejected path, may be null
     * @param theReason why the path was rejected
     */
    public InvalidPathException(final String thePath, final String theReason) {
        super("Invalid path '" + thePath + "': " + theReason, ERROR_CODE);
        this.path = thePath;
        this.reason = theReason;
    }

    /**
     * Returns the rejected path.
     *
     * @return the path as received, may be null
     */
    public String getPath() {
        return path;
    }

    /**
     * Returns why the path was rejected.
     *
     * @return the reason
     */
    public String getReason() {
        return reason;
    }

}
