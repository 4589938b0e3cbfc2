package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.ValueObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Value object for the repository-relative path of a file.
 *
 * <p>A valid path uses forward slashes, has no leading slash, no empty,
 * {@code .} or {@code ..} segments and does not end with a slash.
 * Directories derived from a path use {@link #ROOT} for the repository
 * root and plain relative paths otherwise, e.g. {@code src/lib}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RepositoryPath implements ValueObject,
        Comparable<RepositoryPath> {

    private static final long serialVersionUID = 1L;

    /** The path of the repository root directory. */
    public static final String ROOT = "/";

    private static final Pattern DRIVE_LETTER = Pattern.compile(
            "^[A-Za-z]:.*");

    private final String value;

    private RepositoryPath(final String theValue) {
        validate(theValue);
        this.value = theValue;
    }

    /**
     * Creates a repository path from a string.
     *
     * @param path the path, e.g. {@code src/lib/c.py}
     * @return the repository path
     * @throws InvalidPathException if the path is not normalized
     */
    public static RepositoryPath of(final String path) {
        return new RepositoryPath(path);
    }

    /**
     * Returns the path value.
     *
     * @return the path string
     */
    public String value() {
        return value;
    }

    /**
     * Returns the last segment of the path.
     *
     * @return the file name
     */
    public String fileName() {
        return value.substring(value.lastIndexOf('/') + 1);
    }

    /**
     * Returns the extension of the file name including the dot.
     *
     * <p>A leading dot is not an extension: {@code .gitignore} has
     * none.</p>
     *
     * @return the extension, empty if none
     */
    public String extension() {
        final String name = fileName();
        final int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    /**
     * Returns the directory holding this file.
     *
     * @return the directory path, {@link #ROOT} for top-level files
     */
    public String directory() {
        final int slash = value.lastIndexOf('/');
        return slash < 0 ? ROOT : value.substring(0, slash);
    }

    /**
     * Returns every directory from the root down to the directory that
     * holds this file.
     *
     * @return the directories, root first, never empty
     */
    public List<String> ancestorDirectories() {
        final List<String> result = new ArrayList<>();
        result.add(ROOT);
        int slash = value.indexOf('/');
        while (slash >= 0) {
            result.add(value.substring(0, slash));
            slash = value.indexOf('/', slash + 1);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the depth of a directory path, 0 for the root.
     *
     * @param directory the directory path
     * @return the number of segments
     */
    public static int depthOf(final String directory) {
        if (ROOT.equals(directory)) {
            return 0;
        }
        int depth = 1;
        for (int i = 0; i < directory.length(); i++) {
            if (directory.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }

    /**
     * Returns the parent of a directory path.
     *
     * @param directory the directory path
     * @return the parent directory, null for the root
     */
    public static String parentOf(final String directory) {
        if (ROOT.equals(directory)) {
            return null;
        }
        final int slash = directory.lastIndexOf('/');
        return slash < 0 ? ROOT : directory.substring(0, slash);
    }

    private static void validate(final String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidPathException(path, "path is empty");
        }
        if (path.startsWith("/") || DRIVE_LETTER.matcher(path).matches()) {
            throw new InvalidPathException(path, "path is absolute");
        }
        if (path.indexOf('\\') >= 0) {
            throw new InvalidPathException(path,
                    "backslash is not a valid separator");
        }
        if (path.endsWith("/")) {
            throw new InvalidPathException(path, "path names a directory");
        }
        for (final String segment : path.split("/", -1)) {
            if (segment.isEmpty()) {
                throw new InvalidPathException(path, "empty path segment");
            }
            if ("..".equals(segment)) {
                throw new InvalidPathException(path,
                        "parent directory segment");
            }
            if (".".equals(segment)) {
                throw new InvalidPathException(path,
                        "current directory segment");
            }
        }
    }

    @Override
    public int compareTo(final RepositoryPath other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RepositoryPath that = (RepositoryPath) obj;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }

}
