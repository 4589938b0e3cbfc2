package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.Preconditions;
import co.fanki.dirrollup.shared.ValueObject;

import java.util.List;
import java.util.Optional;

/**
 * The rollup of a repository: one entry per directory, one per file and
 * a repository summary.
 *
 * <p>Contains no timestamp; the same input always yields an equal
 * report.</p>
 *
 * @param schemaVersion the report format version
 * @param directories the directory entries, root first, then by path
 * @param files the file entries, in input order
 * @param summary the repository summary
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RollupReport(
        String schemaVersion,
        List<DirectoryEntry> directories,
        List<FileEntry> files,
        RepositorySummary summary) implements ValueObject {

    /** Current report format version. */
    public static final String SCHEMA_VERSION = "2.1";

    /** Copies the lists. */
    public RollupReport {
        Preconditions.requireNonBlank(schemaVersion,
                "Schema version is required");
        directories = List.copyOf(directories);
        files = List.copyOf(files);
        Preconditions.requireNonNull(summary, "Summary is required");
    }

    /**
     * Finds the entry of a directory.
     *
     * @param path the directory path, {@code /} for the root
     * @return the entry, empty if the report has no such directory
     */
    public Optional<DirectoryEntry> directory(final String path) {
        for (final DirectoryEntry entry : directories) {
            if (entry.path().equals(path)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the root directory entry.
     *
     * @return the root entry
     */
    public DirectoryEntry root() {
        return directories.get(0);
    }

}
