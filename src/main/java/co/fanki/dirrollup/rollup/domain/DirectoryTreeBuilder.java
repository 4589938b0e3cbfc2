package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.DomainException;
import co.fanki.dirrollup.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reconstructs the directory hierarchy from a flat list of file records.
 *
 * <p>Every file registers its directory and every ancestor of it up to
 * the root, so intermediate directories without files of their own are
 * still part of the tree. Paths are validated when the
 * {@link FileRecord} is created; {@link #addPath(String)} validates raw
 * strings and throws {@link InvalidPathException} for malformed ones.</p>
 *
 * <p>Not thread-safe; use one builder per tree.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DirectoryTreeBuilder {

    /** Error code for a path registered twice. */
    public static final String DUPLICATE_PATH = "DUPLICATE_PATH";

    private final Map<String, SortedSet<String>> children = new HashMap<>();
    private final Map<String, List<FileRecord>> directFiles = new HashMap<>();
    private final List<FileRecord> records = new ArrayList<>();
    private final Set<RepositoryPath> seen = new HashSet<>();

    /**
     * Creates a builder holding only the root directory.
     */
    public DirectoryTreeBuilder() {
        children.put(RepositoryPath.ROOT, new TreeSet<>());
    }

    /**
     * Adds a file record.
     *
     * @param fileRecord the record, never null
     * @return this builder
     * @throws DomainException with code {@link #DUPLICATE_PATH} if a
     *         record with the same path was already added
     */
    public DirectoryTreeBuilder add(final FileRecord fileRecord) {
        Preconditions.requireNonNull(fileRecord, "File record is required");

        if (!seen.add(fileRecord.path())) {
            throw new DomainException("Duplicate file path: "
                    + fileRecord.path(), DUPLICATE_PATH);
        }
        register(fileRecord.path());
        directFiles.computeIfAbsent(fileRecord.path().directory(),
                k -> new ArrayList<>()).add(fileRecord);
        records.add(fileRecord);
        return this;
    }

    /**
     * Adds every record of a collection.
     *
     * @param fileRecords the records
     * @return this builder
     */
    public DirectoryTreeBuilder addAll(
            final Collection<FileRecord> fileRecords) {
        Preconditions.requireNonNull(fileRecords, "File records are required");
        for (final FileRecord fileRecord : fileRecords) {
            add(fileRecord);
        }
        return this;
    }

    /**
     * Registers the directories of a file path without attaching a record.
     *
     * @param path the raw repository-relative file path
     * @return this builder
     * @throws InvalidPathException if the path is absolute, has a
     *         {@code ..} segment or uses a backslash
     */
    public DirectoryTreeBuilder addPath(final String path) {
        register(RepositoryPath.of(path));
        return this;
    }

    /**
     * Builds the immutable tree.
     *
     * @return the tree
     */
    public DirectoryTree build() {
        final Map<String, DirectoryNode> nodes = new LinkedHashMap<>();
        for (final Map.Entry<String, SortedSet<String>> entry
                : children.entrySet()) {
            nodes.put(entry.getKey(),
                    new DirectoryNode(entry.getKey(), entry.getValue()));
        }
        return new DirectoryTree(nodes, directFiles, records);
    }

    private void register(final RepositoryPath path) {
        String parent = null;
        for (final String directory : path.ancestorDirectories()) {
            children.computeIfAbsent(directory, k -> new TreeSet<>());
            if (parent != null) {
                children.get(parent).add(directory);
            }
            parent = directory;
        }
    }

}
