package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The directory hierarchy implied by a set of file records.
 *
 * <p>Read-only once built. Holds one {@link DirectoryNode} per directory
 * and, per directory, the records that live immediately inside it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DirectoryTree {

    /** Report order of directories: the root first, then by path. */
    public static final Comparator<String> PATH_ORDER = (a, b) -> {
        if (a.equals(b)) {
            return 0;
        }
        if (RepositoryPath.ROOT.equals(a)) {
            return -1;
        }
        if (RepositoryPath.ROOT.equals(b)) {
            return 1;
        }
        return a.compareTo(b);
    };

    /** Orders records by path. */
    public static final Comparator<FileRecord> RECORD_ORDER =
            Comparator.comparing(FileRecord::path);

    private final Map<String, DirectoryNode> nodes;
    private final Map<String, List<FileRecord>> directFiles;
    private final List<FileRecord> records;

    DirectoryTree(final Map<String, DirectoryNode> theNodes,
            final Map<String, List<FileRecord>> theDirectFiles,
            final List<FileRecord> theRecords) {
        final Map<String, DirectoryNode> sortedNodes = new TreeMap<>(PATH_ORDER);
        sortedNodes.putAll(theNodes);
        Preconditions.require(sortedNodes.containsKey(RepositoryPath.ROOT),
                "A directory tree always has a root");
        this.nodes = Collections.unmodifiableMap(sortedNodes);

        final Map<String, List<FileRecord>> files = new TreeMap<>(PATH_ORDER);
        for (final Map.Entry<String, List<FileRecord>> entry
                : theDirectFiles.entrySet()) {
            final List<FileRecord> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(RECORD_ORDER);
            files.put(entry.getKey(), Collections.unmodifiableList(sorted));
        }
        this.directFiles = Collections.unmodifiableMap(files);
        this.records = List.copyOf(theRecords);
    }

    /**
     * Builds the tree of the given records.
     *
     * @param records the file records, paths must be unique
     * @return the tree
     */
    public static DirectoryTree of(final Collection<FileRecord> records) {
        return new DirectoryTreeBuilder().addAll(records).build();
    }

    /**
     * Returns the root node.
     *
     * @return the root, never null
     */
    public DirectoryNode root() {
        return nodes.get(RepositoryPath.ROOT);
    }

    /**
     * Returns the node for a directory path.
     *
     * @param path the directory path
     * @return the node, null if the directory is not part of the tree
     */
    public DirectoryNode node(final String path) {
        return nodes.get(path);
    }

    /**
     * Checks whether a directory is part of the tree.
     *
     * @param path the directory path
     * @return true if present
     */
    public boolean contains(final String path) {
        return nodes.containsKey(path);
    }

    /**
     * Returns all nodes in report order.
     *
     * @return unmodifiable list of nodes, root first
     */
    public List<DirectoryNode> nodes() {
        return List.copyOf(nodes.values());
    }

    /**
     * Returns the number of directories, root included.
     *
     * @return the directory count
     */
    public int size() {
        return nodes.size();
    }

    /**
     * Returns the records whose immediate directory is the given one.
     *
     * @param path the directory path
     * @return the records sorted by path, empty if none
     */
    public List<FileRecord> directFiles(final String path) {
        return directFiles.getOrDefault(path, List.of());
    }

    /**
     * Returns every record of the tree in input order.
     *
     * @return unmodifiable list of records
     */
    public List<FileRecord> records() {
        return records;
    }

    /**
     * Returns the depth of the deepest directory.
     *
     * @return the max depth, 0 when only the root exists
     */
    public int maxDepth() {
        int max = 0;
        for (final DirectoryNode node : nodes.values()) {
            max = Math.max(max, node.depth());
        }
        return max;
    }

    /**
     * Groups the nodes by depth, deepest level first.
     *
     * <p>Processing the levels in this order visits every child before
     * its parent; nodes within one level are unrelated and can be
     * processed in any order.</p>
     *
     * @return the levels, the last one holds only the root
     */
    public List<List<DirectoryNode>> levelsDeepestFirst() {
        final List<List<DirectoryNode>> levels = new ArrayList<>();
        for (int depth = 0; depth <= maxDepth(); depth++) {
            levels.add(new ArrayList<>());
        }
        for (final DirectoryNode node : nodes.values()) {
            levels.get(node.depth()).add(node);
        }
        Collections.reverse(levels);
        final List<List<DirectoryNode>> result = new ArrayList<>();
        for (final List<DirectoryNode> level : levels) {
            result.add(List.copyOf(level));
        }
        return List.copyOf(result);
    }

}
