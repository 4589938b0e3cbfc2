package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.Preconditions;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A directory of the reconstructed tree.
 *
 * <p>Immutable. Built by {@link DirectoryTreeBuilder}; every directory
 * that is an ancestor of some file has a node, including the root.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DirectoryNode {

    private final String path;
    private final int depth;
    private final String parentPath;
    private final SortedSet<String> childPaths;

    DirectoryNode(final String thePath, final SortedSet<String> theChildren) {
        this.path = Preconditions.requireNonBlank(thePath,
                "Directory path is required");
        this.depth = RepositoryPath.depthOf(thePath);
        this.parentPath = RepositoryPath.parentOf(thePath);
        this.childPaths = Collections.unmodifiableSortedSet(
                new TreeSet<>(theChildren));
    }

    /**
     * Returns the directory path.
     *
     * @return the path, {@link RepositoryPath#ROOT} for the root
     */
    public String path() {
        return path;
    }

    /**
     * Returns the depth, 0 for the root.
     *
     * @return the depth
     */
    public int depth() {
        return depth;
    }

    /**
     * Returns the parent directory path.
     *
     * @return the parent path, null for the root
     */
    public String parentPath() {
        return parentPath;
    }

    /**
     * Returns the paths of the immediate subdirectories.
     *
     * @return unmodifiable sorted set, empty for a leaf
     */
    public SortedSet<String> childPaths() {
        return childPaths;
    }

    /**
     * Checks whether this directory has no subdirectories.
     *
     * @return true for a leaf directory
     */
    public boolean isLeaf() {
        return childPaths.isEmpty();
    }

    /**
     * Checks whether this is the repository root.
     *
     * @return true for the root
     */
    public boolean isRoot() {
        return parentPath == null;
    }

    @Override
    public String toString() {
        return "DirectoryNode{" + path + ", depth=" + depth
                + ", children=" + childPaths + "}";
    }

}
