package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.ValueObject;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Rollup result for one directory.
 *
 * @param path the directory path, {@code /} for the root
 * @param depth the depth, 0 for the root
 * @param leaf true if the directory has no subdirectories
 * @param childCount number of immediate subdirectories
 * @param subdirectories paths of the immediate subdirectories, sorted
 * @param direct stats over the files immediately inside the directory
 * @param recursive stats over every file of the subtree
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DirectoryEntry(
        String path,
        int depth,
        @JsonProperty("is_leaf") boolean leaf,
        int childCount,
        List<String> subdirectories,
        DirectoryStats direct,
        DirectoryStats recursive) implements ValueObject {

    /** Creates the entry, copying the subdirectory list. */
    public DirectoryEntry {
        subdirectories = List.copyOf(subdirectories);
    }

    /**
     * Creates the entry of a tree node.
     *
     * @param node the directory node
     * @param direct the direct stats
     * @param recursive the recursive stats
     * @return the entry
     */
    public static DirectoryEntry of(final DirectoryNode node,
            final DirectoryStats direct, final DirectoryStats recursive) {
        return new DirectoryEntry(node.path(), node.depth(), node.isLeaf(),
                node.childPaths().size(), List.copyOf(node.childPaths()),
                direct, recursive);
    }

}
