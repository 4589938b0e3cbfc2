package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.ValueObject;

import java.util.List;

/**
 * Shape of the directory tree.
 *
 * @param maxDepth depth of the deepest directory
 * @param avgDepth mean directory depth
 * @param leafDirectoryCount number of directories without subdirectories
 * @param avgFilesPerDirectory files over directories
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record StructureStats(
        int maxDepth,
        double avgDepth,
        int leafDirectoryCount,
        double avgFilesPerDirectory) implements ValueObject {

    /**
     * Measures the tree behind a list of directory entries.
     *
     * @param directories the directory entries
     * @param fileCount the number of files in the tree
     * @return the structure stats
     */
    public static StructureStats of(final List<DirectoryEntry> directories,
            final int fileCount) {
        if (directories.isEmpty()) {
            return new StructureStats(0, 0, 0, 0);
        }
        int maxDepth = 0;
        long depthSum = 0;
        int leaves = 0;
        for (final DirectoryEntry entry : directories) {
            maxDepth = Math.max(maxDepth, entry.depth());
            depthSum += entry.depth();
            if (entry.leaf()) {
                leaves++;
            }
        }
        final int count = directories.size();
        return new StructureStats(maxDepth, (double) depthSum / count, leaves,
                (double) fileCount / count);
    }

}
