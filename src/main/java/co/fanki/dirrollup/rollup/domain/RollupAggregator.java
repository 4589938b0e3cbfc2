package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.classification.domain.FileClassification;
import co.fanki.dirrollup.classification.domain.FileClassifier;
import co.fanki.dirrollup.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Computes the direct and recursive stats of every directory of a tree.
 *
 * <p>Direct stats cover the records whose immediate directory is the
 * node; recursive stats cover every record of the node's subtree. Stats
 * are computed from record multisets put in path order, so the result is
 * the same for both {@link RollupStrategy strategies} and with or without
 * parallelism.</p>
 *
 * <p>In parallel mode the bottom-up strategy still completes a depth
 * level before starting the one above it; only unrelated directories of
 * one level run concurrently.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RollupAggregator {

    private final List<String> configuredMetrics;
    private final FileClassifier classifier;
    private final boolean parallel;

    /**
     * Creates a new aggregator.
     *
     * @param theConfiguredMetrics the metrics always reported, in order
     * @param theClassifier the file classifier
     * @param isParallel whether independent directories run concurrently
     */
    public RollupAggregator(final List<String> theConfiguredMetrics,
            final FileClassifier theClassifier, final boolean isParallel) {
        this.configuredMetrics = List.copyOf(Preconditions.requireNonNull(
                theConfiguredMetrics, "Configured metrics are required"));
        this.classifier = Preconditions.requireNonNull(theClassifier,
                "File classifier is required");
        this.parallel = isParallel;
    }

    /**
     * Returns the metric key set reported for a set of records: the
     * configured metrics, then every other metric the records carry in
     * alphabetical order.
     *
     * @param records the records
     * @return the tracked metric names
     */
    public List<String> trackedMetrics(final Collection<FileRecord> records) {
        final Set<String> extra = new TreeSet<>();
        for (final FileRecord fileRecord : records) {
            extra.addAll(fileRecord.metrics().keySet());
        }
        final Set<String> result = new LinkedHashSet<>(configuredMetrics);
        result.addAll(extra);
        return List.copyOf(result);
    }

    /**
     * Resolves the classification of every record.
     *
     * @param records the records
     * @return the classification of each record path
     */
    public Map<RepositoryPath, FileClassification> classify(
            final Collection<FileRecord> records) {
        final Map<RepositoryPath, FileClassification> result = new HashMap<>();
        for (final FileRecord fileRecord : records) {
            final RepositoryPath path = fileRecord.path();
            result.put(path, classifier.classify(path.value(),
                    path.fileName(), path.extension())
                    .orElse(FileClassification.SOURCE));
        }
        return result;
    }

    /**
     * Aggregates with the bottom-up strategy.
     *
     * @param tree the directory tree
     * @return one entry per directory, root first, then by path
     */
    public List<DirectoryEntry> aggregate(final DirectoryTree tree) {
        return aggregate(tree, RollupStrategy.BOTTOM_UP);
    }

    /**
     * Aggregates every directory of the tree.
     *
     * @param tree the directory tree
     * @param strategy how recursive record sets are gathered
     * @return one entry per directory, root first, then by path
     */
    public List<DirectoryEntry> aggregate(final DirectoryTree tree,
            final RollupStrategy strategy) {
        Preconditions.requireNonNull(tree, "Directory tree is required");
        Preconditions.requireNonNull(strategy, "Rollup strategy is required");

        final List<String> metrics = trackedMetrics(tree.records());
        final Map<RepositoryPath, FileClassification> classifications =
                classify(tree.records());
        final Function<FileRecord, FileClassification> classification =
                fileRecord -> classifications.get(fileRecord.path());

        final Map<String, List<FileRecord>> subtrees =
                strategy == RollupStrategy.BOTTOM_UP
                        ? bottomUp(tree) : closure(tree);

        return stream(tree.nodes())
                .map(node -> DirectoryEntry.of(node,
                        DirectoryStats.of(tree.directFiles(node.path()),
                                metrics, classification),
                        DirectoryStats.of(subtrees.get(node.path()),
                                metrics, classification)))
                .sorted(Comparator.comparing(DirectoryEntry::path,
                        DirectoryTree.PATH_ORDER))
                .collect(Collectors.toList());
    }

    private Map<String, List<FileRecord>> bottomUp(final DirectoryTree tree) {
        final Map<String, List<FileRecord>> subtrees =
                new ConcurrentHashMap<>();
        for (final List<DirectoryNode> level : tree.levelsDeepestFirst()) {
            stream(level).forEach(node -> {
                final List<FileRecord> subtree =
                        new ArrayList<>(tree.directFiles(node.path()));
                for (final String child : node.childPaths()) {
                    subtree.addAll(subtrees.get(child));
                }
                subtrees.put(node.path(), subtree);
            });
        }
        return subtrees;
    }

    private static Map<String, List<FileRecord>> closure(
            final DirectoryTree tree) {
        final Map<String, List<FileRecord>> subtrees = new HashMap<>();
        for (final DirectoryNode node : tree.nodes()) {
            subtrees.put(node.path(), new ArrayList<>());
        }
        for (final FileRecord fileRecord : tree.records()) {
            for (final String ancestor
                    : fileRecord.path().ancestorDirectories()) {
                subtrees.get(ancestor).add(fileRecord);
            }
        }
        return subtrees;
    }

    private <T> Stream<T> stream(final List<T> values) {
        return parallel ? values.parallelStream() : values.stream();
    }

}
