package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.classification.domain.FileClassification;
import co.fanki.dirrollup.classification.domain.FileClassifier;
import co.fanki.dirrollup.metrics.domain.MetricDistribution;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for RollupAggregator.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RollupAggregatorTest {

    private final RollupAggregator aggregator = new RollupAggregator(
            WellKnownMetrics.DEFAULTS, FileClassifier.standard(), false);

    @Test
    void whenAggregating_givenThreeFiles_shouldSplitDirectAndRecursive() {
        final List<DirectoryEntry> entries = aggregator.aggregate(
                DirectoryTree.of(threeFiles()));

        assertEquals(3, entries.size());

        final DirectoryEntry root = entries.get(0);
        assertEquals("/", root.path());
        assertEquals(0, root.depth());
        assertEquals(1, root.direct().fileCount());
        assertEquals(80.0, root.direct().total(WellKnownMetrics.LINES_CODE));
        assertEquals(3, root.recursive().fileCount());
        assertEquals(180.0,
                root.recursive().total(WellKnownMetrics.LINES_CODE));
        assertEquals(List.of("src"), root.subdirectories());

        final DirectoryEntry src = entries.get(1);
        assertEquals("src", src.path());
        assertEquals(1, src.direct().fileCount());
        assertEquals(40.0, src.direct().total(WellKnownMetrics.LINES_CODE));
        assertEquals(2, src.recursive().fileCount());
        assertEquals(100.0,
                src.recursive().total(WellKnownMetrics.LINES_CODE));
        assertFalse(src.leaf());

        final DirectoryEntry lib = entries.get(2);
        assertEquals("src/lib", lib.path());
        assertEquals(2, lib.depth());
        assertTrue(lib.leaf());
        assertEquals(0, lib.childCount());
        assertEquals(60.0, lib.recursive().total(WellKnownMetrics.LINES_CODE));
    }

    @Test
    void whenAggregating_givenLeafDirectory_shouldHaveEqualDirectAndRecursive() {
        final List<DirectoryEntry> entries = aggregator.aggregate(
                DirectoryTree.of(threeFiles()));

        for (final DirectoryEntry entry : entries) {
            if (entry.leaf()) {
                assertEquals(entry.direct(), entry.recursive());
            }
        }
    }

    @Test
    void whenAggregating_givenIntermediateDirectory_shouldHaveEmptyDirectStats() {
        final List<DirectoryEntry> entries = aggregator.aggregate(
                DirectoryTree.of(List.of(record("a/b/c.py", 10))));

        final DirectoryEntry a = entries.get(1);
        assertEquals("a", a.path());
        assertEquals(0, a.direct().fileCount());
        assertEquals(0, a.direct().distribution(
                WellKnownMetrics.LINES_CODE).count());
        assertEquals(1, a.recursive().fileCount());
    }

    @Test
    void whenAggregating_givenBothStrategies_shouldProduceEqualEntries() {
        final DirectoryTree tree = DirectoryTree.of(manyFiles());

        assertEquals(aggregator.aggregate(tree, RollupStrategy.BOTTOM_UP),
                aggregator.aggregate(tree, RollupStrategy.CLOSURE));
    }

    @Test
    void whenAggregating_givenParallelMode_shouldMatchSequentialRun() {
        final RollupAggregator parallel = new RollupAggregator(
                WellKnownMetrics.DEFAULTS, FileClassifier.standard(), true);
        final DirectoryTree tree = DirectoryTree.of(manyFiles());

        assertEquals(aggregator.aggregate(tree), parallel.aggregate(tree));
        assertEquals(aggregator.aggregate(tree),
                parallel.aggregate(tree, RollupStrategy.CLOSURE));
    }

    @Test
    void whenAggregating_givenShuffledInput_shouldProduceEqualEntries() {
        final List<FileRecord> records = manyFiles();
        final List<FileRecord> reversed = new ArrayList<>(records);
        java.util.Collections.reverse(reversed);

        assertEquals(aggregator.aggregate(DirectoryTree.of(records)),
                aggregator.aggregate(DirectoryTree.of(reversed)));
    }

    @Test
    void whenTrackingMetrics_givenExtraMetrics_shouldAppendThemSorted() {
        final List<FileRecord> records = List.of(
                FileRecord.of("a.py", Map.of("lines_code", 1.0,
                        "vulnerabilities", 2.0, "coverage", 0.5)));

        final List<String> metrics = aggregator.trackedMetrics(records);

        assertEquals(WellKnownMetrics.DEFAULTS,
                metrics.subList(0, WellKnownMetrics.DEFAULTS.size()));
        assertEquals(List.of("coverage", "vulnerabilities"), metrics.subList(
                WellKnownMetrics.DEFAULTS.size(), metrics.size()));
    }

    @Test
    void whenAggregating_givenMissingMetric_shouldStillReportItAsZero() {
        final List<DirectoryEntry> entries = aggregator.aggregate(
                DirectoryTree.of(List.of(record("a.py", 10))));

        final DirectoryStats root = entries.get(0).recursive();

        assertEquals(List.copyOf(WellKnownMetrics.DEFAULTS),
                List.copyOf(root.totals().keySet()));
        assertEquals(0.0, root.total(WellKnownMetrics.COMPLEXITY));
    }

    @Test
    void whenAggregating_givenClassifiedFiles_shouldCountEveryClassification() {
        final List<DirectoryEntry> entries = aggregator.aggregate(
                DirectoryTree.of(List.of(
                        record("src/app.py", 100),
                        record("tests/test_app.py", 40),
                        record(".github/workflows/ci.yml", 5),
                        record("README.md", 10))));

        final DirectoryStats root = entries.get(0).recursive();

        assertEquals(1, root.classifications().fileCount(
                FileClassification.SOURCE));
        assertEquals(1, root.classifications().fileCount(
                FileClassification.TEST));
        assertEquals(1, root.classifications().fileCount(
                FileClassification.CI));
        assertEquals(1, root.classifications().fileCount(
                FileClassification.DOCS));
        assertEquals(0, root.classifications().fileCount(
                FileClassification.BUILD));
        assertEquals(40.0, root.classifications().loc(
                FileClassification.TEST));
        assertEquals(4, root.classifications().totalFileCount());
        assertEquals(0.4, root.ratios().testToCodeRatio(), 1e-12);
        assertEquals(0.25, root.ratios().testRatio(), 1e-12);
    }

    @Test
    void whenAggregating_givenLanguagesAndFlags_shouldCountThem() {
        final List<DirectoryEntry> entries = aggregator.aggregate(
                DirectoryTree.of(List.of(
                        FileRecord.of("a.js", "JavaScript",
                                Map.of("lines_code", 10.0),
                                new FileFlags(true, false, false)),
                        FileRecord.of("b.js", "JavaScript",
                                Map.of("lines_code", 20.0),
                                new FileFlags(false, true, false)),
                        FileRecord.of("c.py", "Python",
                                Map.of("lines_code", 30.0), null))));

        final DirectoryStats root = entries.get(0).recursive();

        assertEquals(2, root.languageCount());
        assertEquals(2, root.byLanguage().get("JavaScript").fileCount());
        assertEquals(30.0, root.byLanguage().get("JavaScript")
                .total(WellKnownMetrics.LINES_CODE));
        assertEquals(1, root.minifiedCount());
        assertEquals(1, root.generatedCount());
        assertEquals(0, root.binaryCount());
        assertEquals(20.0, root.ratios().avgFileLoc(), 1e-12);
    }

    @Test
    void whenAggregating_givenCommentLines_shouldDistributePerFileCommentRatio() {
        final List<DirectoryEntry> entries = aggregator.aggregate(
                DirectoryTree.of(List.of(
                        withLines("src/a.py", 100, 25),
                        withLines("src/b.py", 50, 0),
                        withLines("src/c.py", 0, 3),
                        withLines("top.py", 20, 10))));

        final DirectoryStats src = entries.get(1).direct();
        final MetricDistribution srcRatios = src.commentRatioDistribution();
        assertEquals(3, srcRatios.count());
        assertEquals(0.0, srcRatios.min());
        assertEquals(0.25, srcRatios.max(), 1e-12);
        assertEquals(0.25 / 3, srcRatios.mean(), 1e-12);

        final MetricDistribution rootRatios =
                entries.get(0).recursive().commentRatioDistribution();
        assertEquals(4, rootRatios.count());
        assertEquals(0.5, rootRatios.max(), 1e-12);
        assertEquals(0.75 / 4, rootRatios.mean(), 1e-12);
    }

    private static FileRecord withLines(final String path,
            final double total, final double comment) {
        return FileRecord.of(path, "Python",
                Map.of(WellKnownMetrics.LINES_TOTAL, total,
                        WellKnownMetrics.LINES_COMMENT, comment),
                FileFlags.NONE);
    }

    private static List<FileRecord> threeFiles() {
        return List.of(
                record("a.py", 80),
                record("src/b.py", 40),
                record("src/lib/c.py", 60));
    }

    private static List<FileRecord> manyFiles() {
        final List<FileRecord> records = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            final String dir = "pkg" + (i % 4) + "/mod" + (i % 3);
            records.add(FileRecord.of(dir + "/file" + i + ".py", "Python",
                    Map.of("lines_code", 10.0 + i * 1.1,
                            "complexity", (double) (i % 7),
                            "lines_total", 20.0 + i * 1.7),
                    FileFlags.NONE));
        }
        records.add(record("top.py", 3));
        return records;
    }

    private static FileRecord record(final String path, final double loc) {
        return FileRecord.of(path, "Python",
                Map.of(WellKnownMetrics.LINES_CODE, loc), FileFlags.NONE);
    }

}
