package co.fanki.dirrollup.rollup.domain;

import co.fanki.dirrollup.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for DirectoryTreeBuilder and DirectoryTree.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DirectoryTreeBuilderTest {

    @Test
    void whenBuilding_givenNoRecords_shouldHoldOnlyTheRoot() {
        final DirectoryTree tree = new DirectoryTreeBuilder().build();

        assertEquals(1, tree.size());
        assertTrue(tree.root().isRoot());
        assertTrue(tree.root().isLeaf());
        assertEquals(0, tree.maxDepth());
    }

    @Test
    void whenBuilding_givenDeepFile_shouldRegisterEveryAncestor() {
        final DirectoryTree tree = new DirectoryTreeBuilder()
                .add(record("a/b/c/d.py"))
                .build();

        assertEquals(4, tree.size());
        assertTrue(tree.contains("a"));
        assertTrue(tree.contains("a/b"));
        assertTrue(tree.contains("a/b/c"));
        assertTrue(tree.directFiles("a").isEmpty());
        assertEquals(1, tree.directFiles("a/b/c").size());
        assertEquals(3, tree.maxDepth());
    }

    @Test
    void whenBuilding_givenSiblings_shouldLinkParentAndChildren() {
        final DirectoryTree tree = DirectoryTree.of(List.of(
                record("src/z.py"), record("src/lib/c.py"),
                record("src/app/b.py"), record("a.py")));

        final DirectoryNode src = tree.node("src");

        assertEquals(1, src.depth());
        assertEquals("/", src.parentPath());
        assertEquals(List.of("src/app", "src/lib"),
                List.copyOf(src.childPaths()));
        assertFalse(src.isLeaf());
        assertTrue(tree.node("src/lib").isLeaf());
        assertNull(tree.root().parentPath());
        assertNull(tree.node("missing"));
    }

    @Test
    void whenListingNodes_givenAnyInput_shouldPutRootFirstThenByPath() {
        final DirectoryTree tree = DirectoryTree.of(List.of(
                record("z/a.py"), record("b/c/d.py"), record("a.py")));

        final List<String> paths = tree.nodes().stream()
                .map(DirectoryNode::path).toList();

        assertEquals(List.of("/", "b", "b/c", "z"), paths);
    }

    @Test
    void whenListingLevels_givenTree_shouldReturnDeepestFirst() {
        final DirectoryTree tree = DirectoryTree.of(List.of(
                record("a/b/c.py"), record("d/e.py")));

        final List<List<DirectoryNode>> levels = tree.levelsDeepestFirst();

        assertEquals(3, levels.size());
        assertEquals("a/b", levels.get(0).get(0).path());
        assertEquals(2, levels.get(1).size());
        assertEquals("/", levels.get(2).get(0).path());
    }

    @Test
    void whenListingDirectFiles_givenUnsortedInput_shouldSortByPath() {
        final DirectoryTree tree = DirectoryTree.of(List.of(
                record("src/b.py"), record("src/a.py")));

        assertEquals("src/a.py",
                tree.directFiles("src").get(0).path().value());
        assertEquals("src/b.py", tree.records().get(0).path().value());
    }

    @Test
    void whenAdding_givenDuplicatePath_shouldThrowException() {
        final DirectoryTreeBuilder builder = new DirectoryTreeBuilder()
                .add(record("a.py"));

        final DomainException e = assertThrows(DomainException.class,
                () -> builder.add(record("a.py")));

        assertEquals(DirectoryTreeBuilder.DUPLICATE_PATH, e.getErrorCode());
    }

    @Test
    void whenAddingPath_givenRawPath_shouldRegisterItsDirectories() {
        final DirectoryTree tree = new DirectoryTreeBuilder()
                .addPath("docs/guide/index.md")
                .build();

        assertTrue(tree.contains("docs/guide"));
        assertTrue(tree.records().isEmpty());
    }

    @Test
    void whenAddingPath_givenAbsolutePath_shouldThrowInvalidPath() {
        assertThrows(InvalidPathException.class,
                () -> new DirectoryTreeBuilder().addPath("/abs/file.c"));
    }

    private static FileRecord record(final String path) {
        return FileRecord.of(path, Map.of("lines_code", 1.0));
    }

}
