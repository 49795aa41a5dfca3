package io.hearthwarrio.ariaindex.core;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultSnapshotParserTest {
    private final SnapshotParser parser = new DefaultSnapshotParser();

    private static final String PAGE = String.join("\n",
            "- banner:",
            "  - link \"Home\" [ref=@e1]",
            "  - navigation \"Main\":",
            "    - link \"Docs\"",
            "    - link \"Blog\"",
            "- main:",
            "  - heading \"Welcome\" [level=1]",
            "  - paragraph: Some intro text",
            "  - button \"Sign up\"",
            "- contentinfo"
    );

    @Test
    void buildsTreeFromIndentation() {
        SnapshotTree tree = parser.parse(PAGE);

        assertEquals(10, tree.size());
        assertEquals(List.of(0, 5, 9), tree.getRoots());

        ParsedNode nav = tree.node(2);
        assertEquals("navigation", nav.getRole());
        assertEquals("Main", nav.getName());
        assertEquals(0, nav.getParentId());
        assertEquals(List.of(3, 4), nav.getChildren());
        assertEquals(1, nav.getDepth());
        assertEquals(":", nav.getRawSuffix());

        ParsedNode heading = tree.node(6);
        assertEquals(" [level=1]", heading.getRawSuffix());

        ParsedNode paragraph = tree.node(7);
        assertNull(paragraph.getName());
        assertEquals(": Some intro text", paragraph.getRawSuffix());
    }

    @Test
    void assignsPathsInTreeOrder() {
        SnapshotTree tree = parser.parse(PAGE);

        assertEquals("0", tree.node(0).getPath());
        assertEquals("0/1", tree.node(2).getPath());
        assertEquals("0/1/1", tree.node(4).getPath());
        assertEquals("1/2", tree.node(8).getPath());
        assertEquals("2", tree.node(9).getPath());
        assertSame(tree.node(4), tree.nodeAt("0/1/1"));
    }

    @Test
    void childPathExtendsParentPathAndPathsAreUnique() {
        SnapshotTree tree = parser.parse(PAGE);

        Set<String> paths = new HashSet<>();
        for (ParsedNode node : tree.getNodes()) {
            assertTrue(paths.add(node.getPath()), "duplicate path " + node.getPath());
            if (!node.isRoot()) {
                String parentPath = tree.parentOf(node).getPath();
                String path = node.getPath();
                assertTrue(path.startsWith(parentPath + "/"));
                assertEquals(PathAssigner.pathDepth(parentPath) + 1, PathAssigner.pathDepth(path));
            }
        }
        assertEquals(tree.size(), tree.getPathIndex().size());
    }

    @Test
    void lowercasesRoleAndSkipsClosingMarkersAndNoise() {
        String text = String.join("\n",
                "- Button \"OK\"",
                "some stray line",
                "- /list",
                "  - text: hello"
        );

        SnapshotTree tree = parser.parse(text);

        assertEquals(2, tree.size());
        assertEquals("button", tree.node(0).getRole());
        assertEquals("text", tree.node(1).getRole());
        assertEquals(0, tree.node(1).getParentId());
    }

    @Test
    void popsDeeperEntriesWhenIndentationJumps() {
        String text = String.join("\n",
                "- list",
                "      - listitem \"deep\"",
                "  - listitem \"shallow\""
        );

        SnapshotTree tree = parser.parse(text);

        assertEquals(List.of(1, 2), tree.node(0).getChildren());
        assertEquals("0/0", tree.node(1).getPath());
        assertEquals("0/1", tree.node(2).getPath());
    }

    @Test
    void emptyOrBlankInputYieldsEmptyTree() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("   \n  ").isEmpty());
        assertTrue(parser.parse("no element lines here").isEmpty());
    }

    @Test
    void unknownPathThrows() {
        SnapshotTree tree = parser.parse(PAGE);

        PathNotFoundException ex = assertThrows(PathNotFoundException.class, () -> tree.nodeAt("7/7"));
        assertEquals("7/7", ex.getPath());
    }

    @Test
    void pathCannotBeAssignedTwice() {
        SnapshotTree tree = parser.parse("- button \"x\"");

        assertThrows(IllegalStateException.class,
                () -> PathAssigner.assignPaths(tree.getNodes(), tree.getRoots()));
    }
}
