package io.hearthwarrio.ariaindex.core;

import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class SnapshotIndexBuilderTest {
    private final SnapshotIndexBuilder builder = new SnapshotIndexBuilder();

    private static final String PAGE = String.join("\n",
            "- main:",
            "  - navigation \"Top\":",
            "    - link \"Home\"",
            "    - link \"About\"",
            "  - region \"Hero\":",
            "    - heading \"Big title\" [level=1]",
            "    - generic:",
            "      - button \"Start\"",
            "      - text: hello",
            "  - list:",
            "    - listitem \"a\"",
            "    - listitem \"b\"",
            "    - listitem \"c\"",
            "    - listitem \"d\"",
            "    - listitem \"e\""
    );

    @Test
    void unscopedIndexExpandsOnlyTheRootFrontier() {
        String index = builder.buildIndex(SnapshotTree.parse(PAGE), null, 1, 200, 80);

        String expected = String.join("\n",
                "index (path=root, depth=1, max_nodes=200)",
                "- main [path=0]",
                "  - navigation \"Top\" [path=0/0] (grandchildren: link \"Home\" [path=0/0/0] :: Home; " +
                        "link \"About\" [path=0/0/1] :: About)",
                "  - region \"Hero\" [path=0/1] (grandchildren: heading \"Big title\" [path=0/1/0] :: Big title; " +
                        "generic [path=0/1/1] :: Start)",
                "  - list [path=0/2] (grandchildren: listitem \"a\" [path=0/2/0]; listitem \"b\" [path=0/2/1]; " +
                        "listitem \"c\" [path=0/2/2]; +2 more)"
        );
        assertEquals(expected, index);
    }

    @Test
    void unscopedIndexDoesNotGoDeeperEvenWithLargeDepth() {
        String index = builder.buildIndex(SnapshotTree.parse(PAGE), null, 5, 200, 80);

        assertFalse(index.contains("- link \"Home\" [path=0/0/0]\n"));
        assertEquals(5, index.split("\n").length);
    }

    @Test
    void depthZeroShowsPreviewWithSubtreeSummaries() {
        String index = builder.buildIndex(SnapshotTree.parse(PAGE), null, 0, 200, 80);

        String expected = String.join("\n",
                "index (path=root, depth=0, max_nodes=200)",
                "- main [path=0] (grandchildren: navigation \"Top\" [path=0/0] :: Home | About; " +
                        "region \"Hero\" [path=0/1] :: Big title | Start; list [path=0/2])"
        );
        assertEquals(expected, index);
    }

    @Test
    void scopedIndexExpandsDownToRequestedDepth() {
        String index = builder.buildIndex(SnapshotTree.parse(PAGE), "0/1", 2, 200, 80);

        String expected = String.join("\n",
                "index (path=0/1, depth=2, max_nodes=200)",
                "- region \"Hero\" [path=0/1]",
                "  - heading \"Big title\" [path=0/1/0]",
                "  - generic [path=0/1/1]",
                "    - button \"Start\" [path=0/1/1/0]",
                "    - text \"hello\" [path=0/1/1/1]"
        );
        assertEquals(expected, index);
    }

    @Test
    void maxNodesTruncatesAndReportsTotal() {
        String index = builder.buildIndex(SnapshotTree.parse(PAGE), null, 1, 2, 80);

        String[] lines = index.split("\n");
        assertEquals(4, lines.length);
        assertTrue(lines[2].startsWith("  - navigation \"Top\" [path=0/0]"));
        assertEquals("... (truncated: returned 2 of 15)", lines[3]);
    }

    @Test
    void labelsAreTruncatedToTextLimit() {
        String index = builder.buildIndex(SnapshotTree.parse("- button \"Very long label\""), null, 1, 10, 5);

        assertEquals("index (path=root, depth=1, max_nodes=10)\n- button \"Very …\" [path=0]", index);
    }

    @Test
    void twoButtonsUnderHeading() {
        String text = "- heading \"Title\"\n  - button \"Save\"\n  - button \"Save\"";

        String index = builder.buildIndex(SnapshotTree.parse(text), null, 1, 200, 80);

        String expected = String.join("\n",
                "index (path=root, depth=1, max_nodes=200)",
                "- heading \"Title\" [path=0]",
                "  - button \"Save\" [path=0/0]",
                "  - button \"Save\" [path=0/1]"
        );
        assertEquals(expected, index);
    }

    @Test
    void summaryDeduplicatesCaseInsensitivelyAndStopsAtLimit() {
        String text = String.join("\n",
                "- group:",
                "  - button \"OK\"",
                "  - button \"ok\"",
                "  - link \"one\"",
                "  - link \"two\"",
                "  - link \"three\"",
                "  - link \"four\"",
                "  - link \"five\"",
                "  - link \"six\""
        );

        String summary = SnapshotIndexBuilder.collectSummary(SnapshotTree.parse(text), 0, 6, 80);

        assertEquals("OK | one | two | three | four | five", summary);
    }

    @Test
    void emptyTreeRendersSentinel() {
        assertEquals("(empty)", builder.buildIndex(SnapshotTree.parse(""), null, 1, 200, 80));
    }

    @Test
    void unknownPathThrows() {
        assertThrows(PathNotFoundException.class,
                () -> builder.buildIndex(SnapshotTree.parse(PAGE), "0/9", 1, 200, 80));
    }

    @Test
    void optionsOverloadUsesConfiguredBounds() {
        IndexOptions options = IndexOptions.defaults().withDepth(2).withMaxNodes(3);

        String index = builder.buildIndex(SnapshotTree.parse(PAGE), "0/0", options);

        assertTrue(index.startsWith("index (path=0/0, depth=2, max_nodes=3)"));
        assertTrue(index.contains("  - link \"About\" [path=0/0/1]"));
    }

    @Test
    void deepScopedListingRendersEveryLevel() {
        int levels = 4000;
        StringBuilder dump = new StringBuilder();
        for (int i = 0; i < levels; i++) {
            dump.append("  ".repeat(i)).append("- group\n");
        }

        String index = builder.buildIndex(SnapshotTree.parse(dump.toString()), "0", levels, levels, 80);

        String[] lines = index.split("\n");
        assertEquals(levels + 1, lines.length);
        String deepest = String.join("/", Collections.nCopies(levels, "0"));
        assertEquals("  ".repeat(levels - 1) + "- group [path=" + deepest + "]", lines[levels]);
    }
}
