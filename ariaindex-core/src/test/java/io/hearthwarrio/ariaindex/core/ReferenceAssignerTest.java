package io.hearthwarrio.ariaindex.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ReferenceAssignerTest {
    private final ReferenceAssigner assigner = new ReferenceAssigner();

    private static final String FORM = String.join("\n",
            "- main:",
            "  - heading \"Checkout\" [level=1]",
            "  - group:",
            "    - textbox \"Email\"",
            "    - button \"Save\"",
            "    - button \"Save\"",
            "    - button \"Cancel\"",
            "  - list:",
            "    - listitem: first",
            "    - listitem \"Named\"",
            "  - button \"Save\""
    );

    @Test
    void annotatesInteractiveAndNamedContentLines() {
        AnnotatedSnapshot snapshot = assigner.assignRefs(FORM, SnapshotOptions.defaults());

        String expected = String.join("\n",
                "- main:",
                "  - heading \"Checkout\" [ref=@e1] [level=1]",
                "  - group:",
                "    - textbox \"Email\" [ref=@e2]",
                "    - button \"Save\" [ref=@e3]",
                "    - button \"Save\" [ref=@e4]",
                "    - button \"Cancel\" [ref=@e5]",
                "  - list:",
                "    - listitem: first",
                "    - listitem \"Named\" [ref=@e6]",
                "  - button \"Save\" [ref=@e7]"
        );
        assertEquals(expected, snapshot.getTree());
        assertEquals(7, snapshot.getRefs().size());
        assertEquals(new RefTarget("heading", "Checkout", null), snapshot.getRefs().get("e1"));
        assertEquals(new RefTarget("textbox", "Email", null), snapshot.getRefs().get("e2"));
        assertEquals(new RefTarget("button", "Cancel", null), snapshot.getRefs().get("e5"));
    }

    @Test
    void duplicateKeysGetConsecutiveNthAndUniqueKeysGetNone() {
        AnnotatedSnapshot snapshot = assigner.assignRefs(FORM, SnapshotOptions.defaults());
        Map<String, RefTarget> refs = snapshot.getRefs();

        assertEquals(Integer.valueOf(0), refs.get("e3").getNth());
        assertEquals(Integer.valueOf(1), refs.get("e4").getNth());
        assertEquals(Integer.valueOf(2), refs.get("e7").getNth());
        assertNull(refs.get("e2").getNth());
    }

    @Test
    void nthValuesPerSharedKeyAreExactlyZeroToCountMinusOne() {
        String text = String.join("\n",
                "- link \"More\"",
                "- button",
                "- link \"More\"",
                "- button",
                "- button",
                "- link \"More\""
        );

        Map<String, RefTarget> refs = assigner.assignRefs(text, SnapshotOptions.defaults()).getRefs();

        Map<String, List<Integer>> byKey = new HashMap<>();
        for (RefTarget t : refs.values()) {
            byKey.computeIfAbsent(t.getRole() + ":" + t.getName(), k -> new ArrayList<>()).add(t.getNth());
        }
        assertEquals(List.of(0, 1, 2), byKey.get("link:More"));
        assertEquals(List.of(0, 1, 2), byKey.get("button:null"));
    }

    @Test
    void interactiveOnlyDropsLinesButKeepsDescendantIndentation() {
        AnnotatedSnapshot snapshot = assigner.assignRefs(FORM, SnapshotOptions.defaults().withInteractiveOnly(true));

        String expected = String.join("\n",
                "    - textbox \"Email\" [ref=@e1]",
                "    - button \"Save\" [ref=@e2]",
                "    - button \"Save\" [ref=@e3]",
                "    - button \"Cancel\" [ref=@e4]",
                "  - button \"Save\" [ref=@e5]"
        );
        assertEquals(expected, snapshot.getTree());
        assertEquals(Integer.valueOf(2), snapshot.getRefs().get("e5").getNth());
    }

    @Test
    void compactDropsUnnamedStructuralLinesOnly() {
        String text = String.join("\n",
                "- generic:",
                "  - group \"Filters\":",
                "    - checkbox \"Only new\" [checked]",
                "  - list:",
                "    - listitem: a"
        );

        AnnotatedSnapshot snapshot = assigner.assignRefs(text, SnapshotOptions.defaults().withCompact(true));

        String expected = String.join("\n",
                "  - group \"Filters\":",
                "    - checkbox \"Only new\" [ref=@e1] [checked]",
                "    - listitem: a"
        );
        assertEquals(expected, snapshot.getTree());
    }

    @Test
    void maxDepthDropsDeeperLinesBeforeCounting() {
        String text = String.join("\n",
                "- button \"Go\"",
                "  - button \"Go\"",
                "    - button \"Go\""
        );

        AnnotatedSnapshot snapshot = assigner.assignRefs(text, SnapshotOptions.defaults().withMaxDepth(1));

        assertEquals(2, snapshot.getRefs().size());
        assertEquals(Integer.valueOf(0), snapshot.getRefs().get("e1").getNth());
        assertEquals(Integer.valueOf(1), snapshot.getRefs().get("e2").getNth());
    }

    @Test
    void passthroughLinesAndClosingMarkersArePreserved() {
        String text = String.join("\n",
                "- list:",
                "  some free text",
                "  - /children",
                "  - link \"A\""
        );

        AnnotatedSnapshot snapshot = assigner.assignRefs(text, SnapshotOptions.defaults().withInteractiveOnly(true));

        String expected = String.join("\n",
                "  some free text",
                "  - /children",
                "  - link \"A\" [ref=@e1]"
        );
        assertEquals(expected, snapshot.getTree());
    }

    @Test
    void emptyInputRendersEmptySentinel() {
        AnnotatedSnapshot snapshot = assigner.assignRefs("", SnapshotOptions.defaults());

        assertEquals("(empty)", snapshot.getTree());
        assertTrue(snapshot.getRefs().isEmpty());
    }

    @Test
    void eachCallStartsNumberingAgain() {
        AnnotatedSnapshot first = assigner.assignRefs("- button \"A\"\n- button \"B\"", SnapshotOptions.defaults());
        AnnotatedSnapshot second = assigner.assignRefs("- link \"C\"", SnapshotOptions.defaults());

        assertEquals(2, first.getRefs().size());
        assertEquals(1, second.getRefs().size());
        assertEquals(new RefTarget("link", "C", null), second.getRefs().get("e1"));
    }

    @Test
    void selectorDescribesRoleLocator() {
        assertEquals("getByRole(\"button\", { name: \"Say \\\"hi\\\"\", exact: true })",
                new RefTarget("button", "Say \"hi\"", null).selector());
        assertEquals("getByRole(\"textbox\")", new RefTarget("textbox", null, 1).selector());
        assertEquals("getByText(\"Terms\", { exact: true })", new RefTarget("text", "Terms", null).selector());
    }

    @Test
    void rejectsNegativeMaxDepth() {
        assertThrows(IllegalArgumentException.class, () -> SnapshotOptions.defaults().withMaxDepth(-1));
    }
}
