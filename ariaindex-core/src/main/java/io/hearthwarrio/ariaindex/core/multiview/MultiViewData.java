package io.hearthwarrio.ariaindex.core.multiview;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Page outline gathered by the browser layer, split into four views:
 * headings, text blocks, interactive controls and overlays.
 * Every item carries the CSS selector it was collected from.
 */
public final class MultiViewData {

    private final String title;
    private final String lang;
    private final List<Section> sections;
    private final List<Block> blocks;
    private final List<Control> interactions;
    private final List<Overlay> overlays;

    public MultiViewData(
            String title,
            String lang,
            List<Section> sections,
            List<Block> blocks,
            List<Control> interactions,
            List<Overlay> overlays
    ) {
        this.title = title == null ? "" : title;
        this.lang = lang == null ? "" : lang;
        this.sections = copy(sections);
        this.blocks = copy(blocks);
        this.interactions = copy(interactions);
        this.overlays = copy(overlays);
    }

    public static MultiViewData empty() {
        return new MultiViewData("", "", List.of(), List.of(), List.of(), List.of());
    }

    /**
     * Converts the map returned by a collecting script ({@code JavascriptExecutor#executeScript}) into view data.
     * Missing keys and non-list values yield empty views.
     *
     * @param raw script result (may be null)
     * @return view data, never null
     */
    public static MultiViewData fromScriptResult(Map<?, ?> raw) {
        if (raw == null) {
            return empty();
        }

        List<Section> sections = new ArrayList<>();
        for (Map<?, ?> m : maps(raw.get("sections"))) {
            sections.add(new Section(
                    str(m.get("title")),
                    intOr(m.get("level"), 1),
                    str(m.get("summary")),
                    str(m.get("selector")),
                    str(m.get("anchor"))
            ));
        }

        List<Block> blocks = new ArrayList<>();
        for (Map<?, ?> m : maps(raw.get("blocks"))) {
            blocks.add(new Block(str(m.get("text")), str(m.get("selector"))));
        }

        List<Control> controls = new ArrayList<>();
        for (Map<?, ?> m : maps(raw.get("interactions"))) {
            controls.add(new Control(str(m.get("kind")), str(m.get("label")), str(m.get("selector"))));
        }

        List<Overlay> overlays = new ArrayList<>();
        for (Map<?, ?> m : maps(raw.get("overlays"))) {
            overlays.add(new Overlay(str(m.get("label")), str(m.get("selector"))));
        }

        return new MultiViewData(str(raw.get("title")), str(raw.get("lang")), sections, blocks, controls, overlays);
    }

    public String getTitle() {
        return title;
    }

    public String getLang() {
        return lang;
    }

    public List<Section> getSections() {
        return sections;
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    public List<Control> getInteractions() {
        return interactions;
    }

    public List<Overlay> getOverlays() {
        return overlays;
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
    }

    private static List<Map<?, ?>> maps(Object value) {
        if (!(value instanceof List)) {
            return List.of();
        }
        List<Map<?, ?>> out = new ArrayList<>();
        for (Object o : (List<?>) value) {
            if (o instanceof Map) {
                out.add((Map<?, ?>) o);
            }
        }
        return out;
    }

    private static String str(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int intOr(Object value, int fallback) {
        if (value instanceof Number) {
            int v = ((Number) value).intValue();
            return v == 0 ? fallback : v;
        }
        if (value instanceof String) {
            try {
                int v = Integer.parseInt(((String) value).trim());
                return v == 0 ? fallback : v;
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    /**
     * A visible heading with the first text that follows it.
     */
    public static final class Section {
        private final String title;
        private final int level;
        private final String summary;
        private final String selector;
        private final String anchor;

        public Section(String title, int level, String summary, String selector, String anchor) {
            this.title = Objects.requireNonNullElse(title, "");
            this.level = level;
            this.summary = Objects.requireNonNullElse(summary, "");
            this.selector = Objects.requireNonNullElse(selector, "");
            this.anchor = Objects.requireNonNullElse(anchor, "");
        }

        public String getTitle() {
            return title;
        }

        public int getLevel() {
            return level;
        }

        public String getSummary() {
            return summary;
        }

        public String getSelector() {
            return selector;
        }

        public String getAnchor() {
            return anchor;
        }
    }

    /**
     * A text-heavy block (paragraph, list item, section...).
     */
    public static final class Block {
        private final String text;
        private final String selector;

        public Block(String text, String selector) {
            this.text = Objects.requireNonNullElse(text, "");
            this.selector = Objects.requireNonNullElse(selector, "");
        }

        public String getText() {
            return text;
        }

        public String getSelector() {
            return selector;
        }
    }

    /**
     * A visible form control or link. {@code kind} is the input type or the tag name.
     */
    public static final class Control {
        private final String kind;
        private final String label;
        private final String selector;

        public Control(String kind, String label, String selector) {
            this.kind = Objects.requireNonNullElse(kind, "");
            this.label = Objects.requireNonNullElse(label, "");
            this.selector = Objects.requireNonNullElse(selector, "");
        }

        public String getKind() {
            return kind;
        }

        public String getLabel() {
            return label;
        }

        public String getSelector() {
            return selector;
        }
    }

    /**
     * A visible dialog.
     */
    public static final class Overlay {
        private final String label;
        private final String selector;

        public Overlay(String label, String selector) {
            this.label = Objects.requireNonNullElse(label, "");
            this.selector = Objects.requireNonNullElse(selector, "");
        }

        public String getLabel() {
            return label;
        }

        public String getSelector() {
            return selector;
        }
    }
}
