package io.hearthwarrio.ariaindex.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Substring / regex search over node text.
 * <p>
 * Result pipeline:
 * <ol>
 *   <li>collect up to {@code 4 * limit} matching nodes in tree order</li>
 *   <li>sort by (path depth, path)</li>
 *   <li>drop any match equal to or below an already kept path, keeping the shallowest match per subtree</li>
 *   <li>cap at {@code limit}</li>
 * </ol>
 */
public class SnapshotSearch {

    static final int CANDIDATE_FACTOR = 4;

    /**
     * Searches the tree and renders the result listing.
     *
     * @return header plus one {@code - role "snippet" [path=P]} line per result, {@code (empty)} when nothing
     * matched; a bare {@code "(empty)"} for an empty tree or blank query
     * @throws InvalidQueryException if {@code mode} is regex and {@code query} does not compile
     */
    public String search(SnapshotTree tree, String query, SearchMode mode, int limit, int textLimit) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }

        if (tree.isEmpty() || query == null || query.isEmpty()) {
            return ReferenceAssigner.EMPTY;
        }

        List<SearchHit> hits = find(tree, QueryMatcher.compile(query, mode), limit, textLimit);

        String header = "search (query=\"" + query + "\", mode=" + mode.label() + ", limit=" + limit + ")";
        if (hits.isEmpty()) {
            return header + "\n" + ReferenceAssigner.EMPTY;
        }

        List<String> lines = new ArrayList<>(hits.size() + 1);
        lines.add(header);
        for (SearchHit hit : hits) {
            lines.add(hit.render());
        }
        return String.join("\n", lines);
    }

    /**
     * Runs the match/sort/prune pipeline and returns structured hits.
     */
    public List<SearchHit> find(SnapshotTree tree, QueryMatcher matcher, int limit, int textLimit) {
        List<SearchHit> candidates = new ArrayList<>();
        int maxCandidates = limit * CANDIDATE_FACTOR;

        for (ParsedNode node : tree.getNodes()) {
            String textValue = NodeText.textValue(node);
            String suffix = NodeText.cleanSuffix(node.getRawSuffix());
            String haystack = NodeText.joinNonEmpty(node.getRole(), textValue, suffix);
            if (haystack.isEmpty() || !matcher.matches(haystack)) {
                continue;
            }

            String source = !textValue.isEmpty() ? textValue : (!suffix.isEmpty() ? suffix : haystack);
            String snippet = NodeText.snippet(source, matcher, textLimit);
            candidates.add(new SearchHit(node.getRole(), snippet, node.getPath()));

            if (candidates.size() >= maxCandidates) {
                break;
            }
        }

        candidates.sort(Comparator
                .comparingInt((SearchHit h) -> PathAssigner.pathDepth(h.getPath()))
                .thenComparing(SearchHit::getPath));

        List<SearchHit> kept = new ArrayList<>();
        for (SearchHit hit : candidates) {
            if (coveredBy(hit.getPath(), kept)) {
                continue;
            }
            kept.add(hit);
            if (kept.size() >= limit) {
                break;
            }
        }
        return kept;
    }

    private static boolean coveredBy(String path, List<SearchHit> kept) {
        for (SearchHit k : kept) {
            if (PathAssigner.isSameOrDescendant(path, k.getPath())) {
                return true;
            }
        }
        return false;
    }
}
