package io.hearthwarrio.ariaindex.core;

/**
 * One surviving search result.
 */
public final class SearchHit {

    private final String role;
    private final String snippet;
    private final String path;

    SearchHit(String role, String snippet, String path) {
        this.role = role;
        this.snippet = snippet;
        this.path = path;
    }

    public String getRole() {
        return role;
    }

    /**
     * Context window around the match; may be empty.
     */
    public String getSnippet() {
        return snippet;
    }

    public String getPath() {
        return path;
    }

    String render() {
        StringBuilder sb = new StringBuilder("- ").append(role);
        if (!snippet.isEmpty()) {
            sb.append(" \"").append(snippet).append('"');
        }
        return sb.append(" [path=").append(path).append(']').toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
