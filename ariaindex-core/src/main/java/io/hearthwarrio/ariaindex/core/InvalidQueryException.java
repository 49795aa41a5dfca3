package io.hearthwarrio.ariaindex.core;

/**
 * Thrown when a regex search query cannot be compiled.
 */
public class InvalidQueryException extends AriaIndexException {

    private final String query;

    public InvalidQueryException(String query, Throwable cause) {
        super("Invalid regex query '" + query + "': " + cause.getMessage(), cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
