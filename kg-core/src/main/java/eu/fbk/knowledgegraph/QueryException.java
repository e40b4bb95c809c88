package eu.fbk.knowledgegraph;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Signals the failure of a query submitted to the {@link KnowledgeGraph}.
 * <p>
 * Subclasses tell apart the three ways a query may fail: rejection before execution (
 * {@link QueryValidationException}), expiration of the time allotted to it (
 * {@link QueryTimeoutException}) and failure of a valid query during evaluation (
 * {@link QueryExecutionException}). In all cases no partial result is returned to the caller.
 * </p>
 */
public abstract class QueryException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String query;

    /**
     * Creates a new instance for the query, message and optional cause specified.
     * 
     * @param query
     *            the failed query string
     * @param message
     *            the error message
     * @param cause
     *            the optional cause
     */
    protected QueryException(final String query, final String message,
            @Nullable final Throwable cause) {
        super(message, cause);
        this.query = Preconditions.checkNotNull(query);
    }

    /**
     * Returns the string of the failed query.
     * 
     * @return the query string
     */
    public final String getQuery() {
        return this.query;
    }

}
