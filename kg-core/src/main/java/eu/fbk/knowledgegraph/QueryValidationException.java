package eu.fbk.knowledgegraph;

import javax.annotation.Nullable;

/**
 * Signals that a query has been rejected before execution, either because it is not a valid
 * SPARQL query or because it is not a read-only SELECT, ASK, CONSTRUCT or DESCRIBE query.
 */
public class QueryValidationException extends QueryException {

    private static final long serialVersionUID = 1L;

    public QueryValidationException(final String query, final String message) {
        this(query, message, null);
    }

    public QueryValidationException(final String query, final String message,
            @Nullable final Throwable cause) {
        super(query, message, cause);
    }

}
