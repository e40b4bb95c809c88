package eu.fbk.knowledgegraph;

import javax.annotation.Nullable;

/**
 * Signals an internal failure during the evaluation of a syntactically valid query.
 */
public class QueryExecutionException extends QueryException {

    private static final long serialVersionUID = 1L;

    public QueryExecutionException(final String query, final String message,
            @Nullable final Throwable cause) {
        super(query, message, cause);
    }

}
