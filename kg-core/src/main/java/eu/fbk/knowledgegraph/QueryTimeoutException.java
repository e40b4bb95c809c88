package eu.fbk.knowledgegraph;

/**
 * Signals that the evaluation of a query has been aborted as it exceeded its timeout.
 */
public class QueryTimeoutException extends QueryException {

    private static final long serialVersionUID = 1L;

    private final long timeout;

    public QueryTimeoutException(final String query, final long timeout) {
        super(query, "Query evaluation exceeded timeout of " + timeout + " ms", null);
        this.timeout = timeout;
    }

    /**
     * Returns the timeout that was exceeded.
     * 
     * @return the timeout in milliseconds
     */
    public long getTimeout() {
        return this.timeout;
    }

}
