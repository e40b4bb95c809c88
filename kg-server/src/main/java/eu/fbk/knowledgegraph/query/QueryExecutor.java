package eu.fbk.knowledgegraph.query;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;

import org.openrdf.model.Statement;
import org.openrdf.model.Value;
import org.openrdf.query.BindingSet;
import org.openrdf.query.BooleanQuery;
import org.openrdf.query.GraphQuery;
import org.openrdf.query.GraphQueryResult;
import org.openrdf.query.MalformedQueryException;
import org.openrdf.query.Query;
import org.openrdf.query.QueryEvaluationException;
import org.openrdf.query.QueryInterruptedException;
import org.openrdf.query.QueryLanguage;
import org.openrdf.query.TupleQuery;
import org.openrdf.query.TupleQueryResult;
import org.openrdf.repository.RepositoryConnection;
import org.openrdf.repository.RepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.knowledgegraph.QueryException;
import eu.fbk.knowledgegraph.QueryExecutionException;
import eu.fbk.knowledgegraph.QueryTimeoutException;
import eu.fbk.knowledgegraph.QueryValidationException;
import eu.fbk.knowledgegraph.graphstore.GraphStore;

/**
 * Evaluates read-only SPARQL queries against a {@link GraphStore} generation.
 * <p>
 * Evaluation runs on a worker thread of the supplied executor, while the calling thread waits at
 * most for the requested timeout; on expiration the evaluation is cancelled and a
 * {@link QueryTimeoutException} is thrown. The Sesame query time limit is set as well, so that a
 * cancelled evaluation stops also on the worker side. Results are consumed lazily and evaluation
 * stops as soon as the requested number of rows is reached.
 * </p>
 * <p>
 * Rows are maps with an entry for each variable (SELECT), a single {@code result} entry (ASK) or
 * {@code subject}, {@code predicate} and {@code object} entries (CONSTRUCT and DESCRIBE). Values
 * are rendered with their lexical form; unbound variables map to null.
 * </p>
 */
public final class QueryExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryExecutor.class);

    public static final String RESULT = "result";

    public static final String SUBJECT = "subject";

    public static final String PREDICATE = "predicate";

    public static final String OBJECT = "object";

    private final ListeningExecutorService executor;

    private final int defaultMaxResults;

    private final int maxResults;

    private final long defaultTimeout;

    /**
     * Creates a new executor.
     * 
     * @param executor
     *            the executor whose threads evaluate the queries
     * @param defaultMaxResults
     *            the row limit applied when the caller does not specify a positive one
     * @param maxResults
     *            the upper bound to any row limit
     * @param defaultTimeout
     *            the timeout in milliseconds applied when the caller does not specify a positive
     *            one
     */
    public QueryExecutor(final ListeningExecutorService executor, final int defaultMaxResults,
            final int maxResults, final long defaultTimeout) {
        Preconditions.checkArgument(defaultMaxResults > 0);
        Preconditions.checkArgument(maxResults > 0);
        Preconditions.checkArgument(defaultTimeout > 0);
        this.executor = Preconditions.checkNotNull(executor);
        this.defaultMaxResults = Math.min(defaultMaxResults, maxResults);
        this.maxResults = maxResults;
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Returns the row limit actually applied for the requested one.
     * 
     * @param requested
     *            the requested limit, not positive to use the default
     * @return the effective limit
     */
    public int getEffectiveMaxResults(final int requested) {
        return requested <= 0 ? this.defaultMaxResults : Math.min(requested, this.maxResults);
    }

    /**
     * Validates and evaluates the query specified.
     * 
     * @param store
     *            the generation to query
     * @param queryString
     *            the SPARQL query string
     * @param maxResults
     *            the maximum number of rows to return, not positive to use the default
     * @param timeout
     *            the timeout in milliseconds, not positive to use the default
     * @return the result rows, at most {@code maxResults} and in evaluation order
     * @throws QueryValidationException
     *             if the query is malformed or not read-only
     * @throws QueryTimeoutException
     *             if evaluation did not complete within the timeout
     * @throws QueryExecutionException
     *             if evaluation failed
     */
    public List<Map<String, String>> execute(final GraphStore store, final String queryString,
            final int maxResults, final long timeout) throws QueryException {

        final ReadOnlyQuery query = ReadOnlyQuery.from(queryString);
        final int limit = getEffectiveMaxResults(maxResults);
        final long actualTimeout = timeout <= 0 ? this.defaultTimeout : timeout;

        final ListenableFuture<List<Map<String, String>>> future = this.executor
                .submit(new Callable<List<Map<String, String>>>() {

                    @Override
                    public List<Map<String, String>> call() throws QueryException {
                        return evaluate(store, query, limit, actualTimeout);
                    }

                });

        try {
            return future.get(actualTimeout, TimeUnit.MILLISECONDS);

        } catch (final TimeoutException ex) {
            future.cancel(true);
            LOGGER.debug("Query timed out after {} ms: {}", actualTimeout, queryString);
            throw new QueryTimeoutException(queryString, actualTimeout);

        } catch (final InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new QueryExecutionException(queryString, "Interrupted while waiting for query "
                    + "results", ex);

        } catch (final ExecutionException ex) {
            final Throwable cause = ex.getCause();
            if (cause instanceof QueryException) {
                throw (QueryException) cause;
            }
            throw new QueryExecutionException(queryString, "Query evaluation failed: "
                    + cause.getMessage(), cause);
        }
    }

    private static List<Map<String, String>> evaluate(final GraphStore store,
            final ReadOnlyQuery query, final int limit, final long timeout)
            throws QueryException {

        final String string = query.getString();
        RepositoryConnection connection = null;
        try {
            connection = store.getRepository().getConnection();
            switch (query.getForm()) {
            case SELECT:
                final TupleQuery tupleQuery = connection.prepareTupleQuery(QueryLanguage.SPARQL,
                        string);
                setMaxQueryTime(tupleQuery, timeout);
                return evaluateTuple(tupleQuery, limit);
            case ASK:
                final BooleanQuery booleanQuery = connection.prepareBooleanQuery(
                        QueryLanguage.SPARQL, string);
                setMaxQueryTime(booleanQuery, timeout);
                final Map<String, String> row = Collections.singletonMap(RESULT,
                        Boolean.toString(booleanQuery.evaluate()));
                return ImmutableList.of(row);
            case GRAPH:
                final GraphQuery graphQuery = connection.prepareGraphQuery(QueryLanguage.SPARQL,
                        string);
                setMaxQueryTime(graphQuery, timeout);
                return evaluateGraph(graphQuery, limit);
            default:
                throw new Error("Unexpected query form " + query.getForm());
            }

        } catch (final QueryInterruptedException ex) {
            throw new QueryTimeoutException(string, timeout);

        } catch (final MalformedQueryException ex) {
            throw new QueryValidationException(string, "Invalid SPARQL query: "
                    + ex.getMessage(), ex);

        } catch (final QueryEvaluationException | RepositoryException ex) {
            throw new QueryExecutionException(string, "Query evaluation failed: "
                    + ex.getMessage(), ex);

        } finally {
            if (connection != null) {
                try {
                    connection.close();
                } catch (final RepositoryException ex) {
                    LOGGER.error("Failed to close repository connection", ex);
                }
            }
        }
    }

    private static List<Map<String, String>> evaluateTuple(final TupleQuery query,
            final int limit) throws QueryEvaluationException {
        final TupleQueryResult result = query.evaluate();
        try {
            final List<String> names = result.getBindingNames();
            final List<Map<String, String>> rows = Lists.newArrayList();
            while (rows.size() < limit && result.hasNext()) {
                checkInterrupted();
                final BindingSet bindings = result.next();
                final Map<String, String> row = Maps.newLinkedHashMap();
                for (final String name : names) {
                    row.put(name, toString(bindings.getValue(name)));
                }
                rows.add(Collections.unmodifiableMap(row));
            }
            return rows;
        } finally {
            result.close();
        }
    }

    private static List<Map<String, String>> evaluateGraph(final GraphQuery query,
            final int limit) throws QueryEvaluationException {
        final GraphQueryResult result = query.evaluate();
        try {
            final List<Map<String, String>> rows = Lists.newArrayList();
            while (rows.size() < limit && result.hasNext()) {
                checkInterrupted();
                final Statement statement = result.next();
                final Map<String, String> row = Maps.newLinkedHashMap();
                row.put(SUBJECT, toString(statement.getSubject()));
                row.put(PREDICATE, toString(statement.getPredicate()));
                row.put(OBJECT, toString(statement.getObject()));
                rows.add(Collections.unmodifiableMap(row));
            }
            return rows;
        } finally {
            result.close();
        }
    }

    private static void setMaxQueryTime(final Query query, final long timeout) {
        final long seconds = Math.max(1L, (timeout + 999L) / 1000L);
        query.setMaxQueryTime((int) Math.min(seconds, Integer.MAX_VALUE));
    }

    private static void checkInterrupted() throws QueryInterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new QueryInterruptedException("Query evaluation cancelled");
        }
    }

    @Nullable
    private static String toString(@Nullable final Value value) {
        return value == null ? null : value.stringValue();
    }

}
