package eu.fbk.knowledgegraph.query;

import com.google.common.base.Preconditions;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import org.openrdf.query.MalformedQueryException;
import org.openrdf.query.QueryLanguage;
import org.openrdf.query.algebra.Service;
import org.openrdf.query.algebra.TupleExpr;
import org.openrdf.query.algebra.helpers.QueryModelVisitorBase;
import org.openrdf.query.parser.ParsedBooleanQuery;
import org.openrdf.query.parser.ParsedGraphQuery;
import org.openrdf.query.parser.ParsedQuery;
import org.openrdf.query.parser.ParsedTupleQuery;
import org.openrdf.query.parser.QueryParserUtil;

import eu.fbk.knowledgegraph.QueryValidationException;

/**
 * A SPARQL query string that passed validation as a read-only query.
 * <p>
 * Only the query forms SELECT, ASK, CONSTRUCT and DESCRIBE are accepted. Update operations are
 * rejected, as are queries delegating evaluation to remote endpoints through SERVICE clauses.
 * Validated queries are cached by query string, with soft values reclaimable by the GC.
 * </p>
 */
public final class ReadOnlyQuery {

    private static final Cache<String, ReadOnlyQuery> CACHE = CacheBuilder.newBuilder()
            .softValues().build();

    private final String string;

    private final Form form;

    private final TupleExpr expression;

    /**
     * Returns the {@code ReadOnlyQuery} for the query string specified, validating it.
     * 
     * @param string
     *            the SPARQL query string
     * @return the validated query
     * @throws QueryValidationException
     *             if the string is not a syntactically valid, read-only SPARQL query
     */
    public static ReadOnlyQuery from(final String string) throws QueryValidationException {

        Preconditions.checkNotNull(string);

        ReadOnlyQuery query = CACHE.getIfPresent(string);
        if (query == null) {
            if (string.trim().isEmpty()) {
                throw new QueryValidationException(string, "Empty SPARQL query");
            }
            final ParsedQuery parsedQuery = parse(string);
            final Form form;
            if (parsedQuery instanceof ParsedTupleQuery) {
                form = Form.SELECT;
            } else if (parsedQuery instanceof ParsedBooleanQuery) {
                form = Form.ASK;
            } else if (parsedQuery instanceof ParsedGraphQuery) {
                form = Form.GRAPH;
            } else {
                throw new QueryValidationException(string, "Unsupported SPARQL query form");
            }
            final TupleExpr expression = parsedQuery.getTupleExpr();
            if (containsService(expression)) {
                throw new QueryValidationException(string,
                        "SERVICE clauses are not allowed in read-only queries");
            }
            query = new ReadOnlyQuery(string, form, expression);
            CACHE.put(string, query);
        }
        return query;
    }

    private static ParsedQuery parse(final String string) throws QueryValidationException {
        try {
            return QueryParserUtil.parseQuery(QueryLanguage.SPARQL, string, null);
        } catch (final MalformedQueryException ex) {
            if (isUpdate(string)) {
                throw new QueryValidationException(string,
                        "SPARQL update operations are not allowed, only read-only queries", ex);
            }
            throw new QueryValidationException(string, "Invalid SPARQL query: "
                    + ex.getMessage(), ex);
        } catch (final RuntimeException ex) {
            throw new QueryValidationException(string, "Invalid SPARQL query: "
                    + ex.getMessage(), ex);
        }
    }

    private static boolean isUpdate(final String string) {
        try {
            QueryParserUtil.parseUpdate(QueryLanguage.SPARQL, string, null);
            return true;
        } catch (final MalformedQueryException | RuntimeException ex) {
            return false;
        }
    }

    private static boolean containsService(final TupleExpr expression) {
        final boolean[] found = new boolean[] { false };
        expression.visit(new QueryModelVisitorBase<RuntimeException>() {

            @Override
            public void meet(final Service node) {
                found[0] = true;
            }

        });
        return found[0];
    }

    private ReadOnlyQuery(final String string, final Form form, final TupleExpr expression) {
        this.string = string;
        this.form = form;
        this.expression = expression;
    }

    public String getString() {
        return this.string;
    }

    public Form getForm() {
        return this.form;
    }

    /**
     * Returns the algebraic expression of the query. The expression is shared among all users
     * of the cached instance and must not be modified.
     * 
     * @return the algebraic expression
     */
    public TupleExpr getExpression() {
        return this.expression;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof ReadOnlyQuery)) {
            return false;
        }
        final ReadOnlyQuery other = (ReadOnlyQuery) object;
        return this.string.equals(other.string);
    }

    @Override
    public int hashCode() {
        return this.string.hashCode();
    }

    @Override
    public String toString() {
        return this.string;
    }

    /** The result forms of accepted queries. */
    public enum Form {

        /** Variable bindings, one row per solution. */
        SELECT,

        /** A single boolean. */
        ASK,

        /** Statements, from CONSTRUCT or DESCRIBE queries. */
        GRAPH

    }

}
