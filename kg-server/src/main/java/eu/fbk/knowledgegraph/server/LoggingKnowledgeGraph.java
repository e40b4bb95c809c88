package eu.fbk.knowledgegraph.server;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.knowledgegraph.KnowledgeGraph;
import eu.fbk.knowledgegraph.QueryException;
import eu.fbk.knowledgegraph.data.Concept;
import eu.fbk.knowledgegraph.data.Hierarchy;
import eu.fbk.knowledgegraph.data.Neighbor;
import eu.fbk.knowledgegraph.data.PrefixMatch;
import eu.fbk.knowledgegraph.data.SearchResult;
import eu.fbk.knowledgegraph.data.Taxonomy;
import eu.fbk.knowledgegraph.data.TaxonomyStats;

/**
 * A {@code KnowledgeGraph} wrapper that logs calls to the operations of a wrapped
 * {@code KnowledgeGraph} and their execution times.
 * <p>
 * Request information, result sizes and execution times are logged via SLF4J (level DEBUG,
 * logger named after this class). Failed queries are logged with their error message. The
 * overhead introduced by this wrapper when logging is disabled is negligible.
 * </p>
 */
public final class LoggingKnowledgeGraph extends ForwardingKnowledgeGraph {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingKnowledgeGraph.class);

    private final KnowledgeGraph delegate;

    /**
     * Creates a new instance for the wrapped {@code KnowledgeGraph} specified.
     * 
     * @param delegate
     *            the wrapped {@code KnowledgeGraph}
     */
    public LoggingKnowledgeGraph(final KnowledgeGraph delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
        LOGGER.debug("{} configured", getClass().getSimpleName());
    }

    @Override
    protected KnowledgeGraph delegate() {
        return this.delegate;
    }

    @Override
    public long rebuild() {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final long generation = super.rebuild();
            LOGGER.debug("{} - rebuilt generation {} in {} ms", this, generation,
                    System.currentTimeMillis() - ts);
            return generation;
        } else {
            return super.rebuild();
        }
    }

    @Override
    public List<Map<String, String>> query(final String query, final int maxResults,
            final long timeout) throws QueryException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            try {
                final List<Map<String, String>> rows = super.query(query, maxResults, timeout);
                LOGGER.debug("{} - query returned {} rows in {} ms: {}", this, rows.size(),
                        System.currentTimeMillis() - ts, abbreviate(query));
                return rows;
            } catch (final QueryException ex) {
                LOGGER.debug("{} - query failed after {} ms ({}): {}", this,
                        System.currentTimeMillis() - ts, ex.getMessage(), abbreviate(query));
                throw ex;
            }
        } else {
            return super.query(query, maxResults, timeout);
        }
    }

    @Override
    public List<PrefixMatch> prefixSearch(final String text, final int limit) {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final List<PrefixMatch> result = super.prefixSearch(text, limit);
            log("prefixSearch('" + text + "')", result.size(), ts);
            return result;
        } else {
            return super.prefixSearch(text, limit);
        }
    }

    @Override
    public List<SearchResult> searchConcepts(final String text, @Nullable final String taxonomy,
            final int limit) {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final List<SearchResult> result = super.searchConcepts(text, taxonomy, limit);
            log("searchConcepts('" + text + "', " + taxonomy + ")", result.size(), ts);
            return result;
        } else {
            return super.searchConcepts(text, taxonomy, limit);
        }
    }

    @Override
    public List<Taxonomy> getTaxonomies() {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final List<Taxonomy> result = super.getTaxonomies();
            log("getTaxonomies()", result.size(), ts);
            return result;
        } else {
            return super.getTaxonomies();
        }
    }

    @Override
    public List<Concept> getConceptsByTaxonomy(@Nullable final String taxonomy) {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final List<Concept> result = super.getConceptsByTaxonomy(taxonomy);
            log("getConceptsByTaxonomy(" + taxonomy + ")", result.size(), ts);
            return result;
        } else {
            return super.getConceptsByTaxonomy(taxonomy);
        }
    }

    @Override
    public Map<String, List<Concept>> getGroupedConcepts() {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final Map<String, List<Concept>> result = super.getGroupedConcepts();
            log("getGroupedConcepts()", result.size(), ts);
            return result;
        } else {
            return super.getGroupedConcepts();
        }
    }

    @Override
    public List<Concept> getTopLevelConcepts(@Nullable final String taxonomy) {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final List<Concept> result = super.getTopLevelConcepts(taxonomy);
            log("getTopLevelConcepts(" + taxonomy + ")", result.size(), ts);
            return result;
        } else {
            return super.getTopLevelConcepts(taxonomy);
        }
    }

    @Override
    @Nullable
    public Concept getConceptDetails(final String iri) {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final Concept result = super.getConceptDetails(iri);
            log("getConceptDetails(<" + iri + ">)", result == null ? 0 : 1, ts);
            return result;
        } else {
            return super.getConceptDetails(iri);
        }
    }

    @Override
    @Nullable
    public Hierarchy getConceptHierarchy(final String iri) {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final Hierarchy result = super.getConceptHierarchy(iri);
            log("getConceptHierarchy(<" + iri + ">)", result == null ? 0 : 1, ts);
            return result;
        } else {
            return super.getConceptHierarchy(iri);
        }
    }

    @Override
    public List<Neighbor> neighbors(final String iri, final int limit) {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final List<Neighbor> result = super.neighbors(iri, limit);
            log("neighbors(<" + iri + ">)", result.size(), ts);
            return result;
        } else {
            return super.neighbors(iri, limit);
        }
    }

    @Override
    public TaxonomyStats getTaxonomyStats() {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final TaxonomyStats result = super.getTaxonomyStats();
            log("getTaxonomyStats()", result.getTaxonomies().size(), ts);
            return result;
        } else {
            return super.getTaxonomyStats();
        }
    }

    @Override
    public void close() {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.close();
            LOGGER.debug("{} - closed in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.close();
        }
    }

    private void log(final String operation, final int size, final long ts) {
        LOGGER.debug("{} - {} returned {} results in {} ms", this, operation, size,
                System.currentTimeMillis() - ts);
    }

    private static String abbreviate(final String query) {
        final String string = query.replaceAll("\\s+", " ").trim();
        return string.length() <= 200 ? string : string.substring(0, 197) + "...";
    }

}
