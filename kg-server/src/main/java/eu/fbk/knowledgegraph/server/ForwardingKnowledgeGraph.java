package eu.fbk.knowledgegraph.server;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ForwardingObject;

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
 * A {@code KnowledgeGraph} that forwards all its method calls to another {@code KnowledgeGraph}.
 * <p>
 * This class provides a starting point for implementing the decorator pattern on top of the
 * {@code KnowledgeGraph} interface. Subclasses must implement method {@link #delegate()} and
 * override the methods of {@code KnowledgeGraph} they want to decorate.
 * </p>
 */
public abstract class ForwardingKnowledgeGraph extends ForwardingObject implements
        KnowledgeGraph {

    @Override
    protected abstract KnowledgeGraph delegate();

    @Override
    public long rebuild() {
        return delegate().rebuild();
    }

    @Override
    public long getGeneration() {
        return delegate().getGeneration();
    }

    @Override
    public List<Map<String, String>> query(final String query, final int maxResults,
            final long timeout) throws QueryException {
        return delegate().query(query, maxResults, timeout);
    }

    @Override
    public List<PrefixMatch> prefixSearch(final String text, final int limit) {
        return delegate().prefixSearch(text, limit);
    }

    @Override
    public List<SearchResult> searchConcepts(final String text, @Nullable final String taxonomy,
            final int limit) {
        return delegate().searchConcepts(text, taxonomy, limit);
    }

    @Override
    public List<Taxonomy> getTaxonomies() {
        return delegate().getTaxonomies();
    }

    @Override
    public List<Concept> getConceptsByTaxonomy(@Nullable final String taxonomy) {
        return delegate().getConceptsByTaxonomy(taxonomy);
    }

    @Override
    public Map<String, List<Concept>> getGroupedConcepts() {
        return delegate().getGroupedConcepts();
    }

    @Override
    public List<Concept> getTopLevelConcepts(@Nullable final String taxonomy) {
        return delegate().getTopLevelConcepts(taxonomy);
    }

    @Override
    @Nullable
    public Concept getConceptDetails(final String iri) {
        return delegate().getConceptDetails(iri);
    }

    @Override
    @Nullable
    public Hierarchy getConceptHierarchy(final String iri) {
        return delegate().getConceptHierarchy(iri);
    }

    @Override
    public List<Neighbor> neighbors(final String iri, final int limit) {
        return delegate().neighbors(iri, limit);
    }

    @Override
    public TaxonomyStats getTaxonomyStats() {
        return delegate().getTaxonomyStats();
    }

    @Override
    public void close() {
        delegate().close();
    }

}
