package eu.fbk.knowledgegraph.server;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ListeningExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import eu.fbk.knowledgegraph.KnowledgeGraph;
import eu.fbk.knowledgegraph.QueryException;
import eu.fbk.knowledgegraph.concept.ConceptExtractor;
import eu.fbk.knowledgegraph.concept.ConceptSearch;
import eu.fbk.knowledgegraph.concept.HierarchyResolver;
import eu.fbk.knowledgegraph.concept.TaxonomyAggregator;
import eu.fbk.knowledgegraph.data.Concept;
import eu.fbk.knowledgegraph.data.Data;
import eu.fbk.knowledgegraph.data.Hierarchy;
import eu.fbk.knowledgegraph.data.Neighbor;
import eu.fbk.knowledgegraph.data.PrefixMatch;
import eu.fbk.knowledgegraph.data.SearchResult;
import eu.fbk.knowledgegraph.data.Taxonomy;
import eu.fbk.knowledgegraph.data.TaxonomyStats;
import eu.fbk.knowledgegraph.explore.NeighborExplorer;
import eu.fbk.knowledgegraph.explore.PrefixSearch;
import eu.fbk.knowledgegraph.graphstore.GraphBuilder;
import eu.fbk.knowledgegraph.graphstore.GraphStore;
import eu.fbk.knowledgegraph.internal.Logging;
import eu.fbk.knowledgegraph.query.QueryExecutor;
import eu.fbk.knowledgegraph.source.SourceKind;
import eu.fbk.knowledgegraph.source.SourceProvider;

/**
 * A {@code KnowledgeGraph} kept in memory and rebuilt on demand from a {@link SourceProvider}.
 * <p>
 * The published graph is an immutable {@link GraphStore} generation held in an atomic reference.
 * {@link #rebuild()} builds the next generation off to the side and then swaps it in, so readers
 * always see either the old or the new generation in full; concurrent rebuilds are serialized.
 * Read operations take no lock. The concept list and the hierarchy index of a generation are
 * derived on first use and shared by all subsequent reads of that generation.
 * </p>
 * <p>
 * Before the first rebuild the graph is empty and has generation 0.
 * </p>
 */
public final class MemoryKnowledgeGraph implements KnowledgeGraph {

    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryKnowledgeGraph.class);

    private static final Comparator<Concept> LABEL_ORDERING = new Comparator<Concept>() {

        @Override
        public int compare(final Concept first, final Concept second) {
            final int result = sortKey(first).compareTo(sortKey(second));
            return result != 0 ? result : first.getIri().compareTo(second.getIri());
        }

        private String sortKey(final Concept concept) {
            final String label = concept.getLabel();
            return (label != null ? label : concept.getIri()).toLowerCase(Locale.ROOT);
        }

    };

    private final SourceProvider sources;

    private final KnowledgeGraphConfig config;

    private final QueryExecutor queryExecutor;

    private final AtomicReference<Generation> current;

    private final Object rebuildLock;

    private final AtomicBoolean closed;

    private MemoryKnowledgeGraph(final Builder builder) {
        this.sources = builder.sources;
        this.config = MoreObjects.firstNonNull(builder.config, KnowledgeGraphConfig.defaults());
        this.queryExecutor = new QueryExecutor(builder.executor != null ? builder.executor
                : Data.getExecutor(), this.config.getDefaultMaxResults(),
                this.config.getMaxResults(), this.config.getTimeout());
        this.current = new AtomicReference<Generation>(new Generation(GraphStore.empty()));
        this.rebuildLock = new Object();
        this.closed = new AtomicBoolean(false);
        LOGGER.debug("{} configured with {}", getClass().getSimpleName(), this.config);
    }

    public static Builder builder(final SourceProvider sources) {
        return new Builder(sources);
    }

    /**
     * Returns the currently published generation.
     * 
     * @return the current graph store
     */
    public GraphStore getGraphStore() {
        return snapshot().store;
    }

    @Override
    public long rebuild() {
        checkOpen();
        synchronized (this.rebuildLock) {
            final long generation = this.current.get().store.getGeneration() + 1;
            final Map<String, String> oldMdc = Logging.getMDC();
            try {
                MDC.put(Logging.MDC_CONTEXT, "gen" + generation);
                final GraphStore store = GraphBuilder.build(generation, this.sources);
                this.current.set(new Generation(store));
                LOGGER.info("Published graph generation {}", generation);
            } finally {
                Logging.setMDC(oldMdc);
            }
            return generation;
        }
    }

    @Override
    public long getGeneration() {
        return snapshot().store.getGeneration();
    }

    @Override
    public List<Map<String, String>> query(final String query, final int maxResults,
            final long timeout) throws QueryException {
        Preconditions.checkNotNull(query);
        return this.queryExecutor.execute(snapshot().store, query, maxResults, timeout);
    }

    @Override
    public List<PrefixMatch> prefixSearch(final String text, final int limit) {
        Preconditions.checkNotNull(text);
        return PrefixSearch.search(snapshot().store, text,
                limit > 0 ? limit : this.config.getPrefixLimit());
    }

    @Override
    public List<SearchResult> searchConcepts(final String text, @Nullable final String taxonomy,
            final int limit) {
        Preconditions.checkNotNull(text);
        final Generation generation = snapshot();
        return ConceptSearch.search(ConceptExtractor.filter(generation.store,
                generation.conceptsByContext.get(), taxonomy), text,
                limit > 0 ? limit : this.config.getSearchLimit());
    }

    @Override
    public List<Taxonomy> getTaxonomies() {
        return TaxonomyAggregator.getTaxonomies(snapshot().store);
    }

    @Override
    public List<Concept> getConceptsByTaxonomy(@Nullable final String taxonomy) {
        final Generation generation = snapshot();
        return ConceptExtractor.filter(generation.store, generation.conceptsByContext.get(),
                taxonomy);
    }

    @Override
    public Map<String, List<Concept>> getGroupedConcepts() {
        final ListMultimap<String, Concept> concepts = snapshot().conceptsByContext.get();
        final Map<String, List<Concept>> groups = Maps.newLinkedHashMap();
        for (final String key : concepts.keySet()) {
            final List<Concept> group = Lists.newArrayList(concepts.get(key));
            Collections.sort(group, LABEL_ORDERING);
            final String name = SourceKind.nameOf(key);
            groups.put(groups.containsKey(name) ? key : name, ImmutableList.copyOf(group));
        }
        return ImmutableMap.copyOf(groups);
    }

    @Override
    public List<Concept> getTopLevelConcepts(@Nullable final String taxonomy) {
        final Generation generation = snapshot();
        final ImmutableList.Builder<Concept> builder = ImmutableList.builder();
        for (final Concept concept : ConceptExtractor.filter(generation.store,
                generation.conceptsByContext.get(), taxonomy)) {
            if (concept.getParentConcepts().isEmpty()) {
                builder.add(concept);
            }
        }
        return builder.build();
    }

    @Override
    @Nullable
    public Concept getConceptDetails(final String iri) {
        Preconditions.checkNotNull(iri);
        for (final Concept concept : snapshot().concepts.get()) {
            if (concept.getIri().equals(iri)) {
                return concept;
            }
        }
        return null;
    }

    @Override
    @Nullable
    public Hierarchy getConceptHierarchy(final String iri) {
        Preconditions.checkNotNull(iri);
        return snapshot().hierarchy.get().resolve(iri);
    }

    @Override
    public List<Neighbor> neighbors(final String iri, final int limit) {
        Preconditions.checkNotNull(iri);
        return NeighborExplorer.explore(snapshot().store, iri,
                limit > 0 ? limit : this.config.getNeighborsLimit());
    }

    @Override
    public TaxonomyStats getTaxonomyStats() {
        final Generation generation = snapshot();
        return TaxonomyAggregator.getStats(generation.store, generation.concepts.get());
    }

    @Override
    public void close() {
        if (this.closed.compareAndSet(false, true)) {
            synchronized (this.rebuildLock) {
                this.current.get().store.close();
            }
            LOGGER.debug("{} closed", this);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " (generation "
                + this.current.get().store.getGeneration() + ")";
    }

    private Generation snapshot() {
        checkOpen();
        return this.current.get();
    }

    private void checkOpen() {
        Preconditions.checkState(!this.closed.get(), "Knowledge graph closed");
    }

    private static final class Generation {

        final GraphStore store;

        final Supplier<ListMultimap<String, Concept>> conceptsByContext;

        final Supplier<List<Concept>> concepts;

        final Supplier<HierarchyResolver> hierarchy;

        Generation(final GraphStore store) {
            this.store = store;
            this.conceptsByContext = Suppliers
                    .memoize(new Supplier<ListMultimap<String, Concept>>() {

                        @Override
                        public ListMultimap<String, Concept> get() {
                            return ConceptExtractor.extractByContext(store);
                        }

                    });
            this.concepts = Suppliers.memoize(new Supplier<List<Concept>>() {

                @Override
                public List<Concept> get() {
                    return ImmutableList.copyOf(Generation.this.conceptsByContext.get().values());
                }

            });
            this.hierarchy = Suppliers.memoize(new Supplier<HierarchyResolver>() {

                @Override
                public HierarchyResolver get() {
                    return new HierarchyResolver(Generation.this.concepts.get());
                }

            });
        }

    }

    public static final class Builder {

        private final SourceProvider sources;

        @Nullable
        private KnowledgeGraphConfig config;

        @Nullable
        private ListeningExecutorService executor;

        Builder(final SourceProvider sources) {
            this.sources = Preconditions.checkNotNull(sources);
        }

        public Builder config(@Nullable final KnowledgeGraphConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the executor evaluating SPARQL queries. If not set, the shared executor returned
         * by {@link Data#getExecutor()} is used.
         * 
         * @param executor
         *            the executor, null for the shared one
         * @return this builder, for call chaining
         */
        public Builder executor(@Nullable final ListeningExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public MemoryKnowledgeGraph build() {
            return new MemoryKnowledgeGraph(this);
        }

    }

}
