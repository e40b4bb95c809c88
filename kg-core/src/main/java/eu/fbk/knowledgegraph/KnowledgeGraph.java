package eu.fbk.knowledgegraph;

import java.io.Closeable;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import eu.fbk.knowledgegraph.data.Concept;
import eu.fbk.knowledgegraph.data.Hierarchy;
import eu.fbk.knowledgegraph.data.Neighbor;
import eu.fbk.knowledgegraph.data.PrefixMatch;
import eu.fbk.knowledgegraph.data.SearchResult;
import eu.fbk.knowledgegraph.data.Taxonomy;
import eu.fbk.knowledgegraph.data.TaxonomyStats;

/**
 * A knowledge graph unifying taxonomies, semantic models, built-in schemas, glossaries and
 * governance links.
 * <p>
 * This interface is the entry point of the engine. The graph is rebuilt from its sources by
 * {@link #rebuild()}, which is called by the owner of the sources whenever one of them changes;
 * all the other methods read the latest published graph generation, are safe to call
 * concurrently with each other and with a rebuild, and never see a partially built graph. Each
 * read method works on a single generation from start to end.
 * </p>
 * <p>
 * Views such as {@link Concept}s and {@link Taxonomy}s are derived on each call; two calls on
 * the same generation return equal results. Lookups of unknown IRIs return {@code null} rather
 * than failing.
 * </p>
 */
public interface KnowledgeGraph extends Closeable {

    /**
     * Rebuilds the graph from the current content of its sources, replacing the published
     * generation atomically. Sources that cannot be parsed are logged and skipped.
     * 
     * @return the number of the generation published
     * @throws IllegalStateException
     *             if the graph has been closed
     */
    long rebuild() throws IllegalStateException;

    /**
     * Returns the number of the published generation; zero before the first rebuild.
     * 
     * @return the generation number
     */
    long getGeneration();

    /**
     * Evaluates a read-only SPARQL query (SELECT, ASK, CONSTRUCT or DESCRIBE).
     * 
     * @param query
     *            the query string
     * @param maxResults
     *            the maximum number of rows to return; non-positive for the configured default
     * @param timeout
     *            the timeout in milliseconds; non-positive for the configured default
     * @return the result rows, each mapping a variable name to the string form of its value, or
     *         to null if unbound
     * @throws QueryValidationException
     *             if the query is malformed or is not a read-only query
     * @throws QueryTimeoutException
     *             if the evaluation exceeds the timeout
     * @throws QueryExecutionException
     *             if the evaluation fails
     */
    List<Map<String, String>> query(String query, int maxResults, long timeout)
            throws QueryException;

    /**
     * Returns the resource and property IRIs containing the supplied text, case-insensitive.
     * 
     * @param text
     *            the text to look for
     * @param limit
     *            the maximum number of matches
     * @return the matches, in graph order
     */
    List<PrefixMatch> prefixSearch(String text, int limit);

    /**
     * Searches concepts by label, IRI and comment, ranking results by relevance.
     * 
     * @param text
     *            the text to look for; blank to list all concepts
     * @param taxonomy
     *            the taxonomy to search in, null for all
     * @param limit
     *            the maximum number of results
     * @return the results, best first
     */
    List<SearchResult> searchConcepts(String text, @Nullable String taxonomy, int limit);

    /**
     * Returns a summary of each graph context.
     * 
     * @return the taxonomies, in load order
     */
    List<Taxonomy> getTaxonomies();

    /**
     * Returns the concepts of a taxonomy, or of all taxonomies.
     * 
     * @param taxonomy
     *            the taxonomy name or context key, null for all
     * @return the concepts
     */
    List<Concept> getConceptsByTaxonomy(@Nullable String taxonomy);

    /**
     * Returns the concepts of all taxonomies grouped by source context name, each group sorted
     * by display name. Groups follow context order; a context whose name is already taken by an
     * earlier context is keyed by its full context key.
     * 
     * @return the concepts by source context
     */
    Map<String, List<Concept>> getGroupedConcepts();

    /**
     * Returns the concepts without parents of a taxonomy, or of all taxonomies.
     * 
     * @param taxonomy
     *            the taxonomy name or context key, null for all
     * @return the top-level concepts
     */
    List<Concept> getTopLevelConcepts(@Nullable String taxonomy);

    /**
     * Returns the concept with the IRI specified.
     * 
     * @param iri
     *            the concept IRI
     * @return the concept, null if there is no concept with that IRI
     */
    @Nullable
    Concept getConceptDetails(String iri);

    /**
     * Returns the ancestors, descendants and siblings of a concept.
     * 
     * @param iri
     *            the concept IRI
     * @return the hierarchy, null if there is no concept with that IRI
     */
    @Nullable
    Hierarchy getConceptHierarchy(String iri);

    /**
     * Returns the edges directly connected to a resource.
     * 
     * @param iri
     *            the resource IRI
     * @param limit
     *            the maximum number of neighbors, across all directions
     * @return the neighbors
     */
    List<Neighbor> neighbors(String iri, int limit);

    /**
     * Returns statistics over all the taxonomies.
     * 
     * @return the statistics
     */
    TaxonomyStats getTaxonomyStats();

    /**
     * Releases the resources of the graph. Further calls to {@link #rebuild()} fail.
     */
    @Override
    void close();

}
