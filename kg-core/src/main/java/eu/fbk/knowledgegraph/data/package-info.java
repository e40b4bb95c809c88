/**
 * Derived views over the knowledge graph: concepts, hierarchies, taxonomies, search results and
 * neighbors, plus the {@link eu.fbk.knowledgegraph.data.Data} helpers.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.knowledgegraph.data;
