/**
 * Immutable graph generations and their construction from source content.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.knowledgegraph.graphstore;
