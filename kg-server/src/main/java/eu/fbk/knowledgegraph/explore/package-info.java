/**
 * Lexical lookup and neighborhood exploration of graph resources.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.knowledgegraph.explore;
