/**
 * Concept extraction, hierarchy navigation, search and taxonomy statistics.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.knowledgegraph.concept;
