/**
 * Validation and time-bounded evaluation of read-only SPARQL queries.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.knowledgegraph.query;
