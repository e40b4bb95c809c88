/**
 * Description of the sources a knowledge graph is rebuilt from, as handed over by the
 * collaborators owning them.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.knowledgegraph.source;
