/**
 * In-memory {@code KnowledgeGraph} implementation, its decorators and configuration.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.knowledgegraph.server;
