/**
 * Knowledge graph core API ({@code kg-core}).
 * <p>
 * The package defines the {@link eu.fbk.knowledgegraph.KnowledgeGraph} entry point and the
 * exceptions its operations report. Sub-packages provide the derived views returned to callers (
 * {@code data}), the description of the sources the graph is rebuilt from ({@code source}), the
 * RDF vocabularies the engine relies on ({@code vocabulary}) and shared helpers
 * ({@code internal}).
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.knowledgegraph;
