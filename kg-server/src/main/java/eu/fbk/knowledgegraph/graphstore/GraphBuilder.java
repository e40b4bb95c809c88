package eu.fbk.knowledgegraph.graphstore;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDFS;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.knowledgegraph.SourceParseException;
import eu.fbk.knowledgegraph.data.Data;
import eu.fbk.knowledgegraph.data.ParseException;
import eu.fbk.knowledgegraph.source.DefinitionFile;
import eu.fbk.knowledgegraph.source.EntityLink;
import eu.fbk.knowledgegraph.source.Glossary;
import eu.fbk.knowledgegraph.source.ModelFormat;
import eu.fbk.knowledgegraph.source.SourceKind;
import eu.fbk.knowledgegraph.source.SourceProvider;
import eu.fbk.knowledgegraph.source.StoredDefinition;

/**
 * Builds a new {@link GraphStore} generation from the current content of all the graph sources.
 * <p>
 * Sources are loaded in a fixed order: taxonomy files, enabled stored definitions, built-in
 * schemas, glossaries and finally entity links. Every source item is loaded in isolation: an item
 * that cannot be parsed is logged and skipped, without affecting the others. Two items mapping to
 * the same context key are not merged: the later one replaces the earlier one.
 * </p>
 */
public final class GraphBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(GraphBuilder.class);

    private final SourceProvider provider;

    private final Map<String, Context> contexts;

    private int skipped;

    private GraphBuilder(final SourceProvider provider) {
        this.provider = provider;
        this.contexts = Maps.newLinkedHashMap();
    }

    /**
     * Builds a generation with the number specified out of the sources of the supplied provider.
     * Never fails because of source content.
     * 
     * @param generation
     *            the generation number
     * @param provider
     *            the provider of source content
     * @return the new, fully built generation
     */
    public static GraphStore build(final long generation, final SourceProvider provider) {
        final long ts = System.currentTimeMillis();
        final GraphBuilder builder = new GraphBuilder(provider);
        builder.loadDefinitionFiles();
        builder.loadStoredDefinitions();
        builder.loadBuiltinSchemas();
        builder.loadGlossaries();
        builder.loadEntityLinks();
        final GraphStore store = new GraphStore(generation, builder.contexts.values());
        LOGGER.info("Built graph generation {}: {} contexts, {} statements, {} sources skipped "
                + "({} ms)", generation, store.getContexts().size(), store.size(),
                builder.skipped, System.currentTimeMillis() - ts);
        return store;
    }

    private void loadDefinitionFiles() {
        for (final DefinitionFile file : list("definition files", new Lister<DefinitionFile>() {

            @Override
            public List<DefinitionFile> list() throws IOException {
                return GraphBuilder.this.provider.getDefinitionFiles();
            }

        })) {
            loadDefinition(SourceKind.TAXONOMY_FILE, file);
        }
    }

    private void loadStoredDefinitions() {
        for (final StoredDefinition definition : list("stored definitions",
                new Lister<StoredDefinition>() {

                    @Override
                    public List<StoredDefinition> list() throws IOException {
                        return GraphBuilder.this.provider.getStoredDefinitions();
                    }

                })) {
            if (!definition.isEnabled()) {
                LOGGER.debug("Ignoring disabled definition {}", definition.getName());
                continue;
            }
            final String key = keyFor(SourceKind.UPLOADED_MODEL, definition.getName());
            if (key != null) {
                final ModelFormat format = definition.getFormat();
                load(key, SourceKind.UPLOADED_MODEL, format.getName(), definition.getContent(),
                        format);
            }
        }
    }

    private void loadBuiltinSchemas() {
        for (final DefinitionFile file : list("built-in schemas", new Lister<DefinitionFile>() {

            @Override
            public List<DefinitionFile> list() throws IOException {
                return GraphBuilder.this.provider.getBuiltinSchemas();
            }

        })) {
            loadDefinition(SourceKind.BUILTIN_SCHEMA, file);
        }
    }

    private void loadGlossaries() {
        for (final Glossary glossary : list("glossaries", new Lister<Glossary>() {

            @Override
            public List<Glossary> list() throws IOException {
                return GraphBuilder.this.provider.getGlossaries();
            }

        })) {
            final String key = keyFor(SourceKind.GLOSSARY, glossary.getName());
            if (key != null) {
                put(new Context(key, SourceKind.GLOSSARY, ModelFormat.SKOS.getName(),
                        glossary.getStatements()));
            }
        }
    }

    private void loadEntityLinks() {
        final ValueFactory factory = Data.getValueFactory();
        final List<Statement> statements = Lists.newArrayList();
        for (final EntityLink link : list("entity links", new Lister<EntityLink>() {

            @Override
            public List<EntityLink> list() throws IOException {
                return GraphBuilder.this.provider.getEntityLinks();
            }

        })) {
            try {
                final URI entity = Data.parseURI(link.getEntityIri());
                final URI target = Data.parseURI(link.getTargetIri());
                statements.add(factory.createStatement(entity, RDFS.SEEALSO, target));
            } catch (final ParseException ex) {
                LOGGER.warn("Skipping entity link {}: invalid IRI '{}'", link,
                        ex.getParsedString());
                ++this.skipped;
            }
        }
        if (!statements.isEmpty()) {
            put(new Context(SourceKind.ENTITY_LINK.keyFor(null), SourceKind.ENTITY_LINK, null,
                    statements));
        }
    }

    private void loadDefinition(final SourceKind kind, final DefinitionFile file) {
        final String key = keyFor(kind, file.getName());
        if (key == null) {
            return;
        }
        final ModelFormat format = file.getFormat();
        final String extension = file.getExtension();
        load(key, kind, extension != null ? extension : format.getName(), file.getText(), format);
    }

    private void load(final String key, final SourceKind kind, @Nullable final String label,
            final String text, final ModelFormat format) {
        try {
            final List<Statement> statements = RDFSourceParser.parse(key, text, format);
            put(new Context(key, kind, label, statements));
        } catch (final SourceParseException ex) {
            LOGGER.warn("Skipping source {}: {}", key, ex.getMessage());
            ++this.skipped;
        }
    }

    @Nullable
    private String keyFor(final SourceKind kind, final String name) {
        try {
            return kind.keyFor(name);
        } catch (final IllegalArgumentException ex) {
            LOGGER.warn("Skipping {} source '{}': {}", kind, name, ex.getMessage());
            ++this.skipped;
            return null;
        }
    }

    private void put(final Context context) {
        final Context previous = this.contexts.put(context.getKey(), context);
        if (previous != null) {
            LOGGER.info("Context {} loaded twice, keeping last content", context.getKey());
        }
        LOGGER.debug("Loaded context {} with {} statements", context.getKey(), context.size());
    }

    private <T> List<T> list(final String what, final Lister<T> lister) {
        try {
            final List<T> items = lister.list();
            return items != null ? items : Collections.<T>emptyList();
        } catch (final IOException ex) {
            LOGGER.warn("Cannot retrieve " + what + ", ignoring them", ex);
            ++this.skipped;
            return ImmutableList.of();
        }
    }

    private interface Lister<T> {

        List<T> list() throws IOException;

    }

}
