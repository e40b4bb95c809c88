package eu.fbk.knowledgegraph.source;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A {@code SourceProvider} returning fixed lists of sources.
 * <p>
 * Instances are created with {@link #builder()} and are immutable. They suit embedded uses where
 * sources are collected upfront, as well as tests.
 * </p>
 */
public final class Sources implements SourceProvider {

    private static final Sources EMPTY = builder().build();

    private final List<DefinitionFile> definitionFiles;

    private final List<StoredDefinition> storedDefinitions;

    private final List<DefinitionFile> builtinSchemas;

    private final List<Glossary> glossaries;

    private final List<EntityLink> entityLinks;

    private Sources(final Builder builder) {
        this.definitionFiles = builder.definitionFiles.build();
        this.storedDefinitions = builder.storedDefinitions.build();
        this.builtinSchemas = builder.builtinSchemas.build();
        this.glossaries = builder.glossaries.build();
        this.entityLinks = builder.entityLinks.build();
    }

    public static Sources empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<DefinitionFile> getDefinitionFiles() {
        return this.definitionFiles;
    }

    @Override
    public List<StoredDefinition> getStoredDefinitions() {
        return this.storedDefinitions;
    }

    @Override
    public List<DefinitionFile> getBuiltinSchemas() {
        return this.builtinSchemas;
    }

    @Override
    public List<Glossary> getGlossaries() {
        return this.glossaries;
    }

    @Override
    public List<EntityLink> getEntityLinks() {
        return this.entityLinks;
    }

    @Override
    public String toString() {
        return "Sources: " + this.definitionFiles.size() + " files, "
                + this.storedDefinitions.size() + " stored definitions, "
                + this.builtinSchemas.size() + " schemas, " + this.glossaries.size()
                + " glossaries, " + this.entityLinks.size() + " links";
    }

    public static final class Builder {

        private final ImmutableList.Builder<DefinitionFile> definitionFiles = ImmutableList
                .builder();

        private final ImmutableList.Builder<StoredDefinition> storedDefinitions = ImmutableList
                .builder();

        private final ImmutableList.Builder<DefinitionFile> builtinSchemas = ImmutableList
                .builder();

        private final ImmutableList.Builder<Glossary> glossaries = ImmutableList.builder();

        private final ImmutableList.Builder<EntityLink> entityLinks = ImmutableList.builder();

        Builder() {
        }

        public Builder definitionFile(final DefinitionFile file) {
            this.definitionFiles.add(file);
            return this;
        }

        public Builder definitionFile(final String path, final String text) {
            return definitionFile(new DefinitionFile(path, text));
        }

        public Builder definitionFiles(final Iterable<DefinitionFile> files) {
            this.definitionFiles.addAll(files);
            return this;
        }

        public Builder storedDefinition(final StoredDefinition definition) {
            this.storedDefinitions.add(definition);
            return this;
        }

        public Builder storedDefinition(final String name, final String content,
                final String format, final boolean enabled) {
            return storedDefinition(new StoredDefinition(name, content, format, enabled));
        }

        public Builder builtinSchema(final DefinitionFile schema) {
            this.builtinSchemas.add(schema);
            return this;
        }

        public Builder builtinSchemas(final Iterable<DefinitionFile> schemas) {
            this.builtinSchemas.addAll(schemas);
            return this;
        }

        public Builder glossary(final Glossary glossary) {
            this.glossaries.add(glossary);
            return this;
        }

        public Builder entityLink(final EntityLink link) {
            this.entityLinks.add(link);
            return this;
        }

        public Builder entityLink(final String entityType, final String entityId,
                final String targetIri) {
            return entityLink(new EntityLink(entityType, entityId, targetIri));
        }

        public Sources build() {
            return new Sources(this);
        }

    }

}
