package eu.fbk.knowledgegraph.source;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import eu.fbk.knowledgegraph.vocabulary.KG;

/**
 * The kinds of source a graph context can be loaded from, each identified by the URN scheme of
 * the keys of its contexts.
 */
public enum SourceKind {

    /** A taxonomy file supplied by the file-based collaborator. */
    TAXONOMY_FILE(KG.TAXONOMY_PREFIX, "file"),

    /** A semantic model uploaded to the definitions store. */
    UPLOADED_MODEL(KG.SEMANTIC_MODEL_PREFIX, "database"),

    /** A schema bundled with the application, always loaded. */
    BUILTIN_SCHEMA(KG.SCHEMA_PREFIX, "schema"),

    /** Statements derived from a business glossary. */
    GLOSSARY(KG.GLOSSARY_PREFIX, "glossary"),

    /** Governance links between catalog entities and graph resources (single context). */
    ENTITY_LINK(KG.SEMANTIC_LINKS, "external");

    private final String prefix;

    private final String sourceType;

    private SourceKind(final String prefix, final String sourceType) {
        this.prefix = prefix;
        this.sourceType = sourceType;
    }

    /**
     * Returns the scheme prefix of context keys of this kind. For {@link #ENTITY_LINK} this is
     * the whole reserved key.
     * 
     * @return the key prefix
     */
    public String getPrefix() {
        return this.prefix;
    }

    /**
     * Returns the source type reported in taxonomy summaries.
     * 
     * @return the source type
     */
    public String getSourceType() {
        return this.sourceType;
    }

    /**
     * Returns the context key for a source item of this kind with the name specified.
     * 
     * @param name
     *            the item name, ignored for {@link #ENTITY_LINK}
     * @return the context key
     */
    public String keyFor(@Nullable final String name) {
        if (this == ENTITY_LINK) {
            return this.prefix;
        }
        Preconditions.checkArgument(name != null && !name.isEmpty(), "Missing source name");
        return this.prefix + name;
    }

    /**
     * Returns the name embedded in the supplied context key, i.e., the key without its scheme
     * prefix. The reserved entity link key yields its last segment.
     * 
     * @param key
     *            the context key
     * @return the display name
     */
    public static String nameOf(final String key) {
        final SourceKind kind = forKey(key);
        if (kind == null) {
            return key;
        } else if (kind == ENTITY_LINK) {
            return key.substring("urn:".length());
        }
        return key.substring(kind.prefix.length());
    }

    /**
     * Returns the kind whose scheme prefix the supplied key starts with.
     * 
     * @param key
     *            the context key
     * @return the matching kind, null if the key has an unknown scheme
     */
    @Nullable
    public static SourceKind forKey(final String key) {
        for (final SourceKind kind : values()) {
            if (kind == ENTITY_LINK ? key.equals(kind.prefix) : key.startsWith(kind.prefix)) {
                return kind;
            }
        }
        return null;
    }

}
