package eu.fbk.knowledgegraph.data;

import java.util.Locale;

/**
 * The kind of a {@link Concept}.
 */
public enum ConceptType {

    /** A class declared as {@code rdfs:Class} or {@code owl:Class}. */
    CLASS,

    /** A controlled vocabulary entry declared as {@code skos:Concept}. */
    CONCEPT,

    /** Any other eligible resource. */
    INDIVIDUAL;

    /**
     * Returns the lowercase name used when exposing the type to callers.
     * 
     * @return the lowercase name
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

}
