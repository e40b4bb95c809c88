package eu.fbk.knowledgegraph.source;

import java.util.Locale;

import javax.annotation.Nullable;

/**
 * The serialization profiles accepted for definition sources.
 */
public enum ModelFormat {

    /** SKOS-style taxonomies, serialized in Turtle. */
    SKOS,

    /** RDFS-style ontologies, serialized in RDF/XML. This is the default profile. */
    RDFS;

    /**
     * Infers the profile from a file name: {@code .ttl} files are {@link #SKOS}, anything else
     * ({@code .rdf}, {@code .xml}, {@code .owl}, {@code .skos}, unknown) is {@link #RDFS}.
     * 
     * @param fileName
     *            the file name, possibly null
     * @return the inferred profile
     */
    public static ModelFormat forFileName(@Nullable final String fileName) {
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".ttl")) {
            return SKOS;
        }
        return RDFS;
    }

    /**
     * Returns the profile denoted by a declared format name, case-insensitive: {@code skos},
     * {@code ttl} and {@code turtle} denote {@link #SKOS}; everything else, including a null or
     * empty name, denotes {@link #RDFS}.
     * 
     * @param name
     *            the declared format name, possibly null
     * @return the denoted profile
     */
    public static ModelFormat forName(@Nullable final String name) {
        if (name != null) {
            final String normalized = name.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("skos") || normalized.equals("ttl")
                    || normalized.equals("turtle")) {
                return SKOS;
            }
        }
        return RDFS;
    }

    /**
     * Returns the lowercase name of the profile.
     * 
     * @return the lowercase name
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

}
