package eu.fbk.knowledgegraph.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the Simple Knowledge Organization System (SKOS) core vocabulary.
 * 
 * @see <a href="http://www.w3.org/TR/skos-reference/">vocabulary specification</a>
 */
public final class SKOS {

    /** Recommended prefix for the vocabulary namespace: "skos". */
    public static final String PREFIX = "skos";

    /** Vocabulary namespace: "http://www.w3.org/2004/02/skos/core#". */
    public static final String NAMESPACE = "http://www.w3.org/2004/02/skos/core#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // CLASSES

    /** Class skos:Concept. */
    public static final URI CONCEPT = createURI("Concept");

    /** Class skos:ConceptScheme. */
    public static final URI CONCEPT_SCHEME = createURI("ConceptScheme");

    /** Class skos:Collection. */
    public static final URI COLLECTION = createURI("Collection");

    // PROPERTIES

    /** Property skos:altLabel. */
    public static final URI ALT_LABEL = createURI("altLabel");

    /** Property skos:broader. */
    public static final URI BROADER = createURI("broader");

    /** Property skos:definition. */
    public static final URI DEFINITION = createURI("definition");

    /** Property skos:inScheme. */
    public static final URI IN_SCHEME = createURI("inScheme");

    /** Property skos:narrower. */
    public static final URI NARROWER = createURI("narrower");

    /** Property skos:prefLabel. */
    public static final URI PREF_LABEL = createURI("prefLabel");

    /** Property skos:related. */
    public static final URI RELATED = createURI("related");

    /** Property skos:topConceptOf. */
    public static final URI TOP_CONCEPT_OF = createURI("topConceptOf");

    // HELPER METHODS

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private SKOS() {
    }

}
