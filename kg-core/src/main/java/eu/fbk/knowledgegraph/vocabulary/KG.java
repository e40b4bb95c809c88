package eu.fbk.knowledgegraph.vocabulary;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;

/**
 * Constants used by the knowledge graph engine: URN schemes of graph contexts, the entity URN
 * scheme of governance links and the structural vocabulary terms excluded from concepts.
 */
public final class KG {

    /** Scheme prefix of contexts loaded from taxonomy files: "urn:taxonomy:". */
    public static final String TAXONOMY_PREFIX = "urn:taxonomy:";

    /** Scheme prefix of contexts loaded from uploaded semantic models: "urn:semantic-model:". */
    public static final String SEMANTIC_MODEL_PREFIX = "urn:semantic-model:";

    /** Scheme prefix of contexts loaded from built-in schemas: "urn:schema:". */
    public static final String SCHEMA_PREFIX = "urn:schema:";

    /** Scheme prefix of contexts derived from business glossaries: "urn:glossary:". */
    public static final String GLOSSARY_PREFIX = "urn:glossary:";

    /** Reserved key of the context holding governance entity links: "urn:semantic-links". */
    public static final String SEMANTIC_LINKS = "urn:semantic-links";

    /** Scheme prefix of governance entities: "urn:entity:". */
    public static final String ENTITY_PREFIX = "urn:entity:";

    /** Core namespaces whose terms are never reported as concepts. */
    public static final Set<String> RESERVED_NAMESPACES = ImmutableSet.of(RDF.NAMESPACE,
            RDFS.NAMESPACE, SKOS.NAMESPACE);

    /** Type terms that declare structure rather than a domain type. */
    public static final Set<URI> STRUCTURAL_TYPES = ImmutableSet.of(RDFS.CLASS, OWL.CLASS,
            SKOS.CONCEPT, SKOS.CONCEPT_SCHEME, RDF.PROPERTY, OWL.OBJECTPROPERTY,
            OWL.DATATYPEPROPERTY, OWL.ANNOTATIONPROPERTY, OWL.ONTOLOGY, RDFS.DATATYPE);

    /**
     * Returns true if the value is an IRI belonging to one of the reserved core namespaces.
     *
     * @param value
     *            the value to test
     * @return true if reserved
     */
    public static boolean isReserved(final Value value) {
        if (!(value instanceof URI)) {
            return false;
        }
        final String string = value.stringValue();
        for (final String namespace : RESERVED_NAMESPACES) {
            if (string.startsWith(namespace)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if the value is a type term describing structure (classes, concepts,
     * properties, ontologies) rather than a domain type.
     *
     * @param value
     *            the value to test
     * @return true if structural
     */
    public static boolean isStructuralType(final Value value) {
        return STRUCTURAL_TYPES.contains(value);
    }

    private KG() {
    }

}
