package eu.fbk.knowledgegraph.concept;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Maps;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Sets;

import eu.fbk.knowledgegraph.data.Concept;
import eu.fbk.knowledgegraph.data.Hierarchy;

/**
 * Resolves the position of a concept in the hierarchy formed by the parent links of a concept
 * list.
 * <p>
 * Concepts with the same IRI coming from different contexts are merged: the first one is kept as
 * representative and its parents and children are replaced by the union of those of all the
 * concepts with that IRI. Closures are computed iteratively with a visited set, so they terminate
 * on cyclic hierarchies and never include the concept they start from.
 * </p>
 */
public final class HierarchyResolver {

    private final Map<String, Concept> concepts;

    private final SetMultimap<String, String> parents;

    private final SetMultimap<String, String> children;

    public HierarchyResolver(final Iterable<Concept> concepts) {

        final Map<String, Concept> representatives = Maps.newLinkedHashMap();
        final SetMultimap<String, String> parents = LinkedHashMultimap.create();
        final SetMultimap<String, String> children = LinkedHashMultimap.create();
        for (final Concept concept : concepts) {
            final String iri = concept.getIri();
            if (!representatives.containsKey(iri)) {
                representatives.put(iri, concept);
            }
            parents.putAll(iri, concept.getParentConcepts());
            children.putAll(iri, concept.getChildConcepts());
            for (final String parent : concept.getParentConcepts()) {
                children.put(parent, iri);
            }
        }

        this.concepts = Maps.newLinkedHashMap();
        for (final Concept concept : representatives.values()) {
            final String iri = concept.getIri();
            this.concepts.put(iri, new Concept(iri, concept.getLabel(), concept.getComment(),
                    concept.getConceptType(), concept.getSourceContext(), parents.get(iri),
                    children.get(iri)));
        }
        this.parents = parents;
        this.children = children;
    }

    /**
     * Returns the merged concept with the IRI specified.
     * 
     * @param iri
     *            the concept IRI
     * @return the merged concept, null if no concept has that IRI
     */
    @Nullable
    public Concept getConcept(final String iri) {
        return this.concepts.get(iri);
    }

    /**
     * Returns the hierarchy around the concept specified.
     * 
     * @param iri
     *            the concept IRI
     * @return the hierarchy, null if no concept has that IRI
     */
    @Nullable
    public Hierarchy resolve(final String iri) {
        final Concept concept = this.concepts.get(iri);
        if (concept == null) {
            return null;
        }
        return new Hierarchy(concept, getAncestors(iri), getDescendants(iri), getSiblings(iri));
    }

    public List<Concept> getAncestors(final String iri) {
        return closure(iri, this.parents);
    }

    public List<Concept> getDescendants(final String iri) {
        return closure(iri, this.children);
    }

    /**
     * Returns the concepts sharing at least a direct parent with the concept specified.
     * 
     * @param iri
     *            the concept IRI
     * @return the siblings, excluding the concept itself
     */
    public List<Concept> getSiblings(final String iri) {
        final Set<String> siblings = Sets.newLinkedHashSet();
        for (final String parent : this.parents.get(iri)) {
            siblings.addAll(this.children.get(parent));
        }
        siblings.remove(iri);
        return toConcepts(siblings);
    }

    private List<Concept> closure(final String iri, final SetMultimap<String, String> edges) {
        final Set<String> visited = Sets.newLinkedHashSet();
        final Deque<String> queue = new ArrayDeque<String>();
        visited.add(iri);
        queue.add(iri);
        while (!queue.isEmpty()) {
            for (final String next : edges.get(queue.remove())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        visited.remove(iri);
        return toConcepts(visited);
    }

    private List<Concept> toConcepts(final Iterable<String> iris) {
        final ImmutableList.Builder<Concept> builder = ImmutableList.builder();
        for (final String iri : iris) {
            final Concept concept = this.concepts.get(iri);
            if (concept != null) {
                builder.add(concept);
            }
        }
        return builder.build();
    }

}
