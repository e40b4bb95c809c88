package eu.fbk.knowledgegraph.concept;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Sets;

import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;

import eu.fbk.knowledgegraph.data.Concept;
import eu.fbk.knowledgegraph.data.ConceptType;
import eu.fbk.knowledgegraph.graphstore.Context;
import eu.fbk.knowledgegraph.graphstore.GraphStore;
import eu.fbk.knowledgegraph.vocabulary.KG;
import eu.fbk.knowledgegraph.vocabulary.SKOS;

/**
 * Derives {@link Concept} views from the statements of a {@link GraphStore}.
 * <p>
 * Extraction works in two passes. The first pass scans each context on its own, collecting the
 * IRIs eligible as concepts together with their label, comment, type and parents: the same IRI
 * appearing in two contexts yields two concepts. The second pass computes the children of each
 * concept by reversing the parent links of the whole concept list.
 * </p>
 */
public final class ConceptExtractor {

    private static final Set<URI> CLASS_TYPES = ImmutableSet.of(RDFS.CLASS, OWL.CLASS);

    private static final Set<URI> DECLARING_TYPES = ImmutableSet.of(RDFS.CLASS, OWL.CLASS,
            SKOS.CONCEPT, SKOS.CONCEPT_SCHEME);

    private static final Ordering<URI> URI_ORDERING = Ordering.<String>natural().onResultOf(
            new Function<URI, String>() {

                @Override
                public String apply(final URI uri) {
                    return uri.stringValue();
                }

            });

    private ConceptExtractor() {
    }

    /**
     * Extracts the concepts of all the contexts of the store, in context order and, within a
     * context, in IRI order.
     * 
     * @param store
     *            the store
     * @return an immutable list of concepts, with children computed across all contexts
     */
    public static List<Concept> extract(final GraphStore store) {
        return ImmutableList.copyOf(extractByContext(store).values());
    }

    /**
     * Extracts the concepts of all the contexts of the store, indexed by the key of the context
     * they were found in. Keys follow context order; concepts of a context are in IRI order.
     * 
     * @param store
     *            the store
     * @return an immutable multimap from context keys to concepts
     */
    public static ImmutableListMultimap<String, Concept> extractByContext(final GraphStore store) {

        final List<Draft> drafts = Lists.newArrayList();
        for (final Context context : store.getContexts().values()) {
            drafts.addAll(scan(context).values());
        }

        final SetMultimap<String, String> children = LinkedHashMultimap.create();
        for (final Draft draft : drafts) {
            for (final String parent : draft.parents) {
                children.put(parent, draft.iri);
            }
        }

        final ImmutableListMultimap.Builder<String, Concept> builder = ImmutableListMultimap
                .builder();
        for (final Draft draft : drafts) {
            builder.put(draft.contextKey, new Concept(draft.iri, draft.label, draft.comment,
                    draft.type, draft.sourceContext, draft.parents, children.get(draft.iri)));
        }
        return builder.build();
    }

    /**
     * Returns the IRIs eligible as concepts in the context specified.
     * 
     * @param context
     *            the context
     * @return the concept IRIs, in IRI order
     */
    public static Set<URI> findConceptIRIs(final Context context) {
        return scan(context).keySet();
    }

    /**
     * Returns the concepts belonging to the taxonomy specified. A full context key selects that
     * context only; otherwise the argument is matched against context display names, selecting
     * every context with that name.
     * 
     * @param store
     *            the store the concepts were extracted from
     * @param concepts
     *            the concepts to filter, indexed by context key
     * @param taxonomy
     *            the taxonomy key or name, null to keep all the concepts
     * @return the filtered list, in context order
     */
    public static List<Concept> filter(final GraphStore store,
            final ListMultimap<String, Concept> concepts, @Nullable final String taxonomy) {
        if (taxonomy == null) {
            return ImmutableList.copyOf(concepts.values());
        }
        if (store.getContext(taxonomy) != null) {
            return ImmutableList.copyOf(concepts.get(taxonomy));
        }
        final ImmutableList.Builder<Concept> builder = ImmutableList.builder();
        for (final Context context : store.getContexts().values()) {
            if (taxonomy.equals(context.getName())) {
                builder.addAll(concepts.get(context.getKey()));
            }
        }
        return builder.build();
    }

    private static Map<URI, Draft> scan(final Context context) {

        final Map<URI, Draft> drafts = Maps.newTreeMap(URI_ORDERING);
        final Set<URI> candidates = Sets.newHashSet();
        final SetMultimap<URI, Value> types = LinkedHashMultimap.create();
        final SetMultimap<URI, URI> parents = LinkedHashMultimap.create();
        final Map<URI, String> rdfsLabels = Maps.newHashMap();
        final Map<URI, String> prefLabels = Maps.newHashMap();
        final Map<URI, String> rdfsComments = Maps.newHashMap();
        final Map<URI, String> definitions = Maps.newHashMap();

        for (final Statement statement : context.getStatements()) {
            final Resource subj = statement.getSubject();
            final URI pred = statement.getPredicate();
            final Value obj = statement.getObject();
            if (pred.equals(RDF.TYPE)) {
                if (subj instanceof URI) {
                    types.put((URI) subj, obj);
                }
                if (obj instanceof URI && !obj.equals(subj) && !KG.isStructuralType(obj)) {
                    candidates.add((URI) obj);
                    addParent(parents, subj, obj);
                }
            } else if (pred.equals(RDFS.SUBCLASSOF)) {
                if (obj instanceof URI) {
                    candidates.add((URI) obj);
                }
                addParent(parents, subj, obj);
            } else if (pred.equals(SKOS.BROADER)) {
                addParent(parents, subj, obj);
            } else if (pred.equals(SKOS.NARROWER) && obj instanceof Resource) {
                addParent(parents, (Resource) obj, subj);
            } else if (pred.equals(RDFS.LABEL)) {
                putFirst(rdfsLabels, subj, obj);
            } else if (pred.equals(SKOS.PREF_LABEL)) {
                putFirst(prefLabels, subj, obj);
            } else if (pred.equals(RDFS.COMMENT)) {
                putFirst(rdfsComments, subj, obj);
            } else if (pred.equals(SKOS.DEFINITION)) {
                putFirst(definitions, subj, obj);
            }
        }

        for (final Map.Entry<URI, Value> entry : types.entries()) {
            if (DECLARING_TYPES.contains(entry.getValue())) {
                candidates.add(entry.getKey());
            }
        }
        for (final URI uri : Sets.union(rdfsLabels.keySet(), prefLabels.keySet())) {
            if (rdfsComments.containsKey(uri) || definitions.containsKey(uri)) {
                candidates.add(uri);
            }
        }

        for (final URI uri : candidates) {
            if (KG.isReserved(uri)) {
                continue;
            }
            final String label = first(rdfsLabels.get(uri), prefLabels.get(uri));
            final String comment = first(rdfsComments.get(uri), definitions.get(uri));
            drafts.put(uri, new Draft(uri.stringValue(), label, comment,
                    typeOf(types.get(uri)), context.getKey(), context.getName(),
                    parents.get(uri)));
        }
        return drafts;
    }

    private static ConceptType typeOf(final Collection<Value> types) {
        for (final Value type : types) {
            if (CLASS_TYPES.contains(type)) {
                return ConceptType.CLASS;
            }
        }
        return types.contains(SKOS.CONCEPT) ? ConceptType.CONCEPT : ConceptType.INDIVIDUAL;
    }

    private static void addParent(final SetMultimap<URI, URI> parents, final Resource child,
            final Value parent) {
        if (child instanceof URI && parent instanceof URI && !child.equals(parent)
                && !KG.isReserved(parent) && !KG.isStructuralType(parent)) {
            parents.put((URI) child, (URI) parent);
        }
    }

    private static void putFirst(final Map<URI, String> map, final Resource subject,
            final Value object) {
        if (subject instanceof URI && object instanceof Literal && !map.containsKey(subject)) {
            map.put((URI) subject, object.stringValue());
        }
    }

    @Nullable
    private static String first(@Nullable final String first, @Nullable final String second) {
        return first != null ? first : second;
    }

    private static final class Draft {

        final String iri;

        @Nullable
        final String label;

        @Nullable
        final String comment;

        final ConceptType type;

        final List<String> parents;

        final String contextKey;

        final String sourceContext;

        Draft(final String iri, @Nullable final String label, @Nullable final String comment,
                final ConceptType type, final String contextKey, final String sourceContext,
                final Collection<URI> parents) {
            this.iri = iri;
            this.label = label;
            this.comment = comment;
            this.type = type;
            this.contextKey = contextKey;
            this.sourceContext = sourceContext;
            this.parents = Lists.newArrayListWithCapacity(parents.size());
            for (final URI parent : parents) {
                this.parents.add(parent.stringValue());
            }
        }

    }

}
