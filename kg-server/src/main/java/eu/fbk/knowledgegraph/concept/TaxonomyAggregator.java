package eu.fbk.knowledgegraph.concept;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.vocabulary.RDF;

import eu.fbk.knowledgegraph.data.Concept;
import eu.fbk.knowledgegraph.data.ConceptType;
import eu.fbk.knowledgegraph.data.Taxonomy;
import eu.fbk.knowledgegraph.data.TaxonomyStats;
import eu.fbk.knowledgegraph.graphstore.Context;
import eu.fbk.knowledgegraph.graphstore.GraphStore;

/**
 * Summarizes the contexts of a {@link GraphStore} as taxonomies and computes aggregate
 * statistics over them.
 */
public final class TaxonomyAggregator {

    private TaxonomyAggregator() {
    }

    /**
     * Returns one taxonomy summary per context, in context order.
     * 
     * @param store
     *            the store
     * @return an immutable list of summaries
     */
    public static List<Taxonomy> getTaxonomies(final GraphStore store) {
        final ImmutableList.Builder<Taxonomy> builder = ImmutableList.builder();
        for (final Context context : store.getContexts().values()) {
            builder.add(summarize(context));
        }
        return builder.build();
    }

    /**
     * Returns the statistics of the store.
     * 
     * @param store
     *            the store
     * @param concepts
     *            the concepts extracted from all the contexts of the store
     * @return the statistics
     */
    public static TaxonomyStats getStats(final GraphStore store, final List<Concept> concepts) {

        final List<Taxonomy> taxonomies = getTaxonomies(store);
        int totalConcepts = 0;
        int totalProperties = 0;
        for (final Taxonomy taxonomy : taxonomies) {
            totalConcepts += taxonomy.getConceptsCount();
            totalProperties += taxonomy.getPropertiesCount();
        }

        final Map<ConceptType, Integer> histogram = Maps.newEnumMap(ConceptType.class);
        int topLevel = 0;
        for (final Concept concept : concepts) {
            final Integer count = histogram.get(concept.getConceptType());
            histogram.put(concept.getConceptType(), count == null ? 1 : count + 1);
            if (concept.getParentConcepts().isEmpty()) {
                ++topLevel;
            }
        }

        return new TaxonomyStats(totalConcepts, totalProperties, taxonomies, histogram,
                topLevel);
    }

    private static Taxonomy summarize(final Context context) {
        final String name = context.getName();
        final String description;
        switch (context.getSourceKind()) {
        case TAXONOMY_FILE:
            description = "Taxonomy file " + name;
            break;
        case UPLOADED_MODEL:
            description = "Semantic model " + name;
            break;
        case BUILTIN_SCHEMA:
            description = "Built-in schema " + name;
            break;
        case GLOSSARY:
            description = "Business glossary " + name;
            break;
        default:
            description = "Links between catalog entities and graph resources";
        }
        return new Taxonomy(name, description, context.getSourceKind().getSourceType(),
                context.getFormat(), ConceptExtractor.findConceptIRIs(context).size(),
                countProperties(context));
    }

    private static int countProperties(final Context context) {
        final Set<Resource> properties = Sets.newHashSet();
        for (final Statement statement : context.getStatements()) {
            if (statement.getPredicate().equals(RDF.TYPE)
                    && statement.getObject().equals(RDF.PROPERTY)
                    && statement.getSubject() instanceof URI) {
                properties.add(statement.getSubject());
            }
        }
        return properties.size();
    }

}
