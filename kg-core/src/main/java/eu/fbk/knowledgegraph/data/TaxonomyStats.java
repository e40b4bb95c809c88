package eu.fbk.knowledgegraph.data;

import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Aggregated figures over all the taxonomies of a graph generation.
 */
public final class TaxonomyStats {

    private final int totalConcepts;

    private final int totalProperties;

    private final List<Taxonomy> taxonomies;

    private final Map<ConceptType, Integer> conceptsByType;

    private final int topLevelConcepts;

    public TaxonomyStats(final int totalConcepts, final int totalProperties,
            final Iterable<Taxonomy> taxonomies, final Map<ConceptType, Integer> conceptsByType,
            final int topLevelConcepts) {
        this.totalConcepts = totalConcepts;
        this.totalProperties = totalProperties;
        this.taxonomies = ImmutableList.copyOf(taxonomies);
        this.conceptsByType = ImmutableMap.copyOf(conceptsByType);
        this.topLevelConcepts = topLevelConcepts;
    }

    public int getTotalConcepts() {
        return this.totalConcepts;
    }

    public int getTotalProperties() {
        return this.totalProperties;
    }

    public List<Taxonomy> getTaxonomies() {
        return this.taxonomies;
    }

    /**
     * Returns the number of concepts of each type; types with no concepts are omitted.
     * 
     * @return an immutable histogram
     */
    public Map<ConceptType, Integer> getConceptsByType() {
        return this.conceptsByType;
    }

    /**
     * Returns the number of concepts having no parent concept.
     * 
     * @return the top-level concept count
     */
    public int getTopLevelConcepts() {
        return this.topLevelConcepts;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof TaxonomyStats)) {
            return false;
        }
        final TaxonomyStats other = (TaxonomyStats) object;
        return this.totalConcepts == other.totalConcepts
                && this.totalProperties == other.totalProperties
                && this.taxonomies.equals(other.taxonomies)
                && this.conceptsByType.equals(other.conceptsByType)
                && this.topLevelConcepts == other.topLevelConcepts;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.totalConcepts, this.totalProperties, this.taxonomies,
                this.conceptsByType, this.topLevelConcepts);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("concepts", this.totalConcepts)
                .add("properties", this.totalProperties).add("byType", this.conceptsByType)
                .add("topLevel", this.topLevelConcepts).toString();
    }

}
