package eu.fbk.knowledgegraph.data;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A typed view of a graph node qualifying as a class, concept or individual.
 * <p>
 * Concepts are derived from the statements of a single graph context each time they are
 * requested; they are never stored. Parent and child concepts are reported as IRI strings.
 * Instances are immutable.
 * </p>
 */
public final class Concept {

    private final String iri;

    @Nullable
    private final String label;

    @Nullable
    private final String comment;

    private final ConceptType conceptType;

    @Nullable
    private final String sourceContext;

    private final List<String> parentConcepts;

    private final List<String> childConcepts;

    public Concept(final String iri, @Nullable final String label,
            @Nullable final String comment, final ConceptType conceptType,
            @Nullable final String sourceContext, final Iterable<String> parentConcepts,
            final Iterable<String> childConcepts) {
        this.iri = Preconditions.checkNotNull(iri);
        this.label = label;
        this.comment = comment;
        this.conceptType = Preconditions.checkNotNull(conceptType);
        this.sourceContext = sourceContext;
        this.parentConcepts = ImmutableList.copyOf(parentConcepts);
        this.childConcepts = ImmutableList.copyOf(childConcepts);
    }

    public String getIri() {
        return this.iri;
    }

    @Nullable
    public String getLabel() {
        return this.label;
    }

    @Nullable
    public String getComment() {
        return this.comment;
    }

    public ConceptType getConceptType() {
        return this.conceptType;
    }

    /**
     * Returns the name of the context the concept was extracted from, i.e., the context key
     * without its URN scheme prefix.
     * 
     * @return the source context name, null if unknown
     */
    @Nullable
    public String getSourceContext() {
        return this.sourceContext;
    }

    public List<String> getParentConcepts() {
        return this.parentConcepts;
    }

    public List<String> getChildConcepts() {
        return this.childConcepts;
    }

    /**
     * Returns the label if available, otherwise the local name of the IRI.
     * 
     * @return a name suitable for display
     */
    public String getDisplayName() {
        if (this.label != null && !this.label.trim().isEmpty()) {
            return this.label.trim();
        }
        return Data.localName(this.iri);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Concept)) {
            return false;
        }
        final Concept other = (Concept) object;
        return this.iri.equals(other.iri) && Objects.equal(this.label, other.label)
                && Objects.equal(this.comment, other.comment)
                && this.conceptType == other.conceptType
                && Objects.equal(this.sourceContext, other.sourceContext)
                && this.parentConcepts.equals(other.parentConcepts)
                && this.childConcepts.equals(other.childConcepts);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.iri, this.label, this.comment, this.conceptType,
                this.sourceContext, this.parentConcepts, this.childConcepts);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("iri", this.iri)
                .add("label", this.label).add("type", this.conceptType)
                .add("context", this.sourceContext).add("parents", this.parentConcepts)
                .add("children", this.childConcepts).toString();
    }

}
