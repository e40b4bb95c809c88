package eu.fbk.knowledgegraph.data;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The hierarchical neighborhood of a {@link Concept}: its transitive ancestors and descendants
 * and the concepts sharing one of its direct parents.
 */
public final class Hierarchy {

    private final Concept concept;

    private final List<Concept> ancestors;

    private final List<Concept> descendants;

    private final List<Concept> siblings;

    public Hierarchy(final Concept concept, final Iterable<Concept> ancestors,
            final Iterable<Concept> descendants, final Iterable<Concept> siblings) {
        this.concept = Preconditions.checkNotNull(concept);
        this.ancestors = ImmutableList.copyOf(ancestors);
        this.descendants = ImmutableList.copyOf(descendants);
        this.siblings = ImmutableList.copyOf(siblings);
    }

    public Concept getConcept() {
        return this.concept;
    }

    public List<Concept> getAncestors() {
        return this.ancestors;
    }

    public List<Concept> getDescendants() {
        return this.descendants;
    }

    public List<Concept> getSiblings() {
        return this.siblings;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Hierarchy)) {
            return false;
        }
        final Hierarchy other = (Hierarchy) object;
        return this.concept.equals(other.concept) && this.ancestors.equals(other.ancestors)
                && this.descendants.equals(other.descendants)
                && this.siblings.equals(other.siblings);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.concept, this.ancestors, this.descendants, this.siblings);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("concept", this.concept.getIri())
                .add("ancestors", this.ancestors.size())
                .add("descendants", this.descendants.size())
                .add("siblings", this.siblings.size()).toString();
    }

}
