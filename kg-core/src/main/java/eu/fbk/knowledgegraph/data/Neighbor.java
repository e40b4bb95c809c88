package eu.fbk.knowledgegraph.data;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * An edge directly connected to an explored resource, seen from that resource.
 */
public final class Neighbor {

    /** How the explored resource takes part in the edge. */
    public enum Direction {

        /** The resource is the subject; the object is displayed. */
        OUTGOING,

        /** The resource is the object; the subject is displayed. */
        INCOMING,

        /** The resource is the predicate; subject and object are displayed separately. */
        PREDICATE

    }

    /** The kind of the displayed term. */
    public enum DisplayType {

        RESOURCE,

        PROPERTY,

        LITERAL

    }

    private final Direction direction;

    private final String predicate;

    private final String display;

    private final DisplayType displayType;

    @Nullable
    private final String stepIri;

    public Neighbor(final Direction direction, final String predicate, final String display,
            final DisplayType displayType, @Nullable final String stepIri) {
        this.direction = Preconditions.checkNotNull(direction);
        this.predicate = Preconditions.checkNotNull(predicate);
        this.display = Preconditions.checkNotNull(display);
        this.displayType = Preconditions.checkNotNull(displayType);
        this.stepIri = stepIri;
    }

    public Direction getDirection() {
        return this.direction;
    }

    public String getPredicate() {
        return this.predicate;
    }

    public String getDisplay() {
        return this.display;
    }

    public DisplayType getDisplayType() {
        return this.displayType;
    }

    /**
     * Returns the IRI to navigate to for exploring further from the displayed term.
     * 
     * @return the IRI of the displayed term, null if it is not an IRI
     */
    @Nullable
    public String getStepIri() {
        return this.stepIri;
    }

    public boolean isStepResource() {
        return this.stepIri != null;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Neighbor)) {
            return false;
        }
        final Neighbor other = (Neighbor) object;
        return this.direction == other.direction && this.predicate.equals(other.predicate)
                && this.display.equals(other.display) && this.displayType == other.displayType
                && Objects.equal(this.stepIri, other.stepIri);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.direction, this.predicate, this.display, this.displayType,
                this.stepIri);
    }

    @Override
    public String toString() {
        return this.direction + " " + this.predicate + " " + this.display + " ("
                + this.displayType + ")";
    }

}
