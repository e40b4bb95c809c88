package eu.fbk.knowledgegraph.data;

import java.util.Locale;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A resource or property IRI matched by a lexical search.
 */
public final class PrefixMatch {

    /** Whether the matched IRI is used as a predicate in the graph. */
    public enum Type {

        RESOURCE,

        PROPERTY

    }

    private final String value;

    private final Type type;

    public PrefixMatch(final String value, final Type type) {
        this.value = Preconditions.checkNotNull(value);
        this.type = Preconditions.checkNotNull(type);
    }

    public String getValue() {
        return this.value;
    }

    public Type getType() {
        return this.type;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof PrefixMatch)) {
            return false;
        }
        final PrefixMatch other = (PrefixMatch) object;
        return this.value.equals(other.value) && this.type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.value, this.type);
    }

    @Override
    public String toString() {
        return this.value + " (" + this.type.name().toLowerCase(Locale.ROOT) + ")";
    }

}
