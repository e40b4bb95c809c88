package eu.fbk.knowledgegraph.data;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Summary of one graph context, seen as a taxonomy or ontology source.
 */
public final class Taxonomy {

    private final String name;

    @Nullable
    private final String description;

    private final String sourceType;

    @Nullable
    private final String format;

    private final int conceptsCount;

    private final int propertiesCount;

    public Taxonomy(final String name, @Nullable final String description,
            final String sourceType, @Nullable final String format, final int conceptsCount,
            final int propertiesCount) {
        Preconditions.checkArgument(conceptsCount >= 0 && propertiesCount >= 0);
        this.name = Preconditions.checkNotNull(name);
        this.description = description;
        this.sourceType = Preconditions.checkNotNull(sourceType);
        this.format = format;
        this.conceptsCount = conceptsCount;
        this.propertiesCount = propertiesCount;
    }

    public String getName() {
        return this.name;
    }

    @Nullable
    public String getDescription() {
        return this.description;
    }

    /**
     * Returns where the taxonomy comes from: {@code file}, {@code database}, {@code schema},
     * {@code glossary} or {@code external}.
     * 
     * @return the source type
     */
    public String getSourceType() {
        return this.sourceType;
    }

    @Nullable
    public String getFormat() {
        return this.format;
    }

    public int getConceptsCount() {
        return this.conceptsCount;
    }

    public int getPropertiesCount() {
        return this.propertiesCount;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Taxonomy)) {
            return false;
        }
        final Taxonomy other = (Taxonomy) object;
        return this.name.equals(other.name) && Objects.equal(this.description, other.description)
                && this.sourceType.equals(other.sourceType)
                && Objects.equal(this.format, other.format)
                && this.conceptsCount == other.conceptsCount
                && this.propertiesCount == other.propertiesCount;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.name, this.description, this.sourceType, this.format,
                this.conceptsCount, this.propertiesCount);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("name", this.name)
                .add("sourceType", this.sourceType).add("format", this.format)
                .add("concepts", this.conceptsCount).add("properties", this.propertiesCount)
                .toString();
    }

}
