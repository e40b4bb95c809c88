package eu.fbk.knowledgegraph.source;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

import eu.fbk.knowledgegraph.vocabulary.KG;

/**
 * A governance link associating a catalog entity (data product, contract, domain, ...) with a
 * graph resource.
 */
public final class EntityLink {

    private final String entityType;

    private final String entityId;

    private final String targetIri;

    public EntityLink(final String entityType, final String entityId, final String targetIri) {
        this.entityType = Preconditions.checkNotNull(entityType);
        this.entityId = Preconditions.checkNotNull(entityId);
        this.targetIri = Preconditions.checkNotNull(targetIri);
    }

    public String getEntityType() {
        return this.entityType;
    }

    public String getEntityId() {
        return this.entityId;
    }

    public String getTargetIri() {
        return this.targetIri;
    }

    /**
     * Returns the IRI standing for the linked entity: {@code urn:entity:<type>:<id>}, with type
     * and id percent-encoded as path segments.
     * 
     * @return the entity IRI string
     */
    public String getEntityIri() {
        final Escaper escaper = UrlEscapers.urlPathSegmentEscaper();
        return KG.ENTITY_PREFIX + escaper.escape(this.entityType) + ":"
                + escaper.escape(this.entityId);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof EntityLink)) {
            return false;
        }
        final EntityLink other = (EntityLink) object;
        return this.entityType.equals(other.entityType) && this.entityId.equals(other.entityId)
                && this.targetIri.equals(other.targetIri);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.entityType, this.entityId, this.targetIri);
    }

    @Override
    public String toString() {
        return getEntityIri() + " -> " + this.targetIri;
    }

}
