package eu.fbk.knowledgegraph.data;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A concept matching a text search, with the score and the kind of its best match.
 */
public final class SearchResult {

    /** Where a search text matched a concept. */
    public enum MatchType {

        LABEL,

        COMMENT,

        IRI

    }

    private final Concept concept;

    private final double relevanceScore;

    private final MatchType matchType;

    public SearchResult(final Concept concept, final double relevanceScore,
            final MatchType matchType) {
        this.concept = Preconditions.checkNotNull(concept);
        this.relevanceScore = relevanceScore;
        this.matchType = Preconditions.checkNotNull(matchType);
    }

    public Concept getConcept() {
        return this.concept;
    }

    public double getRelevanceScore() {
        return this.relevanceScore;
    }

    public MatchType getMatchType() {
        return this.matchType;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof SearchResult)) {
            return false;
        }
        final SearchResult other = (SearchResult) object;
        return this.concept.equals(other.concept)
                && Double.compare(this.relevanceScore, other.relevanceScore) == 0
                && this.matchType == other.matchType;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.concept, this.relevanceScore, this.matchType);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("iri", this.concept.getIri())
                .add("score", this.relevanceScore).add("match", this.matchType).toString();
    }

}
