package eu.fbk.knowledgegraph.concept;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import eu.fbk.knowledgegraph.data.Concept;
import eu.fbk.knowledgegraph.data.Data;
import eu.fbk.knowledgegraph.data.SearchResult;
import eu.fbk.knowledgegraph.data.SearchResult.MatchType;

/**
 * Ranks concepts by how well their label, IRI or comment match a search text.
 * <p>
 * Matching is case insensitive. Each concept is scored by its best match:
 * </p>
 * <ul>
 * <li>1.0 - label equal to the text;</li>
 * <li>0.9 - label starting with the text;</li>
 * <li>0.8 - label containing the text;</li>
 * <li>0.7 - IRI local name containing the text;</li>
 * <li>0.6 - IRI containing the text;</li>
 * <li>0.4 - comment containing the text.</li>
 * </ul>
 */
public final class ConceptSearch {

    private static final Comparator<SearchResult> RANKING = new Comparator<SearchResult>() {

        @Override
        public int compare(final SearchResult first, final SearchResult second) {
            final int result = Double.compare(second.getRelevanceScore(),
                    first.getRelevanceScore());
            return result != 0 ? result : first.getConcept().getIri()
                    .compareTo(second.getConcept().getIri());
        }

    };

    private ConceptSearch() {
    }

    /**
     * Searches the supplied concepts.
     * 
     * @param concepts
     *            the concepts to search
     * @param text
     *            the search text; if blank, all the concepts are returned with score 0
     * @param limit
     *            the maximum number of results, greater than zero
     * @return the results, by descending score and then by IRI, with distinct IRIs
     */
    public static List<SearchResult> search(final Iterable<Concept> concepts, final String text,
            final int limit) {

        Preconditions.checkArgument(limit > 0, "Invalid limit %s", limit);
        final String query = text.trim().toLowerCase(Locale.ROOT);

        final List<SearchResult> results = Lists.newArrayList();
        for (final Concept concept : concepts) {
            final SearchResult result = query.isEmpty() ? new SearchResult(concept, 0.0,
                    MatchType.LABEL) : match(concept, query);
            if (result != null) {
                results.add(result);
            }
        }
        Collections.sort(results, RANKING);

        final Set<String> seen = Sets.newHashSet();
        final List<SearchResult> selected = Lists.newArrayList();
        for (final SearchResult result : results) {
            if (selected.size() >= limit) {
                break;
            }
            if (seen.add(result.getConcept().getIri())) {
                selected.add(result);
            }
        }
        return selected;
    }

    @Nullable
    private static SearchResult match(final Concept concept, final String query) {
        final String label = lower(concept.getLabel());
        if (label != null) {
            if (label.equals(query)) {
                return new SearchResult(concept, 1.0, MatchType.LABEL);
            } else if (label.startsWith(query)) {
                return new SearchResult(concept, 0.9, MatchType.LABEL);
            } else if (label.contains(query)) {
                return new SearchResult(concept, 0.8, MatchType.LABEL);
            }
        }
        final String iri = concept.getIri();
        if (lower(Data.localName(iri)).contains(query)) {
            return new SearchResult(concept, 0.7, MatchType.IRI);
        } else if (lower(iri).contains(query)) {
            return new SearchResult(concept, 0.6, MatchType.IRI);
        }
        final String comment = lower(concept.getComment());
        if (comment != null && comment.contains(query)) {
            return new SearchResult(concept, 0.4, MatchType.COMMENT);
        }
        return null;
    }

    @Nullable
    private static String lower(@Nullable final String string) {
        return string == null ? null : string.toLowerCase(Locale.ROOT);
    }

}
