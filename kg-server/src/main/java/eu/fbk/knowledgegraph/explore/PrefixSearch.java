package eu.fbk.knowledgegraph.explore;

import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;

import eu.fbk.knowledgegraph.data.PrefixMatch;
import eu.fbk.knowledgegraph.graphstore.GraphStore;

/**
 * Looks up subject and predicate IRIs containing a text, for autocompletion.
 */
public final class PrefixSearch {

    private PrefixSearch() {
    }

    /**
     * Returns the distinct subject and predicate IRIs containing the supplied text, ignoring
     * case, in the order they are first met in the graph. Scanning stops as soon as the limit is
     * reached.
     * 
     * @param store
     *            the store to scan
     * @param text
     *            the text to look for
     * @param limit
     *            the maximum number of matches, greater than zero
     * @return the matches
     */
    public static List<PrefixMatch> search(final GraphStore store, final String text,
            final int limit) {

        Preconditions.checkArgument(limit > 0, "Invalid limit %s", limit);
        final String query = text.toLowerCase(Locale.ROOT);

        final Set<String> seen = Sets.newHashSet();
        final List<PrefixMatch> matches = Lists.newArrayList();
        for (final Statement statement : store.getStatements()) {
            final Resource subject = statement.getSubject();
            if (subject instanceof URI) {
                add(store, (URI) subject, query, seen, matches);
                if (matches.size() >= limit) {
                    break;
                }
            }
            add(store, statement.getPredicate(), query, seen, matches);
            if (matches.size() >= limit) {
                break;
            }
        }
        return matches;
    }

    private static void add(final GraphStore store, final URI uri, final String query,
            final Set<String> seen, final List<PrefixMatch> matches) {
        final String string = uri.stringValue();
        if (!seen.contains(string) && string.toLowerCase(Locale.ROOT).contains(query)) {
            seen.add(string);
            matches.add(new PrefixMatch(string, store.isPredicate(uri) ? PrefixMatch.Type.PROPERTY
                    : PrefixMatch.Type.RESOURCE));
        }
    }

}
