package eu.fbk.knowledgegraph.explore;

import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

import eu.fbk.knowledgegraph.data.Data;
import eu.fbk.knowledgegraph.data.Neighbor;
import eu.fbk.knowledgegraph.data.Neighbor.Direction;
import eu.fbk.knowledgegraph.data.Neighbor.DisplayType;
import eu.fbk.knowledgegraph.data.ParseException;
import eu.fbk.knowledgegraph.graphstore.GraphStore;

/**
 * Lists the terms directly connected to a resource, for step-by-step graph navigation.
 * <p>
 * Neighbors are returned in three groups: {@link Direction#OUTGOING} (the resource is the
 * subject, the object is shown), {@link Direction#INCOMING} (the resource is the object, the
 * subject is shown) and {@link Direction#PREDICATE} (the resource is the predicate, subject and
 * object are both shown). Entries with the same direction, predicate and displayed term are
 * reported once.
 * </p>
 */
public final class NeighborExplorer {

    private NeighborExplorer() {
    }

    public static List<Neighbor> explore(final GraphStore store, final String iri,
            final int limit) {

        Preconditions.checkArgument(limit > 0, "Invalid limit %s", limit);

        final URI uri;
        try {
            uri = Data.parseURI(iri);
        } catch (final ParseException ex) {
            return ImmutableList.of();
        }

        final Collector collector = new Collector(store, limit);
        for (final Statement statement : store.getStatementsWithSubject(uri)) {
            if (!collector.add(Direction.OUTGOING, statement.getPredicate(),
                    statement.getObject())) {
                return collector.neighbors;
            }
        }
        for (final Statement statement : store.getStatementsWithObject(uri)) {
            if (!collector.add(Direction.INCOMING, statement.getPredicate(),
                    statement.getSubject())) {
                return collector.neighbors;
            }
        }
        for (final Statement statement : store.getStatementsWithPredicate(uri)) {
            if (!collector.add(Direction.PREDICATE, uri, statement.getSubject())
                    || !collector.add(Direction.PREDICATE, uri, statement.getObject())) {
                return collector.neighbors;
            }
        }
        return collector.neighbors;
    }

    private static final class Collector {

        final GraphStore store;

        final int limit;

        final Set<List<Object>> seen;

        final List<Neighbor> neighbors;

        Collector(final GraphStore store, final int limit) {
            this.store = store;
            this.limit = limit;
            this.seen = Sets.newHashSet();
            this.neighbors = Lists.newArrayList();
        }

        boolean add(final Direction direction, final URI predicate, final Value term) {
            if (this.neighbors.size() >= this.limit) {
                return false;
            }
            final String display = term.stringValue();
            if (this.seen.add(ImmutableList.<Object>of(direction, predicate.stringValue(),
                    display))) {
                final DisplayType type;
                if (!(term instanceof URI)) {
                    type = DisplayType.LITERAL;
                } else if (this.store.isPredicate(term)) {
                    type = DisplayType.PROPERTY;
                } else {
                    type = DisplayType.RESOURCE;
                }
                this.neighbors.add(new Neighbor(direction, predicate.stringValue(), display,
                        type, term instanceof URI ? display : null));
            }
            return this.neighbors.size() < this.limit;
        }

    }

}
