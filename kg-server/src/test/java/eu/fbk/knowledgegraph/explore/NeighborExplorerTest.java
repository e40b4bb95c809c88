package eu.fbk.knowledgegraph.explore;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.knowledgegraph.GraphFixtures;
import eu.fbk.knowledgegraph.data.Neighbor;
import eu.fbk.knowledgegraph.data.Neighbor.Direction;
import eu.fbk.knowledgegraph.data.Neighbor.DisplayType;
import eu.fbk.knowledgegraph.graphstore.GraphStore;

public class NeighborExplorerTest {

    private static final String SUBCLASS = "http://www.w3.org/2000/01/rdf-schema#subClassOf";

    private static final GraphStore STORE = GraphFixtures.store("a.ttl", "" //
            + "ex:Person rdfs:subClassOf ex:Agent ; rdfs:label \"Person\" .\n"
            + "ex:alice a ex:Person ; ex:knows ex:bob ; ex:knows _:friend .\n"
            + "ex:bob ex:knows ex:alice .\n", //
            "b.ttl", "ex:Person rdfs:subClassOf ex:Agent .\n");

    @Test
    public void testOutgoing() {
        final List<Neighbor> neighbors = NeighborExplorer.explore(STORE, "urn:x:Person", 100);
        int subclass = 0;
        for (final Neighbor neighbor : neighbors) {
            if (neighbor.getDirection() == Direction.OUTGOING
                    && neighbor.getPredicate().equals(SUBCLASS)) {
                Assert.assertEquals("urn:x:Agent", neighbor.getDisplay());
                Assert.assertEquals(DisplayType.RESOURCE, neighbor.getDisplayType());
                Assert.assertEquals("urn:x:Agent", neighbor.getStepIri());
                Assert.assertTrue(neighbor.isStepResource());
                ++subclass;
            }
        }
        Assert.assertEquals(1, subclass);
        Assert.assertTrue(neighbors.contains(new Neighbor(Direction.OUTGOING,
                "http://www.w3.org/2000/01/rdf-schema#label", "Person", DisplayType.LITERAL,
                null)));
        Assert.assertTrue(neighbors.contains(new Neighbor(Direction.INCOMING,
                "http://www.w3.org/1999/02/22-rdf-syntax-ns#type", "urn:x:alice",
                DisplayType.RESOURCE, "urn:x:alice")));
    }

    @Test
    public void testSymmetry() {
        final Neighbor outgoing = new Neighbor(Direction.OUTGOING, "urn:x:knows", "urn:x:bob",
                DisplayType.RESOURCE, "urn:x:bob");
        final Neighbor incoming = new Neighbor(Direction.INCOMING, "urn:x:knows", "urn:x:alice",
                DisplayType.RESOURCE, "urn:x:alice");
        Assert.assertTrue(NeighborExplorer.explore(STORE, "urn:x:alice", 100).contains(outgoing));
        Assert.assertTrue(NeighborExplorer.explore(STORE, "urn:x:bob", 100).contains(incoming));
    }

    @Test
    public void testPredicate() {
        final List<Neighbor> neighbors = NeighborExplorer.explore(STORE, "urn:x:knows", 100);
        Assert.assertEquals(3, neighbors.size());
        for (final Neighbor neighbor : neighbors) {
            Assert.assertEquals(Direction.PREDICATE, neighbor.getDirection());
            Assert.assertEquals("urn:x:knows", neighbor.getPredicate());
        }
        int blank = 0;
        for (final Neighbor neighbor : neighbors) {
            if (!neighbor.isStepResource()) {
                Assert.assertEquals(DisplayType.LITERAL, neighbor.getDisplayType());
                ++blank;
            }
        }
        Assert.assertEquals(1, blank);
    }

    @Test
    public void testPropertyDisplayType() {
        final GraphStore store = GraphFixtures.store("p.ttl", "" //
                + "ex:knows rdfs:subPropertyOf ex:related .\n" + "ex:a ex:related ex:b .\n");
        final List<Neighbor> neighbors = NeighborExplorer.explore(store, "urn:x:knows", 10);
        Assert.assertEquals(1, neighbors.size());
        Assert.assertEquals(DisplayType.PROPERTY, neighbors.get(0).getDisplayType());
    }

    @Test
    public void testLimit() {
        Assert.assertEquals(2, NeighborExplorer.explore(STORE, "urn:x:alice", 2).size());
        Assert.assertEquals(2, NeighborExplorer.explore(STORE, "urn:x:knows", 2).size());
    }

    @Test
    public void testUnknown() {
        Assert.assertTrue(NeighborExplorer.explore(STORE, "urn:x:nobody", 10).isEmpty());
        Assert.assertTrue(NeighborExplorer.explore(STORE, "not an iri", 10).isEmpty());
    }

}
