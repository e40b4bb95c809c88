package eu.fbk.knowledgegraph.concept;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.knowledgegraph.GraphFixtures;
import eu.fbk.knowledgegraph.data.Concept;
import eu.fbk.knowledgegraph.data.SearchResult;
import eu.fbk.knowledgegraph.data.SearchResult.MatchType;

public class ConceptSearchTest {

    private static final List<Concept> CONCEPTS = ConceptExtractor.extract(GraphFixtures.store(
            "t.ttl", "" //
                    + "ex:Customer a skos:Concept ; skos:prefLabel \"Customer\" .\n"
                    + "ex:CustomerAccount a skos:Concept ; skos:prefLabel \"Customer account\" .\n"
                    + "ex:VipGuest a skos:Concept ; skos:prefLabel \"Important customer\" .\n"
                    + "ex:customerId a skos:Concept ; skos:prefLabel \"Identifier\" .\n"
                    + "ex:Buyer a skos:Concept ; skos:prefLabel \"Buyer\" ;\n"
                    + "  skos:definition \"Synonym of customer\" .\n"
                    + "ex:Supplier a skos:Concept ; skos:prefLabel \"Supplier\" .\n",
            "u.ttl", "ex:Customer a skos:Concept ; skos:prefLabel \"Customer\" .\n"));

    @Test
    public void testRanking() {
        final List<SearchResult> results = ConceptSearch.search(CONCEPTS, "  CUSTOMER ", 100);
        Assert.assertEquals(5, results.size());
        assertResult(results.get(0), "urn:x:Customer", 1.0, MatchType.LABEL);
        assertResult(results.get(1), "urn:x:CustomerAccount", 0.9, MatchType.LABEL);
        assertResult(results.get(2), "urn:x:VipGuest", 0.8, MatchType.LABEL);
        assertResult(results.get(3), "urn:x:customerId", 0.7, MatchType.IRI);
        assertResult(results.get(4), "urn:x:Buyer", 0.4, MatchType.COMMENT);
    }

    @Test
    public void testIriMatch() {
        final List<SearchResult> results = ConceptSearch.search(CONCEPTS, "urn:x:sup", 10);
        Assert.assertEquals(1, results.size());
        assertResult(results.get(0), "urn:x:Supplier", 0.6, MatchType.IRI);
    }

    @Test
    public void testLimit() {
        final List<SearchResult> results = ConceptSearch.search(CONCEPTS, "customer", 2);
        Assert.assertEquals(2, results.size());
        Assert.assertEquals("urn:x:CustomerAccount", results.get(1).getConcept().getIri());
    }

    @Test
    public void testBlankReturnsAll() {
        final List<SearchResult> results = ConceptSearch.search(CONCEPTS, " ", 100);
        Assert.assertEquals(6, results.size());
        Assert.assertEquals("urn:x:Buyer", results.get(0).getConcept().getIri());
        for (final SearchResult result : results) {
            Assert.assertEquals(0.0, result.getRelevanceScore(), 0.0);
        }
    }

    @Test
    public void testNoMatch() {
        Assert.assertTrue(ConceptSearch.search(CONCEPTS, "warehouse", 10).isEmpty());
    }

    private static void assertResult(final SearchResult result, final String iri,
            final double score, final MatchType type) {
        Assert.assertEquals(iri, result.getConcept().getIri());
        Assert.assertEquals(score, result.getRelevanceScore(), 0.0001);
        Assert.assertEquals(type, result.getMatchType());
    }

}
