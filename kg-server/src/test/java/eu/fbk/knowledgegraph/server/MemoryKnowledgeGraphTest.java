package eu.fbk.knowledgegraph.server;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;

import eu.fbk.knowledgegraph.GraphFixtures;
import eu.fbk.knowledgegraph.QueryValidationException;
import eu.fbk.knowledgegraph.data.Concept;
import eu.fbk.knowledgegraph.data.ConceptType;
import eu.fbk.knowledgegraph.data.Hierarchy;
import eu.fbk.knowledgegraph.data.PrefixMatch;
import eu.fbk.knowledgegraph.data.SearchResult;
import eu.fbk.knowledgegraph.data.Taxonomy;
import eu.fbk.knowledgegraph.data.TaxonomyStats;
import eu.fbk.knowledgegraph.graphstore.GraphStore;
import eu.fbk.knowledgegraph.source.DefinitionFile;
import eu.fbk.knowledgegraph.source.DefinitionFiles;
import eu.fbk.knowledgegraph.source.EntityLink;
import eu.fbk.knowledgegraph.source.Glossary;
import eu.fbk.knowledgegraph.source.ModelFormat;
import eu.fbk.knowledgegraph.source.SourceProvider;
import eu.fbk.knowledgegraph.source.Sources;
import eu.fbk.knowledgegraph.source.StoredDefinition;

public class MemoryKnowledgeGraphTest {

    private static final String GOV = "http://example.com/gov#";

    private static final String MODEL = "http://example.com/model#";

    private SwitchableSources sources;

    private MemoryKnowledgeGraph graph;

    @Before
    public void setUp() {
        this.sources = new SwitchableSources(Sources.builder()
                .definitionFiles(DefinitionFiles.fromClasspath(MemoryKnowledgeGraphTest.class,
                        ImmutableList.of("governance.ttl", "model.rdf", "broken.ttl")))
                .build());
        this.graph = MemoryKnowledgeGraph.builder(this.sources)
                .config(KnowledgeGraphConfig.defaults()).build();
    }

    @After
    public void tearDown() {
        this.graph.close();
    }

    @Test
    public void testEmptyBeforeRebuild() throws Throwable {
        Assert.assertEquals(0, this.graph.getGeneration());
        Assert.assertTrue(this.graph.getTaxonomies().isEmpty());
        Assert.assertTrue(this.graph.getConceptsByTaxonomy(null).isEmpty());
        Assert.assertEquals("false", this.graph.query("ASK { ?s ?p ?o }", 0, 0).get(0)
                .get("result"));
    }

    @Test
    public void testRebuildSkipsBrokenSource() {
        Assert.assertEquals(1, this.graph.rebuild());
        Assert.assertEquals(1, this.graph.getGeneration());
        final List<String> names = Lists.newArrayList();
        for (final Taxonomy taxonomy : this.graph.getTaxonomies()) {
            names.add(taxonomy.getName());
        }
        Assert.assertEquals(ImmutableList.of("governance.ttl", "model.rdf"), names);
        Assert.assertEquals(8, this.graph.getConceptsByTaxonomy(null).size());
        Assert.assertEquals(6, this.graph.getConceptsByTaxonomy("governance.ttl").size());
        Assert.assertEquals(2, this.graph.getConceptsByTaxonomy("urn:taxonomy:model.rdf")
                .size());
    }

    @Test
    public void testRebuildIsIdempotent() {
        this.graph.rebuild();
        final GraphStore first = this.graph.getGraphStore();
        final List<Concept> concepts = this.graph.getConceptsByTaxonomy(null);
        Assert.assertEquals(2, this.graph.rebuild());
        final GraphStore second = this.graph.getGraphStore();
        Assert.assertNotSame(first, second);
        Assert.assertEquals(first.size(), second.size());
        Assert.assertEquals(first.getContexts().keySet(), second.getContexts().keySet());
        Assert.assertEquals(concepts, this.graph.getConceptsByTaxonomy(null));
    }

    @Test
    public void testRebuildPublishesNewContent() {
        this.graph.rebuild();
        final GraphStore old = this.graph.getGraphStore();
        this.sources.set(GraphFixtures.sources("other.ttl", "ex:Only a skos:Concept .\n")
                .build());
        this.graph.rebuild();
        Assert.assertEquals(1, this.graph.getConceptsByTaxonomy(null).size());
        Assert.assertNull(this.graph.getConceptDetails(GOV + "Data"));
        Assert.assertEquals(2, old.getContexts().size());
    }

    @Test
    public void testSameNamedTaxonomiesKeptApart() {
        this.sources.set(Sources.builder()
                .definitionFile(new DefinitionFile("terms", GraphFixtures.PREFIXES
                        + "ex:Foo a skos:Concept .\n", ModelFormat.SKOS))
                .storedDefinition("terms", GraphFixtures.PREFIXES + "ex:Bar a skos:Concept .\n",
                        "skos", true).build());
        this.graph.rebuild();

        final List<Concept> file = this.graph.getConceptsByTaxonomy("urn:taxonomy:terms");
        Assert.assertEquals(1, file.size());
        Assert.assertEquals("urn:x:Foo", file.get(0).getIri());
        Assert.assertEquals("urn:x:Bar", this.graph.getTopLevelConcepts(
                "urn:semantic-model:terms").get(0).getIri());
        Assert.assertEquals(1, this.graph.searchConcepts("", "urn:semantic-model:terms", 0)
                .size());
        Assert.assertEquals(2, this.graph.getConceptsByTaxonomy("terms").size());

        final Map<String, List<Concept>> groups = this.graph.getGroupedConcepts();
        Assert.assertEquals(ImmutableList.of("terms", "urn:semantic-model:terms"),
                ImmutableList.copyOf(groups.keySet()));
        Assert.assertEquals("urn:x:Bar", groups.get("urn:semantic-model:terms").get(0).getIri());
    }

    @Test
    public void testUpdateRejected() {
        this.graph.rebuild();
        try {
            this.graph.query("PREFIX gov: <" + GOV + ">\nDELETE WHERE { gov:Data ?p ?o }", 0, 0);
            Assert.fail("Update accepted");
        } catch (final QueryValidationException ex) {
            Assert.assertNotNull(this.graph.getConceptDetails(GOV + "Data"));
        } catch (final Throwable ex) {
            Assert.fail("Unexpected exception " + ex);
        }
    }

    @Test
    public void testQuery() throws Throwable {
        this.graph.rebuild();
        final List<Map<String, String>> rows = this.graph.query(
                "PREFIX skos: <http://www.w3.org/2004/02/skos/core#>\n"
                        + "SELECT ?c ?label WHERE { ?c skos:broader <" + GOV
                        + "Data> ; skos:prefLabel ?label } ORDER BY ?label", 0, 0);
        Assert.assertEquals(2, rows.size());
        Assert.assertEquals("Metadata", rows.get(0).get("label"));
        Assert.assertEquals(GOV + "PersonalData", rows.get(1).get("c"));
    }

    @Test
    public void testConceptDetails() {
        this.graph.rebuild();
        final Concept data = this.graph.getConceptDetails(GOV + "Data");
        Assert.assertNotNull(data);
        Assert.assertEquals("Data", data.getLabel());
        Assert.assertEquals(ConceptType.CONCEPT, data.getConceptType());
        Assert.assertEquals("governance.ttl", data.getSourceContext());
        Assert.assertEquals(ImmutableList.of(GOV + "Metadata", GOV + "PersonalData", GOV
                + "Reference"), data.getChildConcepts());
        Assert.assertNull(this.graph.getConceptDetails(GOV + "Unknown"));
    }

    @Test
    public void testHierarchy() {
        this.graph.rebuild();
        final Hierarchy sensitive = this.graph.getConceptHierarchy(GOV + "SensitiveData");
        Assert.assertEquals(2, sensitive.getAncestors().size());
        Assert.assertEquals(GOV + "PersonalData", sensitive.getAncestors().get(0).getIri());
        Assert.assertEquals(GOV + "Data", sensitive.getAncestors().get(1).getIri());
        Assert.assertTrue(sensitive.getSiblings().isEmpty());

        final Hierarchy personal = this.graph.getConceptHierarchy(GOV + "PersonalData");
        Assert.assertEquals(2, personal.getSiblings().size());
        Assert.assertEquals(1, personal.getDescendants().size());

        final Hierarchy person = this.graph.getConceptHierarchy(MODEL + "Person");
        Assert.assertEquals(MODEL + "Agent", person.getAncestors().get(0).getIri());
        Assert.assertNull(this.graph.getConceptHierarchy(MODEL + "alice"));
    }

    @Test
    public void testGroupedAndTopLevelConcepts() {
        this.graph.rebuild();
        final Map<String, List<Concept>> groups = this.graph.getGroupedConcepts();
        Assert.assertEquals(ImmutableList.of("governance.ttl", "model.rdf"),
                ImmutableList.copyOf(groups.keySet()));
        final List<String> labels = Lists.newArrayList();
        for (final Concept concept : groups.get("governance.ttl")) {
            labels.add(concept.getLabel());
        }
        Assert.assertEquals(ImmutableList.of("Data", "Data Governance", "Metadata",
                "Personal Data", "Reference Data", "Sensitive Data"), labels);

        final List<String> topLevel = Lists.newArrayList();
        for (final Concept concept : this.graph.getTopLevelConcepts(null)) {
            topLevel.add(concept.getIri());
        }
        Assert.assertEquals(ImmutableList.of(GOV + "Data", GOV + "Scheme", MODEL + "Agent"),
                topLevel);
        Assert.assertEquals(1, this.graph.getTopLevelConcepts("model.rdf").size());
    }

    @Test
    public void testSearch() {
        this.graph.rebuild();
        final List<SearchResult> results = this.graph.searchConcepts("data", "governance.ttl",
                0);
        Assert.assertEquals(GOV + "Data", results.get(0).getConcept().getIri());
        Assert.assertEquals(1.0, results.get(0).getRelevanceScore(), 0.0);
        Assert.assertTrue(this.graph.searchConcepts("data", "model.rdf", 0).isEmpty());
        Assert.assertEquals(2, this.graph.searchConcepts("data", null, 2).size());
    }

    @Test
    public void testStats() {
        this.graph.rebuild();
        final TaxonomyStats stats = this.graph.getTaxonomyStats();
        int sum = 0;
        for (final Taxonomy taxonomy : this.graph.getTaxonomies()) {
            sum += taxonomy.getConceptsCount();
        }
        Assert.assertEquals(sum, stats.getTotalConcepts());
        Assert.assertEquals(8, stats.getTotalConcepts());
        Assert.assertEquals(2, stats.getTotalProperties());
        Assert.assertEquals(Integer.valueOf(2), stats.getConceptsByType().get(ConceptType.CLASS));
        Assert.assertEquals(Integer.valueOf(5),
                stats.getConceptsByType().get(ConceptType.CONCEPT));
        Assert.assertEquals(Integer.valueOf(1),
                stats.getConceptsByType().get(ConceptType.INDIVIDUAL));
        Assert.assertEquals(3, stats.getTopLevelConcepts());
    }

    @Test
    public void testNeighborsAndPrefixSearch() {
        this.graph.rebuild();
        Assert.assertFalse(this.graph.neighbors(MODEL + "Person", 0).isEmpty());
        Assert.assertEquals(1, this.graph.neighbors(MODEL + "Person", 1).size());
        Assert.assertEquals(ImmutableSet.of(MODEL + "name", MODEL + "email"),
                prefixValues(this.graph.prefixSearch("model#e", 0), this.graph.prefixSearch(
                        "model#n", 0)));
    }

    @Test
    public void testConcurrentReadsSeeWholeGenerations() throws Throwable {
        final Sources small = GraphFixtures.sources("small.ttl", "ex:A a skos:Concept .\n")
                .build();
        final Sources large = GraphFixtures.sources("large.ttl", "ex:A a skos:Concept .\n"
                + "ex:B a skos:Concept .\n" + "ex:C a skos:Concept .\n").build();
        this.sources.set(small);
        this.graph.rebuild();

        final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
        final CountDownLatch done = new CountDownLatch(1);
        final Thread reader = new Thread() {

            @Override
            public void run() {
                try {
                    while (done.getCount() > 0) {
                        final int count = MemoryKnowledgeGraphTest.this.graph
                                .getTaxonomyStats().getTotalConcepts();
                        if (count != 1 && count != 3) {
                            throw new AssertionError("Partial graph observed: " + count);
                        }
                    }
                } catch (final Throwable ex) {
                    failure.set(ex);
                }
            }

        };
        reader.start();
        for (int i = 0; i < 50; ++i) {
            this.sources.set(i % 2 == 0 ? large : small);
            this.graph.rebuild();
        }
        done.countDown();
        reader.join();
        Assert.assertNull(failure.get());
        Assert.assertEquals(51, this.graph.getGeneration());
    }

    @Test
    public void testClose() {
        this.graph.close();
        this.graph.close();
        try {
            this.graph.rebuild();
            Assert.fail("Rebuild after close");
        } catch (final IllegalStateException ex) {
            // expected
        }
    }

    private static ImmutableSet<String> prefixValues(
            final List<PrefixMatch> first,
            final List<PrefixMatch> second) {
        final ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (final PrefixMatch match : Iterables.concat(first,
                second)) {
            builder.add(match.getValue());
        }
        return builder.build();
    }

    private static final class SwitchableSources implements SourceProvider {

        private volatile Sources sources;

        SwitchableSources(final Sources sources) {
            this.sources = sources;
        }

        void set(final Sources sources) {
            this.sources = sources;
        }

        @Override
        public List<DefinitionFile> getDefinitionFiles() throws IOException {
            return this.sources.getDefinitionFiles();
        }

        @Override
        public List<StoredDefinition> getStoredDefinitions() throws IOException {
            return this.sources.getStoredDefinitions();
        }

        @Override
        public List<DefinitionFile> getBuiltinSchemas() throws IOException {
            return this.sources.getBuiltinSchemas();
        }

        @Override
        public List<Glossary> getGlossaries() throws IOException {
            return this.sources.getGlossaries();
        }

        @Override
        public List<EntityLink> getEntityLinks() throws IOException {
            return this.sources.getEntityLinks();
        }

    }

}
