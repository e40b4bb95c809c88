package eu.fbk.knowledgegraph.graphstore;

import java.io.IOException;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.vocabulary.RDFS;

import com.google.common.collect.ImmutableList;

import eu.fbk.knowledgegraph.GraphFixtures;
import eu.fbk.knowledgegraph.data.Data;
import eu.fbk.knowledgegraph.source.DefinitionFile;
import eu.fbk.knowledgegraph.source.EntityLink;
import eu.fbk.knowledgegraph.source.Glossary;
import eu.fbk.knowledgegraph.source.ModelFormat;
import eu.fbk.knowledgegraph.source.SkosGlossary;
import eu.fbk.knowledgegraph.source.SourceKind;
import eu.fbk.knowledgegraph.source.SourceProvider;
import eu.fbk.knowledgegraph.source.Sources;
import eu.fbk.knowledgegraph.source.StoredDefinition;

public class GraphBuilderTest {

    private static final String TURTLE = GraphFixtures.PREFIXES
            + "ex:Person rdfs:subClassOf ex:Agent .\n";

    private static final String RDFXML = "<?xml version=\"1.0\"?>\n"
            + "<rdf:RDF xmlns:rdf=\"http://www.w3.org/1999/02/22-rdf-syntax-ns#\"\n"
            + "         xmlns:rdfs=\"http://www.w3.org/2000/01/rdf-schema#\">\n"
            + "  <rdfs:Class rdf:about=\"urn:x:Agent\"/>\n" + "</rdf:RDF>\n";

    @Test
    public void testFormatInferredFromFileName() {
        final GraphStore store = GraphBuilder.build(1, Sources.builder()
                .definitionFile("dir/people.ttl", TURTLE).definitionFile("agents.rdf", RDFXML)
                .definitionFile("turtle-in-xml.xml", TURTLE).build());

        Assert.assertEquals(2, store.getContexts().size());
        final Context people = store.getContext("urn:taxonomy:people.ttl");
        Assert.assertNotNull(people);
        Assert.assertEquals(SourceKind.TAXONOMY_FILE, people.getSourceKind());
        Assert.assertEquals("ttl", people.getFormat());
        Assert.assertEquals(1, people.size());
        final Context agents = store.getContext("urn:taxonomy:agents.rdf");
        Assert.assertNotNull(agents);
        Assert.assertEquals("rdf", agents.getFormat());
        Assert.assertNull(store.getContext("urn:taxonomy:turtle-in-xml.xml"));
    }

    @Test
    public void testDeclaredFormatWins() {
        final GraphStore store = GraphBuilder.build(1, Sources.builder()
                .definitionFile(new DefinitionFile("model.xml", TURTLE, ModelFormat.SKOS))
                .build());
        Assert.assertEquals(1, store.getContext("urn:taxonomy:model.xml").size());
    }

    @Test
    public void testBrokenSourceSkipped() {
        final GraphStore store = GraphBuilder.build(3, Sources.builder()
                .definitionFile("broken.ttl", GraphFixtures.PREFIXES + "ex:a ex:b \"open")
                .definitionFile("good.ttl", TURTLE).build());
        Assert.assertEquals(3, store.getGeneration());
        Assert.assertEquals(1, store.getContexts().size());
        Assert.assertNotNull(store.getContext("urn:taxonomy:good.ttl"));
    }

    @Test
    public void testStoredDefinitions() {
        final GraphStore store = GraphBuilder.build(1, Sources.builder()
                .storedDefinition("enabled", TURTLE, "skos", true)
                .storedDefinition("disabled", TURTLE, "skos", false)
                .storedDefinition("xml", RDFXML, null, true)
                .storedDefinition("empty", null, "rdfs", true).build());

        Assert.assertNotNull(store.getContext("urn:semantic-model:enabled"));
        Assert.assertNull(store.getContext("urn:semantic-model:disabled"));
        Assert.assertEquals("skos", store.getContext("urn:semantic-model:enabled").getFormat());
        Assert.assertEquals("rdfs", store.getContext("urn:semantic-model:xml").getFormat());
        Assert.assertEquals(1, store.getContext("urn:semantic-model:xml").size());
        Assert.assertNull(store.getContext("urn:semantic-model:empty"));
    }

    @Test
    public void testUnnamedSourcesSkipped() {
        final GraphStore store = GraphBuilder.build(1, Sources.builder()
                .definitionFile("good.ttl", TURTLE).definitionFile("dir/", TURTLE)
                .storedDefinition("", RDFXML, "rdfs", true)
                .builtinSchema(new DefinitionFile("schemas/", TURTLE))
                .glossary(new Glossary("", SkosGlossary.builder("Finance", null)
                        .term("revenue", "Revenue", null, null).build().getStatements()))
                .storedDefinition("model", RDFXML, "rdfs", true).build());
        Assert.assertEquals(ImmutableList.of("urn:taxonomy:good.ttl", "urn:semantic-model:model"),
                ImmutableList.copyOf(store.getContexts().keySet()));
    }

    @Test
    public void testGlossariesAndSchemas() {
        final Glossary glossary = SkosGlossary.builder("Finance", "Finance terms")
                .term("revenue", "Revenue", "Income from sales", null).build();
        final GraphStore store = GraphBuilder.build(1, Sources.builder()
                .builtinSchema(new DefinitionFile("core.ttl", TURTLE)).glossary(glossary)
                .build());

        final Context schema = store.getContext("urn:schema:core.ttl");
        Assert.assertEquals(SourceKind.BUILTIN_SCHEMA, schema.getSourceKind());
        final Context finance = store.getContext("urn:glossary:Finance");
        Assert.assertEquals(SourceKind.GLOSSARY, finance.getSourceKind());
        Assert.assertEquals(glossary.getStatements().size(), finance.size());
    }

    @Test
    public void testEntityLinks() {
        final GraphStore store = GraphBuilder.build(1, Sources.builder()
                .entityLink("data_product", "p1", "urn:x:Person")
                .entityLink("data_product", "p2", "not an iri")
                .entityLink(new EntityLink("contract", "c1", "http://example.com/terms#Tax"))
                .entityLink("table", "my table", "urn:x:Person").build());

        final Context links = store.getContext("urn:semantic-links");
        Assert.assertNotNull(links);
        Assert.assertEquals(SourceKind.ENTITY_LINK, links.getSourceKind());
        Assert.assertNull(links.getFormat());
        Assert.assertEquals(3, links.size());
        Assert.assertEquals(1, store.getStatementsWithSubject(Data.getValueFactory().createURI(
                "urn:entity:table:my%20table")).size());

        final URI entity = Data.getValueFactory().createURI("urn:entity:data_product:p1");
        final List<Statement> statements = store.getStatementsWithSubject(entity);
        Assert.assertEquals(1, statements.size());
        Assert.assertEquals(RDFS.SEEALSO, statements.get(0).getPredicate());
        Assert.assertEquals("urn:x:Person", statements.get(0).getObject().stringValue());
    }

    @Test
    public void testNoLinksNoContext() {
        final GraphStore store = GraphBuilder.build(1, Sources.empty());
        Assert.assertTrue(store.getContexts().isEmpty());
        Assert.assertEquals(0, store.size());
    }

    @Test
    public void testSameKeyKeepsLast() {
        final GraphStore store = GraphBuilder.build(1, Sources.builder()
                .definitionFile("a/tax.ttl", TURTLE)
                .definitionFile("b/tax.ttl", GraphFixtures.PREFIXES + "ex:X a skos:Concept .\n"
                        + "ex:Y a skos:Concept .\n").build());
        Assert.assertEquals(1, store.getContexts().size());
        Assert.assertEquals(2, store.getContext("urn:taxonomy:tax.ttl").size());
    }

    @Test
    public void testFailingProviderContributesNothing() {
        final SourceProvider provider = new SourceProvider() {

            @Override
            public List<DefinitionFile> getDefinitionFiles() throws IOException {
                throw new IOException("directory not readable");
            }

            @Override
            public List<StoredDefinition> getStoredDefinitions() throws IOException {
                throw new IOException("database down");
            }

            @Override
            public List<DefinitionFile> getBuiltinSchemas() {
                return Sources.builder().definitionFile("core.ttl", TURTLE).build()
                        .getDefinitionFiles();
            }

            @Override
            public List<Glossary> getGlossaries() {
                return null;
            }

            @Override
            public List<EntityLink> getEntityLinks() throws IOException {
                throw new IOException("links unavailable");
            }

        };
        final GraphStore store = GraphBuilder.build(1, provider);
        Assert.assertEquals(1, store.getContexts().size());
        Assert.assertNotNull(store.getContext("urn:schema:core.ttl"));
    }

}
