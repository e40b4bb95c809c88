package eu.fbk.knowledgegraph.graphstore;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.repository.RepositoryConnection;

import com.google.common.collect.ImmutableList;

import eu.fbk.knowledgegraph.data.Data;
import eu.fbk.knowledgegraph.source.SourceKind;

public class GraphStoreTest {

    private static final ValueFactory VF = Data.getValueFactory();

    private static final URI PERSON = VF.createURI("urn:x:Person");

    private static final URI AGENT = VF.createURI("urn:x:Agent");

    private static final Statement SUBCLASS = VF.createStatement(PERSON, RDFS.SUBCLASSOF, AGENT);

    private static final Statement TYPE = VF.createStatement(AGENT, RDF.TYPE, RDFS.CLASS);

    @Test
    public void testEmpty() {
        final GraphStore store = GraphStore.empty();
        Assert.assertEquals(0, store.getGeneration());
        Assert.assertTrue(store.getContexts().isEmpty());
        Assert.assertTrue(store.getStatements().isEmpty());
    }

    @Test
    public void testUnionKeepsDuplicates() {
        final Context first = new Context("urn:taxonomy:a.ttl", SourceKind.TAXONOMY_FILE, "ttl",
                ImmutableList.of(SUBCLASS, TYPE));
        final Context second = new Context("urn:taxonomy:b.ttl", SourceKind.TAXONOMY_FILE,
                "ttl", ImmutableList.of(SUBCLASS));
        final GraphStore store = new GraphStore(2, ImmutableList.of(first, second));

        Assert.assertEquals(3, store.size());
        Assert.assertEquals(2, store.getStatementsWithSubject(PERSON).size());
        Assert.assertEquals(2, store.getStatementsWithObject(AGENT).size());
        Assert.assertEquals(2, store.getStatementsWithPredicate(RDFS.SUBCLASSOF).size());
        Assert.assertTrue(store.isPredicate(RDFS.SUBCLASSOF));
        Assert.assertFalse(store.isPredicate(PERSON));
        Assert.assertEquals(ImmutableList.of("urn:taxonomy:a.ttl", "urn:taxonomy:b.ttl"),
                ImmutableList.copyOf(store.getContexts().keySet()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateKeysRejected() {
        final Context context = new Context("urn:taxonomy:a.ttl", SourceKind.TAXONOMY_FILE,
                "ttl", ImmutableList.of(SUBCLASS));
        new GraphStore(1, ImmutableList.of(context, context));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testKeyMustMatchKind() {
        new Context("urn:glossary:x", SourceKind.TAXONOMY_FILE, null,
                ImmutableList.<Statement>of());
    }

    @Test
    public void testRepositoryHoldsNamedGraphs() throws Throwable {
        final Context context = new Context("urn:semantic-model:My Model",
                SourceKind.UPLOADED_MODEL, "skos", ImmutableList.of(SUBCLASS, TYPE));
        final GraphStore store = new GraphStore(1, ImmutableList.of(context));
        Assert.assertEquals("urn:semantic-model:My%20Model", context.getURI().stringValue());
        Assert.assertEquals("My Model", context.getName());

        final RepositoryConnection connection = store.getRepository().getConnection();
        try {
            Assert.assertEquals(2, connection.size(context.getURI()));
            Assert.assertTrue(connection.hasStatement(PERSON, RDFS.SUBCLASSOF, AGENT, false));
        } finally {
            connection.close();
        }
        Assert.assertSame(store.getRepository(), store.getRepository());
        store.close();
    }

    @Test(expected = IllegalStateException.class)
    public void testClosedRepository() throws Throwable {
        final GraphStore store = GraphStore.empty();
        store.close();
        store.getRepository();
    }

}
