package eu.fbk.knowledgegraph.source;

import org.junit.Assert;
import org.junit.Test;

public class SourceKindTest {

    @Test
    public void testKeys() {
        Assert.assertEquals("urn:taxonomy:terms.ttl", SourceKind.TAXONOMY_FILE.keyFor("terms.ttl"));
        Assert.assertEquals("urn:semantic-model:m", SourceKind.UPLOADED_MODEL.keyFor("m"));
        Assert.assertEquals("urn:schema:dcat.rdf", SourceKind.BUILTIN_SCHEMA.keyFor("dcat.rdf"));
        Assert.assertEquals("urn:glossary:g", SourceKind.GLOSSARY.keyFor("g"));
        Assert.assertEquals("urn:semantic-links", SourceKind.ENTITY_LINK.keyFor(null));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingName() {
        SourceKind.TAXONOMY_FILE.keyFor("");
    }

    @Test
    public void testForKeyAndName() {
        for (final SourceKind kind : SourceKind.values()) {
            final String key = kind.keyFor("item");
            Assert.assertEquals(kind, SourceKind.forKey(key));
        }
        Assert.assertEquals("terms.ttl", SourceKind.nameOf("urn:taxonomy:terms.ttl"));
        Assert.assertEquals("semantic-links", SourceKind.nameOf("urn:semantic-links"));
        Assert.assertNull(SourceKind.forKey("urn:semantic-links:x"));
        Assert.assertNull(SourceKind.forKey("http://example.com/"));
        Assert.assertEquals("http://example.com/", SourceKind.nameOf("http://example.com/"));
    }

}
