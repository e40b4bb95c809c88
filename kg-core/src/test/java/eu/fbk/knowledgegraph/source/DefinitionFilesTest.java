package eu.fbk.knowledgegraph.source;

import java.io.File;
import java.util.List;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class DefinitionFilesTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testScan() throws Throwable {
        final File root = this.folder.getRoot();
        Files.asCharSink(new File(root, "b.rdf"), Charsets.UTF_8).write("<rdf/>");
        Files.asCharSink(new File(root, "a.ttl"), Charsets.UTF_8).write("@prefix x: <urn:x:> .");
        Files.asCharSink(new File(root, "notes.txt"), Charsets.UTF_8).write("ignored");
        this.folder.newFolder("nested.ttl");

        final List<DefinitionFile> files = DefinitionFiles.scan(root);
        Assert.assertEquals(2, files.size());
        Assert.assertEquals("a.ttl", files.get(0).getName());
        Assert.assertEquals("@prefix x: <urn:x:> .", files.get(0).getText());
        Assert.assertEquals("b.rdf", files.get(1).getName());
    }

    @Test
    public void testScanMissingDirectory() {
        Assert.assertTrue(DefinitionFiles.scan(new File(this.folder.getRoot(), "missing"))
                .isEmpty());
    }

    @Test
    public void testFromClasspath() {
        final List<DefinitionFile> files = DefinitionFiles.fromClasspath(
                DefinitionFilesTest.class, ImmutableList.of("missing.ttl", "/logback-test.xml"));
        Assert.assertEquals(1, files.size());
        Assert.assertEquals("logback-test.xml", files.get(0).getName());
        Assert.assertTrue(files.get(0).getText().contains("<configuration"));
    }

    @Test
    public void testIsDefinitionFile() {
        Assert.assertTrue(DefinitionFiles.isDefinitionFile("model.OWL"));
        Assert.assertTrue(DefinitionFiles.isDefinitionFile("terms.skos"));
        Assert.assertFalse(DefinitionFiles.isDefinitionFile("ttl"));
        Assert.assertFalse(DefinitionFiles.isDefinitionFile(".ttl"));
        Assert.assertFalse(DefinitionFiles.isDefinitionFile("readme.md"));
    }

}
