package eu.fbk.ontomodule.tool;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.ontomodule.ConfigurationException;
import eu.fbk.ontomodule.ModuleException;
import eu.fbk.ontomodule.extract.Intermediates;
import eu.fbk.ontomodule.extract.ModuleSpec;
import eu.fbk.ontomodule.extract.Related;
import eu.fbk.ontomodule.extract.SeedTerm;
import eu.fbk.ontomodule.internal.CommandLine;

public class ExtractToolTest {

    private String path(final String name) throws URISyntaxException {
        return new File(getClass().getResource(name).toURI()).getAbsolutePath();
    }

    private static ModuleSpec spec(final String... args) throws ModuleException, IOException {
        return ExtractTool.createSpec(ExtractTool.parser().parse(args));
    }

    @Test
    public void testTerms() throws ModuleException, IOException, URISyntaxException {
        final ModuleSpec spec = spec("-d", "obi.db", "-t", "OBI:0100046", "-t", "OBI:0000079",
                "-T", path("terms.txt"), "-C", "rdfs:comment", "skos:note");
        Assert.assertEquals(ImmutableList.of("OBI:0100046", "OBI:0000079", "OBI:0000070",
                "imaging assay"), ImmutableList.copyOf(spec.getSeeds().keySet()));
        for (final SeedTerm seed : spec.getSeeds().values()) {
            Assert.assertEquals(ImmutableSet.of(Related.ANCESTORS), seed.getRelated());
        }
        final Map.Entry<String, String> copy = Iterables.getOnlyElement(spec.getCopies());
        Assert.assertEquals("rdfs:comment", copy.getKey());
        Assert.assertEquals("skos:note", copy.getValue());
        Assert.assertNull(spec.getPredicates());
        Assert.assertFalse(spec.isSuppressHierarchy());
    }

    @Test
    public void testNoHierarchy() throws ModuleException, IOException {
        final ModuleSpec spec = spec("-d", "obi.db", "-t", "OBI:0100046", "-n", "-p",
                "rdfs:label", "-m", "http://purl.obolibrary.org/obo/obi.owl", "-M", "ex:from");
        Assert.assertTrue(spec.getSeeds().get("OBI:0100046").getRelated().isEmpty());
        Assert.assertTrue(spec.isSuppressHierarchy());
        Assert.assertEquals(ImmutableList.of("rdfs:label"), spec.getPredicates());
        Assert.assertEquals("http://purl.obolibrary.org/obo/obi.owl", spec.getImportedFrom());
        Assert.assertEquals("ex:from", spec.getImportedFromPredicate());
    }

    @Test
    public void testImportsFilteredBySource() throws ModuleException, IOException,
            URISyntaxException {
        final ModuleSpec spec = spec("-d", "obi.db", "-i", path("imports.tsv"), "-s", "OBI");
        Assert.assertEquals(ImmutableSet.of("OBI:0000070", "OBI:0000185"), spec.getSeeds()
                .keySet());
        final SeedTerm seed = spec.getSeeds().get("OBI:0000185");
        Assert.assertEquals("OBI:0000011", seed.getOverrideParent());
        Assert.assertEquals(ImmutableSet.of(Related.CHILDREN), seed.getRelated());
    }

    @Test
    public void testImportsWithoutSourceColumn() throws ModuleException, IOException,
            URISyntaxException {
        final ModuleSpec spec = spec("-d", "obi.db", "-i", path("imports.csv"), "-s", "OBI");
        Assert.assertEquals(ImmutableSet.of(Related.ANCESTORS, Related.DESCENDANTS), spec
                .getSeeds().get("OBI:0000070").getRelated());
        Assert.assertTrue(spec.getSeeds().get("CHEBI:75958").getRelated().isEmpty());
    }

    @Test
    public void testConfig() throws ModuleException, IOException, URISyntaxException {
        final ModuleSpec spec = spec("-d", "obi.db", "-t", "assay", "-p", "rdfs:comment", "-c",
                path("config.tsv"), "-s", "OBI");
        Assert.assertEquals(Intermediates.NONE, spec.getIntermediates());
        Assert.assertEquals(ImmutableList.of("rdfs:comment", "rdfs:label", "IAO:0000115"),
                spec.getPredicates());
        Assert.assertEquals("http://purl.obolibrary.org/obo/obi.owl", spec.getImportedFrom());

        final ModuleSpec defaults = spec("-d", "obi.db", "-t", "assay", "-I", "none", "-c",
                path("config.tsv"), "-s", "BFO");
        Assert.assertEquals(Intermediates.ALL, defaults.getIntermediates());
        Assert.assertNull(defaults.getPredicates());
        Assert.assertNull(defaults.getImportedFrom());
    }

    @Test(expected = ConfigurationException.class)
    public void testConfigUnknownSource() throws ModuleException, IOException,
            URISyntaxException {
        spec("-d", "obi.db", "-t", "assay", "-c", path("config.tsv"), "-s", "CHEBI");
    }

    @Test(expected = CommandLine.Exception.class)
    public void testConfigWithoutSource() throws ModuleException, IOException,
            URISyntaxException {
        spec("-d", "obi.db", "-t", "assay", "-c", path("config.tsv"));
    }

    @Test(expected = CommandLine.Exception.class)
    public void testNoTerms() throws ModuleException, IOException {
        spec("-d", "obi.db", "-p", "rdfs:label");
    }

    @Test(expected = ConfigurationException.class)
    public void testInvalidIntermediates() throws ModuleException, IOException {
        spec("-d", "obi.db", "-t", "assay", "-I", "some");
    }

    @Test
    public void testJdbcURL() {
        Assert.assertEquals("jdbc:postgresql://localhost/obi",
                ExtractTool.toJdbcURL("jdbc:postgresql://localhost/obi"));
        Assert.assertTrue(ExtractTool.toJdbcURL("obi.db").startsWith("jdbc:sqlite:"));
        Assert.assertTrue(ExtractTool.toJdbcURL("obi.db").endsWith("obi.db"));
        try {
            ExtractTool.toJdbcURL("obi.ini");
            Assert.fail();
        } catch (final CommandLine.Exception ex) {
            // expected
        }
    }

}
