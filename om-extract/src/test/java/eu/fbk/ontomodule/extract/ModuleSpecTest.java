package eu.fbk.ontomodule.extract;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.ontomodule.ConfigurationException;
import eu.fbk.ontomodule.vocabulary.IAO;

public class ModuleSpecTest {

    @Test
    public void testDefaults() throws ConfigurationException {
        final ModuleSpec spec = ModuleSpec.builder().withSeed("OBI:0000070").build();
        Assert.assertEquals(Intermediates.ALL, spec.getIntermediates());
        Assert.assertNull(spec.getPredicates());
        Assert.assertFalse(spec.isSuppressHierarchy());
        Assert.assertTrue(spec.getCopies().isEmpty());
        Assert.assertNull(spec.getImportedFrom());
        Assert.assertEquals(IAO.IMPORTED_FROM, spec.getImportedFromPredicate());
        Assert.assertTrue(spec.getSeeds().get("OBI:0000070").getRelated().isEmpty());
    }

    @Test
    public void testSeeds() throws ConfigurationException {
        final ModuleSpec spec = ModuleSpec.builder()
                .withSeed("OBI:0000070", " ", "Ancestors  descendants")
                .withSeed("OBI:0000185", "OBI:0000011", null)
                .withSeed("OBI:0000070", null, "children").build();
        Assert.assertEquals(ImmutableList.of("OBI:0000185", "OBI:0000070"),
                ImmutableList.copyOf(spec.getSeeds().keySet()));
        final SeedTerm last = spec.getSeeds().get("OBI:0000070");
        Assert.assertEquals(ImmutableSet.of(Related.CHILDREN), last.getRelated());
        Assert.assertNull(last.getOverrideParent());
        Assert.assertEquals("OBI:0000011", spec.getSeeds().get("OBI:0000185")
                .getOverrideParent());
    }

    @Test
    public void testBothDirectionsOnOneSeed() throws ConfigurationException {
        final ModuleSpec spec = ModuleSpec.builder()
                .withSeed("OBI:0000185", Related.ANCESTORS, Related.DESCENDANTS).build();
        Assert.assertEquals(ImmutableSet.of(Related.ANCESTORS, Related.DESCENDANTS), spec
                .getSeeds().get("OBI:0000185").getRelated());
    }

    @Test
    public void testOptions() throws ConfigurationException {
        final ModuleSpec spec = ModuleSpec.builder().withSeed("assay")
                .withPredicates(ImmutableList.of(" rdfs:label", "definition", "rdfs:label", ""))
                .withIntermediates("None").withSuppressHierarchy(true)
                .withCopy("rdfs:comment", "skos:note")
                .withImportedFrom(" <http://purl.obolibrary.org/obo/obi.owl> ").build();
        Assert.assertEquals(ImmutableList.of("rdfs:label", "definition"), spec.getPredicates());
        Assert.assertEquals(Intermediates.NONE, spec.getIntermediates());
        Assert.assertTrue(spec.isSuppressHierarchy());
        Assert.assertEquals("skos:note", Iterables.getOnlyElement(spec.getCopies()).getValue());
        Assert.assertEquals("http://purl.obolibrary.org/obo/obi.owl", spec.getImportedFrom());
    }

    @Test(expected = ConfigurationException.class)
    public void testNoSeeds() throws ConfigurationException {
        ModuleSpec.builder().withIntermediates(Intermediates.NONE).build();
    }

    @Test
    public void testUnknownDirective() {
        try {
            ModuleSpec.builder().withSeed("OBI:0000070", null, "ancestors siblings").build();
            Assert.fail();
        } catch (final ConfigurationException ex) {
            Assert.assertTrue(ex.getMessage().contains("siblings"));
        }
    }

    @Test(expected = ConfigurationException.class)
    public void testUnknownIntermediates() throws ConfigurationException {
        ModuleSpec.builder().withSeed("OBI:0000070").withIntermediates("some").build();
    }

    @Test
    public void testParseRelated() throws ConfigurationException {
        Assert.assertEquals(Related.PARENTS, Related.parse(" PARENTS "));
        Assert.assertTrue(Related.parseAll(null).isEmpty());
        Assert.assertTrue(Related.parseAll("   ").isEmpty());
        Assert.assertEquals("descendants", Related.DESCENDANTS.toString());
    }

}
