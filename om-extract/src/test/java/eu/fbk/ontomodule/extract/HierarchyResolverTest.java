package eu.fbk.ontomodule.extract;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import eu.fbk.ontomodule.store.MemoryStatementStore;
import eu.fbk.ontomodule.store.StatementStore;
import eu.fbk.ontomodule.store.StatementTransaction;

public class HierarchyResolverTest {

    private StatementStore store;

    private StatementTransaction transaction;

    private HierarchyResolver resolver;

    @Before
    public void setUp() throws IOException, URISyntaxException {
        this.store = new MemoryStatementStore(new File(getClass().getResource("obi.tsv").toURI()),
                new File(getClass().getResource("prefixes.tsv").toURI()));
        this.store.init();
        this.transaction = this.store.begin(true);
        this.resolver = new HierarchyResolver(this.transaction);
    }

    @After
    public void tearDown() throws IOException {
        this.transaction.end(false);
        this.store.close();
    }

    @Test
    public void testAncestorsFetchedOneLevelAtATime() throws IOException {
        final Hierarchy ancestors = this.resolver.ancestorsOf(ImmutableList.of("OBI:0100046"));
        Assert.assertEquals(ImmutableSet.of("CHEBI:75958", "OBI:0000079"),
                ancestors.get("OBI:0100046"));
        Assert.assertEquals(ImmutableSet.of(HierarchyResolver.ROOT),
                ancestors.get("BFO:0000001"));
        Assert.assertEquals(8, ancestors.getTerms().size());
        Assert.assertEquals(6, this.resolver.getQueryCount());

        // Cached edges are not fetched again
        this.resolver.ancestorsOf(ImmutableList.of("CHEBI:75958"));
        Assert.assertEquals(6, this.resolver.getQueryCount());
    }

    @Test
    public void testClosureAfterSingleLevelLookup() throws IOException {
        Assert.assertEquals(ImmutableSet.of("BFO:0000004"),
                this.resolver.parentsOf(ImmutableList.of("BFO:0000040")).get("BFO:0000040"));
        final Hierarchy ancestors = this.resolver.ancestorsOf(ImmutableList.of("BFO:0000040"));
        Assert.assertTrue(ancestors.contains("BFO:0000001"));
        Assert.assertEquals(ImmutableSet.of("BFO:0000001"), ancestors.get("BFO:0000002"));
    }

    @Test
    public void testDescendants() throws IOException {
        final Hierarchy descendants = this.resolver.descendantsOf(ImmutableList
                .of("OBI:0000070"));
        Assert.assertEquals(ImmutableSet.of("OBI:0000185", "OBI:0002119"),
                descendants.get("OBI:0000070"));
        Assert.assertEquals(ImmutableSet.of("OBI:0002120"), descendants.get("OBI:0000185"));
        Assert.assertEquals(ImmutableSet.of("OBI:0000185", "OBI:0002119"), this.resolver
                .childrenOf(ImmutableList.of("OBI:0000070")).get("OBI:0000070"));
    }

    @Test
    public void testStructuredParentsIgnored() throws IOException {
        Assert.assertEquals(ImmutableSet.of("OBI:0000011"),
                this.resolver.parentsOf(ImmutableList.of("OBI:0000070")).get("OBI:0000070"));
    }

    @Test
    public void testCycle() throws IOException {
        final Hierarchy ancestors = this.resolver.ancestorsOf(ImmutableList.of("ex:A"));
        Assert.assertEquals(ImmutableSet.of("ex:B"), ancestors.get("ex:A"));
        Assert.assertEquals(ImmutableSet.of("ex:A"), ancestors.get("ex:B"));
    }

}
