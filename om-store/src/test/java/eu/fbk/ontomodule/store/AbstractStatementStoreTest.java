package eu.fbk.ontomodule.store;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Sets;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

import eu.fbk.ontomodule.data.Annotation;
import eu.fbk.ontomodule.data.Fact;
import eu.fbk.ontomodule.store.StatementTransaction.Position;
import eu.fbk.ontomodule.vocabulary.OWL;
import eu.fbk.ontomodule.vocabulary.RDF;
import eu.fbk.ontomodule.vocabulary.RDFS;
import eu.fbk.ontomodule.vocabulary.XSD;

/**
 * Abstract class for defining statement store tests.
 */
public abstract class AbstractStatementStoreTest {

    private static final Annotation SOURCE = Annotation.create(ImmutableMap.of("oboInOwl:source",
            ImmutableList.of(new Annotation.Entry("PMID:123", XSD.STRING, null))));

    private static final List<Fact> FACTS = ImmutableList.of( //
            Fact.create("ex:a", RDF.TYPE, OWL.CLASS, Fact.IRI), //
            Fact.create("ex:a", RDFS.SUB_CLASS_OF, "ex:b", Fact.IRI), //
            Fact.create("ex:a", RDFS.SUB_CLASS_OF, "ex:d", Fact.IRI), //
            Fact.create("ex:b", RDFS.SUB_CLASS_OF, "ex:c", Fact.IRI), //
            Fact.create("ex:e", RDFS.SUB_CLASS_OF, "{\"owl:someValuesFrom\":[]}", Fact.JSON), //
            Fact.create("ex:p", RDFS.SUB_PROPERTY_OF, "ex:q", Fact.IRI), //
            Fact.create("ex:a", RDFS.LABEL, "alpha", XSD.STRING), //
            Fact.create("ex:z", RDFS.LABEL, "alpha", XSD.STRING), //
            Fact.create("ex:b", RDFS.LABEL, "beta", "@en"), //
            Fact.create(1, 0, Fact.DEFAULT_GRAPH, "ex:a", RDFS.COMMENT, "first letter",
                    XSD.STRING, SOURCE));

    private StatementStore store;

    protected abstract StatementStore createStore() throws IOException;

    protected final StatementStore getStore() {
        return this.store;
    }

    @Before
    public void setUp() throws IOException {
        this.store = createStore();
        this.store.init();
        this.store.reset();
        final StatementTransaction tx = this.store.begin(false);
        tx.add(FACTS);
        tx.addNamespaces(ImmutableList.of(new NamespaceImpl("ex", "http://example.org/")));
        tx.end(true);
    }

    @After
    public void tearDown() {
        this.store.close();
    }

    @Test
    public void testParentsAndChildren() throws IOException {
        final StatementTransaction tx = this.store.begin(true);
        try {
            final SetMultimap<String, String> parents = tx.parents(ImmutableSet.of("ex:a",
                    "ex:b", "ex:e", "ex:p", "ex:missing"));
            Assert.assertEquals(ImmutableSet.of("ex:b", "ex:d"), parents.get("ex:a"));
            Assert.assertEquals(ImmutableSet.of("ex:c"), parents.get("ex:b"));
            Assert.assertEquals(ImmutableSet.of("ex:q"), parents.get("ex:p"));
            Assert.assertFalse(parents.containsKey("ex:e"));
            Assert.assertFalse(parents.containsKey("ex:missing"));

            final SetMultimap<String, String> children = tx.children(ImmutableSet.of("ex:b",
                    "ex:c", "ex:a"));
            Assert.assertEquals(ImmutableSet.of("ex:a"), children.get("ex:b"));
            Assert.assertEquals(ImmutableSet.of("ex:b"), children.get("ex:c"));
            Assert.assertFalse(children.containsKey("ex:a"));
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testParentsInManyChunks() throws IOException {
        final List<Fact> facts = Lists.newArrayList();
        final Set<String> terms = Sets.newLinkedHashSet();
        for (int i = 0; i < 2500; ++i) {
            facts.add(Fact.create("ex:n" + i, RDFS.SUB_CLASS_OF, "ex:root", Fact.IRI));
            terms.add("ex:n" + i);
        }
        final StatementTransaction writeTx = this.store.begin(false);
        writeTx.add(facts);
        writeTx.end(true);

        final StatementTransaction tx = this.store.begin(true);
        try {
            final SetMultimap<String, String> parents = tx.parents(terms);
            Assert.assertEquals(2500, parents.size());
            Assert.assertEquals(2500, tx.children(ImmutableSet.of("ex:root")).size());
            Assert.assertEquals(2500, tx.match(terms, null).size());
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testMatch() throws IOException {
        final StatementTransaction tx = this.store.begin(true);
        try {
            Assert.assertEquals(FACTS.size(), tx.match(null, null).size());
            Assert.assertEquals(5, tx.match(ImmutableSet.of("ex:a"), null).size());
            Assert.assertEquals(ImmutableSet.of(FACTS.get(6), FACTS.get(7), FACTS.get(8)),
                    ImmutableSet.copyOf(tx.match(null, ImmutableSet.of(RDFS.LABEL))));
            Assert.assertEquals(ImmutableList.of(FACTS.get(9)), tx.match(
                    ImmutableSet.of("ex:a", "ex:b"), ImmutableSet.of(RDFS.COMMENT)));
            Assert.assertTrue(tx.match(ImmutableSet.<String>of(), null).isEmpty());
            Assert.assertTrue(tx.match(null, ImmutableSet.<String>of()).isEmpty());
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testAnnotationIsPreserved() throws IOException {
        final StatementTransaction tx = this.store.begin(true);
        try {
            final List<Fact> facts = tx.match(ImmutableSet.of("ex:a"),
                    ImmutableSet.of(RDFS.COMMENT));
            Assert.assertEquals(1, facts.size());
            Assert.assertEquals(SOURCE, facts.get(0).getAnnotation());
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testPredicates() throws IOException {
        final StatementTransaction tx = this.store.begin(true);
        try {
            Assert.assertEquals(ImmutableList.of(RDF.TYPE, RDFS.COMMENT, RDFS.LABEL,
                    RDFS.SUB_CLASS_OF, RDFS.SUB_PROPERTY_OF), ImmutableList.copyOf(tx
                    .predicates()));
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testResolve() throws IOException {
        final StatementTransaction tx = this.store.begin(true);
        try {
            final ListMultimap<String, String> subjects = tx.resolve(
                    ImmutableList.of("ex:a", "beta", "alpha", "unknown", RDFS.LABEL),
                    Position.SUBJECT);
            Assert.assertEquals(ImmutableList.of("ex:a"), subjects.get("ex:a"));
            Assert.assertEquals(ImmutableList.of("ex:b"), subjects.get("beta"));
            Assert.assertEquals(ImmutableList.of("ex:a", "ex:z"), subjects.get("alpha"));
            Assert.assertFalse(subjects.containsKey("unknown"));
            Assert.assertFalse(subjects.containsKey(RDFS.LABEL));

            final ListMultimap<String, String> predicates = tx.resolve(
                    ImmutableList.of(RDFS.LABEL, "ex:p"), Position.PREDICATE);
            Assert.assertEquals(ImmutableList.of(RDFS.LABEL), predicates.get(RDFS.LABEL));
            Assert.assertEquals(ImmutableList.of("ex:p"), predicates.get("ex:p"));
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testNamespaces() throws IOException {
        final StatementTransaction tx = this.store.begin(true);
        try {
            final List<Namespace> namespaces = tx.namespaces();
            Assert.assertEquals(1, namespaces.size());
            Assert.assertEquals("ex", namespaces.get(0).getPrefix());
            Assert.assertEquals("http://example.org/", namespaces.get(0).getName());
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testModuleLifecycle() throws IOException {
        final List<Fact> first = FACTS.subList(0, 3);
        final List<Fact> second = FACTS.subList(6, 10);

        StatementTransaction tx = this.store.begin(false);
        Assert.assertNull(tx.read("extract"));
        tx.write("extract", first);
        Assert.assertEquals(first, tx.read("extract"));
        tx.end(true);

        tx = this.store.begin(false);
        tx.write("extract", second);
        tx.end(true);

        tx = this.store.begin(true);
        Assert.assertEquals(second, tx.read("extract"));
        tx.end(false);

        tx = this.store.begin(false);
        Assert.assertTrue(tx.drop("extract"));
        Assert.assertFalse(tx.drop("extract"));
        tx.end(true);

        tx = this.store.begin(true);
        Assert.assertNull(tx.read("extract"));
        tx.end(false);
    }

    @Test
    public void testRollbackDiscardsChanges() throws IOException {
        StatementTransaction tx = this.store.begin(false);
        tx.write("extract", FACTS);
        tx.add(ImmutableList.of(Fact.create("ex:x", RDFS.SUB_CLASS_OF, "ex:a", Fact.IRI)));
        tx.end(false);

        tx = this.store.begin(true);
        try {
            Assert.assertNull(tx.read("extract"));
            Assert.assertTrue(tx.children(ImmutableSet.of("ex:a")).isEmpty());
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testReadOnlyTransactionRejectsWrites() throws IOException {
        final StatementTransaction tx = this.store.begin(true);
        try {
            tx.write("extract", FACTS);
            Assert.fail();
        } catch (final IllegalStateException ex) {
            // expected
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testEndedTransactionRejectsOperations() throws IOException {
        final StatementTransaction tx = this.store.begin(true);
        tx.end(false);
        tx.end(false);
        try {
            tx.predicates();
            Assert.fail();
        } catch (final IllegalStateException ex) {
            // expected
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidModuleName() throws IOException {
        final StatementTransaction tx = this.store.begin(false);
        try {
            tx.write("extract\"; DROP TABLE statement; --", FACTS);
        } finally {
            tx.end(false);
        }
    }

}
