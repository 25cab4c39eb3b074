package eu.fbk.ontomodule.data;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Namespace;

public class FactTableTest {

    private static final String TABLE = "" //
            + "1\t0\tgraph\tOBI:0000070\trdf:type\towl:Class\t_IRI\t\n" //
            + "\n" //
            + "\t\t\tOBI:0000070\trdfs:label\tassay\txsd:string\n" //
            + "1\t0\tOBI\tOBI:0000070\tIAO:0000115\tA planned process.\txsd:string\t"
            + "{\"IAO:0000119\":[{\"object\":\"OBI branch\",\"datatype\":\"xsd:string\"}]}\n";

    @Test
    public void testRead() throws IOException {
        final List<Fact> facts = FactTable.read(new StringReader(TABLE));
        Assert.assertEquals(3, facts.size());

        Assert.assertEquals(Fact.create("OBI:0000070", "rdf:type", "owl:Class", Fact.IRI),
                facts.get(0));
        Assert.assertTrue(facts.get(0).isIRI());

        final Fact label = facts.get(1);
        Assert.assertEquals(1, label.getAssertion());
        Assert.assertEquals(0, label.getRetraction());
        Assert.assertEquals(Fact.DEFAULT_GRAPH, label.getGraph());
        Assert.assertTrue(label.isLiteral());
        Assert.assertNull(label.getAnnotation());

        final Fact definition = facts.get(2);
        Assert.assertEquals("OBI", definition.getGraph());
        Assert.assertEquals("OBI branch", definition.getAnnotation().get("IAO:0000119").get(0)
                .getObject());
    }

    @Test
    public void testWriteThenRead() throws IOException {
        final List<Fact> facts = FactTable.read(new StringReader(TABLE));
        final StringWriter writer = new StringWriter();
        FactTable.write(facts, writer);
        Assert.assertEquals(facts, FactTable.read(new StringReader(writer.toString())));
    }

    @Test
    public void testWrongColumnCount() {
        try {
            FactTable.read(new StringReader("1\t0\tgraph\tOBI:0000070\trdf:type\n"));
            Assert.fail();
        } catch (final IOException ex) {
            Assert.assertTrue(ex.getMessage().contains("line 1"));
        }
    }

    @Test(expected = IOException.class)
    public void testBadAssertion() throws IOException {
        FactTable.read(new StringReader("yes\t0\tgraph\tOBI:1\trdf:type\towl:Class\t_IRI\t\n"));
    }

    @Test
    public void testReadNamespaces() throws IOException {
        final List<Namespace> namespaces = FactTable.readNamespaces(new StringReader(
                "OBI\thttp://purl.obolibrary.org/obo/OBI_\n\nIAO\thttp://purl.obolibrary.org/obo/IAO_\n"));
        Assert.assertEquals(2, namespaces.size());
        Assert.assertEquals("IAO", namespaces.get(1).getPrefix());
        Assert.assertEquals("http://purl.obolibrary.org/obo/OBI_", namespaces.get(0).getName());
    }

}
