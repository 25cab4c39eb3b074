package eu.fbk.ontomodule.data;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.junit.Assert;
import org.junit.Test;

public class AnnotationTest {

    private static final String JSON = "{\"oboInOwl:hasDbXref\":[{\"object\":\"MSI:1000\","
            + "\"datatype\":\"xsd:string\",\"annotation\":{\"rdfs:comment\":[{\"object\":"
            + "\"nested\",\"datatype\":\"@en\"}]}}],\"IAO:0000117\":[{\"object\":\"PERSON:A\","
            + "\"datatype\":\"xsd:string\"},{\"object\":\"PERSON:B\",\"datatype\":"
            + "\"xsd:string\"}]}";

    @Test
    public void testParse() {
        final Annotation annotation = Annotation.parse(JSON);
        Assert.assertEquals(ImmutableList.of("oboInOwl:hasDbXref", "IAO:0000117"),
                ImmutableList.copyOf(annotation.getPredicates()));
        Assert.assertEquals(2, annotation.get("IAO:0000117").size());
        Assert.assertEquals("PERSON:B", annotation.get("IAO:0000117").get(1).getObject());
        Assert.assertTrue(annotation.get("rdfs:label").isEmpty());

        final Annotation.Entry xref = annotation.get("oboInOwl:hasDbXref").get(0);
        Assert.assertEquals("MSI:1000", xref.getObject());
        Assert.assertEquals("xsd:string", xref.getDatatype());
        Assert.assertEquals(ImmutableSet.of("rdfs:comment"), xref.getAnnotation()
                .getPredicates());
    }

    @Test
    public void testJSONIsStable() {
        final Annotation annotation = Annotation.parse(JSON);
        Assert.assertEquals(JSON, annotation.toJSON());
        Assert.assertEquals(annotation, Annotation.parse(annotation.toJSON()));
    }

    @Test
    public void testExtraKeysAndJSONObjectsPreserved() {
        final String json = "{\"oboInOwl:hasDbXref\":[{\"datatype\":\"xsd:string\","
                + "\"meta\":\"owl:Axiom\",\"object\":\"PMID:1\"}],\"rdfs:comment\":"
                + "[{\"datatype\":\"_JSON\",\"object\":{\"values\":[1,2]}}]}";
        final Annotation annotation = Annotation.parse(json);
        Assert.assertEquals(json, annotation.toJSON());

        final Annotation.Entry xref = annotation.get("oboInOwl:hasDbXref").get(0);
        Assert.assertEquals("PMID:1", xref.getObject());
        Assert.assertEquals("owl:Axiom", xref.getProperty("meta"));
        Assert.assertNull(xref.getProperty("annotation"));

        final Annotation.Entry comment = annotation.get("rdfs:comment").get(0);
        Assert.assertEquals("_JSON", comment.getDatatype());
        Assert.assertEquals("{\"values\":[1,2]}", comment.getObject());
    }

    @Test
    public void testCreate() {
        final Annotation created = Annotation.create(ImmutableMap.of("rdfs:comment",
                ImmutableList.of(new Annotation.Entry("nested", "@en", null))));
        Assert.assertEquals(created, Annotation.parse(JSON).get("oboInOwl:hasDbXref").get(0)
                .getAnnotation());
    }

    @Test
    public void testEmptyIsNull() {
        Assert.assertNull(Annotation.parse(null));
        Assert.assertNull(Annotation.parse("  "));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidJSON() {
        Annotation.parse("{\"rdfs:comment\": [");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNotAnObject() {
        Annotation.parse("[1, 2]");
    }

}
