package eu.fbk.ontomodule.extract;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import eu.fbk.ontomodule.ModuleException;
import eu.fbk.ontomodule.data.Annotation;
import eu.fbk.ontomodule.data.Fact;
import eu.fbk.ontomodule.store.JdbcStatementStore;
import eu.fbk.ontomodule.store.LoggingStatementStore;
import eu.fbk.ontomodule.store.StatementStore;
import eu.fbk.ontomodule.store.StatementTransaction;
import eu.fbk.ontomodule.vocabulary.RDFS;
import eu.fbk.ontomodule.vocabulary.XSD;

public class JdbcExtractorTest extends AbstractExtractorTest {

    private static final String AXIOM_ANNOTATION = "{\"oboInOwl:hasDbXref\":[{\"datatype\":"
            + "\"xsd:string\",\"meta\":\"owl:Axiom\",\"object\":\"PMID:1\"}],\"rdfs:comment\":"
            + "[{\"datatype\":\"_JSON\",\"object\":{\"subject\":\"ex:A\",\"values\":[1,2]}}]}";

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private String url;

    @Override
    protected StatementStore createStore() throws IOException {
        this.url = "jdbc:sqlite:" + this.folder.newFile("obi.db").getAbsolutePath();
        return new LoggingStatementStore(new JdbcStatementStore(this.url, null, null, null));
    }

    @Test
    public void testAnnotationCopiedVerbatim() throws ModuleException, IOException,
            SQLException {
        final StatementTransaction tx = getStore().begin(false);
        tx.add(ImmutableList.of(Fact.create(1, 0, Fact.DEFAULT_GRAPH, "ex:A", RDFS.LABEL,
                "cycle a (axiom)", XSD.STRING, Annotation.parse(AXIOM_ANNOTATION))));
        tx.end(true);

        getExtractor().extract("extract", ModuleSpec.builder().withSeed("ex:A").build());

        try (Connection connection = DriverManager.getConnection(this.url);
                Statement stmt = connection.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT annotation FROM extract "
                        + "WHERE subject = 'ex:A' AND annotation IS NOT NULL")) {
            Assert.assertTrue(rs.next());
            Assert.assertEquals(AXIOM_ANNOTATION, rs.getString(1));
            Assert.assertFalse(rs.next());
        }
    }

}
