package eu.fbk.ontomodule.store;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;

import com.google.common.collect.ImmutableSet;

import org.junit.Assert;
import org.junit.Test;

public class MemoryStatementStoreTest extends AbstractStatementStoreTest {

    @Override
    protected StatementStore createStore() {
        return new MemoryStatementStore();
    }

    @Test
    public void testLoadFromFiles() throws IOException, URISyntaxException {
        final File statements = new File(getClass().getResource("statements.tsv").toURI());
        final File prefixes = new File(getClass().getResource("prefixes.tsv").toURI());
        final StatementStore store = new MemoryStatementStore(statements, prefixes);
        try {
            store.init();
            final StatementTransaction tx = store.begin(true);
            Assert.assertEquals(5, tx.match(null, null).size());
            Assert.assertEquals(ImmutableSet.of("OBI:0000070"),
                    tx.parents(ImmutableSet.of("OBI:0000185")).get("OBI:0000185"));
            Assert.assertEquals(2, tx.namespaces().size());
            tx.end(false);
        } finally {
            store.close();
        }
    }

    @Test
    public void testConcurrentCommitFails() throws IOException {
        final StatementTransaction first = getStore().begin(false);
        final StatementTransaction second = getStore().begin(false);
        first.write("one", first.match(null, null));
        second.write("two", second.match(null, null));
        first.end(true);
        try {
            second.end(true);
            Assert.fail();
        } catch (final IOException ex) {
            // expected
        }
    }

}
