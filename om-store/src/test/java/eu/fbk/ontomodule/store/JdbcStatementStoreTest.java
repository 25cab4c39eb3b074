package eu.fbk.ontomodule.store;

import java.io.File;
import java.io.IOException;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class JdbcStatementStoreTest extends AbstractStatementStoreTest {

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    @Override
    protected StatementStore createStore() throws IOException {
        final File db = this.folder.newFile("test.db");
        return new JdbcStatementStore("jdbc:sqlite:" + db.getAbsolutePath(), null, null, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testModuleCannotReplaceSourceTable() throws IOException {
        final StatementTransaction tx = getStore().begin(false);
        try {
            tx.write(JdbcStatementStore.STATEMENT_TABLE_DEFAULT, tx.match(null, null));
        } finally {
            tx.end(false);
        }
    }

}
