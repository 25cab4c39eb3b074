package eu.fbk.ontomodule.store;

import java.io.IOException;

import eu.fbk.ontomodule.runtime.Component;

/**
 * A storage component holding an LDTab statement table, its prefix table and the extracted
 * modules.
 * <p>
 * A {@code StatementStore} gives access to its contents through {@link StatementTransaction}s
 * created via {@link #begin(boolean)}. Read-only transactions may only query the statement
 * table, the prefix table and stored modules; read-write transactions can additionally append
 * facts and namespaces and write or drop modules. Method {@link #reset()} brings the store back
 * to an empty state, creating the tables it needs.
 * </p>
 * <p>
 * Implementations must be thread safe, although a single extraction run only uses one
 * transaction at a time.
 * </p>
 */
public interface StatementStore extends Component {

    /**
     * Begins a new read-only or read-write transaction.
     *
     * @param readOnly
     *            true if the transaction is not allowed to modify the store contents
     * @return the created transaction
     * @throws IOException
     *             in case some IO error occurs (e.g., the database cannot be reached)
     * @throws IllegalStateException
     *             if the store has not been initialized or has been closed
     */
    StatementTransaction begin(boolean readOnly) throws IOException, IllegalStateException;

    /**
     * Drops all the contents of the store, leaving empty statement and prefix tables.
     *
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the store has not been initialized or has been closed
     */
    void reset() throws IOException, IllegalStateException;

}
