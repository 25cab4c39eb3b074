package eu.fbk.ontomodule.runtime;

import java.io.Closeable;
import java.io.IOException;

/**
 * A component with an explicit initialization and disposal lifecycle.
 * <p>
 * A {@code Component} is created in an uninitialized state; {@link #init()} must be called
 * exactly once before any other method, and {@link #close()} releases any allocated resource
 * (e.g., connection pools). Closing a component has no effect on the data it gives access to,
 * that continues to be persisted and will be accessed unchanged the next time a similarly
 * configured component is created.
 * </p>
 */
public interface Component extends Closeable {

    /**
     * Initializes the {@code Component}, allocating the resources it needs to become functional.
     *
     * @throws IOException
     *             in case initialization fails
     * @throws IllegalStateException
     *             in case the component has already been initialized or closed
     */
    void init() throws IOException, IllegalStateException;

    /**
     * Closes this {@code Component} object, aborting ongoing transactions and freeing allocated
     * resources. Calling this method on a closed or uninitialized component has no effect.
     */
    @Override
    void close();

}
