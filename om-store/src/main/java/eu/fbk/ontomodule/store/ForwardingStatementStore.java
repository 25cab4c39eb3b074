package eu.fbk.ontomodule.store;

import java.io.IOException;

import com.google.common.collect.ForwardingObject;

/**
 * A {@code StatementStore} that forwards all its method calls to another
 * {@code StatementStore}. Subclasses implement {@link #delegate()} and override the methods they
 * want to decorate.
 */
public abstract class ForwardingStatementStore extends ForwardingObject implements
        StatementStore {

    @Override
    protected abstract StatementStore delegate();

    @Override
    public void init() throws IOException {
        delegate().init();
    }

    @Override
    public StatementTransaction begin(final boolean readOnly) throws IOException {
        return delegate().begin(readOnly);
    }

    @Override
    public void reset() throws IOException {
        delegate().reset();
    }

    @Override
    public void close() {
        delegate().close();
    }

}
