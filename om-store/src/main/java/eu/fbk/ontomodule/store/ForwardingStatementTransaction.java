package eu.fbk.ontomodule.store;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.ForwardingObject;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.SetMultimap;

import org.openrdf.model.Namespace;

import eu.fbk.ontomodule.data.Fact;

/**
 * A {@code StatementTransaction} that forwards all its method calls to another
 * {@code StatementTransaction}.
 */
public abstract class ForwardingStatementTransaction extends ForwardingObject implements
        StatementTransaction {

    @Override
    protected abstract StatementTransaction delegate();

    @Override
    public SetMultimap<String, String> parents(final Set<String> terms) throws IOException {
        return delegate().parents(terms);
    }

    @Override
    public SetMultimap<String, String> children(final Set<String> terms) throws IOException {
        return delegate().children(terms);
    }

    @Override
    public List<Fact> match(@Nullable final Set<String> subjects,
            @Nullable final Set<String> predicates) throws IOException {
        return delegate().match(subjects, predicates);
    }

    @Override
    public Set<String> predicates() throws IOException {
        return delegate().predicates();
    }

    @Override
    public ListMultimap<String, String> resolve(final Iterable<String> idsOrLabels,
            final Position position) throws IOException {
        return delegate().resolve(idsOrLabels, position);
    }

    @Override
    public List<Namespace> namespaces() throws IOException {
        return delegate().namespaces();
    }

    @Override
    public void addNamespaces(final Iterable<? extends Namespace> namespaces)
            throws IOException {
        delegate().addNamespaces(namespaces);
    }

    @Override
    public void add(final Iterable<? extends Fact> facts) throws IOException {
        delegate().add(facts);
    }

    @Override
    public void write(final String module, final Iterable<? extends Fact> facts)
            throws IOException {
        delegate().write(module, facts);
    }

    @Override
    @Nullable
    public List<Fact> read(final String module) throws IOException {
        return delegate().read(module);
    }

    @Override
    public boolean drop(final String module) throws IOException {
        return delegate().drop(module);
    }

    @Override
    public void end(final boolean commit) throws IOException {
        delegate().end(commit);
    }

}
