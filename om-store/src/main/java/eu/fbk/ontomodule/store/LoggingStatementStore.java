package eu.fbk.ontomodule.store;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.Iterables;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.SetMultimap;

import org.openrdf.model.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ontomodule.data.Fact;

/**
 * A {@code StatementStore} wrapper that logs calls to the operations of a wrapped
 * {@code StatementStore} and their execution times (measured with a Guava {@code Stopwatch}).
 * <p>
 * This wrapper intercepts calls to an underlying {@code StatementStore} and to the
 * {@code StatementTransaction}s it creates, and logs request information and execution times via
 * SLF4J (level DEBUG, logger named after this class). The overhead introduced by this wrapper
 * when logging is disabled is negligible.
 * </p>
 */
public final class LoggingStatementStore extends ForwardingStatementStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingStatementStore.class);

    private final StatementStore delegate;

    /**
     * Creates a new instance for the wrapped {@code StatementStore} specified.
     *
     * @param delegate
     *            the wrapped {@code StatementStore}
     */
    public LoggingStatementStore(final StatementStore delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
        LOGGER.debug("{} configured", getClass().getSimpleName());
    }

    @Override
    protected StatementStore delegate() {
        return this.delegate;
    }

    @Override
    public void init() throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final Stopwatch watch = Stopwatch.createStarted();
            super.init();
            LOGGER.debug("{} - initialized in {}", this, watch);
        } else {
            super.init();
        }
    }

    @Override
    public StatementTransaction begin(final boolean readOnly) throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final Stopwatch watch = Stopwatch.createStarted();
            final StatementTransaction transaction = new LoggingStatementTransaction(
                    super.begin(readOnly));
            LOGGER.debug("{} - started in {} mode in {}", transaction, readOnly ? "read-only"
                    : "read-write", watch);
            return transaction;
        } else {
            return super.begin(readOnly);
        }
    }

    @Override
    public void reset() throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final Stopwatch watch = Stopwatch.createStarted();
            super.reset();
            LOGGER.debug("{} - reset done in {}", this, watch);
        } else {
            super.reset();
        }
    }

    @Override
    public void close() {
        if (LOGGER.isDebugEnabled()) {
            final Stopwatch watch = Stopwatch.createStarted();
            super.close();
            LOGGER.debug("{} - closed in {}", this, watch);
        } else {
            super.close();
        }
    }

    private static final class LoggingStatementTransaction extends
            ForwardingStatementTransaction {

        private final StatementTransaction delegate;

        LoggingStatementTransaction(final StatementTransaction delegate) {
            this.delegate = Preconditions.checkNotNull(delegate);
        }

        @Override
        protected StatementTransaction delegate() {
            return this.delegate;
        }

        private static String size(@Nullable final Iterable<?> iterable) {
            if (iterable == null) {
                return "*";
            }
            return Integer.toString(Iterables.size(iterable));
        }

        @Override
        public SetMultimap<String, String> parents(final Set<String> terms) throws IOException {
            if (LOGGER.isDebugEnabled()) {
                final Stopwatch watch = Stopwatch.createStarted();
                final SetMultimap<String, String> result = super.parents(terms);
                LOGGER.debug("{} - {} parent edges for {} terms obtained in {}", this,
                        result.size(), terms.size(), watch);
                return result;
            } else {
                return super.parents(terms);
            }
        }

        @Override
        public SetMultimap<String, String> children(final Set<String> terms) throws IOException {
            if (LOGGER.isDebugEnabled()) {
                final Stopwatch watch = Stopwatch.createStarted();
                final SetMultimap<String, String> result = super.children(terms);
                LOGGER.debug("{} - {} child edges for {} terms obtained in {}", this,
                        result.size(), terms.size(), watch);
                return result;
            } else {
                return super.children(terms);
            }
        }

        @Override
        public List<Fact> match(@Nullable final Set<String> subjects,
                @Nullable final Set<String> predicates) throws IOException {
            if (LOGGER.isDebugEnabled()) {
                final Stopwatch watch = Stopwatch.createStarted();
                final List<Fact> result = super.match(subjects, predicates);
                LOGGER.debug("{} - {} facts matching {} subjects, {} predicates obtained "
                        + "in {}", this, result.size(), size(subjects), size(predicates),
                        watch);
                return result;
            } else {
                return super.match(subjects, predicates);
            }
        }

        @Override
        public Set<String> predicates() throws IOException {
            if (LOGGER.isDebugEnabled()) {
                final Stopwatch watch = Stopwatch.createStarted();
                final Set<String> result = super.predicates();
                LOGGER.debug("{} - {} predicates obtained in {}", this, result.size(),
                        watch);
                return result;
            } else {
                return super.predicates();
            }
        }

        @Override
        public ListMultimap<String, String> resolve(final Iterable<String> idsOrLabels,
                final Position position) throws IOException {
            if (LOGGER.isDebugEnabled()) {
                final Stopwatch watch = Stopwatch.createStarted();
                final ListMultimap<String, String> result = super.resolve(idsOrLabels, position);
                LOGGER.debug("{} - {} of {} {} terms resolved in {}", this, result.keySet()
                        .size(), size(idsOrLabels), position.name().toLowerCase(),
                        watch);
                return result;
            } else {
                return super.resolve(idsOrLabels, position);
            }
        }

        @Override
        public List<Namespace> namespaces() throws IOException {
            if (LOGGER.isDebugEnabled()) {
                final Stopwatch watch = Stopwatch.createStarted();
                final List<Namespace> result = super.namespaces();
                LOGGER.debug("{} - {} namespaces obtained in {}", this, result.size(),
                        watch);
                return result;
            } else {
                return super.namespaces();
            }
        }

        @Override
        public void addNamespaces(final Iterable<? extends Namespace> namespaces)
                throws IOException {
            if (LOGGER.isDebugEnabled()) {
                final Stopwatch watch = Stopwatch.createStarted();
                super.addNamespaces(namespaces);
                LOGGER.debug("{} - {} namespaces added in {}", this, size(namespaces),
                        watch);
            } else {
                super.addNamespaces(namespaces);
            }
        }

        @Override
        public void add(final Iterable<? extends Fact> facts) throws IOException {
            if (LOGGER.isDebugEnabled()) {
                final Stopwatch watch = Stopwatch.createStarted();
                super.add(facts);
                LOGGER.debug("{} - {} facts added in {}", this, size(facts),
                        watch);
            } else {
                super.add(facts);
            }
        }

        @Override
        public void write(final String module, final Iterable<? extends Fact> facts)
                throws IOException {
            if (LOGGER.isDebugEnabled()) {
                final Stopwatch watch = Stopwatch.createStarted();
                super.write(module, facts);
                LOGGER.debug("{} - module {} with {} facts written in {}", this, module,
                        size(facts), watch);
            } else {
                super.write(module, facts);
            }
        }

        @Override
        @Nullable
        public List<Fact> read(final String module) throws IOException {
            if (LOGGER.isDebugEnabled()) {
                final Stopwatch watch = Stopwatch.createStarted();
                final List<Fact> result = super.read(module);
                LOGGER.debug("{} - module {} ({} facts) read in {}", this, module,
                        result == null ? "missing" : result.size(), watch);
                return result;
            } else {
                return super.read(module);
            }
        }

        @Override
        public boolean drop(final String module) throws IOException {
            if (LOGGER.isDebugEnabled()) {
                final Stopwatch watch = Stopwatch.createStarted();
                final boolean result = super.drop(module);
                LOGGER.debug("{} - module {} {} in {}", this, module, result ? "dropped"
                        : "not found", watch);
                return result;
            } else {
                return super.drop(module);
            }
        }

        @Override
        public void end(final boolean commit) throws IOException {
            if (LOGGER.isDebugEnabled()) {
                final Stopwatch watch = Stopwatch.createStarted();
                super.end(commit);
                LOGGER.debug("{} - {} done in {}", this, commit ? "commit" : "rollback",
                        watch);
            } else {
                super.end(commit);
            }
        }

    }

}
