package eu.fbk.ontomodule.store;

import java.io.File;
import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Sets;

import org.openrdf.model.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ontomodule.data.Fact;
import eu.fbk.ontomodule.data.FactTable;
import eu.fbk.ontomodule.vocabulary.RDFS;

/**
 * A {@code StatementStore} implementation that keeps all data in memory, optionally loading it
 * from TSV files at startup.
 * <p>
 * This class realizes a low-performance, functional implementation of the
 * {@code StatementStore} component, used for tests and small ontologies. Statement and prefix
 * tables are loaded in {@link #init()} from the files configured (see {@link FactTable} for the
 * format) and then indexed in memory; nothing is written back to disk. Each read-write
 * transaction works on its copy of the data, and changes are merged back in the component upon
 * successful commit, provided no other transaction committed in the meanwhile.
 * </p>
 */
public class MemoryStatementStore implements StatementStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryStatementStore.class);

    @Nullable
    private final File statementFile;

    @Nullable
    private final File prefixFile;

    private Tables tables;

    private int revision;

    private boolean initialized;

    private boolean closed;

    /**
     * Creates a new, empty {@code MemoryStatementStore}.
     */
    public MemoryStatementStore() {
        this(null, null);
    }

    /**
     * Creates a new {@code MemoryStatementStore} loading its statement and prefix tables from the
     * TSV files specified.
     *
     * @param statementFile
     *            the statement TSV file, null if the statement table starts empty
     * @param prefixFile
     *            the prefix TSV file, null if the prefix table starts empty
     */
    public MemoryStatementStore(@Nullable final File statementFile,
            @Nullable final File prefixFile) {
        this.statementFile = statementFile;
        this.prefixFile = prefixFile;
        this.tables = new Tables();
        this.revision = 1;
        this.initialized = false;
        this.closed = false;
        LOGGER.info("{} configured, statements={}, prefixes={}", getClass().getSimpleName(),
                statementFile, prefixFile);
    }

    @Override
    public synchronized void init() throws IOException, IllegalStateException {
        Preconditions.checkState(!this.initialized && !this.closed);
        this.initialized = true;
        if (this.statementFile != null) {
            this.tables.statements.addAll(FactTable.read(this.statementFile));
        }
        if (this.prefixFile != null) {
            for (final Namespace namespace : FactTable.readNamespaces(this.prefixFile)) {
                this.tables.namespaces.put(namespace.getPrefix(), namespace);
            }
        }
        LOGGER.info("{} initialized, {} facts and {} namespaces loaded", getClass()
                .getSimpleName(), this.tables.statements.size(), this.tables.namespaces.size());
    }

    @Override
    public synchronized StatementTransaction begin(final boolean readOnly) throws IOException,
            IllegalStateException {
        Preconditions.checkState(this.initialized && !this.closed);
        return new MemoryStatementTransaction(readOnly ? this.tables : this.tables.copy(),
                this.revision, readOnly);
    }

    @Override
    public synchronized void reset() throws IOException, IllegalStateException {
        Preconditions.checkState(this.initialized && !this.closed);
        this.tables = new Tables();
        ++this.revision;
    }

    @Override
    public synchronized void close() {
        this.closed = true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private synchronized void update(final Tables tables, final int revision)
            throws IOException {
        if (this.revision != revision) {
            throw new IOException("Commit failed due to concurrent modifications "
                    + this.revision + ", " + revision);
        }
        ++this.revision;
        this.tables = tables;
        LOGGER.debug("{} updated, {} facts, {} modules", getClass().getSimpleName(),
                tables.statements.size(), tables.modules.size());
    }

    private static final class Tables {

        final List<Fact> statements;

        final Map<String, Namespace> namespaces;

        final Map<String, List<Fact>> modules;

        @Nullable
        private Index index;

        Tables() {
            this.statements = Lists.newArrayList();
            this.namespaces = Maps.newLinkedHashMap();
            this.modules = Maps.newHashMap();
        }

        Tables copy() {
            final Tables copy = new Tables();
            copy.statements.addAll(this.statements);
            copy.namespaces.putAll(this.namespaces);
            copy.modules.putAll(this.modules);
            return copy;
        }

        synchronized Index index() {
            if (this.index == null) {
                this.index = new Index(this.statements);
            }
            return this.index;
        }

        synchronized void invalidate() {
            this.index = null;
        }

    }

    private static final class Index {

        final ListMultimap<String, Fact> bySubject;

        final SetMultimap<String, String> parents;

        final SetMultimap<String, String> children;

        final SetMultimap<String, String> subjectsByLabel;

        final Set<String> predicates;

        Index(final Iterable<Fact> statements) {
            this.bySubject = ArrayListMultimap.create();
            this.parents = LinkedHashMultimap.create();
            this.children = LinkedHashMultimap.create();
            this.subjectsByLabel = LinkedHashMultimap.create();
            this.predicates = Sets.newTreeSet();
            for (final Fact fact : statements) {
                final String predicate = fact.getPredicate();
                this.bySubject.put(fact.getSubject(), fact);
                this.predicates.add(predicate);
                if (fact.isIRI()
                        && (predicate.equals(RDFS.SUB_CLASS_OF) || predicate
                                .equals(RDFS.SUB_PROPERTY_OF))) {
                    this.parents.put(fact.getSubject(), fact.getObject());
                    this.children.put(fact.getObject(), fact.getSubject());
                } else if (predicate.equals(RDFS.LABEL)) {
                    this.subjectsByLabel.put(fact.getObject(), fact.getSubject());
                }
            }
        }

    }

    private class MemoryStatementTransaction implements StatementTransaction {

        private final Tables tables;

        private final int revision;

        private final boolean readOnly;

        private boolean ended;

        MemoryStatementTransaction(final Tables tables, final int revision,
                final boolean readOnly) {
            this.tables = tables;
            this.revision = revision;
            this.readOnly = readOnly;
            this.ended = false;
        }

        private void checkState(final boolean write) {
            Preconditions.checkState(!this.ended, "Transaction already ended");
            Preconditions.checkState(!write || !this.readOnly, "Read-only transaction");
        }

        private SetMultimap<String, String> edges(final Set<String> terms,
                final SetMultimap<String, String> index) {
            final ImmutableSetMultimap.Builder<String, String> builder = ImmutableSetMultimap
                    .builder();
            for (final String term : terms) {
                builder.putAll(term, index.get(term));
            }
            return builder.build();
        }

        @Override
        public synchronized SetMultimap<String, String> parents(final Set<String> terms) {
            checkState(false);
            return edges(terms, this.tables.index().parents);
        }

        @Override
        public synchronized SetMultimap<String, String> children(final Set<String> terms) {
            checkState(false);
            return edges(terms, this.tables.index().children);
        }

        @Override
        public synchronized List<Fact> match(@Nullable final Set<String> subjects,
                @Nullable final Set<String> predicates) {
            checkState(false);
            final ImmutableList.Builder<Fact> builder = ImmutableList.builder();
            final Collection<Fact> candidates;
            if (subjects == null) {
                candidates = this.tables.statements;
            } else {
                candidates = Lists.newArrayList();
                final ListMultimap<String, Fact> bySubject = this.tables.index().bySubject;
                for (final String subject : subjects) {
                    candidates.addAll(bySubject.get(subject));
                }
            }
            for (final Fact fact : candidates) {
                if (predicates == null || predicates.contains(fact.getPredicate())) {
                    builder.add(fact);
                }
            }
            return builder.build();
        }

        @Override
        public synchronized Set<String> predicates() {
            checkState(false);
            return ImmutableSortedSet.copyOf(this.tables.index().predicates);
        }

        @Override
        public synchronized ListMultimap<String, String> resolve(
                final Iterable<String> idsOrLabels, final Position position) {
            checkState(false);
            final Index index = this.tables.index();
            final ImmutableListMultimap.Builder<String, String> builder = ImmutableListMultimap
                    .builder();
            for (final String input : ImmutableSet.copyOf(idsOrLabels)) {
                final Set<String> ids = Sets.newLinkedHashSet();
                if (index.bySubject.containsKey(input) || position == Position.PREDICATE
                        && index.predicates.contains(input)) {
                    ids.add(input);
                }
                ids.addAll(ImmutableSortedSet.copyOf(index.subjectsByLabel.get(input)));
                builder.putAll(input, ids);
            }
            return builder.build();
        }

        @Override
        public synchronized List<Namespace> namespaces() {
            checkState(false);
            return ImmutableList.copyOf(this.tables.namespaces.values());
        }

        @Override
        public synchronized void addNamespaces(final Iterable<? extends Namespace> namespaces) {
            checkState(true);
            for (final Namespace namespace : namespaces) {
                this.tables.namespaces.put(namespace.getPrefix(), namespace);
            }
        }

        @Override
        public synchronized void add(final Iterable<? extends Fact> facts) {
            checkState(true);
            Iterables.addAll(this.tables.statements, facts);
            this.tables.invalidate();
        }

        @Override
        public synchronized void write(final String module, final Iterable<? extends Fact> facts) {
            checkState(true);
            JdbcStatementStore.checkTableName(module);
            this.tables.modules.put(module, ImmutableList.copyOf(facts));
        }

        @Override
        @Nullable
        public synchronized List<Fact> read(final String module) {
            checkState(false);
            return this.tables.modules.get(module);
        }

        @Override
        public synchronized boolean drop(final String module) {
            checkState(true);
            return this.tables.modules.remove(module) != null;
        }

        @Override
        public synchronized void end(final boolean commit) throws IOException {
            if (this.ended) {
                return;
            }
            this.ended = true;
            if (commit && !this.readOnly) {
                update(this.tables, this.revision);
            }
        }

        @Override
        public String toString() {
            return MemoryStatementStore.this + "-tx" + this.revision;
        }

    }

}
