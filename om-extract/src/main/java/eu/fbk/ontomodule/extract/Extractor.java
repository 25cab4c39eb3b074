package eu.fbk.ontomodule.extract;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.SetMultimap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ontomodule.LookupException;
import eu.fbk.ontomodule.ModuleException;
import eu.fbk.ontomodule.data.Fact;
import eu.fbk.ontomodule.data.PrefixRegistry;
import eu.fbk.ontomodule.internal.Logging;
import eu.fbk.ontomodule.store.StatementStore;
import eu.fbk.ontomodule.store.StatementTransaction;
import eu.fbk.ontomodule.store.StatementTransaction.Position;

/**
 * Extracts modules from a {@link StatementStore}.
 * <p>
 * An extraction resolves the seeds of a {@link ModuleSpec} against the store, collects their
 * related terms, decides the hierarchy edges among them and synthesizes the module facts, all
 * within a read-only transaction; the module is then written to its own table in a separate
 * read-write transaction, which is committed only if the write succeeds. Each call to
 * {@link #extract(String, ModuleSpec)} works on its own transactions and scratch data, so an
 * {@code Extractor} can be shared among threads.
 * </p>
 */
public final class Extractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(Extractor.class);

    private final StatementStore store;

    public Extractor(final StatementStore store) {
        this.store = Preconditions.checkNotNull(store);
    }

    /**
     * Extracts a module, replacing any module with the same name.
     *
     * @param module
     *            the name of the table to write the module to
     * @param spec
     *            the module specification
     * @return the extraction result
     * @throws ModuleException
     *             if the seeds cannot be resolved
     * @throws IOException
     *             in case the store cannot be read or written
     */
    public ExtractionResult extract(final String module, final ModuleSpec spec)
            throws ModuleException, IOException {

        Preconditions.checkNotNull(module);
        Preconditions.checkNotNull(spec);

        try (Logging.Scope scope = Logging.scope(module)) {
            final Run run = new Run(module, spec);
            try {
                return run.execute();
            } finally {
                run.cleanup();
            }
        }
    }

    private final class Run {

        private final String module;

        private final ModuleSpec spec;

        private State state;

        @Nullable
        private StatementTransaction transaction;

        Run(final String module, final ModuleSpec spec) {
            this.module = module;
            this.spec = spec;
            this.state = State.IDLE;
        }

        ExtractionResult execute() throws ModuleException, IOException {

            final long ts = System.currentTimeMillis();

            this.transaction = Extractor.this.store.begin(true);
            final PrefixRegistry registry = PrefixRegistry.create(this.transaction.namespaces());
            final HierarchyResolver resolver = new HierarchyResolver(this.transaction);
            final ModuleSynthesizer synthesizer = new ModuleSynthesizer(this.transaction,
                    resolver);

            transition(State.RESOLVING_SEEDS);
            final Map<String, SeedTerm> seeds = resolveSeeds(registry);
            final WorkingTermSet terms = new WorkingTermSet();
            terms.addAll(seeds.keySet());

            transition(State.EXPANDING_RELATED);
            final int added = terms.addAll(new RelatedEntityExpander(resolver).expand(seeds,
                    this.spec.getIntermediates()));
            LOGGER.debug("{} related terms added to {} seeds", added, seeds.size());

            transition(State.ASSIGNING_PARENTS);
            final SetMultimap<String, String> parents = synthesizer.assignParents(terms, seeds,
                    this.spec.isSuppressHierarchy());

            transition(State.SYNTHESIZING_STATEMENTS);
            final Set<String> predicates = synthesizer.selectPredicates(
                    this.spec.getPredicates(), registry);
            final List<Map.Entry<String, String>> copies = Lists.newArrayList();
            for (final Map.Entry<String, String> copy : this.spec.getCopies()) {
                copies.add(Maps.immutableEntry(registry.compact(copy.getKey()),
                        registry.compact(copy.getValue())));
            }
            final List<Fact> facts = synthesizer.synthesize(new ModuleSynthesizer.Input(terms,
                    parents, predicates, copies, this.spec.getImportedFrom(),
                    registry.compact(this.spec.getImportedFromPredicate())));
            LOGGER.debug("{} hierarchy queries issued", resolver.getQueryCount());

            // A pending read transaction would prevent some databases from acquiring the write
            // lock, so it is closed before writing
            final StatementTransaction readTransaction = this.transaction;
            this.transaction = null;
            readTransaction.end(true);

            this.transaction = Extractor.this.store.begin(false);
            this.transaction.write(this.module, facts);
            final StatementTransaction writeTransaction = this.transaction;
            this.transaction = null;
            writeTransaction.end(true);

            transition(State.DONE);
            LOGGER.info("Module {} extracted: {} terms, {} facts in {} ms", this.module,
                    terms.size(), facts.size(), System.currentTimeMillis() - ts);
            return new ExtractionResult(this.module, terms, facts.size(), this.state);
        }

        private Map<String, SeedTerm> resolveSeeds(final PrefixRegistry registry)
                throws ModuleException, IOException {

            final List<SeedTerm> inputs = Lists.newArrayList();
            for (final SeedTerm seed : this.spec.getSeeds().values()) {
                final String parent = seed.getOverrideParent();
                inputs.add(seed.withId(registry.compact(seed.getId()),
                        parent == null ? null : registry.compact(parent)));
            }

            final List<String> keys = Lists.newArrayList();
            for (final SeedTerm seed : inputs) {
                keys.add(seed.getId());
            }
            final ListMultimap<String, String> ids = this.transaction.resolve(keys,
                    Position.SUBJECT);

            final Map<String, SeedTerm> result = Maps.newLinkedHashMap();
            final List<String> ambiguous = Lists.newArrayList();
            final List<String> unresolved = Lists.newArrayList();
            for (final SeedTerm seed : inputs) {
                final List<String> matches = ids.get(seed.getId());
                final String id = ModuleSynthesizer.choose(seed.getId(), matches);
                if (id != null) {
                    result.put(id, seed.withId(id, seed.getOverrideParent()));
                } else if (matches.size() > 1) {
                    ambiguous.add(seed.getId());
                } else {
                    unresolved.add(seed.getId());
                    LOGGER.warn("Term '{}' not found, ignoring it", seed.getId());
                }
            }

            if (!ambiguous.isEmpty()) {
                throw new LookupException("Labels matching several terms: " + ambiguous,
                        ambiguous);
            } else if (result.isEmpty()) {
                throw new LookupException("None of the terms could be resolved: " + unresolved,
                        unresolved);
            }
            return result;
        }

        private void transition(final State next) {
            LOGGER.debug("{} -> {}", this.state, next);
            this.state = next;
        }

        void cleanup() {
            final State reached = this.state;
            transition(State.CLEANING_UP);
            if (this.transaction != null) {
                try {
                    this.transaction.end(false);
                } catch (final Throwable ex) {
                    LOGGER.error("Could not roll back transaction after failure in state "
                            + reached, ex);
                }
                this.transaction = null;
            }
        }

    }

    /**
     * The phases of an extraction.
     */
    public enum State {

        /** Nothing done yet. */
        IDLE,

        /** Seed identifiers and labels are being resolved. */
        RESOLVING_SEEDS,

        /** Related terms are being collected. */
        EXPANDING_RELATED,

        /** Hierarchy edges are being decided. */
        ASSIGNING_PARENTS,

        /** Module facts are being built and written. */
        SYNTHESIZING_STATEMENTS,

        /** The module has been written. */
        DONE,

        /** Transactions are being released. */
        CLEANING_UP;

        @Override
        public String toString() {
            return name().toLowerCase();
        }

    }

}
