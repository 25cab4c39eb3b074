package eu.fbk.ontomodule.extract;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import eu.fbk.ontomodule.ConfigurationException;
import eu.fbk.ontomodule.vocabulary.IAO;

/**
 * The immutable description of a module to extract.
 * <p>
 * A {@code ModuleSpec} lists the seed terms and the options controlling which related terms,
 * which predicates and which synthesized facts end up in the module. Instances are created via
 * {@link #builder()}; textual options (related directives, intermediates policy) are validated
 * by {@link Builder#build()}, so that configuration errors are reported before the store is
 * accessed.
 * </p>
 */
public final class ModuleSpec {

    private final Map<String, SeedTerm> seeds;

    @Nullable
    private final List<String> predicates;

    private final Intermediates intermediates;

    private final boolean suppressHierarchy;

    private final List<Map.Entry<String, String>> copies;

    @Nullable
    private final String importedFrom;

    private final String importedFromPredicate;

    private ModuleSpec(final Builder builder, final Map<String, SeedTerm> seeds,
            final Intermediates intermediates) {
        this.seeds = ImmutableMap.copyOf(seeds);
        this.predicates = builder.predicates == null ? null : ImmutableList
                .copyOf(builder.predicates);
        this.intermediates = intermediates;
        this.suppressHierarchy = builder.suppressHierarchy;
        this.copies = ImmutableList.copyOf(builder.copies);
        this.importedFrom = builder.importedFrom;
        this.importedFromPredicate = builder.importedFromPredicate;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the seed terms, indexed by their identifier or label.
     *
     * @return an immutable map preserving insertion order
     */
    public Map<String, SeedTerm> getSeeds() {
        return this.seeds;
    }

    /**
     * Returns the identifiers or labels of the predicates to include in the module, or null if
     * all the predicates of the store but the hierarchy and type ones should be included.
     *
     * @return an immutable list of predicates, or null
     */
    @Nullable
    public List<String> getPredicates() {
        return this.predicates;
    }

    public Intermediates getIntermediates() {
        return this.intermediates;
    }

    public boolean isSuppressHierarchy() {
        return this.suppressHierarchy;
    }

    /**
     * Returns the (from, to) predicate pairs whose values should be copied.
     *
     * @return an immutable list of pairs, in the order given
     */
    public List<Map.Entry<String, String>> getCopies() {
        return this.copies;
    }

    /**
     * Returns the IRI of the ontology the module terms are imported from, if any.
     *
     * @return the absolute IRI, without angle brackets, or null
     */
    @Nullable
    public String getImportedFrom() {
        return this.importedFrom;
    }

    public String getImportedFromPredicate() {
        return this.importedFromPredicate;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("seeds", this.seeds.values()).add("predicates", this.predicates)
                .add("intermediates", this.intermediates)
                .add("suppressHierarchy", this.suppressHierarchy).add("copies", this.copies)
                .add("importedFrom", this.importedFrom)
                .add("importedFromPredicate", this.importedFromPredicate).toString();
    }

    public static final class Builder {

        private final List<String[]> seeds;

        @Nullable
        private List<String> predicates;

        private String intermediates;

        private boolean suppressHierarchy;

        private final List<Map.Entry<String, String>> copies;

        @Nullable
        private String importedFrom;

        private String importedFromPredicate;

        Builder() {
            this.seeds = Lists.newArrayList();
            this.predicates = null;
            this.intermediates = Intermediates.ALL.toString();
            this.suppressHierarchy = false;
            this.copies = Lists.newArrayList();
            this.importedFrom = null;
            this.importedFromPredicate = IAO.IMPORTED_FROM;
        }

        /**
         * Adds a seed term. A later seed with the same identifier replaces an earlier one.
         *
         * @param id
         *            the identifier or label of the term
         * @param overrideParent
         *            the parent to assert instead of the computed ones, possibly null
         * @param related
         *            space-separated related directives, possibly null
         * @return this builder
         */
        public Builder withSeed(final String id, @Nullable final String overrideParent,
                @Nullable final String related) {
            Preconditions.checkNotNull(id);
            this.seeds.add(new String[] { id.trim(), overrideParent, related });
            return this;
        }

        public Builder withSeed(final String id, final Related... related) {
            final StringBuilder builder = new StringBuilder();
            for (final Related r : related) {
                builder.append(r).append(' ');
            }
            return withSeed(id, null, builder.toString());
        }

        public Builder withPredicates(@Nullable final Iterable<String> predicates) {
            if (predicates == null) {
                this.predicates = null;
            } else {
                if (this.predicates == null) {
                    this.predicates = Lists.newArrayList();
                }
                for (final String predicate : predicates) {
                    final String trimmed = predicate.trim();
                    if (!trimmed.isEmpty() && !this.predicates.contains(trimmed)) {
                        this.predicates.add(trimmed);
                    }
                }
            }
            return this;
        }

        public Builder withIntermediates(final String intermediates) {
            this.intermediates = Preconditions.checkNotNull(intermediates);
            return this;
        }

        public Builder withIntermediates(final Intermediates intermediates) {
            return withIntermediates(intermediates.toString());
        }

        public Builder withSuppressHierarchy(final boolean suppressHierarchy) {
            this.suppressHierarchy = suppressHierarchy;
            return this;
        }

        public Builder withCopy(final String fromPredicate, final String toPredicate) {
            this.copies.add(Maps.immutableEntry(Preconditions.checkNotNull(fromPredicate),
                    Preconditions.checkNotNull(toPredicate)));
            return this;
        }

        /**
         * Sets the IRI of the ontology the terms are imported from; angle brackets are
         * stripped.
         *
         * @param importedFrom
         *            the IRI, possibly null or empty to disable imported-from stamping
         * @return this builder
         */
        public Builder withImportedFrom(@Nullable final String importedFrom) {
            String iri = importedFrom == null ? null : importedFrom.trim();
            if (iri != null && iri.startsWith("<") && iri.endsWith(">")) {
                iri = iri.substring(1, iri.length() - 1);
            }
            this.importedFrom = iri == null || iri.isEmpty() ? null : iri;
            return this;
        }

        public Builder withImportedFromPredicate(final String importedFromPredicate) {
            this.importedFromPredicate = Preconditions.checkNotNull(importedFromPredicate);
            return this;
        }

        /**
         * Validates the options collected and creates the {@code ModuleSpec}.
         *
         * @return the created specification
         * @throws ConfigurationException
         *             if no seed was given, or a related directive or the intermediates policy
         *             are not recognized
         */
        public ModuleSpec build() throws ConfigurationException {
            if (this.seeds.isEmpty()) {
                throw new ConfigurationException("One or more seed terms must be specified");
            }
            final Map<String, SeedTerm> seeds = Maps.newLinkedHashMap();
            for (final String[] seed : this.seeds) {
                final SeedTerm term;
                try {
                    term = SeedTerm.create(seed[0], seed[1], Related.parseAll(seed[2]));
                } catch (final ConfigurationException ex) {
                    throw new ConfigurationException("Invalid seed '" + seed[0] + "': "
                            + ex.getMessage(), ex);
                } catch (final IllegalArgumentException ex) {
                    throw new ConfigurationException("Invalid seed '" + seed[0] + "'", ex);
                }
                seeds.remove(term.getId());
                seeds.put(term.getId(), term);
            }
            return new ModuleSpec(this, seeds, Intermediates.parse(this.intermediates));
        }

    }

}
