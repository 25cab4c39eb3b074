package eu.fbk.ontomodule.extract;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Sets;
import com.google.common.collect.TreeMultimap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ontomodule.LookupException;
import eu.fbk.ontomodule.data.Fact;
import eu.fbk.ontomodule.data.PrefixRegistry;
import eu.fbk.ontomodule.store.StatementTransaction;
import eu.fbk.ontomodule.store.StatementTransaction.Position;
import eu.fbk.ontomodule.vocabulary.OWL;
import eu.fbk.ontomodule.vocabulary.RDF;
import eu.fbk.ontomodule.vocabulary.RDFS;

/**
 * Builds the facts of a module from its working term set.
 * <p>
 * Synthesis happens in two steps. {@link #assignParents(WorkingTermSet, Map, boolean)} decides
 * the hierarchy edges to assert between working terms; {@link #synthesize(Input)} then emits,
 * in this order: entity declarations, sub-property edges, sub-class edges, type edges for
 * instances, literal facts, facts linking two working terms, IRI-valued annotations,
 * imported-from stamps and copied predicate values. Facts copied from the statement table keep
 * all their fields (annotation included); synthesized facts are asserted in the default graph
 * with no annotation. Within each group facts are sorted and duplicates are dropped, so that the
 * output only depends on the store contents and on the module specification.
 * </p>
 */
public final class ModuleSynthesizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModuleSynthesizer.class);

    /** The types whose declarations are copied to the module. */
    public static final Set<String> DECLARATION_TYPES = ImmutableSet.of(OWL.CLASS,
            OWL.ANNOTATION_PROPERTY, OWL.DATA_PROPERTY, OWL.DATATYPE_PROPERTY,
            OWL.OBJECT_PROPERTY, OWL.NAMED_INDIVIDUAL);

    /** The types identifying properties, whose parents are asserted as sub-property edges. */
    public static final Set<String> PROPERTY_TYPES = ImmutableSet.of(OWL.ANNOTATION_PROPERTY,
            OWL.DATA_PROPERTY, OWL.DATATYPE_PROPERTY, OWL.OBJECT_PROPERTY);

    /** The predicates excluded from modules when no predicate is explicitly requested. */
    public static final Set<String> STRUCTURAL_PREDICATES = ImmutableSet.of(RDFS.SUB_CLASS_OF,
            RDFS.SUB_PROPERTY_OF, RDF.TYPE);

    private final StatementTransaction transaction;

    private final HierarchyResolver resolver;

    public ModuleSynthesizer(final StatementTransaction transaction,
            final HierarchyResolver resolver) {
        this.transaction = Preconditions.checkNotNull(transaction);
        this.resolver = Preconditions.checkNotNull(resolver);
    }

    /**
     * Returns the predicates whose facts may be copied to the module.
     *
     * @param requested
     *            the identifiers or labels of the requested predicates, or null to select all
     *            the predicates of the store except the structural ones
     * @param registry
     *            the registry used to normalize identifiers
     * @return the sorted set of predicate identifiers
     * @throws LookupException
     *             if a requested label matches several predicates
     * @throws IOException
     *             in case the store cannot be queried
     */
    public Set<String> selectPredicates(@Nullable final List<String> requested,
            final PrefixRegistry registry) throws LookupException, IOException {

        if (requested == null) {
            return ImmutableSet.copyOf(Sets.difference(this.transaction.predicates(),
                    STRUCTURAL_PREDICATES));
        }

        final List<String> inputs = Lists.newArrayList();
        for (final String predicate : requested) {
            inputs.add(registry.compact(predicate));
        }
        final ListMultimap<String, String> ids = this.transaction.resolve(inputs,
                Position.PREDICATE);

        final SortedSet<String> result = Sets.newTreeSet();
        final List<String> ambiguous = Lists.newArrayList();
        for (final String input : inputs) {
            final String id = choose(input, ids.get(input));
            if (id != null) {
                result.add(id);
            } else if (ids.get(input).size() > 1) {
                ambiguous.add(input);
            } else if (PrefixRegistry.isIdentifier(input)) {
                // Kept even if unused, so that the module accepts values for it later
                result.add(input);
            } else {
                LOGGER.warn("Predicate '{}' not found, ignoring it", input);
            }
        }
        if (!ambiguous.isEmpty()) {
            throw new LookupException("Ambiguous predicate labels: " + ambiguous, ambiguous);
        }
        return result;
    }

    /**
     * Picks the identifier an input resolves to: the input itself when it is an identifier
     * found in the store, otherwise the only term carrying it as label.
     *
     * @param input
     *            the identifier or label
     * @param ids
     *            the identifiers the input resolves to
     * @return the chosen identifier, or null if there is none or the choice is ambiguous
     */
    @Nullable
    static String choose(final String input, final Collection<String> ids) {
        if (ids.contains(input)) {
            return input;
        } else if (ids.size() == 1) {
            return ids.iterator().next();
        }
        return null;
    }

    /**
     * Decides the parents to assert for each working term. A seed with an override parent gets
     * exactly that parent; otherwise, unless the hierarchy is suppressed, a term gets the
     * nearest ancestors that are themselves working terms.
     *
     * @param terms
     *            the working terms
     * @param seeds
     *            the resolved seeds, providing override parents
     * @param suppressHierarchy
     *            true if only override parents should be asserted
     * @return a sorted child-to-parents multimap
     * @throws IOException
     *             in case the store cannot be queried
     */
    public SetMultimap<String, String> assignParents(final WorkingTermSet terms,
            final Map<String, SeedTerm> seeds, final boolean suppressHierarchy)
            throws IOException {

        final TreeMultimap<String, String> result = TreeMultimap.create();
        final List<String> computed = Lists.newArrayList();
        for (final String term : terms) {
            final SeedTerm seed = seeds.get(term);
            final String override = seed == null ? null : seed.getOverrideParent();
            if (override != null) {
                result.put(term, override);
            } else if (!suppressHierarchy) {
                computed.add(term);
            }
        }

        if (!computed.isEmpty()) {
            final Set<String> frontier = terms.asSet();
            final Hierarchy ancestors = this.resolver.ancestorsOf(computed);
            for (final String term : computed) {
                for (final String parent : FrontierReducer.nearestFrontierAncestors(ancestors,
                        term, frontier)) {
                    if (!parent.equals(term) && terms.contains(parent)) {
                        result.put(term, parent);
                    }
                }
            }
        }

        return ImmutableSetMultimap.copyOf(result);
    }

    /**
     * Emits the facts of the module.
     *
     * @param input
     *            the working terms, their parents and the synthesis options
     * @return the module facts, in emission order
     * @throws IOException
     *             in case the store cannot be queried
     */
    public List<Fact> synthesize(final Input input) throws IOException {

        final Set<String> terms = input.terms.asSet();
        final ImmutableList.Builder<Fact> builder = ImmutableList.builder();

        // Entity declarations
        final Set<String> classes = Sets.newHashSet();
        final Set<String> properties = Sets.newHashSet();
        final SortedSet<Fact> declarations = Sets.newTreeSet();
        for (final Fact fact : this.transaction.match(terms, ImmutableSet.of(RDF.TYPE))) {
            if (OWL.CLASS.equals(fact.getObject())) {
                classes.add(fact.getSubject());
            } else if (PROPERTY_TYPES.contains(fact.getObject())) {
                properties.add(fact.getSubject());
            }
            if (DECLARATION_TYPES.contains(fact.getObject())) {
                declarations.add(fact);
            }
        }
        emit(builder, "declaration", declarations);

        // Hierarchy edges: sub-properties, sub-classes, then instance types for the rest
        final SortedSet<Fact> subProperties = Sets.newTreeSet();
        final SortedSet<Fact> subClasses = Sets.newTreeSet();
        for (final Map.Entry<String, String> edge : input.parents.entries()) {
            if (properties.contains(edge.getKey())) {
                subProperties.add(Fact.create(edge.getKey(), RDFS.SUB_PROPERTY_OF,
                        edge.getValue(), Fact.IRI));
            }
            if (classes.contains(edge.getKey())) {
                subClasses.add(Fact.create(edge.getKey(), RDFS.SUB_CLASS_OF, edge.getValue(),
                        Fact.IRI));
            }
        }
        emit(builder, "sub-property", subProperties);
        emit(builder, "sub-class", subClasses);

        final SortedSet<Fact> instanceTypes = Sets.newTreeSet();
        for (final Map.Entry<String, String> edge : input.parents.entries()) {
            if (!properties.contains(edge.getKey()) && !classes.contains(edge.getKey())) {
                instanceTypes.add(Fact.create(edge.getKey(), RDF.TYPE, edge.getValue(),
                        Fact.IRI));
            }
        }
        emit(builder, "instance type", instanceTypes);

        // Facts on the selected predicates
        final List<Fact> selected = this.transaction.match(terms, input.predicates);
        final SortedSet<Fact> literals = Sets.newTreeSet();
        final SortedSet<Fact> links = Sets.newTreeSet();
        final SortedSet<Fact> iriAnnotations = Sets.newTreeSet();
        final Set<String> annotationProperties = annotationProperties(selected);
        for (final Fact fact : selected) {
            if (fact.isLiteral()) {
                literals.add(fact);
            } else if (terms.contains(fact.getObject())) {
                links.add(fact);
            }
            if (fact.isIRI() && annotationProperties.contains(fact.getPredicate())) {
                iriAnnotations.add(Fact.create(fact.getSubject(), fact.getPredicate(),
                        fact.getObject(), Fact.IRI));
            }
        }
        emit(builder, "literal", literals);
        emit(builder, "link", links);
        emit(builder, "IRI annotation", iriAnnotations);

        // Imported-from stamps
        if (input.importedFrom != null) {
            final SortedSet<Fact> stamps = Sets.newTreeSet();
            final String object = "<" + input.importedFrom + ">";
            for (final String term : terms) {
                stamps.add(Fact.create(term, input.importedFromPredicate, object, Fact.IRI));
            }
            emit(builder, "imported-from", stamps);
        }

        // Copied predicate values
        for (final Map.Entry<String, String> copy : input.copies) {
            final SortedSet<Fact> copies = Sets.newTreeSet();
            for (final Fact fact : this.transaction.match(terms,
                    ImmutableSet.of(copy.getKey()))) {
                copies.add(fact.withPredicate(copy.getValue()));
            }
            emit(builder, copy.getKey() + " -> " + copy.getValue() + " copy", copies);
        }

        return builder.build();
    }

    private Set<String> annotationProperties(final Iterable<Fact> facts) throws IOException {
        final Set<String> predicates = Sets.newHashSet();
        for (final Fact fact : facts) {
            if (fact.isIRI()) {
                predicates.add(fact.getPredicate());
            }
        }
        final Set<String> result = Sets.newHashSet();
        if (!predicates.isEmpty()) {
            for (final Fact fact : this.transaction.match(predicates, ImmutableSet.of(RDF.TYPE))) {
                if (OWL.ANNOTATION_PROPERTY.equals(fact.getObject())) {
                    result.add(fact.getSubject());
                }
            }
        }
        return result;
    }

    private static void emit(final ImmutableList.Builder<Fact> builder, final String group,
            final Collection<Fact> facts) {
        builder.addAll(facts);
        LOGGER.debug("{} {} facts", facts.size(), group);
    }

    /**
     * The data a module is synthesized from.
     */
    public static final class Input {

        private final WorkingTermSet terms;

        private final SetMultimap<String, String> parents;

        private final Set<String> predicates;

        private final List<Map.Entry<String, String>> copies;

        @Nullable
        private final String importedFrom;

        private final String importedFromPredicate;

        /**
         * Creates a new {@code Input}.
         *
         * @param terms
         *            the working terms
         * @param parents
         *            the child-to-parents edges to assert
         * @param predicates
         *            the predicates whose facts may be copied
         * @param copies
         *            the (from, to) predicate pairs whose values should be copied
         * @param importedFrom
         *            the IRI of the source ontology, null to skip imported-from stamps
         * @param importedFromPredicate
         *            the predicate of imported-from stamps
         */
        public Input(final WorkingTermSet terms, final SetMultimap<String, String> parents,
                final Set<String> predicates, final List<Map.Entry<String, String>> copies,
                @Nullable final String importedFrom, final String importedFromPredicate) {
            this.terms = Preconditions.checkNotNull(terms);
            this.parents = Preconditions.checkNotNull(parents);
            this.predicates = Preconditions.checkNotNull(predicates);
            this.copies = ImmutableList.copyOf(copies);
            this.importedFrom = importedFrom;
            this.importedFromPredicate = Preconditions.checkNotNull(importedFromPredicate);
        }

    }

}
