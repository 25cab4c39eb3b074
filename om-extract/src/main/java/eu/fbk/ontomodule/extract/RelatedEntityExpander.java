package eu.fbk.ontomodule.extract;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the terms related to the seeds of a module according to their {@link Related}
 * directives.
 * <p>
 * Closures are requested in batch: one upward closure for all the seeds asking for ancestors,
 * one downward closure for all the seeds asking for descendants, and single-level lookups for
 * parents and children. The seeds themselves are the frontier where ancestor walks stop.
 * </p>
 */
public final class RelatedEntityExpander {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelatedEntityExpander.class);

    private final HierarchyResolver resolver;

    public RelatedEntityExpander(final HierarchyResolver resolver) {
        this.resolver = Preconditions.checkNotNull(resolver);
    }

    /**
     * Returns the terms related to the seeds specified.
     *
     * @param seeds
     *            the resolved seeds, indexed by identifier
     * @param intermediates
     *            whether intermediate ancestors and descendants should be kept
     * @return the sorted set of related terms, possibly including some of the seeds
     * @throws IOException
     *             in case the store cannot be queried
     */
    public Set<String> expand(final Map<String, SeedTerm> seeds,
            final Intermediates intermediates) throws IOException {

        final List<String> ancestorSeeds = Lists.newArrayList();
        final List<String> descendantSeeds = Lists.newArrayList();
        final List<String> parentSeeds = Lists.newArrayList();
        final List<String> childSeeds = Lists.newArrayList();
        for (final SeedTerm seed : seeds.values()) {
            final Set<Related> related = seed.getRelated();
            if (related.contains(Related.ANCESTORS)) {
                ancestorSeeds.add(seed.getId());
            }
            if (related.contains(Related.DESCENDANTS)) {
                descendantSeeds.add(seed.getId());
            }
            if (related.contains(Related.PARENTS)) {
                parentSeeds.add(seed.getId());
            }
            if (related.contains(Related.CHILDREN)) {
                childSeeds.add(seed.getId());
            }
        }

        final Set<String> frontier = seeds.keySet();
        final Set<String> result = Sets.newHashSet();

        if (!ancestorSeeds.isEmpty()) {
            final Hierarchy ancestors = this.resolver.ancestorsOf(ancestorSeeds);
            for (final String seed : ancestorSeeds) {
                result.addAll(intermediates == Intermediates.NONE ? FrontierReducer
                        .nearestFrontierAncestors(ancestors, seed, frontier) : FrontierReducer
                        .cappedAncestors(ancestors, frontier, seed));
            }
        }

        if (!descendantSeeds.isEmpty()) {
            final Hierarchy descendants = this.resolver.descendantsOf(descendantSeeds);
            for (final String seed : descendantSeeds) {
                result.addAll(intermediates == Intermediates.NONE ? FrontierReducer
                        .bottomDescendants(descendants, seed) : FrontierReducer.allDescendants(
                        descendants, seed));
            }
        }

        if (!parentSeeds.isEmpty()) {
            result.addAll(this.resolver.parentsOf(parentSeeds).asMultimap().values());
        }

        if (!childSeeds.isEmpty()) {
            result.addAll(this.resolver.childrenOf(childSeeds).asMultimap().values());
        }

        // The sentinel stands for owl:Thing and is not a term of the ontology
        result.remove(HierarchyResolver.ROOT);

        LOGGER.debug("{} related terms found for {} ancestor, {} descendant, {} parent and {} "
                + "child seeds", result.size(), ancestorSeeds.size(), descendantSeeds.size(),
                parentSeeds.size(), childSeeds.size());
        return ImmutableSortedSet.copyOf(result);
    }

}
