package eu.fbk.ontomodule.extract;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Sets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ontomodule.store.StatementTransaction;
import eu.fbk.ontomodule.vocabulary.OWL;

/**
 * Computes ancestor and descendant closures over the hierarchy edges of a statement table.
 * <p>
 * Closures are computed breadth first for all the requested terms at once, issuing one batched
 * store query per hierarchy level. Edges already fetched are kept by the resolver, so that each
 * term is queried at most once per direction during the lifetime of the resolver (i.e., of an
 * extraction run); every call returns a fresh {@link Hierarchy} restricted to the terms reachable
 * from its arguments. In upward closures the universal top {@code owl:Thing} is replaced by the
 * sentinel {@link #ROOT}, which is never expanded further.
 * </p>
 * <p>
 * Instances are bound to a transaction and are not thread safe.
 * </p>
 */
public final class HierarchyResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(HierarchyResolver.class);

    /** The sentinel root standing for {@code owl:Thing} in upward closures. */
    public static final String ROOT = OWL.CLASS;

    private final StatementTransaction transaction;

    private final SetMultimap<String, String> parents;

    private final SetMultimap<String, String> children;

    private final Set<String> parentsFetched;

    private final Set<String> childrenFetched;

    private int queryCount;

    public HierarchyResolver(final StatementTransaction transaction) {
        this.transaction = Preconditions.checkNotNull(transaction);
        this.parents = LinkedHashMultimap.create();
        this.children = LinkedHashMultimap.create();
        this.parentsFetched = Sets.newHashSet();
        this.childrenFetched = Sets.newHashSet();
        this.queryCount = 0;
    }

    /**
     * Returns the upward closure of the terms specified, mapping each reachable term to its
     * parents.
     *
     * @param terms
     *            the terms to start from
     * @return a child-to-parents hierarchy covering every ancestor of the terms
     * @throws IOException
     *             in case the store cannot be queried
     */
    public Hierarchy ancestorsOf(final Iterable<String> terms) throws IOException {
        fetch(terms, true, true);
        return closure(terms, this.parents);
    }

    /**
     * Returns the downward closure of the terms specified, mapping each reachable term to its
     * children.
     *
     * @param terms
     *            the terms to start from
     * @return a parent-to-children hierarchy covering every descendant of the terms
     * @throws IOException
     *             in case the store cannot be queried
     */
    public Hierarchy descendantsOf(final Iterable<String> terms) throws IOException {
        fetch(terms, false, true);
        return closure(terms, this.children);
    }

    /**
     * Returns the direct parents of the terms specified.
     *
     * @param terms
     *            the child terms
     * @return a single-level child-to-parents hierarchy
     * @throws IOException
     *             in case the store cannot be queried
     */
    public Hierarchy parentsOf(final Iterable<String> terms) throws IOException {
        fetch(terms, true, false);
        return restrict(terms, this.parents);
    }

    /**
     * Returns the direct children of the terms specified.
     *
     * @param terms
     *            the parent terms
     * @return a single-level parent-to-children hierarchy
     * @throws IOException
     *             in case the store cannot be queried
     */
    public Hierarchy childrenOf(final Iterable<String> terms) throws IOException {
        fetch(terms, false, false);
        return restrict(terms, this.children);
    }

    /**
     * Returns the number of store queries issued so far.
     *
     * @return the query count
     */
    public int getQueryCount() {
        return this.queryCount;
    }

    private void fetch(final Iterable<String> terms, final boolean up, final boolean transitive)
            throws IOException {

        final Set<String> fetched = up ? this.parentsFetched : this.childrenFetched;
        final SetMultimap<String, String> edges = up ? this.parents : this.children;

        Set<String> pending = transitive ? unfetched(terms, edges, fetched, up) : Sets
                .<String>newLinkedHashSet();
        if (!transitive) {
            for (final String term : terms) {
                if (!fetched.contains(term) && !(up && ROOT.equals(term))) {
                    pending.add(term);
                }
            }
        }

        int level = 0;
        while (!pending.isEmpty()) {
            final SetMultimap<String, String> result = up ? this.transaction.parents(pending)
                    : this.transaction.children(pending);
            ++this.queryCount;
            ++level;
            fetched.addAll(pending);

            final Set<String> targets = Sets.newLinkedHashSet();
            for (final Map.Entry<String, String> entry : result.entries()) {
                final String target = up && OWL.THING.equals(entry.getValue()) ? ROOT : entry
                        .getValue();
                edges.put(entry.getKey(), target);
                targets.add(target);
            }
            pending = transitive ? unfetched(targets, edges, fetched, up) : Sets
                    .<String>newHashSet();
        }

        if (LOGGER.isDebugEnabled() && level > 0) {
            LOGGER.debug("Fetched {} {} levels, {} terms expanded so far", level, up ? "ancestor"
                    : "descendant", fetched.size());
        }
    }

    // Terms reachable from the ones supplied through cached edges, whose edges are still unknown
    private static Set<String> unfetched(final Iterable<String> terms,
            final SetMultimap<String, String> edges, final Set<String> fetched, final boolean up) {
        final Set<String> result = Sets.newLinkedHashSet();
        final Set<String> visited = Sets.newHashSet();
        final Deque<String> queue = new ArrayDeque<>();
        for (final String term : terms) {
            if (visited.add(term)) {
                queue.add(term);
            }
        }
        while (!queue.isEmpty()) {
            final String term = queue.remove();
            if (up && ROOT.equals(term)) {
                continue;
            } else if (!fetched.contains(term)) {
                result.add(term);
                continue;
            }
            for (final String related : edges.get(term)) {
                if (visited.add(related)) {
                    queue.add(related);
                }
            }
        }
        return result;
    }

    private static Hierarchy closure(final Iterable<String> terms,
            final SetMultimap<String, String> edges) {
        final SetMultimap<String, String> result = LinkedHashMultimap.create();
        final Set<String> visited = Sets.newHashSet();
        final Deque<String> queue = new ArrayDeque<>();
        for (final String term : terms) {
            if (visited.add(term)) {
                queue.add(term);
            }
        }
        while (!queue.isEmpty()) {
            final String term = queue.remove();
            for (final String related : edges.get(term)) {
                result.put(term, related);
                if (visited.add(related)) {
                    queue.add(related);
                }
            }
        }
        return Hierarchy.create(result);
    }

    private static Hierarchy restrict(final Iterable<String> terms,
            final SetMultimap<String, String> edges) {
        final SetMultimap<String, String> result = LinkedHashMultimap.create();
        for (final String term : terms) {
            result.putAll(term, edges.get(term));
        }
        return Hierarchy.create(result);
    }

}
