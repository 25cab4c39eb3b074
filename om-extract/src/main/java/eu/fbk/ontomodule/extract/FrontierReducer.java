package eu.fbk.ontomodule.extract;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

/**
 * Reduces ancestor and descendant closures to the terms worth keeping in a module.
 * <p>
 * All the methods are pure functions of the {@link Hierarchy} supplied, which is never
 * modified. A term missing from the hierarchy is a root (upward closures) or a leaf (downward
 * closures). Walks keep a visited set, so cyclic hierarchies terminate.
 * </p>
 */
public final class FrontierReducer {

    private FrontierReducer() {
    }

    /**
     * Returns the nearest ancestors of a term that either belong to the frontier or are top
     * level terms. Walking up from {@code term}, a parent in the frontier is recorded and not
     * crossed; a term whose parent is the sentinel {@link HierarchyResolver#ROOT}, or that has no
     * parent at all, is recorded itself. All the parents of a term are followed.
     *
     * @param ancestors
     *            the child-to-parents closure of {@code term}
     * @param term
     *            the term to start from
     * @param frontier
     *            the terms where the walk stops
     * @return the sorted set of stopping points
     */
    public static Set<String> nearestFrontierAncestors(final Hierarchy ancestors,
            final String term, final Set<String> frontier) {
        final Set<String> result = Sets.newHashSet();
        final Set<String> visited = Sets.newHashSet(term);
        final Deque<String> stack = new ArrayDeque<>();
        stack.push(term);
        while (!stack.isEmpty()) {
            final String current = stack.pop();
            final Set<String> parents = ancestors.get(current);
            if (parents.isEmpty()) {
                result.add(current);
                continue;
            }
            for (final String parent : parents) {
                if (HierarchyResolver.ROOT.equals(parent)) {
                    result.add(current);
                } else if (frontier.contains(parent)) {
                    result.add(parent);
                } else if (visited.add(parent)) {
                    stack.push(parent);
                }
            }
        }
        return ImmutableSortedSet.copyOf(result);
    }

    /**
     * Returns all the ancestors of a term up to the frontier, including the frontier terms
     * reached and excluding the sentinel {@link HierarchyResolver#ROOT}. Lineages that never meet
     * the frontier are followed up to their top level term.
     *
     * @param ancestors
     *            the child-to-parents closure of {@code term}
     * @param frontier
     *            the terms where the walk stops
     * @param term
     *            the term to start from
     * @return the sorted set of ancestors
     */
    public static Set<String> cappedAncestors(final Hierarchy ancestors,
            final Set<String> frontier, final String term) {
        final Set<String> result = Sets.newHashSet();
        final Set<String> visited = Sets.newHashSet(term);
        final Deque<String> stack = new ArrayDeque<>();
        stack.push(term);
        while (!stack.isEmpty()) {
            for (final String parent : ancestors.get(stack.pop())) {
                if (HierarchyResolver.ROOT.equals(parent)) {
                    continue;
                }
                result.add(parent);
                if (!frontier.contains(parent) && visited.add(parent)) {
                    stack.push(parent);
                }
            }
        }
        return ImmutableSortedSet.copyOf(result);
    }

    /**
     * Returns the leaf descendants of a term, i.e., the descendants with no children. A term
     * without children is its own leaf.
     *
     * @param descendants
     *            the parent-to-children closure of {@code term}
     * @param term
     *            the term to start from
     * @return the sorted set of leaves
     */
    public static Set<String> bottomDescendants(final Hierarchy descendants, final String term) {
        final Set<String> result = Sets.newHashSet();
        final Set<String> visited = Sets.newHashSet(term);
        final Deque<String> stack = new ArrayDeque<>();
        stack.push(term);
        while (!stack.isEmpty()) {
            final String current = stack.pop();
            final Set<String> children = descendants.get(current);
            if (children.isEmpty()) {
                result.add(current);
            }
            for (final String child : children) {
                if (visited.add(child)) {
                    stack.push(child);
                }
            }
        }
        return ImmutableSortedSet.copyOf(result);
    }

    /**
     * Returns all the descendants of a term, intermediate terms included.
     *
     * @param descendants
     *            the parent-to-children closure of {@code term}
     * @param term
     *            the term to start from
     * @return the sorted set of descendants
     */
    public static Set<String> allDescendants(final Hierarchy descendants, final String term) {
        final Set<String> result = Sets.newHashSet();
        final Set<String> visited = Sets.newHashSet(term);
        final Deque<String> stack = new ArrayDeque<>();
        stack.push(term);
        while (!stack.isEmpty()) {
            for (final String child : descendants.get(stack.pop())) {
                result.add(child);
                if (visited.add(child)) {
                    stack.push(child);
                }
            }
        }
        return ImmutableSortedSet.copyOf(result);
    }

}
