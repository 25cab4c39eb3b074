package eu.fbk.ontomodule.extract;

import java.util.Set;

import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Multimap;

/**
 * An immutable adjacency map from terms to the terms directly related to them in one direction
 * of the hierarchy (child to parents, or parent to children).
 * <p>
 * A term with no entry is a root (upward maps) or a leaf (downward maps). Cycles are allowed;
 * code walking a {@code Hierarchy} must keep track of visited terms.
 * </p>
 */
public final class Hierarchy {

    private static final Hierarchy EMPTY = new Hierarchy(ImmutableSetMultimap.<String, String>of());

    private final ImmutableSetMultimap<String, String> edges;

    private Hierarchy(final ImmutableSetMultimap<String, String> edges) {
        this.edges = edges;
    }

    public static Hierarchy create(final Multimap<String, String> edges) {
        return edges.isEmpty() ? EMPTY : new Hierarchy(ImmutableSetMultimap.copyOf(edges));
    }

    /**
     * Returns the terms directly related to the term specified.
     *
     * @param term
     *            the term
     * @return an immutable set, empty if the term has no entry
     */
    public Set<String> get(final String term) {
        return this.edges.get(term);
    }

    public boolean contains(final String term) {
        return this.edges.containsKey(term);
    }

    public Set<String> getTerms() {
        return this.edges.keySet();
    }

    public int size() {
        return this.edges.size();
    }

    public ImmutableSetMultimap<String, String> asMultimap() {
        return this.edges;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Hierarchy)) {
            return false;
        }
        return this.edges.equals(((Hierarchy) object).edges);
    }

    @Override
    public int hashCode() {
        return this.edges.hashCode();
    }

    @Override
    public String toString() {
        return this.edges.toString();
    }

}
