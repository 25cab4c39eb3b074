package eu.fbk.ontomodule.extract;

import java.util.Collections;
import java.util.Iterator;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import com.google.common.collect.Sets;

/**
 * The terms slated for inclusion in a module during one extraction run.
 * <p>
 * The set only grows: terms are added in the order they are discovered (seeds first, then the
 * related terms pulled in by expansion) and adding a term twice has no effect. A
 * {@code WorkingTermSet} is owned by a single run and is not thread safe.
 * </p>
 */
public final class WorkingTermSet implements Iterable<String> {

    private final Set<String> terms;

    public WorkingTermSet() {
        this.terms = Sets.newLinkedHashSet();
    }

    public boolean add(final String term) {
        return this.terms.add(Preconditions.checkNotNull(term));
    }

    /**
     * Adds all the terms specified.
     *
     * @param terms
     *            the terms to add
     * @return the number of terms that were not already in the set
     */
    public int addAll(final Iterable<String> terms) {
        int added = 0;
        for (final String term : terms) {
            if (add(term)) {
                ++added;
            }
        }
        return added;
    }

    public boolean contains(final String term) {
        return this.terms.contains(term);
    }

    public int size() {
        return this.terms.size();
    }

    /**
     * Returns an unmodifiable live view of the terms, in discovery order.
     *
     * @return a set view
     */
    public Set<String> asSet() {
        return Collections.unmodifiableSet(this.terms);
    }

    @Override
    public Iterator<String> iterator() {
        return Iterators.unmodifiableIterator(this.terms.iterator());
    }

    @Override
    public String toString() {
        return this.terms.toString();
    }

}
