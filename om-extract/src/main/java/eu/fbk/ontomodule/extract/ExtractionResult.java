package eu.fbk.ontomodule.extract;

import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * The outcome of a successful module extraction.
 */
public final class ExtractionResult {

    private final String module;

    private final Set<String> terms;

    private final int factCount;

    private final Extractor.State state;

    ExtractionResult(final String module, final Iterable<String> terms, final int factCount,
            final Extractor.State state) {
        Preconditions.checkArgument(factCount >= 0);
        this.module = Preconditions.checkNotNull(module);
        this.terms = ImmutableSet.copyOf(terms);
        this.factCount = factCount;
        this.state = Preconditions.checkNotNull(state);
    }

    /**
     * Returns the name of the table the module was written to.
     *
     * @return the module name
     */
    public String getModule() {
        return this.module;
    }

    /**
     * Returns the working terms of the module, in the order they were collected.
     *
     * @return an immutable set of term identifiers
     */
    public Set<String> getTerms() {
        return this.terms;
    }

    public int getFactCount() {
        return this.factCount;
    }

    public Extractor.State getState() {
        return this.state;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("module", this.module)
                .add("terms", this.terms.size()).add("facts", this.factCount)
                .add("state", this.state).toString();
    }

}
