package eu.fbk.ontomodule;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Signals that one or more term identifiers or labels could not be resolved against the store,
 * either because none of the seeds survived resolution or because a label is ambiguous.
 */
public class LookupException extends ModuleException {

    private static final long serialVersionUID = 1L;

    private final List<String> terms;

    /**
     * Creates a new instance for the offending terms specified.
     *
     * @param message
     *            the error message
     * @param terms
     *            the identifiers or labels that caused the failure
     */
    public LookupException(final String message, final Iterable<String> terms) {
        super(message);
        this.terms = ImmutableList.copyOf(terms);
    }

    /**
     * Returns the identifiers or labels that caused this exception.
     *
     * @return an immutable list of terms, possibly empty
     */
    public List<String> getTerms() {
        return this.terms;
    }

}
