package eu.fbk.ontomodule;

import javax.annotation.Nullable;

/**
 * Signals that a module extraction could not be carried out.
 * <p>
 * This is the checked root of the errors raised by the extraction engine before any change is
 * written to the backing store: configuration problems are reported as
 * {@link ConfigurationException}, identifiers or labels that cannot be resolved as
 * {@link LookupException}. Failures of the backing store itself are not wrapped and surface as
 * plain {@code IOException}s.
 * </p>
 */
public class ModuleException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance with the error message specified.
     *
     * @param message
     *            the error message
     */
    public ModuleException(final String message) {
        this(message, null);
    }

    /**
     * Creates a new instance with the error message and optional cause specified.
     *
     * @param message
     *            the error message
     * @param cause
     *            the optional cause of this exception
     */
    public ModuleException(final String message, @Nullable final Throwable cause) {
        super(message, cause);
    }

}
