package eu.fbk.ontomodule.runtime;

import java.io.IOException;

import javax.annotation.Nullable;

/**
 * Signals that the contents of a store are in an unknown or invalid state.
 * <p>
 * This exception is thrown when stored data cannot be decoded (e.g., malformed annotation JSON)
 * or when a transaction could be neither committed nor rolled back, so that the store may have
 * been left partially modified. Recovery is not attempted automatically.
 * </p>
 */
public class DataCorruptedException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance with the optional error message specified.
     *
     * @param message
     *            an optional error message
     */
    public DataCorruptedException(@Nullable final String message) {
        this(message, null);
    }

    /**
     * Creates a new instance with the optional error message and cause specified.
     *
     * @param message
     *            an optional message providing additional information
     * @param cause
     *            the optional cause of this exception
     */
    public DataCorruptedException(@Nullable final String message,
            @Nullable final Throwable cause) {
        super(message, cause);
    }

}
