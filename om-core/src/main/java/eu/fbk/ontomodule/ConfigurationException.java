package eu.fbk.ontomodule;

import javax.annotation.Nullable;

/**
 * Signals an invalid extraction configuration, such as an unknown related-entity directive, an
 * unknown intermediates policy or an empty seed set. Always raised before the store is modified.
 */
public class ConfigurationException extends ModuleException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, @Nullable final Throwable cause) {
        super(message, cause);
    }

}
