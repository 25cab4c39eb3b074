package eu.fbk.ontomodule.extract;

import eu.fbk.ontomodule.ConfigurationException;

/**
 * Whether the terms between a seed and the related terms it pulls in are kept.
 */
public enum Intermediates {

    ALL,

    NONE;

    public static Intermediates parse(final String string) throws ConfigurationException {
        for (final Intermediates value : values()) {
            if (value.name().equalsIgnoreCase(string.trim())) {
                return value;
            }
        }
        throw new ConfigurationException("Unknown 'intermediates' option: " + string);
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }

}
