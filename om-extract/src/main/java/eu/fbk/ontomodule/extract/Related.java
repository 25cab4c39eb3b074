package eu.fbk.ontomodule.extract;

import java.util.EnumSet;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Splitter;
import com.google.common.collect.Sets;

import eu.fbk.ontomodule.ConfigurationException;

/**
 * The terms related to a seed that should be pulled into a module together with it.
 */
public enum Related {

    /** All ancestors up to the frontier (or only the nearest ones, without intermediates). */
    ANCESTORS,

    /** All descendants (or only the leaves, without intermediates). */
    DESCENDANTS,

    /** Direct parents only. */
    PARENTS,

    /** Direct children only. */
    CHILDREN;

    private static final Splitter SPLITTER = Splitter.on(' ').trimResults().omitEmptyStrings();

    /**
     * Parses a single directive, ignoring case.
     *
     * @param string
     *            the directive, e.g., {@code ancestors}
     * @return the corresponding constant
     * @throws ConfigurationException
     *             if the directive is not recognized
     */
    public static Related parse(final String string) throws ConfigurationException {
        for (final Related related : values()) {
            if (related.name().equalsIgnoreCase(string.trim())) {
                return related;
            }
        }
        throw new ConfigurationException("Unknown 'Related' keyword: " + string);
    }

    /**
     * Parses a space-separated list of directives.
     *
     * @param string
     *            the directives, possibly null or empty
     * @return the set of directives, empty if none is given
     * @throws ConfigurationException
     *             if some directive is not recognized
     */
    public static Set<Related> parseAll(@Nullable final String string)
            throws ConfigurationException {
        final Set<Related> result = EnumSet.noneOf(Related.class);
        if (string != null) {
            for (final String token : SPLITTER.split(string)) {
                result.add(parse(token));
            }
        }
        return Sets.immutableEnumSet(result);
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }

}
