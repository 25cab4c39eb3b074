package eu.fbk.ontomodule.data;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.URIImpl;

import eu.fbk.ontomodule.vocabulary.OWL;
import eu.fbk.ontomodule.vocabulary.RDF;
import eu.fbk.ontomodule.vocabulary.RDFS;
import eu.fbk.ontomodule.vocabulary.XSD;

/**
 * Maps between compact identifiers ({@code prefix:local}) and absolute IRIs.
 * <p>
 * A {@code PrefixRegistry} is built from the namespaces of a statement table (its {@code prefix}
 * table) plus the standard rdf, rdfs, owl and xsd namespaces. Absolute IRIs are written between
 * angle brackets in statement tables; {@link #compact(String)} brings them back to the compact
 * form used by the table whenever a namespace matches, preferring the longest one.
 * </p>
 */
public final class PrefixRegistry {

    private static final Pattern CURIE_PATTERN = Pattern
            .compile("[A-Za-z_][A-Za-z0-9_.\\-]*:[^\\s<>]*");

    private static final Pattern IRI_PATTERN = Pattern
            .compile("[A-Za-z][A-Za-z0-9+.\\-]*://[^\\s<>\"{}|\\\\^`]+");

    private static final List<Namespace> STANDARD_NAMESPACES = ImmutableList.of(RDF.NS, RDFS.NS,
            OWL.NS, XSD.NS);

    private final Map<String, String> prefixToBase;

    private final List<Namespace> byDecreasingLength;

    private PrefixRegistry(final Map<String, String> prefixToBase) {
        this.prefixToBase = prefixToBase;
        final List<Namespace> namespaces = Lists.newArrayList();
        for (final Map.Entry<String, String> entry : prefixToBase.entrySet()) {
            namespaces.add(new NamespaceImpl(entry.getKey(), entry.getValue()));
        }
        this.byDecreasingLength = new Ordering<Namespace>() {

            @Override
            public int compare(final Namespace left, final Namespace right) {
                final int result = right.getName().length() - left.getName().length();
                return result != 0 ? result : left.getPrefix().compareTo(right.getPrefix());
            }

        }.immutableSortedCopy(namespaces);
    }

    /**
     * Creates a registry for the namespaces specified, in addition to the standard ones. On
     * duplicate prefixes, the supplied namespaces take precedence.
     *
     * @param namespaces
     *            the namespaces, not null
     * @return the created registry
     */
    public static PrefixRegistry create(final Iterable<? extends Namespace> namespaces) {
        final Map<String, String> map = Maps.newLinkedHashMap();
        for (final Namespace namespace : STANDARD_NAMESPACES) {
            map.put(namespace.getPrefix(), namespace.getName());
        }
        for (final Namespace namespace : namespaces) {
            map.put(namespace.getPrefix(), namespace.getName());
        }
        return new PrefixRegistry(map);
    }

    /**
     * Returns true if the string supplied is syntactically an identifier, i.e., either a CURIE
     * or an absolute IRI between angle brackets, as opposed to a label.
     *
     * @param string
     *            the string to test
     * @return true if the string is an identifier
     */
    public static boolean isIdentifier(@Nullable final String string) {
        if (string == null) {
            return false;
        }
        if (string.startsWith("<") && string.endsWith(">") && string.length() > 2) {
            return true;
        }
        return CURIE_PATTERN.matcher(string).matches();
    }

    /**
     * Returns the canonical compact form of an identifier. Absolute IRIs (with or without angle
     * brackets) are compacted using the longest matching namespace; if none matches, the IRI is
     * returned between angle brackets. Without brackets, only a whole {@code scheme://...}
     * string with no whitespace counts as an IRI, so labels mentioning a URL are returned
     * unchanged, as are CURIEs.
     *
     * @param id
     *            the identifier
     * @return the canonical form of the identifier
     */
    public String compact(final String id) {
        Preconditions.checkNotNull(id);
        String iri;
        if (id.startsWith("<") && id.endsWith(">")) {
            iri = id.substring(1, id.length() - 1);
        } else if (IRI_PATTERN.matcher(id).matches()) {
            iri = id;
        } else {
            return id;
        }
        for (final Namespace namespace : this.byDecreasingLength) {
            if (iri.startsWith(namespace.getName())) {
                return namespace.getPrefix() + ":" + iri.substring(namespace.getName().length());
            }
        }
        return "<" + iri + ">";
    }

    /**
     * Returns the absolute IRI of a compact identifier.
     *
     * @param id
     *            a CURIE or an IRI between angle brackets
     * @return the absolute IRI, without angle brackets
     * @throws IllegalArgumentException
     *             if the prefix of the CURIE is not registered, or the result is not a valid IRI
     */
    public String expand(final String id) {
        Preconditions.checkNotNull(id);
        final String iri;
        if (id.startsWith("<") && id.endsWith(">")) {
            iri = id.substring(1, id.length() - 1);
        } else {
            final int index = id.indexOf(':');
            Preconditions.checkArgument(index > 0, "Not a compact identifier: %s", id);
            final String base = this.prefixToBase.get(id.substring(0, index));
            Preconditions.checkArgument(base != null, "Prefix '%s' is not defined",
                    id.substring(0, index));
            iri = base + id.substring(index + 1);
        }
        return new URIImpl(iri).stringValue();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + this.prefixToBase;
    }

}
