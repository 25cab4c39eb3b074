package eu.fbk.ontomodule.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

/**
 * Constants for the RDF vocabulary, in compact form.
 */
public final class RDF {

    /** Recommended prefix for the vocabulary namespace: "rdf". */
    public static final String PREFIX = "rdf";

    /** Vocabulary namespace: "http://www.w3.org/1999/02/22-rdf-syntax-ns#". */
    public static final String NAMESPACE = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // PROPERTIES

    /** Property rdf:type. */
    public static final String TYPE = PREFIX + ":type";

    private RDF() {
    }

}
