package eu.fbk.ontomodule.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

/**
 * Constants for the RDF Schema vocabulary, in compact form.
 */
public final class RDFS {

    /** Recommended prefix for the vocabulary namespace: "rdfs". */
    public static final String PREFIX = "rdfs";

    /** Vocabulary namespace: "http://www.w3.org/2000/01/rdf-schema#". */
    public static final String NAMESPACE = "http://www.w3.org/2000/01/rdf-schema#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // PROPERTIES

    /** Property rdfs:subClassOf. */
    public static final String SUB_CLASS_OF = PREFIX + ":subClassOf";

    /** Property rdfs:subPropertyOf. */
    public static final String SUB_PROPERTY_OF = PREFIX + ":subPropertyOf";

    /** Property rdfs:label. */
    public static final String LABEL = PREFIX + ":label";

    /** Property rdfs:comment. */
    public static final String COMMENT = PREFIX + ":comment";

    private RDFS() {
    }

}
