package eu.fbk.ontomodule.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

/**
 * Constants for the XML Schema datatypes, in compact form.
 */
public final class XSD {

    /** Recommended prefix for the vocabulary namespace: "xsd". */
    public static final String PREFIX = "xsd";

    /** Vocabulary namespace: "http://www.w3.org/2001/XMLSchema#". */
    public static final String NAMESPACE = "http://www.w3.org/2001/XMLSchema#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    /** Datatype xsd:string. */
    public static final String STRING = PREFIX + ":string";

    private XSD() {
    }

}
