package eu.fbk.ontomodule.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

/**
 * Constants for the OWL vocabulary, in compact form.
 */
public final class OWL {

    /** Recommended prefix for the vocabulary namespace: "owl". */
    public static final String PREFIX = "owl";

    /** Vocabulary namespace: "http://www.w3.org/2002/07/owl#". */
    public static final String NAMESPACE = "http://www.w3.org/2002/07/owl#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // CLASSES

    /** Class owl:Thing. */
    public static final String THING = PREFIX + ":Thing";

    /** Class owl:Class. */
    public static final String CLASS = PREFIX + ":Class";

    /** Class owl:AnnotationProperty. */
    public static final String ANNOTATION_PROPERTY = PREFIX + ":AnnotationProperty";

    /** Class owl:DatatypeProperty. */
    public static final String DATATYPE_PROPERTY = PREFIX + ":DatatypeProperty";

    /**
     * Non-standard owl:DataProperty, found in statement tables produced by some converters and
     * handled as a synonym of {@link #DATATYPE_PROPERTY}.
     */
    public static final String DATA_PROPERTY = PREFIX + ":DataProperty";

    /** Class owl:ObjectProperty. */
    public static final String OBJECT_PROPERTY = PREFIX + ":ObjectProperty";

    /** Class owl:NamedIndividual. */
    public static final String NAMED_INDIVIDUAL = PREFIX + ":NamedIndividual";

    private OWL() {
    }

}
