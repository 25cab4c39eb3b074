package eu.fbk.ontomodule.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

/**
 * Constants for the Information Artifact Ontology terms used when stamping extracted modules.
 *
 * @see <a href="http://purl.obolibrary.org/obo/iao.owl">IAO</a>
 */
public final class IAO {

    /** Recommended prefix for the vocabulary namespace: "IAO". */
    public static final String PREFIX = "IAO";

    /** Vocabulary namespace: "http://purl.obolibrary.org/obo/IAO_". */
    public static final String NAMESPACE = "http://purl.obolibrary.org/obo/IAO_";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    /** Annotation property IAO:0000412 ('imported from'). */
    public static final String IMPORTED_FROM = PREFIX + ":0000412";

    private IAO() {
    }

}
