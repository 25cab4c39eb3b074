package eu.fbk.ontomodule.data;

import java.io.Serializable;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;

/**
 * A row of an LDTab statement table.
 * <p>
 * A {@code Fact} has the fixed 8-field schema of statement tables: an assertion and a retraction
 * flag, a graph identifier, subject, predicate and object, the object datatype and an optional
 * {@link Annotation} holding reified qualifiers. The datatype tells how the object should be
 * interpreted: {@link #IRI} for IRI-valued objects, {@link #JSON} for nested structures (e.g.,
 * anonymous class expressions), and a language or datatype tag (e.g., {@code xsd:string},
 * {@code @en}) for literals.
 * </p>
 * <p>
 * Facts are immutable and totally ordered on all their fields, so that collections of facts can
 * be emitted in a deterministic order.
 * </p>
 */
public final class Fact implements Comparable<Fact>, Serializable {

    /** Datatype marker of IRI-valued objects. */
    public static final String IRI = "_IRI";

    /** Datatype marker of nested-structure objects. */
    public static final String JSON = "_JSON";

    /** Graph identifier assigned to synthesized facts. */
    public static final String DEFAULT_GRAPH = "graph";

    private static final long serialVersionUID = 1L;

    private static final Ordering<String> NULLS_FIRST = Ordering.<String>natural().nullsFirst();

    private final int assertion;

    private final int retraction;

    private final String graph;

    private final String subject;

    private final String predicate;

    private final String object;

    private final String datatype;

    @Nullable
    private final Annotation annotation;

    private Fact(final int assertion, final int retraction, final String graph,
            final String subject, final String predicate, final String object,
            final String datatype, @Nullable final Annotation annotation) {
        this.assertion = assertion;
        this.retraction = retraction;
        this.graph = Preconditions.checkNotNull(graph);
        this.subject = Preconditions.checkNotNull(subject);
        this.predicate = Preconditions.checkNotNull(predicate);
        this.object = Preconditions.checkNotNull(object);
        this.datatype = Preconditions.checkNotNull(datatype);
        this.annotation = annotation;
    }

    /**
     * Creates a fact with all the fields specified.
     *
     * @param assertion
     *            the assertion flag
     * @param retraction
     *            the retraction flag
     * @param graph
     *            the graph identifier
     * @param subject
     *            the subject identifier
     * @param predicate
     *            the predicate identifier
     * @param object
     *            the object, whose interpretation depends on the datatype
     * @param datatype
     *            the datatype
     * @param annotation
     *            the optional annotation
     * @return the created fact
     */
    public static Fact create(final int assertion, final int retraction, final String graph,
            final String subject, final String predicate, final String object,
            final String datatype, @Nullable final Annotation annotation) {
        return new Fact(assertion, retraction, graph, subject, predicate, object, datatype,
                annotation);
    }

    /**
     * Creates an asserted, non-annotated fact in the {@link #DEFAULT_GRAPH}.
     *
     * @param subject
     *            the subject identifier
     * @param predicate
     *            the predicate identifier
     * @param object
     *            the object
     * @param datatype
     *            the datatype
     * @return the created fact
     */
    public static Fact create(final String subject, final String predicate, final String object,
            final String datatype) {
        return new Fact(1, 0, DEFAULT_GRAPH, subject, predicate, object, datatype, null);
    }

    public int getAssertion() {
        return this.assertion;
    }

    public int getRetraction() {
        return this.retraction;
    }

    public String getGraph() {
        return this.graph;
    }

    public String getSubject() {
        return this.subject;
    }

    public String getPredicate() {
        return this.predicate;
    }

    public String getObject() {
        return this.object;
    }

    public String getDatatype() {
        return this.datatype;
    }

    @Nullable
    public Annotation getAnnotation() {
        return this.annotation;
    }

    /**
     * Returns true if the object is an IRI (compact or absolute).
     *
     * @return true, for IRI-valued facts
     */
    public boolean isIRI() {
        return IRI.equals(this.datatype);
    }

    /**
     * Returns true if the object is a nested structure, such as an anonymous class expression.
     *
     * @return true, for structure-valued facts
     */
    public boolean isStructured() {
        return JSON.equals(this.datatype);
    }

    /**
     * Returns true if the object is a literal value.
     *
     * @return true, if the fact is neither IRI-valued nor structure-valued
     */
    public boolean isLiteral() {
        return !isIRI() && !isStructured();
    }

    /**
     * Returns a fact with the same assertion flag, graph, subject, object and datatype of this
     * fact, but with a different predicate and without annotation.
     *
     * @param predicate
     *            the new predicate
     * @return the new fact
     */
    public Fact withPredicate(final String predicate) {
        return new Fact(this.assertion, 0, this.graph, this.subject, predicate, this.object,
                this.datatype, null);
    }

    @Override
    public int compareTo(final Fact other) {
        return ComparisonChain.start() //
                .compare(this.subject, other.subject) //
                .compare(this.predicate, other.predicate) //
                .compare(this.object, other.object) //
                .compare(this.datatype, other.datatype) //
                .compare(this.graph, other.graph) //
                .compare(this.assertion, other.assertion) //
                .compare(this.retraction, other.retraction) //
                .compare(this.annotation == null ? null : this.annotation.toJSON(),
                        other.annotation == null ? null : other.annotation.toJSON(), NULLS_FIRST)
                .result();
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Fact)) {
            return false;
        }
        final Fact other = (Fact) object;
        return this.assertion == other.assertion && this.retraction == other.retraction
                && this.graph.equals(other.graph) && this.subject.equals(other.subject)
                && this.predicate.equals(other.predicate) && this.object.equals(other.object)
                && this.datatype.equals(other.datatype)
                && Objects.equal(this.annotation, other.annotation);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.assertion, this.retraction, this.graph, this.subject,
                this.predicate, this.object, this.datatype, this.annotation);
    }

    @Override
    public String toString() {
        return this.subject + " " + this.predicate + " " + this.object + " (" + this.datatype
                + ")";
    }

}
