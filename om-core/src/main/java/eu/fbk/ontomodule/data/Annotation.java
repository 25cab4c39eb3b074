package eu.fbk.ontomodule.data;

import java.io.IOException;
import java.io.Serializable;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The reified qualifiers attached to a {@link Fact}.
 * <p>
 * An {@code Annotation} maps each qualifier predicate to an ordered list of {@link Entry}
 * objects, each carrying an object, its datatype and possibly a further nested
 * {@code Annotation}. Instances are immutable. In LDTab statement tables annotations are
 * serialized as JSON objects of the form
 * <tt>{"predicate": [{"object": ..., "datatype": ..., "annotation": {...}}]}</tt>, which is the
 * format accepted by {@link #parse(String)} and produced by {@link #toJSON()}. The parsed JSON
 * tree is retained as is, so other keys (e.g., {@code "meta": "owl:Axiom"}) and JSON-valued
 * objects (datatype {@code _JSON}) survive a parse and serialize cycle.
 * </p>
 */
public final class Annotation implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectNode node;

    private final ImmutableMap<String, ImmutableList<Entry>> entries;

    private Annotation(final ObjectNode node) {
        final ImmutableMap.Builder<String, ImmutableList<Entry>> builder = ImmutableMap.builder();
        final Iterator<Map.Entry<String, JsonNode>> i = node.fields();
        while (i.hasNext()) {
            final Map.Entry<String, JsonNode> field = i.next();
            final ImmutableList.Builder<Entry> list = ImmutableList.builder();
            // values other than arrays of objects are only kept in the JSON tree
            for (final JsonNode item : field.getValue()) {
                if (item.isObject()) {
                    list.add(new Entry((ObjectNode) item));
                }
            }
            builder.put(field.getKey(), list.build());
        }
        this.node = node;
        this.entries = builder.build();
    }

    /**
     * Creates an annotation with the predicate-to-entries mapping specified.
     *
     * @param entries
     *            the entries, not null; iteration order is preserved
     * @return the created annotation
     */
    public static Annotation create(final Map<String, ? extends List<Entry>> entries) {
        final ObjectNode node = MAPPER.createObjectNode();
        for (final Map.Entry<String, ? extends List<Entry>> entry : entries.entrySet()) {
            final ArrayNode array = node.putArray(entry.getKey());
            for (final Entry item : entry.getValue()) {
                array.add(item.node.deepCopy());
            }
        }
        return new Annotation(node);
    }

    /**
     * Parses the JSON serialization of an annotation.
     *
     * @param json
     *            the JSON string, possibly null or empty
     * @return the parsed annotation, or null if the string is null or empty
     * @throws IllegalArgumentException
     *             if the string is not a JSON object in the expected format
     */
    @Nullable
    public static Annotation parse(@Nullable final String json) {
        if (json == null || json.trim().isEmpty()) {
            return null;
        }
        final JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (final IOException ex) {
            throw new IllegalArgumentException("Invalid annotation JSON: " + json, ex);
        }
        Preconditions.checkArgument(node != null && node.isObject(),
                "Expected JSON object, got %s", json);
        return new Annotation((ObjectNode) node);
    }

    /**
     * Returns the qualifier predicates of this annotation, in their original order.
     *
     * @return an immutable set of predicate identifiers
     */
    public Set<String> getPredicates() {
        return this.entries.keySet();
    }

    /**
     * Returns the entries for the predicate specified.
     *
     * @param predicate
     *            the predicate
     * @return an immutable list of entries, empty if the predicate is not used
     */
    public List<Entry> get(final String predicate) {
        return MoreObjects.firstNonNull(this.entries.get(predicate), ImmutableList.<Entry>of());
    }

    /**
     * Returns the JSON serialization of this annotation, with keys in their original order.
     *
     * @return a JSON string
     */
    public String toJSON() {
        try {
            return MAPPER.writeValueAsString(this.node);
        } catch (final JsonProcessingException ex) {
            throw new IllegalStateException(ex);
        }
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Annotation)) {
            return false;
        }
        final Annotation other = (Annotation) object;
        return this.node.equals(other.node);
    }

    @Override
    public int hashCode() {
        return this.node.hashCode();
    }

    @Override
    public String toString() {
        return toJSON();
    }

    /**
     * A single qualifier value of an {@code Annotation}.
     */
    public static final class Entry implements Serializable {

        private static final long serialVersionUID = 1L;

        private final ObjectNode node;

        @Nullable
        private final Annotation annotation;

        public Entry(final String object, final String datatype,
                @Nullable final Annotation annotation) {
            this(newNode(object, datatype, annotation));
        }

        Entry(final ObjectNode node) {
            final JsonNode nested = node.get("annotation");
            this.node = node;
            this.annotation = nested != null && nested.isObject() ? new Annotation(
                    (ObjectNode) nested) : null;
        }

        private static ObjectNode newNode(final String object, final String datatype,
                @Nullable final Annotation annotation) {
            final ObjectNode node = MAPPER.createObjectNode();
            node.put("object", Preconditions.checkNotNull(object));
            node.put("datatype", Preconditions.checkNotNull(datatype));
            if (annotation != null) {
                node.set("annotation", annotation.node.deepCopy());
            }
            return node;
        }

        /**
         * Returns the object. A JSON-valued object (datatype {@code _JSON}) is returned in its
         * compact JSON serialization.
         *
         * @return the object, empty if missing
         */
        public String getObject() {
            final JsonNode object = this.node.path("object");
            return object.isValueNode() ? object.asText() : object.isMissingNode() ? ""
                    : object.toString();
        }

        public String getDatatype() {
            return this.node.path("datatype").asText();
        }

        /**
         * Returns a key of the entry other than object, datatype and annotation, such as LDTab's
         * {@code meta}.
         *
         * @param key
         *            the key
         * @return its textual value, or null if absent
         */
        @Nullable
        public String getProperty(final String key) {
            final JsonNode value = this.node.get(key);
            return value == null || value.isNull() ? null : value.isValueNode() ? value.asText()
                    : value.toString();
        }

        @Nullable
        public Annotation getAnnotation() {
            return this.annotation;
        }

        @Override
        public boolean equals(final Object object) {
            if (object == this) {
                return true;
            }
            if (!(object instanceof Entry)) {
                return false;
            }
            return this.node.equals(((Entry) object).node);
        }

        @Override
        public int hashCode() {
            return this.node.hashCode();
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("object", getObject())
                    .add("datatype", getDatatype()).add("annotation", this.annotation)
                    .toString();
        }

    }

}
