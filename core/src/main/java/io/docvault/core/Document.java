// file: core/src/main/java/io/docvault/core/Document.java
package io.docvault.core;

import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, ordered mapping of field names to JSON-compatible values.
 * <p>
 * Three shapes travel through the persistence layer:
 *  - plain documents: carry a non-blank String "id" which is the durable store key,
 *  - tombstones:      document-shaped records with "$$deleted": true,
 *  - metadata markers: records with "$$indexCreated" or "$$indexRemoved"
 *                     describing index lifecycle events (no "id" required).
 * <p>
 * Invariants:
 *  - Field order is preserved exactly as given.
 *  - The field map is copied on construction and never exposed mutably.
 *  - Every record that is not a metadata marker has a non-blank String id.
 *  - Values are JSON values, held in the form they take after a round trip
 *    through JSON, so a stored document reads back equal:
 *      - null, String, Boolean,
 *      - integral numbers as Integer, else Long, else BigInteger (smallest that fits),
 *      - finite Float/Double as Double (a Float keeps its decimal rendering),
 *      - Character as a one-letter String,
 *      - Collection as an unmodifiable List, Map with String keys as an
 *        unmodifiable ordered Map, both converted element by element.
 *    Anything else (dates, BigDecimal, arrays, beans, NaN) is rejected with
 *    IllegalArgumentException.
 */
public final class Document {
    public static final String ID_FIELD = "id";
    public static final String DELETED_FLAG = "$$deleted";
    public static final String INDEX_CREATED_FLAG = "$$indexCreated";
    public static final String INDEX_REMOVED_FLAG = "$$indexRemoved";

    private final Map<String, Object> fields;

    public Document(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        this.fields = jsonObject("", fields);

        if (kind() != DocumentKind.METADATA) {
            Object id = this.fields.get(ID_FIELD);
            if (!(id instanceof String) || ((String) id).isBlank()) {
                throw new IllegalArgumentException("document requires a non-blank String '" + ID_FIELD + "', got: " + id);
            }
        }
    }

    private static Map<String, Object> jsonObject(String path, Map<?, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getKey() instanceof String)) {
                throw new IllegalArgumentException("field names must be Strings, got " + e.getKey() + " in '" + path + "'");
            }
            String name = (String) e.getKey();
            out.put(name, jsonValue(path.isEmpty() ? name : path + "." + name, e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    private static @Nullable Object jsonValue(String path, @Nullable Object v) {
        if (v == null || v instanceof String || v instanceof Boolean) {
            return v;
        }
        if (v instanceof Character) {
            return v.toString();
        }
        if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
            return integral(BigInteger.valueOf(((Number) v).longValue()));
        }
        if (v instanceof BigInteger) {
            return integral((BigInteger) v);
        }
        if (v instanceof Double || v instanceof Float) {
            double d = v instanceof Float ? Double.parseDouble(v.toString()) : (Double) v;
            if (!Double.isFinite(d)) {
                throw new IllegalArgumentException("field '" + path + "' holds " + v + ", which has no JSON form");
            }
            return d;
        }
        if (v instanceof Map) {
            return jsonObject(path, (Map<?, ?>) v);
        }
        if (v instanceof Collection) {
            List<Object> out = new ArrayList<>();
            int i = 0;
            for (Object item : (Collection<?>) v) {
                out.add(jsonValue(path + "[" + i++ + "]", item));
            }
            return Collections.unmodifiableList(out);
        }
        throw new IllegalArgumentException("field '" + path + "' holds a " + v.getClass().getName()
                + ", which has no JSON form");
    }

    private static Object integral(BigInteger n) {
        if (n.bitLength() < Integer.SIZE) return n.intValue();
        if (n.bitLength() < Long.SIZE) return n.longValue();
        return n;
    }

    /**
     * Build a document from alternating name/value pairs:
     * {@code Document.of("id", "a", "name", "x")}.
     */
    public static Document of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected name/value pairs, got " + namesAndValues.length + " arguments");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            map.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return new Document(map);
    }

    /** Tombstone for the given id. */
    public static Document tombstone(String id) {
        return of(ID_FIELD, id, DELETED_FLAG, true);
    }

    /** Marker announcing a newly created index definition. */
    public static Document indexCreated(Map<String, ?> definition) {
        return of(INDEX_CREATED_FLAG, new LinkedHashMap<>(definition));
    }

    /** Marker announcing that the index on {@code fieldName} was dropped. */
    public static Document indexRemoved(String fieldName) {
        return of(INDEX_REMOVED_FLAG, fieldName);
    }

    /** Identifier, or null for metadata markers that carry none. */
    public @Nullable String id() {
        Object id = fields.get(ID_FIELD);
        return id instanceof String ? (String) id : null;
    }

    public @Nullable Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /** Unmodifiable view, in insertion order. */
    public Map<String, Object> fields() {
        return fields;
    }

    public DocumentKind kind() {
        if (Boolean.TRUE.equals(fields.get(DELETED_FLAG))) {
            return DocumentKind.TOMBSTONE;
        }
        if (fields.containsKey(INDEX_CREATED_FLAG) || fields.containsKey(INDEX_REMOVED_FLAG)) {
            return DocumentKind.METADATA;
        }
        return DocumentKind.DOCUMENT;
    }

    public boolean isTombstone() {
        return kind() == DocumentKind.TOMBSTONE;
    }

    public boolean isMetadataMarker() {
        return kind() == DocumentKind.METADATA;
    }

    /** Copy of this document with one field replaced (or appended). The id cannot be changed. */
    public Document with(String field, Object value) {
        if (ID_FIELD.equals(field) && !Objects.equals(value, fields.get(ID_FIELD))) {
            throw new IllegalArgumentException("document id is immutable");
        }
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new Document(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document)) return false;
        return fields.equals(((Document) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Document" + fields;
    }
}
