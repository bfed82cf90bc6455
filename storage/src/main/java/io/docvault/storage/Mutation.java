// file: storage/src/main/java/io/docvault/storage/Mutation.java
package io.docvault.storage;

import java.util.Arrays;
import java.util.Objects;

/**
 * One buffered write: a put (value present) or a delete (tombstone, value null).
 * <p>
 * Invariants:
 *  - tombstone == (value == null)
 *  - value bytes are copied on input and output.
 */
public final class Mutation {
    private final String key;
    private final byte[] value;
    private final boolean tombstone;

    private Mutation(String key, byte[] value, boolean tombstone) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = value == null ? null : Arrays.copyOf(value, value.length);
        this.tombstone = tombstone;
    }

    public static Mutation put(String key, byte[] value) {
        return new Mutation(key, Objects.requireNonNull(value, "value"), false);
    }

    public static Mutation delete(String key) {
        return new Mutation(key, null, true);
    }

    public String key() { return key; }

    public byte[] value() { return value == null ? null : Arrays.copyOf(value, value.length); }

    public boolean tombstone() { return tombstone; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mutation)) return false;
        Mutation m = (Mutation) o;
        return tombstone == m.tombstone && key.equals(m.key) && Arrays.equals(value, m.value);
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return tombstone ? "delete(" + key + ")" : "put(" + key + ", " + value.length + " bytes)";
    }
}
