// file: storage/src/main/java/io/docvault/storage/KvRecord.java
package io.docvault.storage;

import java.util.Arrays;
import java.util.Objects;

/**
 * Key and value as read through a cursor. The value bytes are copied in and out.
 */
public final class KvRecord {
    private final String key;
    private final byte[] value;

    public KvRecord(String key, byte[] value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Arrays.copyOf(value, value.length);
    }

    public String key() { return key; }

    public byte[] value() { return Arrays.copyOf(value, value.length); }

    @Override
    public String toString() {
        return "KvRecord[" + key + ", " + value.length + " bytes]";
    }
}
