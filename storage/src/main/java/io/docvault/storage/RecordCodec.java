// file: storage/src/main/java/io/docvault/storage/RecordCodec.java
package io.docvault.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records. One record holds one committed write transaction.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xD0C5   (helps detect garbage)
 *     - version (1B)  = 1        (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - store:     int32 len + UTF-8 bytes
 *     - count:     int32 number of mutations
 *         repeated count times:
 *           - key:       int32 len + UTF-8 bytes
 *           - tombstone: byte (0 or 1)
 *           - value:     int32 len + bytes (len == -1 => null, i.e. delete)
 * <p>
 * A batch is either fully present (valid header and CRC) or ignored, which is
 * what makes a commit atomic across a crash.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xD0C5;
    static final byte  VERSION = 1;
    static final int   HEADER_BYTES = 2 + 1 + 4 + 4;

    /** Immutable view of a decoded commit. */
    record CommitRecord(String storeName, List<Mutation> mutations) {}

    private RecordCodec() {
    }

    /** Encode a commit into header+payload bytes ready for append. */
    static byte[] encode(String storeName, List<Mutation> mutations) {
        byte[] payload = encodePayload(storeName, mutations);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static CommitRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        String store = readString(b);
        int count = b.getInt();
        if (count < 0) throw new IllegalArgumentException("negative mutation count " + count);
        List<Mutation> mutations = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String key = readString(b);
            boolean tombstone = b.get() != 0;
            byte[] value = readBytes(b);
            mutations.add(tombstone ? Mutation.delete(key) : Mutation.put(key, value));
        }
        return new CommitRecord(store, List.copyOf(mutations));
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(String storeName, List<Mutation> mutations) {
        byte[] sStore = storeName.getBytes(StandardCharsets.UTF_8);
        List<byte[]> keys = new ArrayList<>(mutations.size());

        int size = 4 + sStore.length + 4;
        for (Mutation m : mutations) {
            byte[] k = m.key().getBytes(StandardCharsets.UTF_8);
            keys.add(k);
            byte[] v = m.value();
            size += 4 + k.length;                  // key
            size += 1;                             // tombstone
            size += 4 + (v == null ? 0 : v.length); // value
        }

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        writeBytes(b, sStore);
        b.putInt(mutations.size());
        for (int i = 0; i < mutations.size(); i++) {
            Mutation m = mutations.get(i);
            writeBytes(b, keys.get(i));
            b.put((byte) (m.tombstone() ? 1 : 0));
            writeBytes(b, m.value());
        }
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        if (data == null) { b.putInt(-1); return; }
        b.putInt(data.length).put(data);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len == -1) return null;
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static String readString(ByteBuffer b) {
        byte[] s = readBytes(b);
        if (s == null) throw new NullPointerException("Bytes read are null");
        return new String(s, StandardCharsets.UTF_8);
    }
}
