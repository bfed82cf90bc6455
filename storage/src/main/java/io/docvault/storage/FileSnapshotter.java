// file: storage/src/main/java/io/docvault/storage/FileSnapshotter.java
package io.docvault.storage;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int32 storeCount
 *   repeated 'storeCount' times:
 *     - store:  int32 len + UTF-8 bytes
 *     - count:  int32
 *         repeated 'count' times:
 *           - key:   int32 len + UTF-8 bytes
 *           - value: int32 len + bytes
 * <p>
 * Atomicity and durability:
 *   - We write to "snapshot-<seq>.bin.tmp" first and fsync it,
 *   - then move to "snapshot-<seq>.bin" using ATOMIC_MOVE and fsync the directory,
 *   - then delete older snapshots.
 * Once writeSnapshot() returns, the snapshot survives a power loss, so the
 * caller may discard the WAL it covers.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new KvEngineException("cannot create snapshot dir " + dir, e); }
    }

    @Override
    public String writeSnapshot(Map<String, Map<String, byte[]>> stores) {
        List<Path> existing = snapshots();
        long seq = existing.isEmpty() ? 1 : sequenceOf(existing.get(existing.size() - 1)) + 1;
        String name = String.format("%s%08d%s", PREFIX, seq, SUFFIX);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (FileChannel ch = FileChannel.open(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            var out = new DataOutputStream(new BufferedOutputStream(Channels.newOutputStream(ch)));
            out.writeInt(stores.size());
            for (Map.Entry<String, Map<String, byte[]>> s : stores.entrySet()) {
                writeString(out, s.getKey());
                out.writeInt(s.getValue().size());
                for (Map.Entry<String, byte[]> r : s.getValue().entrySet()) {
                    writeString(out, r.getKey());
                    writeBytes(out, r.getValue());
                }
            }
            out.flush();
            ch.force(true);
        } catch (IOException ex) { throw new KvEngineException("snapshot write failed: " + tmp, ex); }

        try { Files.move(tmp, dst, ATOMIC_MOVE); }
        catch (IOException e) { throw new KvEngineException("snapshot publish failed: " + dst, e); }
        syncDirectory(dir);

        for (Path old : existing) {
            try { Files.deleteIfExists(old); }
            catch (IOException e) { throw new KvEngineException("cannot delete old snapshot " + old, e); }
        }
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> all = snapshots();
        if (all.isEmpty()) return null;
        Path snap = all.get(all.size() - 1);

        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            int storeCount = in.readInt();
            Map<String, Map<String, byte[]>> stores = new LinkedHashMap<>();
            for (int i = 0; i < storeCount; i++) {
                String store = readString(in);
                int count = in.readInt();
                Map<String, byte[]> records = new TreeMap<>();
                for (int j = 0; j < count; j++) {
                    String key = readString(in);
                    records.put(key, readBytes(in));
                }
                stores.put(store, records);
            }
            return new LoadedSnapshot(snap.getFileName().toString(), stores);
        } catch (IOException e) { throw new KvEngineException("snapshot read failed: " + snap, e); }
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) { throw new KvEngineException("cannot list snapshots in " + dir, e); }
    }

    /**
     * fsync a directory so that renames and creations inside it are durable.
     * Platforms that cannot open a directory for reading fail here, which
     * callers treat as a failed snapshot.
     */
    static void syncDirectory(Path dir) {
        try (FileChannel ch = FileChannel.open(dir, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            throw new KvEngineException("cannot fsync directory " + dir, e);
        }
    }

    private static long sequenceOf(Path p) {
        String n = p.getFileName().toString();
        return Long.parseLong(n.substring(PREFIX.length(), n.length() - SUFFIX.length()));
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }
    private static String readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        byte[] b = in.readNBytes(len);
        if (b.length < len) throw new IOException("truncated snapshot");
        return new String(b, StandardCharsets.UTF_8);
    }
    private static void writeBytes(DataOutputStream out, byte[] v) throws IOException {
        out.writeInt(v.length); out.write(v);
    }
    private static byte[] readBytes(DataInputStream in) throws IOException {
        int len = in.readInt();
        byte[] b = in.readNBytes(len);
        if (b.length < len) throw new IOException("truncated snapshot");
        return b;
    }
}
