// file: storage/src/main/java/io/docvault/storage/FileWal.java
package io.docvault.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - cuts off a torn tail left by a crash, so new records follow the last
 *        valid one instead of garbage,
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - Reader:
 *      - walks all segments oldest first,
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final String FIRST_SEGMENT = "00000001.log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new KvEngineException("cannot create WAL dir " + dir, e); }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new KvEngineException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            String next = String.format("%08d.log", Integer.parseInt(
                    current.getFileName().toString().replace(".log", "")) + 1);
            current = dir.resolve(next);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) { throw new KvEngineException("WAL rotation failed", e); }
    }

    @Override
    public synchronized void reset() {
        try {
            ch.close();
            for (Path seg : segments(dir)) {
                Files.deleteIfExists(seg);
            }
            current = dir.resolve(FIRST_SEGMENT);
            ch = FileChannel.open(current, CREATE, WRITE, READ, TRUNCATE_EXISTING);
            ch.force(true);
            writtenInSegment = 0;
        } catch (IOException e) { throw new KvEngineException("WAL reset failed", e); }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public synchronized void close() {
        try {
            if (ch != null && ch.isOpen()) ch.close();
        } catch (IOException e) {
            throw new KvEngineException("WAL close failed", e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one, truncate it to its
     *    last valid record and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments(dir);
            current = segs.isEmpty() ? dir.resolve(FIRST_SEGMENT) : segs.get(segs.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validPrefix(ch);
            if (valid < ch.size()) {
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) { throw new KvEngineException("cannot open WAL in " + dir, e); }
    }

    static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new KvEngineException("cannot list WAL segments in " + dir, e);
        }
    }

    /** Length of the leading run of well-formed records. */
    private static long validPrefix(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] payload = readRecord(ch, pos);
            if (payload == null) return pos;
            pos += RecordCodec.HEADER_BYTES + payload.length;
        }
    }

    /** Payload of the record starting at {@code pos}, or null at EOF / on a damaged record. */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read <= 0) return null; // EOF or empty
        if (read < RecordCodec.HEADER_BYTES) return null; // truncated header at tail, stop
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
        if (pos + RecordCodec.HEADER_BYTES + len > ch.size()) return null; // truncated payload, stop
        ByteBuffer payload = ByteBuffer.allocate(len);
        int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
        if (r2 < len) return null;
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return null; // bad tail, stop
        return bytes;
    }

    /**
     * Sequential reader for WAL segments used during recovery.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int index = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null) {
                        if (++index >= segments.size()) { stopped = true; return null; }
                        ch = FileChannel.open(segments.get(index), READ);
                        pos = 0;
                    }
                    byte[] bytes = readRecord(ch, pos);
                    if (bytes != null) {
                        pos += RecordCodec.HEADER_BYTES + bytes.length;
                        return bytes;
                    }
                    boolean cleanEnd = pos == ch.size();
                    ch.close();
                    ch = null;
                    if (!cleanEnd) { stopped = true; return null; } // damaged record: nothing after it is trusted
                }
            } catch (IOException e) {
                throw new KvEngineException("WAL read failed", e);
            }
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new KvEngineException("WAL reader close failed", e);
            }
        }
    }
}
