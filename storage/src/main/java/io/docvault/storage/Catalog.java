// file: storage/src/main/java/io/docvault/storage/Catalog.java
package io.docvault.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Schema of a file-backed database, stored as "catalog.json":
 * <pre>
 * { "version": 2, "stores": { "docs": "id" } }
 * </pre>
 * Written to a temp file, fsynced and moved into place atomically.
 */
public class Catalog {
    static final String FILE_NAME = "catalog.json";
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public int version;
    public Map<String, String> stores = new LinkedHashMap<>();

    public Catalog() {
    }

    Catalog(int version, Map<String, String> stores) {
        this.version = version;
        this.stores = new LinkedHashMap<>(stores);
    }

    static @Nullable Catalog readIfExists(Path databaseDir) {
        Path file = databaseDir.resolve(FILE_NAME);
        if (!Files.exists(file)) {
            return null;
        }
        try {
            Catalog c = MAPPER.readValue(file.toFile(), Catalog.class);
            if (c.version < 1) throw new KvEngineException("invalid catalog version " + c.version + " in " + file);
            if (c.stores == null) c.stores = new LinkedHashMap<>();
            return c;
        } catch (IOException e) {
            throw new KvEngineException("Failed to load catalog from " + file, e);
        }
    }

    void write(Path databaseDir) {
        Path file = databaseDir.resolve(FILE_NAME);
        Path tmp = databaseDir.resolve(FILE_NAME + ".tmp");
        try {
            Files.createDirectories(databaseDir);
            ByteBuffer bytes = ByteBuffer.wrap(MAPPER.writeValueAsBytes(this));
            try (FileChannel ch = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
                while (bytes.hasRemaining()) {
                    ch.write(bytes);
                }
                ch.force(true);
            }
            Files.move(tmp, file, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new KvEngineException("Failed to write catalog to " + file, e);
        }
        FileSnapshotter.syncDirectory(databaseDir);
    }
}
