// file: storage/src/main/java/io/docvault/storage/InMemoryKvEngine.java
package io.docvault.storage;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Engine whose databases live only as long as the engine instance.
 * Useful for tests and for collections that must not touch the disk.
 */
public final class InMemoryKvEngine extends AbstractKvEngine {

    public InMemoryKvEngine() {
        this(Duration.ofSeconds(30));
    }

    public InMemoryKvEngine(Duration writeWait) {
        super(writeWait);
    }

    @Override
    DatabaseState recover(String databaseName) {
        return new DatabaseState(databaseName);
    }

    @Override
    void persistSchema(DatabaseState state, int newVersion, Map<String, String> storeKeyFields) {
        // nothing to make durable
    }

    @Override
    void logCommit(DatabaseState state, String storeName, List<Mutation> batch) {
        // nothing to make durable
    }

    @Override
    void committed(DatabaseState state) {
    }

    @Override
    void closeResources() {
    }
}
