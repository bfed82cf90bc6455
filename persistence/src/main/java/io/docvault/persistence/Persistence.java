// file: persistence/src/main/java/io/docvault/persistence/Persistence.java
package io.docvault.persistence;

import io.docvault.core.Document;
import io.docvault.core.IndexEngine;
import io.docvault.storage.KvEngine;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Durable backing of one collection: load on startup, incremental deltas while
 * running, full compaction on demand. The engine stays owned by the caller.
 */
public final class Persistence implements AutoCloseable {
    private final PersistenceConfig config;
    private final StoreConnector connector;
    private final Loader loader;
    private final IncrementalPersister persister;
    private final Compactor compactor;

    public Persistence(PersistenceConfig config, KvEngine engine, IndexEngine index) {
        this(config, engine, index, new DocumentCodec());
    }

    public Persistence(PersistenceConfig config, KvEngine engine, IndexEngine index, DocumentCodec codec) {
        this.config = config;
        this.connector = new StoreConnector(engine, config.maxUpgradeAttempts());
        TransactionRunner runner = new TransactionRunner(connector, config.databaseName(), config.storeName());
        this.loader = new Loader(config, runner, index, codec);
        this.persister = new IncrementalPersister(config, runner, codec);
        this.compactor = new Compactor(config, runner, index, codec);
    }

    public PersistenceConfig config() {
        return config;
    }

    public CompletableFuture<Integer> loadDatabase() {
        return loader.loadDatabase();
    }

    public CompletableFuture<PersistOutcome> persistNewState(List<Document> deltaDocs) {
        return persister.persistNewState(deltaDocs);
    }

    public CompletableFuture<PersistOutcome> persistCachedDatabase() {
        return compactor.persistCachedDatabase();
    }

    @Override
    public void close() {
        connector.close();
    }
}
