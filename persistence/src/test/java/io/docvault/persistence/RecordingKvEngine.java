package io.docvault.persistence;

import io.docvault.storage.AsyncCursor;
import io.docvault.storage.KvDatabase;
import io.docvault.storage.KvEngine;
import io.docvault.storage.KvEngineException;
import io.docvault.storage.KvRecord;
import io.docvault.storage.KvStore;
import io.docvault.storage.KvTransaction;
import io.docvault.storage.TxMode;
import io.docvault.storage.UpgradeHandler;
import io.docvault.storage.VersionChangeListener;
import org.jetbrains.annotations.Nullable;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test engine decorator: counts every call that reaches the engine and
 * injects failures on demand.
 */
final class RecordingKvEngine implements KvEngine {
    final KvEngine delegate;

    final AtomicInteger opens = new AtomicInteger();
    final AtomicInteger upgrades = new AtomicInteger();
    final AtomicInteger transactions = new AtomicInteger();
    final AtomicInteger cursors = new AtomicInteger();
    final AtomicInteger puts = new AtomicInteger();
    final AtomicInteger deletes = new AtomicInteger();
    final AtomicInteger commits = new AtomicInteger();
    final AtomicInteger aborts = new AtomicInteger();

    volatile boolean failOpen;
    volatile boolean failCursor;
    volatile boolean failCommit;
    /** Swallow upgrade callbacks, so stores are never created. */
    volatile boolean ignoreUpgrades;
    final Set<String> failPutKeys = ConcurrentHashMap.newKeySet();
    final Set<String> failDeleteKeys = ConcurrentHashMap.newKeySet();

    RecordingKvEngine(KvEngine delegate) {
        this.delegate = delegate;
    }

    int storeOperations() {
        return cursors.get() + puts.get() + deletes.get();
    }

    @Override
    public CompletableFuture<KvDatabase> open(String databaseName, @Nullable Integer version, UpgradeHandler onUpgrade) {
        opens.incrementAndGet();
        if (failOpen) {
            return CompletableFuture.failedFuture(new KvEngineException("injected open failure"));
        }
        UpgradeHandler counted = up -> {
            upgrades.incrementAndGet();
            if (!ignoreUpgrades) {
                onUpgrade.onUpgrade(up);
            }
        };
        return delegate.open(databaseName, version, counted).thenApply(Db::new);
    }

    @Override
    public void close() {
        delegate.close();
    }

    private final class Db implements KvDatabase {
        private final KvDatabase db;

        Db(KvDatabase db) {
            this.db = db;
        }

        @Override public String name() { return db.name(); }

        @Override public int version() { return db.version(); }

        @Override public Set<String> storeNames() { return db.storeNames(); }

        @Override public String keyField(String storeName) { return db.keyField(storeName); }

        @Override
        public KvTransaction transaction(String storeName, TxMode mode) {
            transactions.incrementAndGet();
            return new Tx(db.transaction(storeName, mode));
        }

        @Override
        public void onVersionChange(VersionChangeListener listener) {
            db.onVersionChange((h, oldVersion, newVersion) -> listener.onVersionChange(this, oldVersion, newVersion));
        }

        @Override public boolean isClosed() { return db.isClosed(); }

        @Override public void close() { db.close(); }
    }

    private final class Tx implements KvTransaction {
        private final KvTransaction tx;
        private final KvStore store;

        Tx(KvTransaction tx) {
            this.tx = tx;
            this.store = new Store(tx.store());
        }

        @Override public TxMode mode() { return tx.mode(); }

        @Override public KvStore store() { return store; }

        @Override
        public CompletableFuture<Void> commit() {
            commits.incrementAndGet();
            if (failCommit) {
                tx.abort();
                return CompletableFuture.failedFuture(new KvEngineException("injected commit failure"));
            }
            return tx.commit();
        }

        @Override
        public void abort() {
            aborts.incrementAndGet();
            tx.abort();
        }

        @Override public boolean isActive() { return tx.isActive(); }
    }

    private final class Store implements KvStore {
        private final KvStore store;

        Store(KvStore store) {
            this.store = store;
        }

        @Override public String name() { return store.name(); }

        @Override public String keyField() { return store.keyField(); }

        @Override
        public CompletableFuture<Void> put(String key, byte[] value) {
            puts.incrementAndGet();
            if (failPutKeys.contains(key)) {
                return CompletableFuture.failedFuture(new KvEngineException("injected put failure: " + key));
            }
            return store.put(key, value);
        }

        @Override
        public CompletableFuture<Void> delete(String key) {
            deletes.incrementAndGet();
            if (failDeleteKeys.contains(key)) {
                return CompletableFuture.failedFuture(new KvEngineException("injected delete failure: " + key));
            }
            return store.delete(key);
        }

        @Override public CompletableFuture<byte[]> get(String key) { return store.get(key); }

        @Override
        public AsyncCursor<KvRecord> openCursor() {
            cursors.incrementAndGet();
            if (failCursor) {
                return () -> CompletableFuture.failedFuture(new KvEngineException("injected cursor failure"));
            }
            return store.openCursor();
        }
    }
}
