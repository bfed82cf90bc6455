// file: persistence/src/main/java/io/docvault/persistence/StoreConnector.java
package io.docvault.persistence;

import io.docvault.core.Document;
import io.docvault.storage.KvDatabase;
import io.docvault.storage.KvEngine;
import io.docvault.storage.UpgradeHandler;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Hands out open database handles that are guaranteed to contain a given store.
 * <p>
 * Semantics of ensureStore(db, store):
 *  1) Reuse the cached handle for (db, store) while it is open.
 *  2) Otherwise open the database at its current version (a fresh database is
 *     created at version 1, and that creation already adds the store).
 *  3) If the store is still missing, close the handle and reopen at version+1;
 *     the upgrade callback creates the store keyed by "id".
 *  4) Step 3 repeats at most {@code maxUpgradeAttempts} times.
 * <p>
 * Cached handles close themselves when another caller upgrades the database;
 * the next ensureStore() opens a fresh one. Every failure is reported as a
 * {@link ConnectionException}.
 */
public final class StoreConnector implements AutoCloseable {
    private static final Logger log = Logger.getLogger(StoreConnector.class.getName());

    private final KvEngine engine;
    private final int maxUpgradeAttempts;
    private final Map<StoreId, KvDatabase> handles = new ConcurrentHashMap<>();

    public record StoreId(String databaseName, String storeName) {
        public StoreId {
            Objects.requireNonNull(databaseName, "databaseName");
            Objects.requireNonNull(storeName, "storeName");
        }

        @Override
        public String toString() {
            return databaseName + "/" + storeName;
        }
    }

    public StoreConnector(KvEngine engine) {
        this(engine, PersistenceConfig.DEFAULT_MAX_UPGRADE_ATTEMPTS);
    }

    public StoreConnector(KvEngine engine, int maxUpgradeAttempts) {
        if (maxUpgradeAttempts <= 0) throw new IllegalArgumentException("maxUpgradeAttempts must be > 0");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.maxUpgradeAttempts = maxUpgradeAttempts;
    }

    public CompletableFuture<KvDatabase> ensureStore(String databaseName, String storeName) {
        StoreId id = new StoreId(databaseName, storeName);
        KvDatabase cached = handles.get(id);
        if (cached != null && !cached.isClosed()) {
            return CompletableFuture.completedFuture(cached);
        }
        return open(id, null, 0).thenApply(db -> remember(id, db));
    }

    private CompletableFuture<KvDatabase> open(StoreId id, @Nullable Integer version, int upgrades) {
        return engine.open(id.databaseName(), version, createStore(id))
                .exceptionallyCompose(err -> CompletableFuture.failedFuture(new ConnectionException(
                        "Error opening database " + id.databaseName(), AsyncSteps.unwrap(err))))
                .thenCompose(db -> {
                    if (db.storeNames().contains(id.storeName())) {
                        return checkKeyField(id, db);
                    }
                    int next = db.version() + 1;
                    db.close();
                    if (upgrades >= maxUpgradeAttempts) {
                        return CompletableFuture.failedFuture(new ConnectionException(
                                "store %s still missing after %d upgrade attempts".formatted(id, upgrades)));
                    }
                    log.info(() -> "store %s missing at v%d, reopening at v%d".formatted(id, next - 1, next));
                    return open(id, next, upgrades + 1);
                });
    }

    private static UpgradeHandler createStore(StoreId id) {
        return upgrade -> {
            if (!upgrade.containsStore(id.storeName())) {
                upgrade.createStore(id.storeName(), Document.ID_FIELD);
                log.info(() -> "created store %s (v%d -> v%d)".formatted(id, upgrade.oldVersion(), upgrade.newVersion()));
            }
        };
    }

    private static CompletableFuture<KvDatabase> checkKeyField(StoreId id, KvDatabase db) {
        String keyField = db.keyField(id.storeName());
        if (!Document.ID_FIELD.equals(keyField)) {
            db.close();
            return CompletableFuture.failedFuture(new ConnectionException(
                    "store %s is keyed by '%s', expected '%s'".formatted(id, keyField, Document.ID_FIELD)));
        }
        return CompletableFuture.completedFuture(db);
    }

    private KvDatabase remember(StoreId id, KvDatabase db) {
        db.onVersionChange((handle, oldVersion, newVersion) -> {
            handle.close();
            handles.remove(id, handle);
            log.info(() -> "closed handle on %s: database moving v%d -> v%d".formatted(id, oldVersion, newVersion));
        });
        KvDatabase previous = handles.put(id, db);
        if (previous != null && previous != db) {
            previous.close();
        }
        return db;
    }

    @Override
    public void close() {
        handles.values().forEach(KvDatabase::close);
        handles.clear();
    }
}
