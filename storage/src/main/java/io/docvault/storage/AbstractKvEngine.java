// file: storage/src/main/java/io/docvault/storage/AbstractKvEngine.java
package io.docvault.storage;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Versioning, handle and transaction machinery shared by the bundled engines.
 * <p>
 * Subclasses decide where state lives through four hooks:
 *  - recover():       build the committed state of a database on first open,
 *  - persistSchema(): make a version upgrade durable before it becomes visible,
 *  - logCommit():     make a write batch durable before it is applied in memory,
 *  - committed():     runs after a batch was applied (e.g. snapshotting).
 * <p>
 * All engine calls complete synchronously; the futures exist so that callers
 * are written against an asynchronous contract.
 */
abstract class AbstractKvEngine implements KvEngine {
    private static final Logger log = Logger.getLogger(AbstractKvEngine.class.getName());
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Map<String, DatabaseState> databases = new HashMap<>();
    private final Duration writeWait;
    private volatile boolean closed;

    protected AbstractKvEngine(Duration writeWait) {
        this.writeWait = Objects.requireNonNull(writeWait, "writeWait");
        if (writeWait.isNegative()) throw new IllegalArgumentException("writeWait must be >= 0");
    }

    abstract DatabaseState recover(String databaseName);

    abstract void persistSchema(DatabaseState state, int newVersion, Map<String, String> storeKeyFields);

    abstract void logCommit(DatabaseState state, String storeName, List<Mutation> batch);

    abstract void committed(DatabaseState state);

    abstract void closeResources();

    @Override
    public CompletableFuture<KvDatabase> open(String databaseName, @Nullable Integer version, UpgradeHandler onUpgrade) {
        try {
            return CompletableFuture.completedFuture(openNow(databaseName, version, onUpgrade));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private KvDatabase openNow(String databaseName, @Nullable Integer version, UpgradeHandler onUpgrade) {
        requireOpen();
        checkName("database", databaseName);
        Objects.requireNonNull(onUpgrade, "onUpgrade");
        if (version != null && version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got " + version);
        }

        DatabaseState state;
        synchronized (databases) {
            state = databases.get(databaseName);
            if (state == null) {
                state = recover(databaseName);
                databases.put(databaseName, state);
            }
        }

        synchronized (state) {
            int current = state.version;
            int target = version != null ? version : Math.max(current, 1);
            if (target < current) {
                throw new KvVersionException(databaseName, target, current);
            }
            if (target > current) {
                upgrade(state, target, onUpgrade);
            }
            DatabaseHandle handle = new DatabaseHandle(this, state, state.version);
            state.handles.add(handle);
            return handle;
        }
    }

    private void upgrade(DatabaseState state, int target, UpgradeHandler onUpgrade) {
        int from = state.version;
        for (DatabaseHandle h : state.handles) {
            h.fireVersionChange(from, target);
        }

        StagedUpgrade staged = new StagedUpgrade(state, from, target);
        onUpgrade.onUpgrade(staged);

        Map<String, String> keyFields = new LinkedHashMap<>();
        state.stores.forEach((n, s) -> keyFields.put(n, s.keyField));
        keyFields.putAll(staged.created);
        persistSchema(state, target, keyFields);

        state.version = target;
        staged.created.forEach((n, kf) -> state.stores.put(n, new DatabaseState.StoreState(kf)));
        log.info(() -> "database %s upgraded v%d -> v%d%s".formatted(state.name, from, target,
                staged.created.isEmpty() ? "" : ", created stores " + staged.created.keySet()));
    }

    KvTransaction begin(DatabaseState state, String storeName, TxMode mode) {
        requireOpen();
        Objects.requireNonNull(mode, "mode");
        DatabaseState.StoreState store;
        synchronized (state) {
            store = state.stores.get(storeName);
        }
        if (store == null) {
            throw new KvEngineException("no store '" + storeName + "' in database " + state.name);
        }
        if (mode == TxMode.WRITE) {
            try {
                if (!state.writeSlot.tryAcquire(writeWait.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new KvEngineException("timed out after " + writeWait.toMillis()
                            + "ms waiting for the write transaction on " + state.name);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new KvEngineException("interrupted waiting for the write transaction on " + state.name, e);
            }
        }
        return new EngineTransaction(this, state, storeName, store, mode);
    }

    void applyCommit(DatabaseState state, String storeName, DatabaseState.StoreState store, List<Mutation> batch) {
        if (batch.isEmpty()) {
            return;
        }
        requireOpen();
        synchronized (state) {
            logCommit(state, storeName, batch);
            apply(store, batch);
            committed(state);
        }
    }

    static void apply(DatabaseState.StoreState store, List<Mutation> batch) {
        for (Mutation m : batch) {
            if (m.tombstone()) {
                store.records.remove(m.key());
            } else {
                store.records.put(m.key(), m.value());
            }
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        synchronized (databases) {
            for (DatabaseState state : databases.values()) {
                for (DatabaseHandle h : state.handles) {
                    h.close();
                }
            }
            databases.clear();
        }
        try {
            closeResources();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "failed to release engine resources", e);
        }
    }

    private void requireOpen() {
        if (closed) throw new KvEngineException("engine is closed");
    }

    static void checkName(String what, String name) {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid " + what + " name: " + name);
        }
    }

    private static final class StagedUpgrade implements SchemaUpgrade {
        private final DatabaseState state;
        private final int oldVersion;
        private final int newVersion;
        private final Map<String, String> created = new LinkedHashMap<>();

        StagedUpgrade(DatabaseState state, int oldVersion, int newVersion) {
            this.state = state;
            this.oldVersion = oldVersion;
            this.newVersion = newVersion;
        }

        @Override public int oldVersion() { return oldVersion; }

        @Override public int newVersion() { return newVersion; }

        @Override
        public boolean containsStore(String storeName) {
            return state.stores.containsKey(storeName) || created.containsKey(storeName);
        }

        @Override
        public Set<String> storeNames() {
            Set<String> names = new LinkedHashSet<>(state.stores.keySet());
            names.addAll(created.keySet());
            return Collections.unmodifiableSet(names);
        }

        @Override
        public void createStore(String storeName, String keyField) {
            checkName("store", storeName);
            Objects.requireNonNull(keyField, "keyField");
            if (containsStore(storeName)) {
                throw new KvEngineException("store '" + storeName + "' already exists in " + state.name);
            }
            created.put(storeName, keyField);
        }
    }
}
