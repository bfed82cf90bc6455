// file: storage/src/main/java/io/docvault/storage/EngineTransaction.java
package io.docvault.storage;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * Transaction implementation shared by the bundled engines.
 * <p>
 * Reads:
 *  - READ: served from a copy of the store taken when the transaction began.
 *  - WRITE: served from the live committed records (no other writer can change
 *    them while this transaction holds the write slot) overlaid with pending
 *    mutations.
 * <p>
 * Writes are buffered in key order; commit() hands them to the engine as one batch.
 */
final class EngineTransaction implements KvTransaction {
    private final AbstractKvEngine engine;
    private final DatabaseState state;
    private final String storeName;
    private final DatabaseState.StoreState storeState;
    private final TxMode mode;
    private final NavigableMap<String, byte[]> readView;
    private final Map<String, Mutation> pending = new TreeMap<>();
    private final StoreView view = new StoreView();
    private boolean active = true;

    EngineTransaction(AbstractKvEngine engine, DatabaseState state, String storeName,
                      DatabaseState.StoreState storeState, TxMode mode) {
        this.engine = engine;
        this.state = state;
        this.storeName = storeName;
        this.storeState = storeState;
        this.mode = mode;
        if (mode == TxMode.READ) {
            synchronized (state) {
                this.readView = new TreeMap<>(storeState.records);
            }
        } else {
            this.readView = null;
        }
    }

    @Override
    public TxMode mode() {
        return mode;
    }

    @Override
    public KvStore store() {
        return view;
    }

    @Override
    public synchronized CompletableFuture<Void> commit() {
        if (!active) {
            return CompletableFuture.failedFuture(ended());
        }
        active = false;
        if (mode == TxMode.READ) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            engine.applyCommit(state, storeName, storeState, new ArrayList<>(pending.values()));
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        } finally {
            pending.clear();
            state.writeSlot.release();
        }
    }

    @Override
    public synchronized void abort() {
        if (!active) {
            return;
        }
        active = false;
        pending.clear();
        if (mode == TxMode.WRITE) {
            state.writeSlot.release();
        }
    }

    @Override
    public synchronized boolean isActive() {
        return active;
    }

    private KvEngineException ended() {
        return new KvEngineException("transaction on " + state.name + "/" + storeName + " has already ended");
    }

    private synchronized void checkActive(boolean needsWrite) {
        if (!active) {
            throw ended();
        }
        if (needsWrite && mode != TxMode.WRITE) {
            throw new KvEngineException("read-only transaction on " + state.name + "/" + storeName);
        }
    }

    private synchronized NavigableMap<String, byte[]> mergedView() {
        NavigableMap<String, byte[]> merged;
        if (mode == TxMode.READ) {
            merged = new TreeMap<>(readView);
        } else {
            synchronized (state) {
                merged = new TreeMap<>(storeState.records);
            }
        }
        for (Mutation m : pending.values()) {
            if (m.tombstone()) {
                merged.remove(m.key());
            } else {
                merged.put(m.key(), m.value());
            }
        }
        return merged;
    }

    private final class StoreView implements KvStore {

        @Override
        public String name() {
            return storeName;
        }

        @Override
        public String keyField() {
            return storeState.keyField;
        }

        @Override
        public CompletableFuture<Void> put(String key, byte[] value) {
            return mutate(Mutation.put(key, value));
        }

        @Override
        public CompletableFuture<Void> delete(String key) {
            return mutate(Mutation.delete(key));
        }

        private CompletableFuture<Void> mutate(Mutation m) {
            try {
                checkActive(true);
                synchronized (EngineTransaction.this) {
                    pending.put(m.key(), m);
                }
                return CompletableFuture.completedFuture(null);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        @Override
        public CompletableFuture<byte[]> get(String key) {
            try {
                checkActive(false);
                byte[] value = mergedLookup(key);
                return CompletableFuture.completedFuture(value);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        private byte[] mergedLookup(String key) {
            synchronized (EngineTransaction.this) {
                Mutation m = pending.get(key);
                if (m != null) {
                    return m.value();
                }
                if (mode == TxMode.READ) {
                    byte[] v = readView.get(key);
                    return v == null ? null : v.clone();
                }
            }
            synchronized (state) {
                byte[] v = storeState.records.get(key);
                return v == null ? null : v.clone();
            }
        }

        @Override
        public AsyncCursor<KvRecord> openCursor() {
            final Iterator<Map.Entry<String, byte[]>> it;
            try {
                checkActive(false);
                it = mergedView().entrySet().iterator();
            } catch (RuntimeException e) {
                return () -> CompletableFuture.failedFuture(e);
            }
            return () -> {
                try {
                    checkActive(false);
                } catch (RuntimeException e) {
                    return CompletableFuture.failedFuture(e);
                }
                if (!it.hasNext()) {
                    return CompletableFuture.completedFuture(null);
                }
                Map.Entry<String, byte[]> e = it.next();
                return CompletableFuture.completedFuture(new KvRecord(e.getKey(), e.getValue()));
            };
        }
    }
}
