// file: storage/src/main/java/io/docvault/storage/DatabaseHandle.java
package io.docvault.storage;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

final class DatabaseHandle implements KvDatabase {
    private static final Logger log = Logger.getLogger(DatabaseHandle.class.getName());

    private final AbstractKvEngine engine;
    private final DatabaseState state;
    private final int version;
    private final List<VersionChangeListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    DatabaseHandle(AbstractKvEngine engine, DatabaseState state, int version) {
        this.engine = engine;
        this.state = state;
        this.version = version;
    }

    @Override
    public String name() {
        return state.name;
    }

    @Override
    public int version() {
        return version;
    }

    @Override
    public Set<String> storeNames() {
        synchronized (state) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(state.stores.keySet()));
        }
    }

    @Override
    public String keyField(String storeName) {
        synchronized (state) {
            DatabaseState.StoreState store = state.stores.get(storeName);
            if (store == null) {
                throw new KvEngineException("no store '" + storeName + "' in database " + state.name);
            }
            return store.keyField;
        }
    }

    @Override
    public KvTransaction transaction(String storeName, TxMode mode) {
        if (closed) {
            throw new KvEngineException("database handle " + state.name + " (v" + version + ") is closed");
        }
        return engine.begin(state, storeName, mode);
    }

    @Override
    public void onVersionChange(VersionChangeListener listener) {
        listeners.add(listener);
    }

    void fireVersionChange(int oldVersion, int newVersion) {
        for (VersionChangeListener l : listeners) {
            try {
                l.onVersionChange(this, oldVersion, newVersion);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "version-change listener failed on " + state.name, e);
            }
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        state.handles.remove(this);
    }

    @Override
    public String toString() {
        return "KvDatabase[" + state.name + " v" + version + (closed ? ", closed" : "") + "]";
    }
}
