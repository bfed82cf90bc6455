// file: storage/src/main/java/io/docvault/storage/DatabaseState.java
package io.docvault.storage;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;

/**
 * Committed state of one database shared by every handle opened on it.
 * <p>
 * Guarded by synchronized(this), except:
 *  - handles: copy-on-write list, mutated without the lock,
 *  - writeSlot: held by the single active write transaction.
 */
final class DatabaseState {
    final String name;
    int version;
    final Map<String, StoreState> stores = new LinkedHashMap<>();
    final List<DatabaseHandle> handles = new CopyOnWriteArrayList<>();
    final Semaphore writeSlot = new Semaphore(1, true);

    DatabaseState(String name) {
        this.name = name;
    }

    /** Deep enough copy for a snapshot: store name -> (key -> value). */
    synchronized Map<String, Map<String, byte[]>> copyRecords() {
        Map<String, Map<String, byte[]>> out = new LinkedHashMap<>();
        for (Map.Entry<String, StoreState> e : stores.entrySet()) {
            out.put(e.getKey(), new TreeMap<>(e.getValue().records));
        }
        return out;
    }

    static final class StoreState {
        final String keyField;
        final NavigableMap<String, byte[]> records = new TreeMap<>();

        StoreState(String keyField) {
            this.keyField = keyField;
        }
    }
}
