// file: storage/src/main/java/io/docvault/storage/KvDatabase.java
package io.docvault.storage;

import java.util.Set;

/**
 * Open handle on one database at one schema version.
 * <p>
 * A handle stays usable until close(). Listeners registered with
 * onVersionChange() fire when another caller opens the same database at a
 * higher version; the usual reaction is to close this handle.
 */
public interface KvDatabase extends AutoCloseable {

    String name();

    int version();

    /** Names of the stores in this database, in creation order. */
    Set<String> storeNames();

    /** Field of the stored value that acts as the key of {@code storeName}. */
    String keyField(String storeName);

    /**
     * Begin a transaction scoped to one store.
     *
     * @throws KvEngineException if the handle is closed, the store is unknown,
     *                           or a write slot could not be obtained in time.
     */
    KvTransaction transaction(String storeName, TxMode mode);

    void onVersionChange(VersionChangeListener listener);

    boolean isClosed();

    @Override
    void close();
}
