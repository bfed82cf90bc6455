// file: storage/src/main/java/io/docvault/storage/SchemaUpgrade.java
package io.docvault.storage;

import java.util.Set;

/**
 * Schema changes staged during one version upgrade.
 */
public interface SchemaUpgrade {

    /** Version before the upgrade; 0 for a database that did not exist. */
    int oldVersion();

    int newVersion();

    boolean containsStore(String storeName);

    /** Stores existing before this upgrade plus those created by it. */
    Set<String> storeNames();

    /**
     * Create an empty store whose records are keyed by {@code keyField}.
     *
     * @throws KvEngineException if a store with that name already exists.
     */
    void createStore(String storeName, String keyField);
}
