// file: storage/src/main/java/io/docvault/storage/KvStore.java
package io.docvault.storage;

import java.util.concurrent.CompletableFuture;

/**
 * Store view bound to one transaction.
 */
public interface KvStore {

    String name();

    String keyField();

    /** Insert or replace. Fails on read-only transactions. */
    CompletableFuture<Void> put(String key, byte[] value);

    /** Remove; deleting an absent key succeeds. Fails on read-only transactions. */
    CompletableFuture<Void> delete(String key);

    /** Completes with the value, or null if absent. */
    CompletableFuture<byte[]> get(String key);

    /** Forward cursor over all records in ascending key order, as seen by this transaction. */
    AsyncCursor<KvRecord> openCursor();
}
