// file: storage/src/main/java/io/docvault/storage/KvTransaction.java
package io.docvault.storage;

import java.util.concurrent.CompletableFuture;

/**
 * Transaction over a single store.
 * <p>
 * Write transactions are exclusive per database and buffer their mutations;
 * commit() applies them atomically (all or none become durable). Reads inside
 * a write transaction observe its own uncommitted mutations.
 * <p>
 * Exactly one of commit() / abort() ends a transaction. Further operations
 * on an ended transaction fail with {@link KvEngineException}.
 */
public interface KvTransaction {

    TxMode mode();

    KvStore store();

    CompletableFuture<Void> commit();

    void abort();

    boolean isActive();
}
