// file: persistence/src/main/java/io/docvault/persistence/TransactionRunner.java
package io.docvault.persistence;

import io.docvault.storage.KvEngineException;
import io.docvault.storage.KvStore;
import io.docvault.storage.KvTransaction;
import io.docvault.storage.TxMode;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Opens transactions on one store through a {@link StoreConnector}.
 * A {@link ConnectionException} from the connector is passed on unchanged;
 * an engine refusing to begin the transaction is reported the same way.
 */
public final class TransactionRunner {
    private final StoreConnector connector;
    private final String databaseName;
    private final String storeName;

    public record OpenTransaction(KvTransaction transaction, KvStore store) {}

    public TransactionRunner(StoreConnector connector, String databaseName, String storeName) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.databaseName = Objects.requireNonNull(databaseName, "databaseName");
        this.storeName = Objects.requireNonNull(storeName, "storeName");
    }

    public CompletableFuture<OpenTransaction> openTransaction(TxMode mode) {
        return connector.ensureStore(databaseName, storeName).thenApply(db -> {
            try {
                KvTransaction tx = db.transaction(storeName, mode);
                return new OpenTransaction(tx, tx.store());
            } catch (KvEngineException e) {
                throw new ConnectionException("Error opening " + mode + " transaction on " + databaseName + "/" + storeName, e);
            }
        });
    }
}
