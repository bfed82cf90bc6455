// file: persistence/src/main/java/io/docvault/persistence/Loader.java
package io.docvault.persistence;

import io.docvault.core.Document;
import io.docvault.core.IndexEngine;
import io.docvault.storage.TxMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Rebuilds the collection's indexes from the store.
 * <p>
 * The indexes are emptied before any I/O. They are rebuilt once, from every
 * durable record, after the scanning transaction commits; only then are the
 * operations buffered during the load released. On failure the indexes stay
 * empty and the buffer is held.
 */
public final class Loader {
    private static final Logger log = Logger.getLogger(Loader.class.getName());

    private final PersistenceConfig config;
    private final TransactionRunner runner;
    private final IndexEngine index;
    private final DocumentCodec codec;

    public Loader(PersistenceConfig config, TransactionRunner runner, IndexEngine index, DocumentCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.index = Objects.requireNonNull(index, "index");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /** Completes with the number of documents loaded. */
    public CompletableFuture<Integer> loadDatabase() {
        OperationRun run = new OperationRun("load", config.databaseName(), config.storeName());
        try {
            index.resetIndexes();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(run.fail(e));
        }
        if (config.inMemoryOnly()) {
            index.executor().processBuffer();
            return CompletableFuture.completedFuture(0);
        }

        return runner.openTransaction(TxMode.WRITE)
                .exceptionallyCompose(err -> CompletableFuture.failedFuture(run.fail(err)))
                .thenCompose(open -> TransactionScope.run(run, open, store -> {
                    List<Document> all = new ArrayList<>();
                    run.enter(Phase.SCANNING);
                    return store.openCursor()
                            .forEachRemaining(rec -> all.add(codec.decode(rec.value())))
                            .thenApply(v -> all);
                }))
                .thenApply(all -> {
                    try {
                        index.resetIndexes(all);
                    } catch (RuntimeException e) {
                        throw run.fail(new PersistenceException("rebuilding indexes of " + run + " failed", Phase.DONE, e));
                    }
                    index.executor().processBuffer();
                    return all.size();
                })
                .whenComplete((count, err) -> {
                    if (err == null) {
                        log.info(() -> run + ": loaded " + count + " documents");
                    } else {
                        log.warning(() -> run + " failed: " + AsyncSteps.unwrap(err).getMessage());
                    }
                });
    }
}
