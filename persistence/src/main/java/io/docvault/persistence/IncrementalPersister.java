// file: persistence/src/main/java/io/docvault/persistence/IncrementalPersister.java
package io.docvault.persistence;

import io.docvault.core.Document;
import io.docvault.storage.TxMode;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Applies a batch of changed documents to the store in one write transaction,
 * in the order given: tombstones delete their key, metadata markers are
 * skipped, everything else is upserted.
 */
public final class IncrementalPersister {
    private static final Logger log = Logger.getLogger(IncrementalPersister.class.getName());

    private final PersistenceConfig config;
    private final TransactionRunner runner;
    private final DocumentCodec codec;

    public IncrementalPersister(PersistenceConfig config, TransactionRunner runner, DocumentCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public CompletableFuture<PersistOutcome> persistNewState(List<Document> deltaDocs) {
        Objects.requireNonNull(deltaDocs, "deltaDocs");
        if (config.inMemoryOnly()) {
            return CompletableFuture.completedFuture(PersistOutcome.EMPTY);
        }
        OperationRun run = new OperationRun("delta", config.databaseName(), config.storeName());
        List<Document> delta = List.copyOf(deltaDocs);

        return runner.openTransaction(TxMode.WRITE)
                .exceptionallyCompose(err -> CompletableFuture.failedFuture(run.fail(err)))
                .thenCompose(open -> TransactionScope.run(run, open, store -> {
                    RecordWriter writer = new RecordWriter(run, store, codec, config.deltaErrorPolicy());
                    run.enter(Phase.WRITING);
                    return AsyncSteps.eachSeries(delta, doc -> {
                        switch (doc.kind()) {
                            case TOMBSTONE:
                                return writer.delete(doc.id());
                            case METADATA:
                                writer.skip();
                                return CompletableFuture.completedFuture(null);
                            default:
                                return writer.upsert(doc);
                        }
                    }).thenApply(v -> writer.outcome());
                }))
                .whenComplete((outcome, err) -> {
                    if (outcome != null) {
                        log.fine(() -> "%s: wrote %d, deleted %d, skipped %d, failed %s".formatted(run,
                                outcome.written(), outcome.deleted(), outcome.skipped(), outcome.failedKeys()));
                    } else {
                        log.warning(() -> run + " failed: " + AsyncSteps.unwrap(err).getMessage());
                    }
                });
    }
}
