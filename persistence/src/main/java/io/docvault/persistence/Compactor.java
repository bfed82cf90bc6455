// file: persistence/src/main/java/io/docvault/persistence/Compactor.java
package io.docvault.persistence;

import io.docvault.core.Document;
import io.docvault.core.DocumentKind;
import io.docvault.core.IndexEngine;
import io.docvault.storage.KvRecord;
import io.docvault.storage.TxMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.LinkedHashSet;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Rewrites the store so that it holds exactly the collection's in-memory documents.
 * <p>
 * Steps, all inside one write transaction:
 *  1) take the in-memory snapshot (before the transaction opens),
 *  2) SCANNING: collect every durable key into keysToDelete,
 *  3) WRITING: upsert each snapshot document in order; each attempted key
 *     leaves keysToDelete,
 *  4) DELETING: delete the keys that remain,
 *  5) commit.
 * <p>
 * A document whose upsert failed under CONTINUE keeps its previous durable copy
 * rather than being deleted.
 */
public final class Compactor {
    private static final Logger log = Logger.getLogger(Compactor.class.getName());

    private final PersistenceConfig config;
    private final TransactionRunner runner;
    private final IndexEngine index;
    private final DocumentCodec codec;

    public Compactor(PersistenceConfig config, TransactionRunner runner, IndexEngine index, DocumentCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.index = Objects.requireNonNull(index, "index");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public CompletableFuture<PersistOutcome> persistCachedDatabase() {
        if (config.inMemoryOnly()) {
            return CompletableFuture.completedFuture(PersistOutcome.EMPTY);
        }
        OperationRun run = new OperationRun("compaction", config.databaseName(), config.storeName());
        List<Document> snapshot;
        try {
            snapshot = new ArrayList<>(index.getAllData());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(run.fail(e));
        }

        return runner.openTransaction(TxMode.WRITE)
                .exceptionallyCompose(err -> CompletableFuture.failedFuture(run.fail(err)))
                .thenCompose(open -> TransactionScope.run(run, open, store -> {
                    RecordWriter writer = new RecordWriter(run, store, codec, config.compactionErrorPolicy());
                    Set<String> keysToDelete = new LinkedHashSet<>();

                    run.enter(Phase.SCANNING);
                    return store.openCursor()
                            .forEachRemaining((KvRecord rec) -> keysToDelete.add(rec.key()))
                            .thenCompose(v -> {
                                run.enter(Phase.WRITING);
                                return AsyncSteps.eachSeries(snapshot, doc -> {
                                    if (doc.kind() == DocumentKind.METADATA) {
                                        writer.skip();
                                        return CompletableFuture.completedFuture(null);
                                    }
                                    keysToDelete.remove(doc.id());
                                    return writer.upsert(doc);
                                });
                            })
                            .thenCompose(v -> {
                                run.enter(Phase.DELETING);
                                return AsyncSteps.eachSeries(keysToDelete, writer::delete);
                            })
                            .thenApply(v -> writer.outcome());
                }))
                .whenComplete((outcome, err) -> {
                    if (outcome != null) {
                        log.info(() -> "%s: wrote %d, deleted %d, skipped %d, failed %s".formatted(run,
                                outcome.written(), outcome.deleted(), outcome.skipped(), outcome.failedKeys()));
                    } else {
                        log.warning(() -> run + " failed: " + AsyncSteps.unwrap(err).getMessage());
                    }
                });
    }
}
