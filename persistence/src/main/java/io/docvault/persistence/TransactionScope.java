// file: persistence/src/main/java/io/docvault/persistence/TransactionScope.java
package io.docvault.persistence;

import io.docvault.storage.KvStore;
import io.docvault.storage.KvTransaction;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Runs a body inside an open transaction and ends the transaction to match:
 *  - body succeeds:               commit; a commit failure is a {@link TransactionException},
 *  - body fails with a record error: commit what was applied, then fail with the record error,
 *  - body fails otherwise:        abort, then fail with the mapped error.
 */
final class TransactionScope {

    private TransactionScope() {
    }

    private record Settled<T>(T value, Throwable error) {}

    static <T> CompletableFuture<T> run(OperationRun run, TransactionRunner.OpenTransaction open,
                                        Function<KvStore, CompletableFuture<T>> body) {
        KvTransaction tx = open.transaction();
        CompletableFuture<T> work;
        try {
            work = body.apply(open.store());
        } catch (RuntimeException e) {
            work = CompletableFuture.failedFuture(e);
        }

        return work
                .handle((value, err) -> new Settled<T>(value, err == null ? null : AsyncSteps.unwrap(err)))
                .thenCompose(settled -> {
                    if (settled.error() == null) {
                        return tx.commit().<T>handle((v, commitErr) -> {
                            if (commitErr != null) {
                                throw run.fail(commitErr);
                            }
                            run.enter(Phase.DONE);
                            return settled.value();
                        });
                    }
                    if (settled.error() instanceof RecordException) {
                        RecordException recordError = (RecordException) settled.error();
                        return tx.commit().<T>handle((v, commitErr) -> {
                            if (commitErr != null) {
                                recordError.addSuppressed(AsyncSteps.unwrap(commitErr));
                            }
                            throw run.fail(recordError);
                        });
                    }
                    tx.abort();
                    throw run.fail(settled.error());
                });
    }
}
