// file: persistence/src/main/java/io/docvault/persistence/RecordWriter.java
package io.docvault.persistence;

import io.docvault.core.Document;
import io.docvault.storage.KvStore;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Issues single-record puts and deletes against one transaction's store,
 * counting results and applying the record-error policy:
 *  - ABORT:    the returned future fails with the {@link RecordException},
 *  - CONTINUE: the failure is logged and the future completes with false.
 * Not thread-safe; steps are issued one at a time.
 */
final class RecordWriter {
    private static final Logger log = Logger.getLogger(RecordWriter.class.getName());

    private final OperationRun run;
    private final KvStore store;
    private final DocumentCodec codec;
    private final RecordErrorPolicy policy;

    private int written;
    private int deleted;
    private int skipped;
    private final List<String> failedKeys = new ArrayList<>();

    RecordWriter(OperationRun run, KvStore store, DocumentCodec codec, RecordErrorPolicy policy) {
        this.run = run;
        this.store = store;
        this.codec = codec;
        this.policy = policy;
    }

    /** Completes with true if the document was written. */
    CompletableFuture<Boolean> upsert(Document doc) {
        String key = doc.id();
        CompletableFuture<Void> put;
        try {
            put = store.put(key, codec.encode(doc));
        } catch (RuntimeException e) {
            put = CompletableFuture.failedFuture(e);
        }
        return put.handle((v, err) -> {
            if (err == null) {
                written++;
                return true;
            }
            return onError(new WriteException(key, run.phase(), AsyncSteps.unwrap(err)));
        });
    }

    /** Completes with true if the key was deleted. */
    CompletableFuture<Boolean> delete(String key) {
        CompletableFuture<Void> del;
        try {
            del = store.delete(key);
        } catch (RuntimeException e) {
            del = CompletableFuture.failedFuture(e);
        }
        return del.handle((v, err) -> {
            if (err == null) {
                deleted++;
                return true;
            }
            return onError(new DeleteException(key, run.phase(), AsyncSteps.unwrap(err)));
        });
    }

    void skip() {
        skipped++;
    }

    PersistOutcome outcome() {
        return new PersistOutcome(written, deleted, skipped, failedKeys);
    }

    private boolean onError(RecordException e) {
        failedKeys.add(e.key());
        if (policy == RecordErrorPolicy.ABORT) {
            throw e;
        }
        log.log(Level.WARNING, run + ": " + e.getMessage() + ", continuing", e.getCause());
        return false;
    }
}
