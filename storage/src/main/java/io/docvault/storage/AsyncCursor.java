// file: storage/src/main/java/io/docvault/storage/AsyncCursor.java
package io.docvault.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Forward-only cursor whose steps complete asynchronously.
 * nextAsync() completes with null once the cursor is exhausted.
 */
public interface AsyncCursor<T> {

    CompletableFuture<T> nextAsync();

    /**
     * Feed every remaining element to {@code sink}, in order.
     * <p>
     * Steps that are already complete are consumed in a loop rather than by
     * chaining stages, so long scans do not grow the stack.
     */
    default CompletableFuture<Void> forEachRemaining(Consumer<? super T> sink) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        drain(this, sink, done);
        return done;
    }

    default CompletableFuture<List<T>> loadAll() {
        List<T> out = new ArrayList<>();
        return forEachRemaining(out::add).thenApply(v -> out);
    }

    private static <T> void drain(AsyncCursor<T> cursor, Consumer<? super T> sink, CompletableFuture<Void> done) {
        try {
            while (true) {
                CompletableFuture<T> step = cursor.nextAsync();
                if (!step.isDone()) {
                    step.whenComplete((t, err) -> {
                        if (err != null) {
                            done.completeExceptionally(err);
                        } else if (t == null) {
                            done.complete(null);
                        } else {
                            try {
                                sink.accept(t);
                            } catch (RuntimeException e) {
                                done.completeExceptionally(e);
                                return;
                            }
                            drain(cursor, sink, done);
                        }
                    });
                    return;
                }
                T t = step.join();
                if (t == null) {
                    done.complete(null);
                    return;
                }
                sink.accept(t);
            }
        } catch (RuntimeException e) {
            // join() wraps step failures in CompletionException; the caller unwraps.
            done.completeExceptionally(e);
        }
    }
}
