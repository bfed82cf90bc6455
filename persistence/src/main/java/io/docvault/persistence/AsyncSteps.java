// file: persistence/src/main/java/io/docvault/persistence/AsyncSteps.java
package io.docvault.persistence;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

final class AsyncSteps {

    private AsyncSteps() {
    }

    /**
     * Run {@code step} for each item, one at a time: an item's step starts only
     * once the previous step completed. The first failure stops the series.
     */
    static <T> CompletableFuture<Void> eachSeries(Iterable<T> items, Function<? super T, ? extends CompletionStage<?>> step) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (T item : items) {
            chain = chain.thenCompose(v -> step.apply(item).thenApply(r -> null));
        }
        return chain;
    }

    /** Strip the CompletionException / ExecutionException wrappers futures add. */
    static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
