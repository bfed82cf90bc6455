// file: persistence/src/main/java/io/docvault/persistence/PersistOutcome.java
package io.docvault.persistence;

import java.util.List;

/**
 * What a compaction or delta run did.
 *
 * @param written    documents upserted
 * @param deleted    keys removed
 * @param skipped    records with no durable effect (metadata markers)
 * @param failedKeys keys whose put/delete failed and was passed over (CONTINUE policy)
 */
public record PersistOutcome(int written, int deleted, int skipped, List<String> failedKeys) {

    public static final PersistOutcome EMPTY = new PersistOutcome(0, 0, 0, List.of());

    public PersistOutcome {
        failedKeys = List.copyOf(failedKeys);
    }

    public boolean hasFailures() {
        return !failedKeys.isEmpty();
    }
}
