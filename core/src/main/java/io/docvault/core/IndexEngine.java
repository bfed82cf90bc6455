// file: core/src/main/java/io/docvault/core/IndexEngine.java
package io.docvault.core;

import java.util.Collection;
import java.util.List;

/**
 * Contract the persistence layer consumes from the owning collection.
 * <p>
 * Semantics:
 *  - getAllData(): current in-memory documents (the canonical copy).
 *  - resetIndexes(): drop every index entry, leaving the collection empty.
 *  - resetIndexes(docs): drop every index entry, then index exactly {@code docs}.
 *  - executor(): buffer of operations queued while a load is pending.
 */
public interface IndexEngine {

    List<Document> getAllData();

    void resetIndexes();

    void resetIndexes(Collection<Document> docs);

    BufferedExecutor executor();
}
