// file: core/src/main/java/io/docvault/core/InMemoryIndexEngine.java
package io.docvault.core;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal id-indexed collection implementing {@link IndexEngine}.
 * <p>
 * Only the primary ("id") index is maintained. Mutators return the delta
 * record the caller hands to the persister afterwards:
 *  - upsert() returns the stored document,
 *  - remove() returns a tombstone (or null if the id was unknown).
 */
public final class InMemoryIndexEngine implements IndexEngine {
    private final Map<String, Document> byId = new LinkedHashMap<>();
    private final BufferedExecutor executor;

    public InMemoryIndexEngine() {
        this(new BufferedExecutor());
    }

    public InMemoryIndexEngine(BufferedExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public synchronized List<Document> getAllData() {
        return List.copyOf(byId.values());
    }

    @Override
    public synchronized void resetIndexes() {
        byId.clear();
    }

    @Override
    public synchronized void resetIndexes(Collection<Document> docs) {
        byId.clear();
        for (Document d : docs) {
            if (d.kind() != DocumentKind.DOCUMENT) {
                throw new IllegalArgumentException("only plain documents can be indexed: " + d);
            }
            byId.put(d.id(), d);
        }
    }

    @Override
    public BufferedExecutor executor() {
        return executor;
    }

    public synchronized Document upsert(Document doc) {
        if (doc.kind() != DocumentKind.DOCUMENT) {
            throw new IllegalArgumentException("only plain documents can be stored: " + doc);
        }
        byId.put(doc.id(), doc);
        return doc;
    }

    public synchronized @Nullable Document remove(String id) {
        return byId.remove(id) == null ? null : Document.tombstone(id);
    }

    public synchronized @Nullable Document get(String id) {
        return byId.get(id);
    }

    public synchronized List<String> ids() {
        return new ArrayList<>(byId.keySet());
    }

    public synchronized int size() {
        return byId.size();
    }
}
