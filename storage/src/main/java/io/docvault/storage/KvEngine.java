// file: storage/src/main/java/io/docvault/storage/KvEngine.java
package io.docvault.storage;

import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;

/**
 * Versioned, transactional key-value engine holding named databases.
 * <p>
 * Semantics of open():
 *  - version == null: open at the current version; a database that does not
 *    exist yet is created at version 1 (which runs the upgrade handler).
 *  - version lower than current: fails with {@link KvVersionException}.
 *  - version higher than current: every other open handle is notified through
 *    its version-change listener, then the upgrade handler runs and may create
 *    stores. If the handler throws, the database keeps its previous schema.
 * <p>
 * Failures are reported through the returned future, never thrown.
 */
public interface KvEngine extends AutoCloseable {

    CompletableFuture<KvDatabase> open(String databaseName, @Nullable Integer version, UpgradeHandler onUpgrade);

    @Override
    void close();
}
