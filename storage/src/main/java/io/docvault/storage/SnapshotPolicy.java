// file: storage/src/main/java/io/docvault/storage/SnapshotPolicy.java
package io.docvault.storage;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Snapshot policy that triggers a full snapshot after every N commits.
 * <p>
 * Bounds recovery time by limiting WAL replay length. Does not consider
 * file size or time.
 */
public final class SnapshotPolicy {
    private final int everyCommits;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyCommits) {
        if (everyCommits <= 0) throw new IllegalArgumentException("everyCommits must be > 0");
        this.everyCommits = everyCommits;
    }

    /**
     * Call after each durable commit. Snapshots when the threshold is hit.
     *
     * @return true if a snapshot was written
     */
    public boolean maybeSnapshot(Supplier<Map<String, Map<String, byte[]>>> current, Snapshotter snaps) {
        if (sinceLast.incrementAndGet() >= everyCommits) {
            snaps.writeSnapshot(current.get());
            sinceLast.set(0);
            return true;
        }
        return false;
    }
}
