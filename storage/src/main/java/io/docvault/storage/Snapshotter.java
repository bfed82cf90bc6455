// file: storage/src/main/java/io/docvault/storage/Snapshotter.java
package io.docvault.storage;

import java.util.Map;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of every store of a database at some point in time.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records written after that snapshot.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the current records.
     *
     * @param stores store name -> (key -> value)
     * @return snapshot identifier (file name).
     */
    String writeSnapshot(Map<String, Map<String, byte[]>> stores);

    /** Load the latest snapshot if present, else null. */
    LoadedSnapshot loadLatest();

    /** Simple holder for snapshot id and its data */
    record LoadedSnapshot(String id, Map<String, Map<String, byte[]>> stores) {}
}
