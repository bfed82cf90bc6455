// file: persistence/src/main/java/io/docvault/persistence/RecordErrorPolicy.java
package io.docvault.persistence;

/**
 * What to do when a single put or delete fails inside a batch.
 */
public enum RecordErrorPolicy {
    /**
     * Stop issuing operations. Records already applied are committed, then
     * the operation fails with the record's {@link RecordException}.
     */
    ABORT,
    /** Log the failure at WARNING, remember the key, carry on with the batch. */
    CONTINUE
}
