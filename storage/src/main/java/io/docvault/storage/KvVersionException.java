// file: storage/src/main/java/io/docvault/storage/KvVersionException.java
package io.docvault.storage;

/**
 * Requested schema version is lower than the stored one.
 */
public class KvVersionException extends KvEngineException {
    private final int requested;
    private final int current;

    public KvVersionException(String databaseName, int requested, int current) {
        super("database %s is at version %d, cannot open at version %d".formatted(databaseName, current, requested));
        this.requested = requested;
        this.current = current;
    }

    public int requested() { return requested; }

    public int current() { return current; }
}
