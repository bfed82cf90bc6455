// file: persistence/src/main/java/io/docvault/persistence/RecordException.java
package io.docvault.persistence;

/**
 * A single-record operation failed. Carries the record's key.
 */
public abstract class RecordException extends PersistenceException {
    private final String key;

    protected RecordException(String message, String key, Phase phase, Throwable cause) {
        super(message, phase, cause);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
