// file: persistence/src/main/java/io/docvault/persistence/PersistenceException.java
package io.docvault.persistence;

/**
 * Base of every failure surfaced by the persistence layer. Carries the phase
 * the operation was in when it failed.
 */
public class PersistenceException extends RuntimeException {
    private final Phase phase;

    public PersistenceException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    public PersistenceException(String message, Phase phase, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    public Phase phase() {
        return phase;
    }
}
