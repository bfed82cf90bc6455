// file: persistence/src/main/java/io/docvault/persistence/ConnectionException.java
package io.docvault.persistence;

/**
 * The database or store could not be opened, upgraded, or a transaction could not be started.
 */
public class ConnectionException extends PersistenceException {

    public ConnectionException(String message) {
        super(message, Phase.OPENING);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, Phase.OPENING, cause);
    }
}
