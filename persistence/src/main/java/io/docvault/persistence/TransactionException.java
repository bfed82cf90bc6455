// file: persistence/src/main/java/io/docvault/persistence/TransactionException.java
package io.docvault.persistence;

/**
 * The engine failed or aborted a transaction as a whole (cursor failure, commit failure).
 */
public class TransactionException extends PersistenceException {

    public TransactionException(String message, Phase phase, Throwable cause) {
        super(message, phase, cause);
    }
}
