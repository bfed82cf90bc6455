// file: storage/src/main/java/io/docvault/storage/KvEngineException.java
package io.docvault.storage;

/**
 * Failure reported by a key-value engine (I/O, closed handle, misuse).
 */
public class KvEngineException extends RuntimeException {

    public KvEngineException(String message) {
        super(message);
    }

    public KvEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
