// file: persistence/src/main/java/io/docvault/persistence/WriteException.java
package io.docvault.persistence;

public class WriteException extends RecordException {

    public WriteException(String key, Phase phase, Throwable cause) {
        super("Error putting document " + key, key, phase, cause);
    }
}
