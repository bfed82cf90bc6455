// file: persistence/src/main/java/io/docvault/persistence/DeleteException.java
package io.docvault.persistence;

public class DeleteException extends RecordException {

    public DeleteException(String key, Phase phase, Throwable cause) {
        super("Error deleting document " + key, key, phase, cause);
    }
}
