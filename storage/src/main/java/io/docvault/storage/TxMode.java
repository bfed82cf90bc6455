// file: storage/src/main/java/io/docvault/storage/TxMode.java
package io.docvault.storage;

public enum TxMode {
    READ,
    WRITE
}
