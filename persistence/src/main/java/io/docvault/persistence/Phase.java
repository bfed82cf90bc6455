// file: persistence/src/main/java/io/docvault/persistence/Phase.java
package io.docvault.persistence;

/**
 * Steps a persistence operation moves through. A run starts in OPENING and
 * ends in DONE or FAILED; SCANNING, WRITING and DELETING are entered in that
 * order when the operation needs them.
 */
public enum Phase {
    OPENING,
    SCANNING,
    WRITING,
    DELETING,
    DONE,
    FAILED
}
