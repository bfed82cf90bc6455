// file: core/src/main/java/io/docvault/core/DocumentKind.java
package io.docvault.core;

/**
 * What a record in a delta stands for.
 */
public enum DocumentKind {
    /** User data; upserted under its id. */
    DOCUMENT,
    /** "$$deleted" marker; the id must be removed from durable storage. */
    TOMBSTONE,
    /** Index lifecycle marker; never written to the data store. */
    METADATA
}
