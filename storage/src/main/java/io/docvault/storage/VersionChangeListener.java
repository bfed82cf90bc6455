// file: storage/src/main/java/io/docvault/storage/VersionChangeListener.java
package io.docvault.storage;

@FunctionalInterface
public interface VersionChangeListener {

    void onVersionChange(KvDatabase handle, int oldVersion, int newVersion);
}
