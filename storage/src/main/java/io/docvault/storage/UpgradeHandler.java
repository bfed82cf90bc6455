// file: storage/src/main/java/io/docvault/storage/UpgradeHandler.java
package io.docvault.storage;

/**
 * Callback run inside a version upgrade; the only place where stores can be created.
 */
@FunctionalInterface
public interface UpgradeHandler {

    void onUpgrade(SchemaUpgrade upgrade);

    UpgradeHandler NONE = upgrade -> { };
}
