// file: persistence/src/main/java/io/docvault/persistence/PersistenceConfig.java
package io.docvault.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.docvault.persistence.dto.JsonPersistenceConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Settings of one persisted collection.
 * <p>
 * Supports:
 *  - databaseName:          database holding the store
 *  - storeName:             store (table) holding one record per document
 *  - inMemoryOnly:          skip all durable I/O; load and compaction succeed at once
 *  - compactionErrorPolicy: record-error handling of persistCachedDatabase (default ABORT)
 *  - deltaErrorPolicy:      record-error handling of persistNewState (default CONTINUE)
 *  - maxUpgradeAttempts:    bound on schema upgrades while ensuring the store exists
 */
public record PersistenceConfig(
        String databaseName,
        String storeName,
        boolean inMemoryOnly,
        RecordErrorPolicy compactionErrorPolicy,
        RecordErrorPolicy deltaErrorPolicy,
        int maxUpgradeAttempts
) {
    public static final int DEFAULT_MAX_UPGRADE_ATTEMPTS = 5;

    public PersistenceConfig {
        Objects.requireNonNull(databaseName, "databaseName");
        Objects.requireNonNull(storeName, "storeName");
        Objects.requireNonNull(compactionErrorPolicy, "compactionErrorPolicy");
        Objects.requireNonNull(deltaErrorPolicy, "deltaErrorPolicy");
        if (databaseName.isBlank()) throw new IllegalArgumentException("databaseName must not be blank");
        if (storeName.isBlank()) throw new IllegalArgumentException("storeName must not be blank");
        if (maxUpgradeAttempts <= 0) throw new IllegalArgumentException("maxUpgradeAttempts must be > 0");
    }

    /** Durable collection with default policies. */
    public static PersistenceConfig of(String databaseName, String storeName) {
        return new PersistenceConfig(databaseName, storeName, false,
                RecordErrorPolicy.ABORT, RecordErrorPolicy.CONTINUE, DEFAULT_MAX_UPGRADE_ATTEMPTS);
    }

    public PersistenceConfig withInMemoryOnly(boolean inMemoryOnly) {
        return new PersistenceConfig(databaseName, storeName, inMemoryOnly,
                compactionErrorPolicy, deltaErrorPolicy, maxUpgradeAttempts);
    }

    public PersistenceConfig withCompactionErrorPolicy(RecordErrorPolicy policy) {
        return new PersistenceConfig(databaseName, storeName, inMemoryOnly,
                policy, deltaErrorPolicy, maxUpgradeAttempts);
    }

    public PersistenceConfig withDeltaErrorPolicy(RecordErrorPolicy policy) {
        return new PersistenceConfig(databaseName, storeName, inMemoryOnly,
                compactionErrorPolicy, policy, maxUpgradeAttempts);
    }

    public PersistenceConfig withMaxUpgradeAttempts(int attempts) {
        return new PersistenceConfig(databaseName, storeName, inMemoryOnly,
                compactionErrorPolicy, deltaErrorPolicy, attempts);
    }

    /**
     * Load from JSON; absent fields take the defaults of {@link #of(String, String)}.
     * <pre>
     * { "databaseName": "app", "storeName": "docs", "deltaErrorPolicy": "abort" }
     * </pre>
     */
    public static PersistenceConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonPersistenceConfig cfg = mapper.readValue(path.toFile(), JsonPersistenceConfig.class);
            PersistenceConfig out = of(cfg.databaseName, cfg.storeName);
            if (cfg.inMemoryOnly != null) out = out.withInMemoryOnly(cfg.inMemoryOnly);
            if (cfg.compactionErrorPolicy != null) out = out.withCompactionErrorPolicy(policy(cfg.compactionErrorPolicy));
            if (cfg.deltaErrorPolicy != null) out = out.withDeltaErrorPolicy(policy(cfg.deltaErrorPolicy));
            if (cfg.maxUpgradeAttempts != null) out = out.withMaxUpgradeAttempts(cfg.maxUpgradeAttempts);
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load PersistenceConfig from " + path, e);
        }
    }

    private static RecordErrorPolicy policy(String value) {
        return RecordErrorPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
