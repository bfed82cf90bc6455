package io.docvault.persistence.dto;

public class JsonPersistenceConfig {
    public String databaseName;
    public String storeName;
    public Boolean inMemoryOnly;
    public String compactionErrorPolicy;
    public String deltaErrorPolicy;
    public Integer maxUpgradeAttempts;
}
