// file: storage/src/main/java/io/docvault/storage/FileKvEngine.java
package io.docvault.storage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable engine: one directory per database under {@code root}.
 * <p>
 * Layout of {@code root/<database>/}:
 *  - catalog.json: schema version and stores (see {@link Catalog}),
 *  - wal/:         one WAL record per committed write transaction,
 *  - snap/:        latest full snapshot of every store.
 * <p>
 *  - On commit:
 *      1) Encode the batch and append+fsync it to the WAL.
 *      2) Apply it to the in-memory records.
 *      3) Every N commits, write a snapshot; only once it is fsynced and
 *         published is the WAL reset. A failed snapshot keeps the WAL.
 * <p>
 *  - On first open of a database:
 *      1) Read the catalog (absent => database does not exist yet).
 *      2) Seed records from the latest snapshot.
 *      3) Replay the WAL in order.
 * <p>
 * A crash between writing a snapshot and resetting the WAL is harmless: every
 * batch carries final values per key, so replaying batches already contained
 * in the snapshot converges to the same records.
 */
public final class FileKvEngine extends AbstractKvEngine {
    private static final Logger log = Logger.getLogger(FileKvEngine.class.getName());

    private final Path root;
    private final long walRotateBytes;
    private final int snapshotEveryCommits;
    private final Map<String, DatabaseFiles> files = new ConcurrentHashMap<>();

    private record DatabaseFiles(Wal wal, Snapshotter snapshots, SnapshotPolicy policy) {}

    public FileKvEngine(Path root) {
        this(root, 64L * 1024 * 1024, 1_000, Duration.ofSeconds(30)); // rotate ~64MB
    }

    public FileKvEngine(Path root, long walRotateBytes, int snapshotEveryCommits, Duration writeWait) {
        super(writeWait);
        if (walRotateBytes <= 0) throw new IllegalArgumentException("walRotateBytes must be > 0");
        if (snapshotEveryCommits <= 0) throw new IllegalArgumentException("snapshotEveryCommits must be > 0");
        this.root = root;
        this.walRotateBytes = walRotateBytes;
        this.snapshotEveryCommits = snapshotEveryCommits;
    }

    public Path root() {
        return root;
    }

    @Override
    DatabaseState recover(String databaseName) {
        DatabaseState state = new DatabaseState(databaseName);
        Catalog catalog = Catalog.readIfExists(root.resolve(databaseName));
        if (catalog == null) {
            return state;
        }

        state.version = catalog.version;
        catalog.stores.forEach((name, keyField) -> state.stores.put(name, new DatabaseState.StoreState(keyField)));

        DatabaseFiles f = files(databaseName);

        // 1) load snapshot
        Snapshotter.LoadedSnapshot loaded = f.snapshots().loadLatest();
        if (loaded != null) {
            loaded.stores().forEach((name, records) -> {
                DatabaseState.StoreState store = state.stores.get(name);
                if (store == null) {
                    log.warning(() -> "snapshot " + loaded.id() + " holds unknown store '" + name + "', skipped");
                } else {
                    store.records.putAll(records);
                }
            });
        }

        // 2) replay WAL
        int replayed = 0;
        try (Wal.WalReader r = f.wal().openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.CommitRecord rec = RecordCodec.decode(payload);
                DatabaseState.StoreState store = state.stores.get(rec.storeName());
                if (store == null) {
                    log.warning(() -> "WAL batch for unknown store '" + rec.storeName() + "' in " + databaseName + ", skipped");
                    continue;
                }
                apply(store, rec.mutations());
                replayed++;
            }
        } catch (RuntimeException e) {
            throw new KvEngineException("Recovery Failed for database " + databaseName, e);
        }

        int batches = replayed;
        log.info(() -> "recovered database %s v%d (snapshot=%s, replayed %d batches)".formatted(
                databaseName, state.version, loaded == null ? "none" : loaded.id(), batches));
        return state;
    }

    @Override
    void persistSchema(DatabaseState state, int newVersion, Map<String, String> storeKeyFields) {
        new Catalog(newVersion, storeKeyFields).write(root.resolve(state.name));
    }

    @Override
    void logCommit(DatabaseState state, String storeName, List<Mutation> batch) {
        Wal wal = files(state.name).wal();
        wal.append(RecordCodec.encode(storeName, batch));
        wal.rotateIfNeeded();
    }

    @Override
    void committed(DatabaseState state) {
        DatabaseFiles f = files(state.name);
        try {
            if (f.policy().maybeSnapshot(state::copyRecords, f.snapshots())) {
                f.wal().reset();
                log.fine(() -> "snapshot written for " + state.name + ", WAL reset");
            }
        } catch (RuntimeException e) {
            // The batch is already durable in the WAL; only recovery time suffers.
            log.log(Level.WARNING, "snapshot of " + state.name + " failed", e);
        }
    }

    @Override
    void closeResources() {
        for (DatabaseFiles f : files.values()) {
            f.wal().close();
        }
        files.clear();
    }

    private DatabaseFiles files(String databaseName) {
        return files.computeIfAbsent(databaseName, name -> {
            Path dir = root.resolve(name);
            return new DatabaseFiles(
                    new FileWal(dir.resolve("wal"), walRotateBytes),
                    new FileSnapshotter(dir.resolve("snap")),
                    new SnapshotPolicy(snapshotEveryCommits));
        });
    }
}
