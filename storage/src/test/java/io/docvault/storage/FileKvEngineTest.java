package io.docvault.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class FileKvEngineTest {

    @TempDir Path root;

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static KvDatabase open(FileKvEngine engine) {
        return engine.open("db", null, up -> {
            if (!up.containsStore("docs")) up.createStore("docs", "id");
        }).join();
    }

    private static void write(KvDatabase db, String key, String value) {
        KvTransaction tx = db.transaction("docs", TxMode.WRITE);
        if (value == null) {
            tx.store().delete(key).join();
        } else {
            tx.store().put(key, b(value)).join();
        }
        tx.commit().join();
    }

    private static List<String> keys(KvDatabase db) {
        KvTransaction tx = db.transaction("docs", TxMode.READ);
        List<String> keys = tx.store().openCursor().loadAll().join().stream().map(KvRecord::key).toList();
        tx.commit().join();
        return keys;
    }

    @Test
    void committed_data_and_schema_survive_restart() {
        try (var engine1 = new FileKvEngine(root)) {
            KvDatabase db = open(engine1);
            write(db, "a", "v1");
            write(db, "b", "v1");
            write(db, "a", "v2");
            write(db, "b", null);
        }

        // "Crash": drop the engine; a new instance recovers from disk
        try (var engine2 = new FileKvEngine(root)) {
            KvDatabase db = engine2.open("db", null, up -> fail("no upgrade expected")).join();
            assertEquals(1, db.version());
            assertEquals(List.of("a"), keys(db));
            KvTransaction tx = db.transaction("docs", TxMode.READ);
            assertArrayEquals(b("v2"), tx.store().get("a").join());
        }
    }

    @Test
    void aborted_transaction_leaves_no_trace_on_disk() {
        try (var engine1 = new FileKvEngine(root)) {
            KvDatabase db = open(engine1);
            KvTransaction tx = db.transaction("docs", TxMode.WRITE);
            tx.store().put("ghost", b("x")).join();
            tx.abort();
        }
        try (var engine2 = new FileKvEngine(root)) {
            assertTrue(keys(open(engine2)).isEmpty());
        }
    }

    @Test
    void snapshot_resets_wal_and_recovery_combines_both() throws Exception {
        try (var engine1 = new FileKvEngine(root, 1L << 30, 2, Duration.ofSeconds(1))) {
            KvDatabase db = open(engine1);
            write(db, "a", "1");
            write(db, "b", "1"); // 2nd commit -> snapshot + WAL reset
            write(db, "c", "1"); // lives in the WAL only
        }

        Path dbDir = root.resolve("db");
        try (var snaps = Files.list(dbDir.resolve("snap"))) {
            assertEquals(1, snaps.filter(p -> p.toString().endsWith(".bin")).count());
        }

        try (var engine2 = new FileKvEngine(root)) {
            assertEquals(List.of("a", "b", "c"), keys(open(engine2)));
        }
    }

    @Test
    void version_upgrades_are_recorded_in_the_catalog() {
        try (var engine1 = new FileKvEngine(root)) {
            open(engine1);
            engine1.open("db", 2, up -> up.createStore("other", "key")).join();
        }
        try (var engine2 = new FileKvEngine(root)) {
            KvDatabase db = engine2.open("db", null, UpgradeHandler.NONE).join();
            assertEquals(2, db.version());
            assertEquals(List.of("docs", "other"), List.copyOf(db.storeNames()));
            assertEquals("key", db.keyField("other"));
        }
    }

    @Test
    void unknown_database_has_no_files_until_created() {
        try (var engine = new FileKvEngine(root)) {
            assertFalse(Files.exists(root.resolve("db")));
            open(engine);
            assertTrue(Files.exists(root.resolve("db").resolve(Catalog.FILE_NAME)));
        }
    }

    @Test
    void crash_between_snapshot_and_wal_reset_recovers_the_same_records() throws Exception {
        try (var engine1 = new FileKvEngine(root)) {
            KvDatabase db = open(engine1);
            write(db, "a", "1");
            write(db, "x", "1");
            write(db, "a", "2");
            write(db, "x", null);
            write(db, "b", "1");
        }

        // Snapshot of the final records is published, the WAL reset never happens.
        Path dbDir = root.resolve("db");
        List<Path> walBefore = FileWal.segments(dbDir.resolve("wal"));
        assertFalse(walBefore.isEmpty());
        Map<String, Map<String, byte[]>> stores = new TreeMap<>();
        stores.put("docs", new TreeMap<>(Map.of("a", b("2"), "b", b("1"))));
        new FileSnapshotter(dbDir.resolve("snap")).writeSnapshot(stores);
        assertEquals(walBefore, FileWal.segments(dbDir.resolve("wal")));
        try (var snaps = Files.list(dbDir.resolve("snap"))) {
            assertTrue(snaps.noneMatch(p -> p.toString().endsWith(".tmp")));
        }

        try (var engine2 = new FileKvEngine(root)) {
            KvDatabase db = open(engine2);
            assertEquals(List.of("a", "b"), keys(db));
            KvTransaction tx = db.transaction("docs", TxMode.READ);
            assertArrayEquals(b("2"), tx.store().get("a").join());
            assertArrayEquals(b("1"), tx.store().get("b").join());
        }
    }
}
