package io.docvault.storage;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKvEngineTest {

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static KvDatabase openWithStore(KvEngine engine, String store) {
        return engine.open("db", null, up -> {
            if (!up.containsStore(store)) up.createStore(store, "id");
        }).join();
    }

    @Test
    void fresh_database_is_created_at_version_one_through_the_upgrade_handler() {
        var engine = new InMemoryKvEngine();
        AtomicInteger upgrades = new AtomicInteger();

        KvDatabase db = engine.open("db", null, up -> {
            upgrades.incrementAndGet();
            assertEquals(0, up.oldVersion());
            assertEquals(1, up.newVersion());
            up.createStore("docs", "id");
        }).join();

        assertEquals(1, upgrades.get());
        assertEquals(1, db.version());
        assertEquals(List.of("docs"), List.copyOf(db.storeNames()));
        assertEquals("id", db.keyField("docs"));

        // Reopening at the current version does not upgrade again.
        engine.open("db", null, up -> upgrades.incrementAndGet()).join();
        assertEquals(1, upgrades.get());
    }

    @Test
    void opening_below_current_version_fails() {
        var engine = new InMemoryKvEngine();
        engine.open("db", 3, UpgradeHandler.NONE).join();

        var ex = assertThrows(CompletionException.class, () -> engine.open("db", 2, UpgradeHandler.NONE).join());
        assertInstanceOf(KvVersionException.class, ex.getCause());
        assertEquals(3, ((KvVersionException) ex.getCause()).current());
    }

    @Test
    void upgrade_notifies_open_handles_before_running() {
        var engine = new InMemoryKvEngine();
        KvDatabase first = engine.open("db", null, UpgradeHandler.NONE).join();
        first.onVersionChange((h, oldV, newV) -> {
            assertEquals(1, oldV);
            assertEquals(2, newV);
            h.close();
        });

        KvDatabase second = engine.open("db", 2, up -> up.createStore("docs", "id")).join();

        assertTrue(first.isClosed());
        assertEquals(2, second.version());
        assertTrue(second.storeNames().contains("docs"));
    }

    @Test
    void failing_upgrade_handler_leaves_schema_untouched() {
        var engine = new InMemoryKvEngine();
        engine.open("db", null, UpgradeHandler.NONE).join();

        assertThrows(CompletionException.class, () -> engine.open("db", 2, up -> {
            up.createStore("docs", "id");
            throw new IllegalStateException("boom");
        }).join());

        KvDatabase db = engine.open("db", null, UpgradeHandler.NONE).join();
        assertEquals(1, db.version());
        assertTrue(db.storeNames().isEmpty());
    }

    @Test
    void uncommitted_writes_are_private_to_their_transaction() {
        var engine = new InMemoryKvEngine();
        KvDatabase db = openWithStore(engine, "docs");

        KvTransaction w = db.transaction("docs", TxMode.WRITE);
        w.store().put("a", b("1")).join();
        assertArrayEquals(b("1"), w.store().get("a").join(), "writer sees its own put");

        KvTransaction r = db.transaction("docs", TxMode.READ);
        assertNull(r.store().get("a").join(), "reader does not see uncommitted put");
        r.commit().join();

        w.commit().join();
        KvTransaction r2 = db.transaction("docs", TxMode.READ);
        assertArrayEquals(b("1"), r2.store().get("a").join());
    }

    @Test
    void abort_discards_buffered_mutations() {
        var engine = new InMemoryKvEngine();
        KvDatabase db = openWithStore(engine, "docs");

        KvTransaction w = db.transaction("docs", TxMode.WRITE);
        w.store().put("a", b("1")).join();
        w.abort();

        assertFalse(w.isActive());
        assertNull(db.transaction("docs", TxMode.READ).store().get("a").join());
        assertThrows(CompletionException.class, () -> w.store().put("b", b("2")).join());
    }

    @Test
    void cursor_walks_keys_in_ascending_order_including_own_writes() {
        var engine = new InMemoryKvEngine();
        KvDatabase db = openWithStore(engine, "docs");
        KvTransaction seed = db.transaction("docs", TxMode.WRITE);
        seed.store().put("b", b("B")).join();
        seed.store().put("d", b("D")).join();
        seed.commit().join();

        KvTransaction w = db.transaction("docs", TxMode.WRITE);
        w.store().put("a", b("A")).join();
        w.store().delete("d").join();
        w.store().put("c", b("C")).join();

        List<KvRecord> all = w.store().openCursor().loadAll().join();
        assertEquals(List.of("a", "b", "c"), all.stream().map(KvRecord::key).toList());
        w.abort();
    }

    @Test
    void read_transactions_reject_mutations() {
        var engine = new InMemoryKvEngine();
        KvDatabase db = openWithStore(engine, "docs");

        KvTransaction r = db.transaction("docs", TxMode.READ);
        var ex = assertThrows(CompletionException.class, () -> r.store().put("a", b("1")).join());
        assertInstanceOf(KvEngineException.class, ex.getCause());
    }

    @Test
    void second_writer_times_out_while_first_is_active() {
        var engine = new InMemoryKvEngine(Duration.ofMillis(20));
        KvDatabase db = openWithStore(engine, "docs");

        KvTransaction first = db.transaction("docs", TxMode.WRITE);
        assertThrows(KvEngineException.class, () -> db.transaction("docs", TxMode.WRITE));

        first.commit().join();
        db.transaction("docs", TxMode.WRITE).abort(); // slot released again
    }

    @Test
    void transactions_on_closed_handle_or_unknown_store_fail() {
        var engine = new InMemoryKvEngine();
        KvDatabase db = openWithStore(engine, "docs");

        assertThrows(KvEngineException.class, () -> db.transaction("missing", TxMode.READ));
        db.close();
        assertThrows(KvEngineException.class, () -> db.transaction("docs", TxMode.READ));
    }
}
