package io.docvault.persistence;

import io.docvault.core.Document;
import io.docvault.storage.InMemoryKvEngine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static io.docvault.persistence.StoreFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LoaderTest {

    private final InMemoryKvEngine base = new InMemoryKvEngine();
    private final RecordingKvEngine engine = new RecordingKvEngine(base);

    private static Loader loader(PersistenceConfig config, RecordingKvEngine engine, RecordingIndexEngine index) {
        var runner = new TransactionRunner(new StoreConnector(engine), config.databaseName(), config.storeName());
        return new Loader(config, runner, index, new DocumentCodec());
    }

    @Test
    void load_resets_once_with_every_record_then_releases_the_buffer() {
        seed(base, Document.of("id", "b", "n", 2), Document.of("id", "a", "n", 1));
        var index = new RecordingIndexEngine(Document.of("id", "leftover"));
        index.executor().execute(() -> index.events.add("queued"));

        int loaded = loader(config(), engine, index).loadDatabase().join();

        assertEquals(2, loaded);
        assertEquals(List.of("reset", "reset:a,b", "queued"), index.events);
        assertEquals(Document.of("id", "a", "n", 1), index.getAllData().get(0));
        assertTrue(index.executor().isReady());
    }

    @Test
    void loading_a_fresh_database_creates_the_store() {
        var index = new RecordingIndexEngine();

        assertEquals(0, loader(config(), engine, index).loadDatabase().join());

        assertEquals(1, engine.upgrades.get());
        assertEquals(List.of("reset", "reset:"), index.events);
    }

    @Test
    void in_memory_only_resets_and_releases_without_io() {
        var index = new RecordingIndexEngine(Document.of("id", "a"));
        index.executor().execute(() -> index.events.add("queued"));

        assertEquals(0, loader(config().withInMemoryOnly(true), engine, index).loadDatabase().join());

        assertEquals(List.of("reset", "queued"), index.events);
        assertEquals(0, engine.opens.get());
        assertEquals(0, engine.storeOperations());
    }

    @Test
    void open_failure_leaves_indexes_empty_and_the_buffer_held() {
        engine.failOpen = true;
        var index = new RecordingIndexEngine(Document.of("id", "a"));
        index.executor().execute(() -> index.events.add("queued"));

        var ex = assertThrows(CompletionException.class, () -> loader(config(), engine, index).loadDatabase().join());

        assertInstanceOf(ConnectionException.class, ex.getCause());
        assertEquals(List.of("reset"), index.events);
        assertTrue(index.getAllData().isEmpty());
        assertFalse(index.executor().isReady());
        assertEquals(1, index.executor().pending());
        assertEquals(0, engine.storeOperations());
    }

    @Test
    void cursor_failure_is_a_transaction_error_in_the_scanning_phase() {
        seed(base, Document.of("id", "a"));
        engine.failCursor = true;
        var index = new RecordingIndexEngine();

        var ex = assertThrows(CompletionException.class, () -> loader(config(), engine, index).loadDatabase().join());

        TransactionException tx = assertInstanceOf(TransactionException.class, ex.getCause());
        assertEquals(Phase.SCANNING, tx.phase());
        assertEquals(List.of("reset"), index.events);
        assertFalse(index.executor().isReady());
    }
}
