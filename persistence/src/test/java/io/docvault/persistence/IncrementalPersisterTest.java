package io.docvault.persistence;

import io.docvault.core.Document;
import io.docvault.core.InMemoryIndexEngine;
import io.docvault.storage.InMemoryKvEngine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static io.docvault.persistence.StoreFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class IncrementalPersisterTest {

    private final InMemoryKvEngine base = new InMemoryKvEngine();
    private final RecordingKvEngine engine = new RecordingKvEngine(base);

    private static IncrementalPersister persister(PersistenceConfig config, RecordingKvEngine engine) {
        var runner = new TransactionRunner(new StoreConnector(engine), config.databaseName(), config.storeName());
        return new IncrementalPersister(config, runner, new DocumentCodec());
    }

    @Test
    void delta_moves_store_from_a_c_to_c_b() {
        var collection = new InMemoryIndexEngine();
        seed(base, collection.upsert(Document.of("id", "a")), collection.upsert(Document.of("id", "c")));

        Document removed = collection.remove("a");
        Document added = collection.upsert(Document.of("id", "b", "name", "bee"));
        PersistOutcome outcome = persister(config(), engine).persistNewState(List.of(removed, added)).join();

        Map<String, Document> stored = read(base);
        assertEquals(List.of("b", "c"), List.copyOf(stored.keySet()));
        assertEquals("bee", stored.get("b").get("name"));
        assertEquals(1, outcome.written());
        assertEquals(1, outcome.deleted());
    }

    @Test
    void later_entries_for_the_same_id_win() {
        persister(config(), engine).persistNewState(List.of(
                Document.of("id", "a", "v", 1),
                Document.of("id", "a", "v", 2),
                Document.of("id", "b"),
                Document.tombstone("b"))).join();

        Map<String, Document> stored = read(base);
        assertEquals(List.of("a"), List.copyOf(stored.keySet()));
        assertEquals(2, stored.get("a").get("v"));
    }

    @Test
    void tombstone_deletes_without_writing() {
        seed(base, Document.of("id", "a"));

        persister(config(), engine).persistNewState(List.of(Document.tombstone("a"))).join();

        assertTrue(read(base).isEmpty());
        assertEquals(0, engine.puts.get());
    }

    @Test
    void metadata_markers_are_skipped() {
        PersistOutcome outcome = persister(config(), engine).persistNewState(List.of(
                Document.indexCreated(Map.of("fieldName", "name", "unique", true)),
                Document.of("id", "a"))).join();

        assertEquals(1, outcome.skipped());
        assertEquals(1, engine.puts.get());
        assertEquals(0, engine.deletes.get());
    }

    @Test
    void empty_delta_still_commits_one_transaction() {
        PersistOutcome outcome = persister(config(), engine).persistNewState(List.of()).join();

        assertEquals(PersistOutcome.EMPTY, outcome);
        assertEquals(1, engine.transactions.get());
        assertEquals(1, engine.commits.get());
        assertEquals(0, engine.storeOperations());
    }

    @Test
    void in_memory_only_touches_nothing() {
        persister(config().withInMemoryOnly(true), engine).persistNewState(List.of(Document.of("id", "a"))).join();

        assertEquals(0, engine.opens.get());
        assertEquals(0, engine.storeOperations());
    }

    @Test
    void failed_put_is_logged_and_the_batch_continues_by_default() {
        engine.failPutKeys.add("a");

        PersistOutcome outcome = persister(config(), engine).persistNewState(List.of(
                Document.of("id", "a"), Document.of("id", "b"))).join();

        assertEquals(List.of("a"), outcome.failedKeys());
        assertEquals(List.of("b"), List.copyOf(read(base).keySet()));
    }

    @Test
    void abort_policy_fails_with_the_record_error_after_committing_earlier_records() {
        engine.failDeleteKeys.add("x");
        PersistenceConfig config = config().withDeltaErrorPolicy(RecordErrorPolicy.ABORT);

        var ex = assertThrows(CompletionException.class, () -> persister(config, engine).persistNewState(List.of(
                Document.of("id", "a"), Document.tombstone("x"), Document.of("id", "b"))).join());

        DeleteException delete = assertInstanceOf(DeleteException.class, ex.getCause());
        assertEquals("x", delete.key());
        assertEquals("Error deleting document x", delete.getMessage());
        assertEquals(List.of("a"), List.copyOf(read(base).keySet()));
    }

    @Test
    void open_failure_is_a_connection_error() {
        engine.failOpen = true;

        var ex = assertThrows(CompletionException.class,
                () -> persister(config(), engine).persistNewState(List.of(Document.of("id", "a"))).join());

        assertInstanceOf(ConnectionException.class, ex.getCause());
        assertEquals(0, engine.storeOperations());
    }
}
