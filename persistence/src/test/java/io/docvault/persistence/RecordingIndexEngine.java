package io.docvault.persistence;

import io.docvault.core.BufferedExecutor;
import io.docvault.core.Document;
import io.docvault.core.IndexEngine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Index engine that serves a fixed document list and records every reset.
 * Events: "reset", "reset:<ids>", plus whatever buffered tasks append.
 */
final class RecordingIndexEngine implements IndexEngine {
    final List<String> events = new ArrayList<>();
    private final BufferedExecutor executor = new BufferedExecutor();
    private List<Document> data;

    RecordingIndexEngine(Document... docs) {
        this.data = List.of(docs);
    }

    void set(Document... docs) {
        this.data = List.of(docs);
    }

    @Override
    public List<Document> getAllData() {
        return data;
    }

    @Override
    public void resetIndexes() {
        events.add("reset");
        data = List.of();
    }

    @Override
    public void resetIndexes(Collection<Document> docs) {
        events.add("reset:" + docs.stream().map(Document::id).collect(Collectors.joining(",")));
        data = List.copyOf(docs);
    }

    @Override
    public BufferedExecutor executor() {
        return executor;
    }
}
