// file: persistence/src/main/java/io/docvault/persistence/DocumentCodec.java
package io.docvault.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docvault.core.Document;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;

/**
 * Durable representation of a document: its fields as a UTF-8 JSON object,
 * in field order.
 */
public final class DocumentCodec {
    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public DocumentCodec() {
        this(new ObjectMapper());
    }

    public DocumentCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(Document doc) {
        try {
            return mapper.writeValueAsBytes(doc.fields());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("cannot encode document " + doc.id(), e);
        }
    }

    public Document decode(byte[] json) {
        try {
            return new Document(mapper.readValue(json, FIELDS));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot decode stored document", e);
        }
    }

    /** Single-line JSON rendering, for tools and logs. */
    public String toJson(Document doc) {
        try {
            return mapper.writeValueAsString(doc.fields());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("cannot encode document " + doc.id(), e);
        }
    }
}
