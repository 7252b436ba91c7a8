package dev.hack.logs.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;

/**
 * Serializes events as single-line JSON documents.
 */
public final class NdjsonWriter {
    private static final ObjectMapper JSON = new ObjectMapper();

    private NdjsonWriter() {}

    public static String toLine(LogStreamEvent event) {
        try {
            return JSON.writeValueAsString(event.toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Unable to serialize " + event.type().wireName() + " event", ex);
        }
    }
}
