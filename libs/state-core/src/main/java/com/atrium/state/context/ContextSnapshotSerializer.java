package com.atrium.state.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON form of {@link ContextSnapshot}. Instants are written as ISO-8601 strings.
 */
public final class ContextSnapshotSerializer {

    private static final Logger log = LoggerFactory.getLogger(ContextSnapshotSerializer.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ContextSnapshotSerializer() {
        // utility class
    }

    /**
     * @throws SnapshotSerializationException if the snapshot cannot be written
     */
    public static String serialize(ContextSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new SnapshotSerializationException("Failed to serialize context snapshot", e);
        }
    }

    /**
     * @throws SnapshotSerializationException if the JSON is malformed or misses required fields
     */
    public static ContextSnapshot deserialize(String json) {
        try {
            return MAPPER.readValue(json, ContextSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new SnapshotSerializationException("Failed to deserialize context snapshot", e);
        }
    }

    /** Empty when the stored JSON is unusable; a stale snapshot is not worth failing startup for. */
    public static Optional<ContextSnapshot> tryDeserialize(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(deserialize(json));
        } catch (SnapshotSerializationException e) {
            log.warn("Ignoring unreadable context snapshot: {}", e.getCause().getMessage());
            return Optional.empty();
        }
    }

    public static class SnapshotSerializationException extends RuntimeException {

        public SnapshotSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
