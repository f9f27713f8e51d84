package com.healthwatch.statusmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.util.Optional;

/**
 * JSON serialization and deserialization for {@link StatusRecord}.
 * <p>
 * Output is a 2-space indented object with {@code "key": value} spacing. Non-ASCII characters
 * are not escaped (Jackson's default); callers encode the resulting string as UTF-8.
 */
public final class StatusRecordSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final ObjectWriter PRETTY_WRITER = MAPPER.writer(createPrettyPrinter());

    private StatusRecordSerializer() {
        // utility class
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        Separators separators = Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER);
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        return new DefaultPrettyPrinter(separators)
                .withObjectIndenter(indenter)
                .withArrayIndenter(indenter);
    }

    /**
     * Serializes a record to an indented JSON string.
     *
     * @throws StatusSerializationException if serialization fails
     */
    public static String toPrettyJson(StatusRecord record) {
        try {
            return PRETTY_WRITER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StatusSerializationException("Failed to serialize status record: " + record.name(), e);
        }
    }

    /**
     * Deserializes a JSON object into a validated record.
     *
     * @throws StatusSerializationException if the JSON is malformed or any field is invalid
     */
    public static StatusRecord fromJson(String json) {
        try {
            return MAPPER.readValue(json, StatusRecord.class);
        } catch (JsonProcessingException e) {
            throw new StatusSerializationException("Failed to deserialize status record", e);
        }
    }

    /**
     * Safely deserializes, returning empty on failure.
     */
    public static Optional<StatusRecord> tryFromJson(String json) {
        try {
            return Optional.of(fromJson(json));
        } catch (StatusSerializationException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Exception thrown when status record serialization/deserialization fails.
     */
    public static class StatusSerializationException extends RuntimeException {
        public StatusSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
