package uk.ac.ntu.loopserve.common.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Jackson-backed JSON encoding shared by the server and the loopback client.
 * Untyped reads produce the plain Java shapes: {@code Map}, {@code List},
 * {@code String}, {@code Number}, {@code Boolean} or {@code null}.
 */
public final class JsonCodec {
    private final ObjectMapper mapper;

    public JsonCodec() {
        this(new ObjectMapper()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public JsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public byte[] writeBytes(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize " + typeName(value), e);
        }
    }

    public String writeString(Object value) {
        return new String(writeBytes(value), StandardCharsets.UTF_8);
    }

    /**
     * Reads any JSON document. Blank input reads as {@code null}.
     */
    public Object read(String json) {
        if (json == null || json.isBlank()) return null;
        return read(json, Object.class);
    }

    public Object read(byte[] json) {
        if (json == null || json.length == 0) return null;
        try {
            return mapper.readValue(json, Object.class);
        } catch (Exception e) {
            throw new JsonException("Failed to parse JSON body", e);
        }
    }

    public <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw new JsonException("Failed to parse JSON as " + type.getName(), e);
        }
    }

    /**
     * Converts an already-decoded value (for example a {@code Map}) into {@code type}.
     */
    public <T> T convert(Object value, Class<T> type) {
        if (value == null) return null;
        if (type.isInstance(value)) return type.cast(value);
        try {
            return mapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new JsonException("Failed to convert " + typeName(value) + " to " + type.getName(), e);
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
