package io.chatrelay.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatrelay.json.spi.JsonCodec;
import io.chatrelay.json.spi.JsonException;

import java.util.List;
import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 *
 * <p>The default mapper has {@link ChatRelayJacksonModule} installed, so relay models read and write
 * in the snake_case wire format without annotations on the model classes.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the relay wire format installed.
     */
    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     *
     * <p>The caller is responsible for registering {@link ChatRelayJacksonModule}.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper(new JsonFactory())
                .registerModule(new ChatRelayJacksonModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize " + describe(value) + " to bytes", e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize " + describe(value) + " to string", e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        if (data == null || data.length == 0) {
            throw new JsonException("Cannot read " + type.getSimpleName() + " from an empty body");
        }
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw new JsonException("Malformed " + type.getSimpleName() + " JSON: " + e.getMessage(), e);
        }
    }

    @Override
    public <T> List<T> readList(byte[] data, Class<T> elementType) throws JsonException {
        JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            return mapper.readValue(data, listType);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to List<" + elementType.getSimpleName() + ">", e);
        }
    }

    @Override
    public <T> T convertValue(Object value, Class<T> type) throws JsonException {
        try {
            return mapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new JsonException("Cannot bind value to " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
