package io.chatrelay.json.spi;

import java.util.List;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries and know the relay wire format
 * ({@code io.chatrelay.core} models in snake_case).
 *
 * <p>This interface intentionally avoids exposing tree model abstractions.
 * Plain {@link java.util.Map}/{@link java.util.List} values serialize as JSON objects/arrays.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON array to a list of typed objects.
     * @param data JSON bytes (must be a JSON array)
     * @param elementType element class
     * @return list of deserialized objects
     * @throws JsonException if deserialization fails
     */
    <T> List<T> readList(byte[] data, Class<T> elementType) throws JsonException;

    /**
     * Re-binds an already-parsed value (typically a column map) to a typed object.
     * @throws JsonException if the value cannot be bound to the type
     */
    <T> T convertValue(Object value, Class<T> type) throws JsonException;
}
