package io.chatrelay.json.spi;

/**
 * Raised when a relay payload cannot be written as JSON or bound from JSON.
 *
 * <p>Message text from the underlying library is kept so request handlers can echo it in 400 responses.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
