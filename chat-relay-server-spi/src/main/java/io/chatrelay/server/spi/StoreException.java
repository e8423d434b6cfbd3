package io.chatrelay.server.spi;

/**
 * Connectivity or query failure reported by a {@link MessageStore}.
 *
 * <p>Not-found is not an error: lookups report it as an empty result.
 */
public class StoreException extends Exception {
    private final int status;

    public StoreException(String message) {
        this(message, 0, null);
    }

    public StoreException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public StoreException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * Upstream status code when the store speaks HTTP, otherwise 0.
     */
    public int status() {
        return status;
    }
}
