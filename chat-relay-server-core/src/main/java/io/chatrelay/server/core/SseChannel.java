package io.chatrelay.server.core;

import java.io.IOException;

/**
 * Host-provided sink for one open event-stream response.
 *
 * <p>Implementations must tolerate {@link #close()} being called more than once and from any thread.
 * The relay never calls {@link #send(SseFrame)} concurrently for the same channel.
 */
public interface SseChannel {

    /**
     * Write and flush one frame.
     *
     * @throws IOException when the peer is gone or the write otherwise fails
     */
    void send(SseFrame frame) throws IOException;

    /** End the response. */
    void close();
}
