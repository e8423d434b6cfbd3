package io.chatrelay.server.core;

/**
 * Body of an event-stream response, started by the host once response headers are committed.
 */
@FunctionalInterface
public interface SseStream {

    /**
     * Begin streaming into {@code channel}. The returned subscription is cancelled by the host when it
     * notices the client went away.
     */
    SseSubscription open(SseChannel channel);
}
