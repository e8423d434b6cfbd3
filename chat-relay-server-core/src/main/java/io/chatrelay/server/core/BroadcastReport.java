package io.chatrelay.server.core;

/**
 * Outcome of one fan-out. {@code delivered} counts frames actually written; the rest were skipped
 * because the subscriber closed first or failed and was removed.
 */
public record BroadcastReport(String sessionId, int attempted, int delivered) {

    static BroadcastReport none(String sessionId) {
        return new BroadcastReport(sessionId, 0, 0);
    }

    public int failed() {
        return attempted - delivered;
    }
}
