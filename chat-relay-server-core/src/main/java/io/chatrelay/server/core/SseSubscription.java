package io.chatrelay.server.core;

/** Handle the host holds on a live event stream. */
public interface SseSubscription {

    boolean isOpen();

    /** Idempotent. */
    void cancel();
}
