package io.chatrelay.server.core;

/** Why a subscriber left the registry. */
public enum CloseReason {
    /** The client went away or the host cancelled the stream. */
    REMOTE_CLOSED,
    /** The connected envelope could not be written. */
    HANDSHAKE_FAILED,
    PULSE_FAILED,
    DELIVERY_FAILED,
    SHUTDOWN
}
