package io.chatrelay.core;

/**
 * An unvalidated request to post a message, as received from a publisher.
 *
 * <p>Any field may be {@code null}; validation happens in the relay core.
 */
public record MessageSubmission(String sessionId, String senderId, String messageText, String recipientId) {
}
