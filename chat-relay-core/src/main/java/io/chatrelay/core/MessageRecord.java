package io.chatrelay.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted chat message.
 *
 * <p>Instances are immutable. A record produced by the direct-write path always carries a store-assigned
 * {@link #id()} and a {@link #timestamp()}; records relayed from a change feed carry whatever the store
 * reported, so every field except {@link #sessionId()} may be {@code null} there.
 */
public final class MessageRecord {
    private final String id;
    private final String sessionId;
    private final String senderId;
    private final String recipientId;
    private final String messageText;
    private final String messageType;
    private final String status;
    private final Instant timestamp;

    private MessageRecord(Builder b) {
        this.id = b.id;
        this.sessionId = b.sessionId;
        this.senderId = b.senderId;
        this.recipientId = b.recipientId;
        this.messageText = b.messageText;
        this.messageType = b.messageType;
        this.status = b.status;
        this.timestamp = b.timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .sessionId(sessionId)
                .senderId(senderId)
                .recipientId(recipientId)
                .messageText(messageText)
                .messageType(messageType)
                .status(status)
                .timestamp(timestamp);
    }

    /** Returns a copy carrying the given store-assigned id. */
    public MessageRecord withId(String id) {
        return toBuilder().id(Objects.requireNonNull(id, "id")).build();
    }

    public String id() {
        return id;
    }

    public String sessionId() {
        return sessionId;
    }

    public String senderId() {
        return senderId;
    }

    public String recipientId() {
        return recipientId;
    }

    public String messageText() {
        return messageText;
    }

    public String messageType() {
        return messageType;
    }

    public String status() {
        return status;
    }

    public Instant timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof MessageRecord)) return false;
        MessageRecord o = (MessageRecord) other;
        return Objects.equals(id, o.id)
                && Objects.equals(sessionId, o.sessionId)
                && Objects.equals(senderId, o.senderId)
                && Objects.equals(recipientId, o.recipientId)
                && Objects.equals(messageText, o.messageText)
                && Objects.equals(messageType, o.messageType)
                && Objects.equals(status, o.status)
                && Objects.equals(timestamp, o.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sessionId, senderId, recipientId, messageText, messageType, status, timestamp);
    }

    @Override
    public String toString() {
        return "MessageRecord{id=" + id + ", session=" + sessionId + ", " + senderId + " -> " + recipientId
                + ", at=" + timestamp + "}";
    }

    public static final class Builder {
        private String id;
        private String sessionId;
        private String senderId;
        private String recipientId;
        private String messageText;
        private String messageType;
        private String status;
        private Instant timestamp;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder senderId(String senderId) {
            this.senderId = senderId;
            return this;
        }

        public Builder recipientId(String recipientId) {
            this.recipientId = recipientId;
            return this;
        }

        public Builder messageText(String messageText) {
            this.messageText = messageText;
            return this;
        }

        public Builder messageType(String messageType) {
            this.messageType = messageType;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public MessageRecord build() {
            return new MessageRecord(this);
        }
    }
}
