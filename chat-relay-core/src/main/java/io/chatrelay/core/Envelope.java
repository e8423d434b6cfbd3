package io.chatrelay.core;

import java.util.Objects;

/**
 * Tagged payload written to a subscriber channel.
 *
 * <p>Relay envelopes are {@code {"type":"connected","session_id":...}} on handshake and
 * {@code {"type":"NEW_MESSAGE","message":{...}}} on delivery.
 */
public sealed interface Envelope permits Envelope.Connected, Envelope.NewMessage {

    /** Wire discriminator. */
    String type();

    static Envelope connected(String sessionId) {
        return new Connected(sessionId);
    }

    static Envelope newMessage(MessageRecord message) {
        return new NewMessage(message);
    }

    record Connected(String sessionId) implements Envelope {
        public Connected {
            Objects.requireNonNull(sessionId, "sessionId");
        }

        @Override
        public String type() {
            return Protocol.ENVELOPE_CONNECTED;
        }
    }

    record NewMessage(MessageRecord message) implements Envelope {
        public NewMessage {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String type() {
            return Protocol.ENVELOPE_NEW_MESSAGE;
        }
    }
}
