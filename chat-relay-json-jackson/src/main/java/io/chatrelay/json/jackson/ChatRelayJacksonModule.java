package io.chatrelay.json.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.chatrelay.core.ChangeEvent;
import io.chatrelay.core.ChangeType;
import io.chatrelay.core.Envelope;
import io.chatrelay.core.MessageRecord;
import io.chatrelay.core.MessageSubmission;
import io.chatrelay.core.Protocol;
import io.chatrelay.core.Timestamps;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds the relay models to their snake_case wire format.
 *
 * <p>Serializers are explicit rather than annotation-driven so {@code chat-relay-core} stays free of
 * JSON library dependencies.
 */
public final class ChatRelayJacksonModule extends SimpleModule {

    public ChatRelayJacksonModule() {
        super("chat-relay");
        addSerializer(Instant.class, new InstantSerializer());
        addSerializer(MessageRecord.class, new MessageRecordSerializer());
        addDeserializer(MessageRecord.class, new MessageRecordDeserializer());
        addSerializer(Envelope.class, new EnvelopeSerializer());
        addDeserializer(MessageSubmission.class, new MessageSubmissionDeserializer());
        addDeserializer(ChangeEvent.class, new ChangeEventDeserializer());
    }

    static final class InstantSerializer extends StdSerializer<Instant> {
        InstantSerializer() {
            super(Instant.class);
        }

        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(Timestamps.format(value));
        }
    }

    static final class MessageRecordSerializer extends StdSerializer<MessageRecord> {
        MessageRecordSerializer() {
            super(MessageRecord.class);
        }

        @Override
        public void serialize(MessageRecord m, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField(Protocol.F_MESSAGE_ID, m.id());
            gen.writeStringField(Protocol.F_SESSION_ID, m.sessionId());
            gen.writeStringField(Protocol.F_SENDER_ID, m.senderId());
            gen.writeStringField(Protocol.F_RECIPIENT_ID, m.recipientId());
            gen.writeStringField(Protocol.F_MESSAGE_TEXT, m.messageText());
            gen.writeStringField(Protocol.F_MESSAGE_TYPE, m.messageType());
            gen.writeStringField(Protocol.F_STATUS, m.status());
            gen.writeStringField(Protocol.F_TIMESTAMP, Timestamps.format(m.timestamp()));
            gen.writeEndObject();
        }
    }

    static final class MessageRecordDeserializer extends StdDeserializer<MessageRecord> {
        MessageRecordDeserializer() {
            super(MessageRecord.class);
        }

        @Override
        public MessageRecord deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (!node.isObject()) {
                throw JsonMappingException.from(p, "message record must be a JSON object");
            }
            Instant timestamp;
            try {
                timestamp = Timestamps.parse(text(node, Protocol.F_TIMESTAMP));
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
            return MessageRecord.builder()
                    .id(text(node, Protocol.F_MESSAGE_ID))
                    .sessionId(text(node, Protocol.F_SESSION_ID))
                    .senderId(text(node, Protocol.F_SENDER_ID))
                    .recipientId(text(node, Protocol.F_RECIPIENT_ID))
                    .messageText(text(node, Protocol.F_MESSAGE_TEXT))
                    .messageType(text(node, Protocol.F_MESSAGE_TYPE))
                    .status(text(node, Protocol.F_STATUS))
                    .timestamp(timestamp)
                    .build();
        }
    }

    static final class EnvelopeSerializer extends StdSerializer<Envelope> {
        EnvelopeSerializer() {
            super(Envelope.class);
        }

        @Override
        public void serialize(Envelope envelope, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField(Protocol.F_TYPE, envelope.type());
            if (envelope instanceof Envelope.Connected connected) {
                gen.writeStringField(Protocol.F_SESSION_ID, connected.sessionId());
            } else if (envelope instanceof Envelope.NewMessage newMessage) {
                gen.writeFieldName(Protocol.F_MESSAGE);
                provider.defaultSerializeValue(newMessage.message(), gen);
            }
            gen.writeEndObject();
        }
    }

    static final class MessageSubmissionDeserializer extends StdDeserializer<MessageSubmission> {
        MessageSubmissionDeserializer() {
            super(MessageSubmission.class);
        }

        @Override
        public MessageSubmission deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (!node.isObject()) {
                throw JsonMappingException.from(p, "message submission must be a JSON object");
            }
            return new MessageSubmission(
                    text(node, Protocol.F_SESSION_ID),
                    text(node, Protocol.F_SENDER_ID),
                    text(node, Protocol.F_MESSAGE_TEXT),
                    text(node, Protocol.F_RECIPIENT_ID));
        }
    }

    static final class ChangeEventDeserializer extends StdDeserializer<ChangeEvent> {
        ChangeEventDeserializer() {
            super(ChangeEvent.class);
        }

        @Override
        public ChangeEvent deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (!node.isObject()) {
                throw JsonMappingException.from(p, "change event must be a JSON object");
            }
            ChangeType type;
            try {
                type = ChangeType.parse(text(node, Protocol.F_TYPE));
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, "unsupported change type: " + e.getMessage(), e);
            }
            return new ChangeEvent(
                    type,
                    text(node, Protocol.F_TABLE),
                    row(ctxt, node.get(Protocol.F_RECORD)),
                    row(ctxt, node.get(Protocol.F_OLD_RECORD)));
        }

        private static Map<String, Object> row(DeserializationContext ctxt, JsonNode node) throws IOException {
            if (node == null || !node.isObject()) return null;
            JavaType rowType = ctxt.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class);
            return ctxt.readTreeAsValue(node, rowType);
        }
    }

    /** Scalar field as text; absent, null and structured values read as {@code null}. */
    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) return null;
        return value.asText();
    }
}
