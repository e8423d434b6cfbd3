package io.chatrelay.server.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.chatrelay.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChatRelayHandlerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final JacksonJsonCodec codec = new JacksonJsonCodec();
    private final InMemoryMessageStore store = new InMemoryMessageStore();
    private final ChatRelayHandler handler = ChatRelayHandler.builder(store)
            .codec(codec)
            .clock(Clock.fixed(NOW, ZoneOffset.UTC))
            .pulseInterval(Duration.ofHours(1))
            .version("test")
            .build();

    @AfterEach
    void tearDown() {
        handler.close();
    }

    private static ServerRequest get(String path) {
        return new ServerRequest(HttpMethod.GET, URI.create(path), Map.of(), null);
    }

    private static ServerRequest post(String path, String body) {
        return new ServerRequest(HttpMethod.POST, URI.create(path),
                Map.of("Content-Type", List.of("application/json")),
                body.getBytes(StandardCharsets.UTF_8));
    }

    private JsonNode json(ServerResponse resp) throws Exception {
        assertThat(resp.headers().get("Content-Type")).containsExactly("application/json");
        assertThat(resp.headers().get("Cache-Control")).containsExactly("no-store");
        assertThat(resp.body()).isInstanceOf(ResponseBody.Bytes.class);
        return codec.getMapper().readTree(((ResponseBody.Bytes) resp.body()).bytes());
    }

    @Test
    void healthListsActiveSessions() throws Exception {
        handler.subscriptions().open("s1", new RecordingChannel());

        ServerResponse resp = handler.handle(get("/"));

        assertThat(resp.status()).isEqualTo(200);
        JsonNode body = json(resp);
        assertThat(body.get("status").asText()).isEqualTo("healthy");
        assertThat(body.get("version").asText()).isEqualTo("test");
        assertThat(body.get("sse_enabled").asBoolean()).isTrue();
        assertThat(body.get("connected_sessions")).hasSize(1);
        assertThat(body.get("connected_sessions").get(0).asText()).isEqualTo("s1");
        assertThat(body.get("endpoints").has("sseStream")).isTrue();
    }

    @Test
    void storeTestReportsCount() throws Exception {
        handler.handle(post("/api/messages", "{\"session_id\":\"s1\",\"sender_id\":\"u1\",\"message_text\":\"hi\"}"));

        JsonNode body = json(handler.handle(get("/api/test")));

        assertThat(body.get("success").asBoolean()).isTrue();
        assertThat(body.get("total_messages").asLong()).isEqualTo(1);
        assertThat(body.get("store").asText()).isEqualTo("in-memory");
        assertThat(body.get("timestamp").asText()).isEqualTo("2025-03-01T12:00:00Z");
    }

    @Test
    void storeTestListsActiveSessionIds() throws Exception {
        handler.subscriptions().open("s2", new RecordingChannel());
        handler.subscriptions().open("s1", new RecordingChannel());

        JsonNode sessions = json(handler.handle(get("/api/test"))).get("sse_active_sessions");

        assertThat(sessions.isArray()).isTrue();
        assertThat(sessions).extracting(JsonNode::asText).containsExactlyInAnyOrder("s1", "s2");
    }

    @Test
    void submitThenReadBack() throws Exception {
        ServerResponse created = handler.handle(post("/api/messages",
                "{\"session_id\":\"s1\",\"sender_id\":\"u1\",\"message_text\":\"Hello\",\"recipient_id\":\"u2\"}"));

        assertThat(created.status()).isEqualTo(200);
        JsonNode body = json(created);
        assertThat(body.get("success").asBoolean()).isTrue();
        assertThat(body.get("w_msg_id").asText()).isEqualTo("1");
        assertThat(body.get("timestamp").asText()).isEqualTo("2025-03-01T12:00:00Z");
        assertThat(body.get("data").get("recipient_id").asText()).isEqualTo("u2");

        JsonNode list = json(handler.handle(get("/api/messages/s1")));
        assertThat(list.get("session_id").asText()).isEqualTo("s1");
        assertThat(list.get("count").asInt()).isEqualTo(1);
        assertThat(list.get("messages").get(0).get("message_text").asText()).isEqualTo("Hello");

        JsonNode one = json(handler.handle(get("/api/message/1")));
        assertThat(one.get("message").get("session_id").asText()).isEqualTo("s1");

        JsonNode sessions = json(handler.handle(get("/api/sessions")));
        assertThat(sessions.get("count").asInt()).isEqualTo(1);
        assertThat(sessions.get("sessions").get(0).asText()).isEqualTo("s1");
    }

    @Test
    void unknownMessageIs404() throws Exception {
        ServerResponse resp = handler.handle(get("/api/message/404"));

        assertThat(resp.status()).isEqualTo(404);
        JsonNode body = json(resp);
        assertThat(body.get("error").asText()).isEqualTo("Message not found");
        assertThat(body.get("messageId").asText()).isEqualTo("404");
    }

    @Test
    void missingFieldIs400WithGuidance() throws Exception {
        ServerResponse resp = handler.handle(post("/api/messages", "{\"session_id\":\"s1\",\"message_text\":\"hi\"}"));

        assertThat(resp.status()).isEqualTo(400);
        JsonNode body = json(resp);
        assertThat(body.get("error").asText()).isEqualTo("Missing required field: sender_id");
        assertThat(body.get("required_fields")).hasSize(3);
        assertThat(body.get("example").get("session_id").asText()).isEqualTo("chat-session-123");
        assertThat(store.count()).isZero();
    }

    @Test
    void malformedJsonIs400() throws Exception {
        ServerResponse resp = handler.handle(post("/api/messages", "{oops"));

        assertThat(resp.status()).isEqualTo(400);
        assertThat(json(resp).get("success").asBoolean()).isFalse();
    }

    @Test
    void storeFailureIs500() throws Exception {
        try (ChatRelayHandler failing = ChatRelayHandler.builder(new MessageServiceTest.FailingStore())
                .codec(codec)
                .build()) {
            ServerResponse submit = failing.handle(post("/api/messages",
                    "{\"session_id\":\"s1\",\"sender_id\":\"u1\",\"message_text\":\"hi\"}"));
            assertThat(submit.status()).isEqualTo(500);
            assertThat(json(submit).get("hint").asText()).isNotBlank();

            ServerResponse list = failing.handle(get("/api/messages/s1"));
            assertThat(list.status()).isEqualTo(500);
            assertThat(json(list).get("messages")).isEmpty();

            assertThat(failing.handle(get("/api/test")).status()).isEqualTo(500);
            assertThat(failing.handle(get("/api/message/1")).status()).isEqualTo(500);
            assertThat(failing.handle(get("/api/sessions")).status()).isEqualTo(500);
        }
    }

    @Test
    void sseStreamStartsWithHandshakeAndReceivesSubmissions() throws Exception {
        ServerResponse resp = handler.handle(get("/api/sse/s1"));

        assertThat(resp.status()).isEqualTo(200);
        assertThat(resp.headers().get("Content-Type")).containsExactly("text/event-stream");
        assertThat(resp.headers().get("Cache-Control")).containsExactly("no-cache");
        assertThat(resp.headers().get("Connection")).containsExactly("keep-alive");
        assertThat(resp.headers().get("Access-Control-Allow-Origin")).containsExactly("*");
        assertThat(resp.body()).isInstanceOf(ResponseBody.Sse.class);

        RecordingChannel channel = new RecordingChannel();
        SseSubscription subscription = ((ResponseBody.Sse) resp.body()).stream().open(channel);
        assertThat(channel.frames).containsExactly("data: {\"type\":\"connected\",\"session_id\":\"s1\"}\n\n");

        handler.handle(post("/api/messages", "{\"session_id\":\"s1\",\"sender_id\":\"u1\",\"message_text\":\"live\"}"));
        RecordingChannel.await(() -> channel.frames.size() == 2);
        assertThat(channel.frames.get(1)).contains("\"message_text\":\"live\"");

        subscription.cancel();
        assertThat(subscription.isOpen()).isFalse();
        assertThat(handler.subscriptions().registry().listActiveSessions()).isEmpty();
    }

    @Test
    void webhookIsAlwaysAcknowledged() throws Exception {
        ServerResponse resp = handler.handle(post("/webhook/supabase", "definitely not json"));

        assertThat(resp.status()).isEqualTo(200);
        JsonNode body = json(resp);
        assertThat(body.get("success").asBoolean()).isTrue();
        assertThat(body.get("message").asText()).isEqualTo("Webhook received");
    }

    @Test
    void webhookInsertReachesSubscribers() throws Exception {
        RecordingChannel channel = new RecordingChannel();
        handler.subscriptions().open("s9", channel);

        handler.handle(post("/webhook/supabase", "{\"type\":\"INSERT\",\"table\":\"whatsapp_messages\","
                + "\"record\":{\"w_msg_id\":5,\"session_id\":\"s9\",\"sender_id\":\"bot\",\"message_text\":\"pong\"}}"));

        RecordingChannel.await(() -> channel.frames.size() == 2);
        assertThat(channel.frames.get(1)).contains("\"message_text\":\"pong\"");
    }

    @Test
    void unknownRoutesAre404() throws Exception {
        ServerResponse resp = handler.handle(get("/api/nope?x=1"));

        assertThat(resp.status()).isEqualTo(404);
        JsonNode body = json(resp);
        assertThat(body.get("error").asText()).isEqualTo("Route not found");
        assertThat(body.get("requested_url").asText()).isEqualTo("/api/nope?x=1");
        assertThat(body.get("available_endpoints")).hasSize(8);

        assertThat(handler.handle(get("/api/sse/")).status()).isEqualTo(404);
        assertThat(handler.handle(post("/api/sessions", "{}")).status()).isEqualTo(404);
    }

    @Test
    void pathParamTakesOneSegment() {
        assertThat(ChatRelayHandler.pathParam("/api/sse/abc", "/api/sse/")).contains("abc");
        assertThat(ChatRelayHandler.pathParam("/api/sse/abc/", "/api/sse/")).contains("abc");
        assertThat(ChatRelayHandler.pathParam("/api/sse/a/b", "/api/sse/")).isEmpty();
        assertThat(ChatRelayHandler.pathParam("/api/sse/", "/api/sse/")).isEmpty();
    }

    @Test
    void sseFramesRender() {
        assertThat(SseFrame.heartbeat().render()).isEqualTo(":heartbeat\n\n");
        assertThat(SseFrame.data("{\"a\":1}").render()).isEqualTo("data: {\"a\":1}\n\n");
        assertThat(SseFrame.data("x\ny").render()).isEqualTo("data: x\ndata: y\n\n");
    }
}
