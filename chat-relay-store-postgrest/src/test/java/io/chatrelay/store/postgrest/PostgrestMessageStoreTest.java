package io.chatrelay.store.postgrest;

import io.chatrelay.core.MessageRecord;
import io.chatrelay.json.jackson.JacksonJsonCodec;
import io.chatrelay.server.spi.StoreException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PostgrestMessageStoreTest {

    private static final String ROW = "{\"w_msg_id\":42,\"session_id\":\"s1\",\"sender_id\":\"u1\","
            + "\"recipient_id\":\"bot\",\"message_text\":\"hi\",\"message_type\":\"text\",\"status\":\"sent\","
            + "\"timestamp\":\"2025-01-01T10:00:00.123456+00:00\"}";

    private MockWebServer server;
    private PostgrestMessageStore store;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        PostgrestConfig config = PostgrestConfig.of(server.url("/").toString(), "secret-key")
                .withTimeout(Duration.ofSeconds(2));
        store = new PostgrestMessageStore(HttpClient.newHttpClient(), new JacksonJsonCodec(), config);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }

    @Test
    void insertPostsRowAndReturnsRepresentation() throws Exception {
        server.enqueue(json(201, "[" + ROW + "]"));
        MessageRecord draft = MessageRecord.builder()
                .sessionId("s1")
                .senderId("u1")
                .recipientId("bot")
                .messageText("hi")
                .messageType("text")
                .status("sent")
                .timestamp(Instant.parse("2025-01-01T10:00:00Z"))
                .build();

        MessageRecord saved = store.insert(draft);

        assertThat(saved.id()).isEqualTo("42");
        assertThat(saved.timestamp()).isEqualTo(Instant.parse("2025-01-01T10:00:00.123456Z"));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/rest/v1/whatsapp_messages");
        assertThat(request.getHeader("apikey")).isEqualTo("secret-key");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret-key");
        assertThat(request.getHeader("Prefer")).isEqualTo("return=representation");
        String body = request.getBody().readUtf8();
        assertThat(body)
                .startsWith("[{\"session_id\":\"s1\"")
                .contains("\"timestamp\":\"2025-01-01T10:00:00Z\"")
                .doesNotContain("w_msg_id");
    }

    @Test
    void findBySessionQueriesInTimestampOrder() throws Exception {
        server.enqueue(json(200, "[" + ROW + "]"));

        assertThat(store.findBySession("chat 1")).hasSize(1);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath())
                .isEqualTo("/rest/v1/whatsapp_messages?select=*&session_id=eq.chat%201&order=timestamp.asc");
    }

    @Test
    void findByIdMapsEmptyArrayToNotFound() throws Exception {
        server.enqueue(json(200, "[]"));
        server.enqueue(json(200, "[" + ROW + "]"));

        assertThat(store.findById("7")).isEmpty();
        Optional<MessageRecord> found = store.findById("42");
        assertThat(found).map(MessageRecord::sessionId).contains("s1");

        assertThat(server.takeRequest().getPath()).endsWith("?select=*&w_msg_id=eq.7");
    }

    @Test
    void sessionsAreDeduplicated() throws Exception {
        server.enqueue(json(200,
                "[{\"session_id\":\"b\"},{\"session_id\":\"a\"},{\"session_id\":null},{\"session_id\":\"b\"}]"));

        assertThat(store.listDistinctSessionIds()).containsExactly("a", "b");
        assertThat(server.takeRequest().getPath()).endsWith("?select=session_id&order=session_id.asc");
    }

    @Test
    void countReadsContentRange() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).addHeader("Content-Range", "0-24/137"));
        server.enqueue(new MockResponse().setResponseCode(200).addHeader("Content-Range", "*/0"));

        assertThat(store.count()).isEqualTo(137);
        assertThat(store.count()).isZero();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("HEAD");
        assertThat(request.getHeader("Prefer")).isEqualTo("count=exact");
    }

    @Test
    void serverErrorBecomesStoreException() {
        server.enqueue(json(500, "{\"code\":\"XX000\",\"message\":\"database is on fire\"}"));

        assertThatThrownBy(() -> store.findById("1"))
                .isInstanceOf(StoreException.class)
                .hasMessage("database is on fire")
                .satisfies(e -> assertThat(((StoreException) e).status()).isEqualTo(500));
    }

    @Test
    void nonJsonErrorKeepsStatus() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("<html>nope</html>"));

        assertThatThrownBy(() -> store.findBySession("s1"))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("404");
    }

    @Test
    void connectionFailureBecomesStoreException() {
        PostgrestMessageStore unreachable = new PostgrestMessageStore(HttpClient.newHttpClient(),
                new JacksonJsonCodec(), PostgrestConfig.of("http://127.0.0.1:1", "k"));

        assertThatThrownBy(unreachable::count)
                .isInstanceOf(StoreException.class)
                .hasMessageStartingWith("PostgREST request failed");
    }

    @Test
    void describeHidesCredentials() {
        assertThat(store.describe()).startsWith("postgrest:").endsWith("/whatsapp_messages").doesNotContain("secret");
    }

    @Test
    void configRejectsMissingPieces() {
        assertThatThrownBy(() -> PostgrestConfig.of("not-a-url", "k")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PostgrestConfig.of("https://x.supabase.co", " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(PostgrestConfig.of("https://x.supabase.co/", "k").tableUri().toString())
                .isEqualTo("https://x.supabase.co/rest/v1/whatsapp_messages");
    }
}
