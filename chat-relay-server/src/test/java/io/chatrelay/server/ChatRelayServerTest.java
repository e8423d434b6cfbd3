package io.chatrelay.server;

import io.chatrelay.json.jackson.JacksonJsonCodec;
import io.chatrelay.server.core.InMemoryMessageStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChatRelayServerTest {

    private ChatRelayServer server;
    private final HttpClient client = HttpClient.newHttpClient();

    @BeforeEach
    void setUp() {
        RelayConfig config = new RelayConfig(0, null, null, "whatsapp_messages", Duration.ofHours(1),
                List.of("*"), Duration.ofSeconds(5));
        server = new ChatRelayServer(config, new InMemoryMessageStore(), new JacksonJsonCodec()).start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.port() + path);
    }

    private HttpResponse<String> post(String path, String json) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void healthRouteAnswersJson() throws Exception {
        HttpResponse<String> resp = client.send(HttpRequest.newBuilder(uri("/")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(resp.statusCode()).isEqualTo(200);
        assertThat(resp.headers().firstValue("Content-Type")).hasValueSatisfying(v -> assertThat(v).startsWith("application/json"));
        assertThat(resp.body()).contains("\"status\":\"healthy\"");
    }

    @Test
    void unknownRouteIsJson404() throws Exception {
        HttpResponse<String> resp = client.send(HttpRequest.newBuilder(uri("/nope")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(resp.statusCode()).isEqualTo(404);
        assertThat(resp.body()).contains("Route not found");
    }

    @Test
    void submittedMessageReachesOpenStream() throws Exception {
        HttpRequest sse = HttpRequest.newBuilder(uri("/api/sse/s1")).GET().build();
        HttpResponse<InputStream> stream = client.send(sse, HttpResponse.BodyHandlers.ofInputStream());
        assertThat(stream.statusCode()).isEqualTo(200);
        assertThat(stream.headers().firstValue("Content-Type")).hasValueSatisfying(v -> assertThat(v).startsWith("text/event-stream"));

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream.body(), StandardCharsets.UTF_8))) {
            assertThat(reader.readLine()).isEqualTo("data: {\"type\":\"connected\",\"session_id\":\"s1\"}");
            assertThat(reader.readLine()).isEmpty();

            HttpResponse<String> sent = post("/api/messages",
                    "{\"session_id\":\"s1\",\"sender_id\":\"u1\",\"message_text\":\"over the wire\"}");
            assertThat(sent.statusCode()).isEqualTo(200);

            String event = reader.readLine();
            assertThat(event).startsWith("data: {\"type\":\"NEW_MESSAGE\"").contains("over the wire");
        }
    }

    @Test
    void invalidSubmissionIs400() throws Exception {
        HttpResponse<String> resp = post("/api/messages", "{\"session_id\":\"s1\"}");

        assertThat(resp.statusCode()).isEqualTo(400);
        assertThat(resp.body()).contains("Missing required field: sender_id");
    }
}
