package io.chatrelay.store.postgrest;

import io.chatrelay.core.MessageRecord;
import io.chatrelay.core.Protocol;
import io.chatrelay.core.Timestamps;
import io.chatrelay.json.spi.JsonCodec;
import io.chatrelay.json.spi.JsonException;
import io.chatrelay.server.spi.MessageStore;
import io.chatrelay.server.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * {@link MessageStore} over a PostgREST table, the storage the relay uses on Supabase.
 *
 * <p>The database assigns {@code w_msg_id}; every other column is written as given.
 */
public final class PostgrestMessageStore implements MessageStore {
    private static final Logger log = LoggerFactory.getLogger(PostgrestMessageStore.class);

    private final HttpClient httpClient;
    private final JsonCodec codec;
    private final PostgrestConfig config;
    private final URI tableUri;

    public PostgrestMessageStore(HttpClient httpClient, JsonCodec codec, PostgrestConfig config) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.config = Objects.requireNonNull(config, "config");
        this.tableUri = config.tableUri();
    }

    public static PostgrestMessageStore create(JsonCodec codec, PostgrestConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(config.timeout())
                .build();
        return new PostgrestMessageStore(client, codec, config);
    }

    @Override
    public MessageRecord insert(MessageRecord message) throws StoreException {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(Protocol.F_SESSION_ID, message.sessionId());
        row.put(Protocol.F_SENDER_ID, message.senderId());
        row.put(Protocol.F_RECIPIENT_ID, message.recipientId());
        row.put(Protocol.F_MESSAGE_TEXT, message.messageText());
        row.put(Protocol.F_MESSAGE_TYPE, message.messageType());
        row.put(Protocol.F_STATUS, message.status());
        row.put(Protocol.F_TIMESTAMP, message.timestamp() == null ? null : Timestamps.format(message.timestamp()));

        byte[] body;
        try {
            body = codec.writeBytes(List.of(row));
        } catch (JsonException e) {
            throw new StoreException("Cannot encode message row: " + e.getMessage(), e);
        }

        HttpRequest request = request(tableUri)
                .header("Content-Type", "application/json")
                .header("Prefer", "return=representation")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        List<MessageRecord> rows = readRows(send(request));
        if (rows.isEmpty()) {
            throw new StoreException("Insert into " + config.table() + " returned no row");
        }
        return rows.get(0);
    }

    @Override
    public List<MessageRecord> findBySession(String sessionId) throws StoreException {
        URI uri = query("select=*&" + Protocol.F_SESSION_ID + "=eq." + encode(sessionId)
                + "&order=" + Protocol.F_TIMESTAMP + ".asc");
        return readRows(send(request(uri).GET().build()));
    }

    @Override
    public Optional<MessageRecord> findById(String messageId) throws StoreException {
        URI uri = query("select=*&" + Protocol.F_MESSAGE_ID + "=eq." + encode(messageId));
        List<MessageRecord> rows = readRows(send(request(uri).GET().build()));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public SortedSet<String> listDistinctSessionIds() throws StoreException {
        // only session_id is selected; the other record fields read as null
        URI uri = query("select=" + Protocol.F_SESSION_ID + "&order=" + Protocol.F_SESSION_ID + ".asc");
        SortedSet<String> sessions = new TreeSet<>();
        for (MessageRecord row : readRows(send(request(uri).GET().build()))) {
            if (row.sessionId() != null) {
                sessions.add(row.sessionId());
            }
        }
        return sessions;
    }

    @Override
    public long count() throws StoreException {
        URI uri = query("select=" + Protocol.F_MESSAGE_ID);
        HttpRequest request = request(uri)
                .header("Prefer", "count=exact")
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<byte[]> response = send(request);
        String contentRange = response.headers().firstValue("Content-Range")
                .orElseThrow(() -> new StoreException("PostgREST response has no Content-Range header"));
        return parseTotal(contentRange);
    }

    @Override
    public String describe() {
        return "postgrest:" + config.baseUrl().getHost() + "/" + config.table();
    }

    /** Total from a {@code Content-Range} value such as {@code 0-0/42} or {@code *}{@code /0}. */
    static long parseTotal(String contentRange) throws StoreException {
        int slash = contentRange.lastIndexOf('/');
        String total = slash < 0 ? "" : contentRange.substring(slash + 1).trim();
        try {
            return Long.parseLong(total);
        } catch (NumberFormatException e) {
            throw new StoreException("Unexpected Content-Range: " + contentRange, e);
        }
    }

    private HttpRequest.Builder request(URI uri) {
        return HttpRequest.newBuilder(uri)
                .timeout(config.timeout())
                .header("apikey", config.apiKey())
                .header("Authorization", "Bearer " + config.apiKey())
                .header("Accept", "application/json");
    }

    private URI query(String query) {
        return URI.create(tableUri + "?" + query);
    }

    private HttpResponse<byte[]> send(HttpRequest request) throws StoreException {
        log.debug("PostgREST {} {}", request.method(), request.uri());
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new StoreException("PostgREST request timed out after " + config.timeout().toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("PostgREST request interrupted", e);
        } catch (IOException e) {
            throw new StoreException("PostgREST request failed: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status > 299) {
            throw new StoreException(errorMessage(response), status, null);
        }
        return response;
    }

    private List<MessageRecord> readRows(HttpResponse<byte[]> response) throws StoreException {
        try {
            return codec.readList(response.body(), MessageRecord.class);
        } catch (JsonException e) {
            throw new StoreException("Unreadable response from " + config.table() + ": " + e.getMessage(), e);
        }
    }

    private String errorMessage(HttpResponse<byte[]> response) {
        byte[] body = response.body();
        if (body != null && body.length > 0) {
            try {
                Map<?, ?> error = codec.readValue(body, Map.class);
                Object message = error.get("message");
                if (message != null) {
                    return message.toString();
                }
            } catch (JsonException e) {
                log.debug("Non-JSON PostgREST error body: {}", e.getMessage());
            }
        }
        return "PostgREST responded with status " + response.statusCode();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
