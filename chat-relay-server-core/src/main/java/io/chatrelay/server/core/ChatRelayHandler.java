package io.chatrelay.server.core;

import io.chatrelay.core.MessageRecord;
import io.chatrelay.core.MessageSubmission;
import io.chatrelay.core.Protocol;
import io.chatrelay.json.spi.JsonCodec;
import io.chatrelay.json.spi.JsonCodecs;
import io.chatrelay.json.spi.JsonException;
import io.chatrelay.server.spi.MessageStore;
import io.chatrelay.server.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.concurrent.ExecutorService;

/**
 * Framework-neutral HTTP handler for the chat relay.
 *
 * <p>Hosts translate their native request into a {@link ServerRequest}, call {@link #handle(ServerRequest)}
 * and write the {@link ServerResponse} back. Event-stream responses carry a {@link ResponseBody.Sse} body
 * the host must start once headers are committed.
 *
 * <pre>{@code
 * ChatRelayHandler handler = ChatRelayHandler.builder(store)
 *     .pulseInterval(Duration.ofSeconds(30))
 *     .messagesTable("whatsapp_messages")
 *     .build();
 * }</pre>
 */
public final class ChatRelayHandler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChatRelayHandler.class);

    static final List<String> AVAILABLE_ENDPOINTS = List.of(
            "GET  /",
            "GET  /api/test",
            "GET  /api/sse/:sessionId",
            "GET  /api/messages/:sessionId",
            "POST /api/messages",
            "GET  /api/message/:messageId",
            "GET  /api/sessions",
            "POST /webhook/supabase");

    private final JsonCodec codec;
    private final Clock clock;
    private final String version;
    private final SubscriptionManager subscriptions;
    private final MessageService messages;
    private final ChangeNotificationIngress notifications;
    private final ExecutorService notificationExecutor;
    private final boolean ownsNotificationExecutor;

    public static Builder builder(MessageStore store) {
        return new Builder(store);
    }

    private ChatRelayHandler(Builder b) {
        this.codec = b.codec != null ? b.codec : JsonCodecs.defaultCodec();
        this.clock = b.clock;
        this.version = b.version != null ? b.version : defaultVersion();

        SubscriptionManager.Builder sm = SubscriptionManager.builder(codec)
                .pulseInterval(b.pulseInterval)
                .clock(clock);
        if (b.writeExecutor != null) {
            sm.writeExecutor(b.writeExecutor);
        }
        this.subscriptions = sm.build();
        BroadcastDispatcher dispatcher = new BroadcastDispatcher(subscriptions.registry(), codec);
        this.messages = new MessageService(b.store, dispatcher, clock);

        this.ownsNotificationExecutor = b.notificationExecutor == null;
        this.notificationExecutor = ownsNotificationExecutor
                ? VirtualThreads.newExecutor("chat-relay-webhook")
                : b.notificationExecutor;
        this.notifications = new ChangeNotificationIngress(dispatcher, codec, b.messagesTable, notificationExecutor);
    }

    public SubscriptionManager subscriptions() {
        return subscriptions;
    }

    public MessageService messages() {
        return messages;
    }

    public ServerResponse handle(ServerRequest req) {
        String path = req.path();
        try {
            switch (req.method()) {
                case GET:
                    if (path.equals(Protocol.PATH_ROOT)) return handleHealth();
                    if (path.equals(Protocol.PATH_STORE_TEST)) return handleStoreTest();
                    if (path.equals(Protocol.PATH_SESSIONS)) return handleSessions();
                    Optional<String> id = pathParam(path, Protocol.PATH_SSE_PREFIX);
                    if (id.isPresent()) return handleSse(id.get());
                    id = pathParam(path, Protocol.PATH_MESSAGES_PREFIX);
                    if (id.isPresent()) return handleListMessages(id.get());
                    id = pathParam(path, Protocol.PATH_MESSAGE_PREFIX);
                    if (id.isPresent()) return handleGetMessage(id.get());
                    break;
                case POST:
                    if (path.equals(Protocol.PATH_MESSAGES)) return handleSubmit(req);
                    if (path.equals(Protocol.PATH_CHANGE_WEBHOOK)) return handleWebhook(req);
                    break;
                default:
                    break;
            }
            return notFound(req.uri());
        } catch (JsonException e) {
            log.error("Cannot encode response for {} {}", req.method(), path, e);
            return new ServerResponse(500, new ResponseBody.Empty())
                    .header(Protocol.H_CACHE_CONTROL, "no-store");
        } catch (RuntimeException e) {
            log.error("Unhandled error for {} {}", req.method(), path, e);
            return errorResponse(500, "internal_error");
        }
    }

    private ServerResponse handleHealth() throws JsonException {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "GET /");
        endpoints.put("testDB", "GET /api/test");
        endpoints.put("getMessages", "GET /api/messages/:sessionId");
        endpoints.put("sendMessage", "POST /api/messages");
        endpoints.put("getMessage", "GET /api/message/:messageId");
        endpoints.put("sseStream", "GET /api/sse/:sessionId");
        endpoints.put("sessions", "GET /api/sessions");
        endpoints.put("webhook", "POST /webhook/supabase");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Chat relay with SSE is running!");
        body.put("status", "healthy");
        body.put("version", version);
        body.put("sse_enabled", true);
        body.put("connected_sessions", activeSessions());
        body.put("endpoints", endpoints);
        return json(200, body);
    }

    private ServerResponse handleStoreTest() throws JsonException {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            long total = messages.count();
            body.put("success", true);
            body.put("message", "Message store connected successfully!");
            body.put("total_messages", total);
            body.put("store", messages.storeDescription());
            body.put("sse_active_sessions", activeSessions());
            body.put("timestamp", clock.instant());
            return json(200, body);
        } catch (StoreException e) {
            log.error("Store connectivity check failed: {}", e.getMessage());
            body.put("success", false);
            body.put("error", e.getMessage());
            body.put("hint", "Check the message store credentials and network connectivity");
            return json(500, body);
        }
    }

    private ServerResponse handleSse(String sessionId) {
        log.info("SSE connection request for session {}", sessionId);
        SseStream stream = channel -> subscriptions.open(sessionId, channel);
        return new ServerResponse(200, new ResponseBody.Sse(stream))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM)
                .header(Protocol.H_CACHE_CONTROL, "no-cache")
                .header(Protocol.H_CONNECTION, "keep-alive")
                .header(Protocol.H_ALLOW_ORIGIN, "*");
    }

    private ServerResponse handleListMessages(String sessionId) throws JsonException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("session_id", sessionId);
        try {
            List<MessageRecord> found = messages.messagesFor(sessionId);
            log.debug("Found {} message(s) for session {}", found.size(), sessionId);
            body.put("count", found.size());
            body.put("messages", found);
            body.put("timestamp", clock.instant());
            return json(200, body);
        } catch (StoreException e) {
            log.error("Cannot list messages for session {}: {}", sessionId, e.getMessage());
            body.put("success", false);
            body.put("error", e.getMessage());
            body.put("messages", List.of());
            return json(500, body);
        }
    }

    private ServerResponse handleSubmit(ServerRequest req) throws JsonException {
        MessageSubmission submission;
        try {
            submission = codec.readValue(req.body(), MessageSubmission.class);
        } catch (JsonException e) {
            return submissionRejected(e.getMessage());
        }

        try {
            MessageRecord saved = messages.submit(submission);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("message", "Message sent successfully!");
            body.put(Protocol.F_MESSAGE_ID, saved.id());
            body.put(Protocol.F_SESSION_ID, saved.sessionId());
            body.put(Protocol.F_SENDER_ID, saved.senderId());
            body.put(Protocol.F_TIMESTAMP, saved.timestamp());
            body.put("data", saved);
            return json(200, body);
        } catch (ValidationException e) {
            log.warn("Rejected message submission: {}", e.getMessage());
            return submissionRejected(e.getMessage());
        } catch (StoreException e) {
            log.error("Failed to store message: {}", e.getMessage());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", false);
            body.put("error", e.getMessage());
            body.put("hint", "Check that the messages table exists and the key may write to it");
            return json(500, body);
        }
    }

    private ServerResponse handleGetMessage(String messageId) throws JsonException {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            Optional<MessageRecord> found = messages.find(messageId);
            if (found.isEmpty()) {
                body.put("success", false);
                body.put("error", "Message not found");
                body.put("messageId", messageId);
                return json(404, body);
            }
            body.put("success", true);
            body.put("message", found.get());
            return json(200, body);
        } catch (StoreException e) {
            log.error("Cannot load message {}: {}", messageId, e.getMessage());
            body.put("success", false);
            body.put("error", e.getMessage());
            return json(500, body);
        }
    }

    private ServerResponse handleSessions() throws JsonException {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            SortedSet<String> sessions = messages.sessions();
            body.put("success", true);
            body.put("count", sessions.size());
            body.put("sessions", new ArrayList<>(sessions));
            body.put("active_sse_sessions", activeSessions());
            return json(200, body);
        } catch (StoreException e) {
            log.error("Cannot list sessions: {}", e.getMessage());
            body.put("success", false);
            body.put("error", e.getMessage());
            return json(500, body);
        }
    }

    private ServerResponse handleWebhook(ServerRequest req) throws JsonException {
        byte[] raw = req.body() == null ? new byte[0] : req.body();
        notifications.accept(raw);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Webhook received");
        return json(200, body);
    }

    private ServerResponse submissionRejected(String error) throws JsonException {
        Map<String, String> example = new LinkedHashMap<>();
        example.put(Protocol.F_SESSION_ID, "chat-session-123");
        example.put(Protocol.F_SENDER_ID, "user1");
        example.put(Protocol.F_MESSAGE_TEXT, "Hello there!");
        example.put(Protocol.F_RECIPIENT_ID, "user2");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        body.put("required_fields", Protocol.REQUIRED_SUBMISSION_FIELDS);
        body.put("example", example);
        return json(400, body);
    }

    private ServerResponse notFound(URI uri) throws JsonException {
        String requested = uri.getRawPath() == null ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            requested = requested + "?" + uri.getRawQuery();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", "Route not found");
        body.put("requested_url", requested);
        body.put("available_endpoints", AVAILABLE_ENDPOINTS);
        return json(404, body);
    }

    private ServerResponse json(int status, Map<String, ?> body) throws JsonException {
        return ServerResponse.json(status, codec.writeBytes(body));
    }

    private static ServerResponse errorResponse(int status, String error) {
        String body = "{\"success\":false,\"error\":\"" + error + "\"}";
        return ServerResponse.json(status, body.getBytes(StandardCharsets.UTF_8));
    }

    private List<String> activeSessions() {
        List<String> sessions = new ArrayList<>(subscriptions.registry().listActiveSessions());
        sessions.sort(null);
        return sessions;
    }

    /** Single non-empty path segment following {@code prefix}, if the path has that shape. */
    static Optional<String> pathParam(String path, String prefix) {
        if (!path.startsWith(prefix)) {
            return Optional.empty();
        }
        String rest = path.substring(prefix.length());
        if (rest.endsWith("/")) {
            rest = rest.substring(0, rest.length() - 1);
        }
        if (rest.isEmpty() || rest.indexOf('/') >= 0) {
            return Optional.empty();
        }
        return Optional.of(rest);
    }

    private static String defaultVersion() {
        String v = ChatRelayHandler.class.getPackage().getImplementationVersion();
        return v != null ? v : "dev";
    }

    /** Closes every subscriber and stops background executors the handler created. */
    @Override
    public void close() {
        subscriptions.shutdown();
        if (ownsNotificationExecutor) {
            notificationExecutor.shutdown();
        }
    }

    /**
     * Builder for {@link ChatRelayHandler}.
     */
    public static final class Builder {
        private final MessageStore store;
        private JsonCodec codec;
        private Clock clock = Clock.systemUTC();
        private Duration pulseInterval = SubscriptionManager.DEFAULT_PULSE_INTERVAL;
        private String messagesTable = Protocol.DEFAULT_MESSAGES_TABLE;
        private ExecutorService writeExecutor;
        private ExecutorService notificationExecutor;
        private String version;

        private Builder(MessageStore store) {
            this.store = Objects.requireNonNull(store, "store");
        }

        /** JSON codec. Default: the highest-priority provider found by {@link JsonCodecs#defaultCodec()}. */
        public Builder codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        /** Clock used for message timestamps. Default: system UTC. */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Keep-alive pulse interval for event streams. Default: 30 seconds. */
        public Builder pulseInterval(Duration pulseInterval) {
            this.pulseInterval = Objects.requireNonNull(pulseInterval, "pulseInterval");
            return this;
        }

        /** Table whose inserts are announced by the change webhook. Default: {@code whatsapp_messages}. */
        public Builder messagesTable(String messagesTable) {
            this.messagesTable = Objects.requireNonNull(messagesTable, "messagesTable");
            return this;
        }

        public Builder writeExecutor(ExecutorService writeExecutor) {
            this.writeExecutor = writeExecutor;
            return this;
        }

        public Builder notificationExecutor(ExecutorService notificationExecutor) {
            this.notificationExecutor = notificationExecutor;
            return this;
        }

        /** Version reported by the health route. Default: the jar's implementation version. */
        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public ChatRelayHandler build() {
            return new ChatRelayHandler(this);
        }
    }
}
