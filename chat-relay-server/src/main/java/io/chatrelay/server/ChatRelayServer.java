package io.chatrelay.server;

import io.chatrelay.json.jackson.JacksonJsonCodec;
import io.chatrelay.json.spi.JsonCodec;
import io.chatrelay.server.core.ChatRelayHandler;
import io.chatrelay.server.core.InMemoryMessageStore;
import io.chatrelay.server.spi.MessageStore;
import io.chatrelay.store.postgrest.PostgrestConfig;
import io.chatrelay.store.postgrest.PostgrestMessageStore;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Runnable chat relay: Javalin host, store selection, CORS and graceful shutdown.
 */
public final class ChatRelayServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChatRelayServer.class);

    private final RelayConfig config;
    private final ChatRelayHandler handler;
    private final Javalin app;

    ChatRelayServer(RelayConfig config, MessageStore store, JsonCodec codec) {
        this.config = config;
        this.handler = ChatRelayHandler.builder(store)
                .codec(codec)
                .pulseInterval(config.heartbeat())
                .messagesTable(config.messagesTable())
                .build();
        this.app = createApp(config, new JavalinBridge(handler));
    }

    public static void main(String[] args) {
        RelayConfig config;
        try {
            config = RelayConfig.fromEnvironment();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        JsonCodec codec = new JacksonJsonCodec();
        ChatRelayServer server = new ChatRelayServer(config, createStore(config, codec), codec);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "chat-relay-shutdown"));
        server.start();
    }

    static MessageStore createStore(RelayConfig config, JsonCodec codec) {
        Optional<PostgrestConfig> postgrest = config.postgrest();
        if (postgrest.isPresent()) {
            return PostgrestMessageStore.create(codec, postgrest.get());
        }
        log.warn("SUPABASE_URL and SUPABASE_KEY are not set; messages are kept in memory and lost on restart");
        return new InMemoryMessageStore();
    }

    private static Javalin createApp(RelayConfig config, JavalinBridge bridge) {
        Javalin app = Javalin.create(javalin -> {
            javalin.showJavalinBanner = false;
            javalin.useVirtualThreads = true;
            javalin.bundledPlugins.enableCors(cors -> cors.addRule(rule -> {
                if (config.anyOrigin()) {
                    rule.anyHost();
                } else {
                    List<String> origins = config.corsOrigins();
                    rule.allowHost(origins.get(0), origins.subList(1, origins.size()).toArray(new String[0]));
                    rule.allowCredentials = true;
                }
            }));
        });
        app.get("/", bridge);
        app.get("/*", bridge);
        app.post("/*", bridge);
        app.put("/*", bridge);
        app.patch("/*", bridge);
        app.delete("/*", bridge);
        return app;
    }

    public ChatRelayServer start() {
        app.start(config.port());
        logBanner();
        return this;
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        return app.port();
    }

    ChatRelayHandler handler() {
        return handler;
    }

    private void logBanner() {
        log.info("==================================================");
        log.info("Chat relay with SSE started on http://localhost:{}", port());
        log.info("Store: {}", handler.messages().storeDescription());
        log.info("Heartbeat every {}s, webhook table '{}'", config.heartbeat().toSeconds(), config.messagesTable());
        log.info("CORS origins: {}", config.corsOrigins());
        log.info("Endpoints:");
        log.info("  GET  /                     health");
        log.info("  GET  /api/test             store connectivity");
        log.info("  GET  /api/sse/:sessionId   live event stream");
        log.info("  GET  /api/messages/:id     messages of a session");
        log.info("  POST /api/messages         send a message");
        log.info("  GET  /api/message/:id      one message");
        log.info("  GET  /api/sessions         all sessions");
        log.info("  POST /webhook/supabase     database change webhook");
        log.info("==================================================");
    }

    /** Close every event stream, then stop the HTTP server. */
    @Override
    public void close() {
        log.info("Shutting down chat relay");
        handler.close();
        app.stop();
    }
}
