package io.chatrelay.server;

import io.chatrelay.core.Protocol;
import io.chatrelay.store.postgrest.PostgrestConfig;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime settings of the relay host, read from environment variables.
 *
 * <ul>
 *   <li>{@code PORT}: listen port, default 8000</li>
 *   <li>{@code SUPABASE_URL}, {@code SUPABASE_KEY}: PostgREST store; both or neither</li>
 *   <li>{@code MESSAGES_TABLE}: default {@code whatsapp_messages}</li>
 *   <li>{@code HEARTBEAT_SECONDS}: default 30</li>
 *   <li>{@code CORS_ORIGINS}: comma separated, {@code *} for any origin</li>
 *   <li>{@code STORE_TIMEOUT_SECONDS}: default 10</li>
 * </ul>
 */
public final class RelayConfig {

    public static final int DEFAULT_PORT = 8000;
    public static final List<String> DEFAULT_CORS_ORIGINS = List.of(
            "https://bbq-chat-if.onrender.com",
            "http://localhost:3000",
            "https://figitallabsllp.retool.com",
            "http://localhost:5173");

    private final int port;
    private final String supabaseUrl;
    private final String supabaseKey;
    private final String messagesTable;
    private final Duration heartbeat;
    private final List<String> corsOrigins;
    private final Duration storeTimeout;

    RelayConfig(int port, String supabaseUrl, String supabaseKey, String messagesTable, Duration heartbeat,
                List<String> corsOrigins, Duration storeTimeout) {
        this.port = port;
        this.supabaseUrl = supabaseUrl;
        this.supabaseKey = supabaseKey;
        this.messagesTable = Objects.requireNonNull(messagesTable, "messagesTable");
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat");
        this.corsOrigins = List.copyOf(corsOrigins);
        this.storeTimeout = Objects.requireNonNull(storeTimeout, "storeTimeout");
    }

    public static RelayConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * @throws IllegalArgumentException when a value is malformed or only one Supabase credential is set
     */
    public static RelayConfig fromEnvironment(Map<String, String> env) {
        int port = intValue(env, "PORT", DEFAULT_PORT);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("PORT out of range: " + port);
        }

        String url = trimToNull(env.get("SUPABASE_URL"));
        String key = trimToNull(env.get("SUPABASE_KEY"));
        if ((url == null) != (key == null)) {
            throw new IllegalArgumentException("SUPABASE_URL and SUPABASE_KEY must be set together");
        }

        String table = trimToNull(env.get("MESSAGES_TABLE"));
        int heartbeat = intValue(env, "HEARTBEAT_SECONDS", 30);
        if (heartbeat <= 0) {
            throw new IllegalArgumentException("HEARTBEAT_SECONDS must be positive");
        }
        int timeout = intValue(env, "STORE_TIMEOUT_SECONDS", 10);
        if (timeout <= 0) {
            throw new IllegalArgumentException("STORE_TIMEOUT_SECONDS must be positive");
        }

        String origins = trimToNull(env.get("CORS_ORIGINS"));
        List<String> cors = origins == null ? DEFAULT_CORS_ORIGINS : parseOrigins(origins);

        return new RelayConfig(port, url, key, table == null ? Protocol.DEFAULT_MESSAGES_TABLE : table,
                Duration.ofSeconds(heartbeat), cors, Duration.ofSeconds(timeout));
    }

    public int port() {
        return port;
    }

    public String messagesTable() {
        return messagesTable;
    }

    public Duration heartbeat() {
        return heartbeat;
    }

    public List<String> corsOrigins() {
        return corsOrigins;
    }

    public boolean anyOrigin() {
        return corsOrigins.contains("*");
    }

    public Duration storeTimeout() {
        return storeTimeout;
    }

    /** PostgREST settings, or empty when the relay should run on the in-memory store. */
    public Optional<PostgrestConfig> postgrest() {
        if (supabaseUrl == null) {
            return Optional.empty();
        }
        return Optional.of(new PostgrestConfig(URI.create(supabaseUrl), supabaseKey, messagesTable, storeTimeout));
    }

    /** Origins reduced to {@code scheme://host[:port]}; browsers never send a path. */
    static List<String> parseOrigins(String value) {
        List<String> out = new ArrayList<>();
        for (String raw : value.split(",")) {
            String origin = raw.trim();
            if (origin.isEmpty()) {
                continue;
            }
            if (origin.equals("*")) {
                return List.of("*");
            }
            URI uri = URI.create(origin);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("Invalid CORS origin: " + origin);
            }
            String normalized = uri.getScheme() + "://" + uri.getHost() + (uri.getPort() >= 0 ? ":" + uri.getPort() : "");
            if (!out.contains(normalized)) {
                out.add(normalized);
            }
        }
        if (out.isEmpty()) {
            throw new IllegalArgumentException("CORS_ORIGINS has no usable origin");
        }
        return out;
    }

    private static int intValue(Map<String, String> env, String name, int fallback) {
        String raw = trimToNull(env.get(name));
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + raw, e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String t = value.trim();
        return t.isEmpty() ? null : t;
    }

    @Override
    public String toString() {
        return "RelayConfig{port=" + port + ", store=" + (supabaseUrl == null ? "in-memory" : supabaseUrl)
                + ", table=" + messagesTable + ", heartbeat=" + heartbeat + ", cors=" + corsOrigins + "}";
    }
}
