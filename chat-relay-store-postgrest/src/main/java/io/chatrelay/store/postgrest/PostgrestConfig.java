package io.chatrelay.store.postgrest;

import io.chatrelay.core.Protocol;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for a PostgREST endpoint such as a Supabase project.
 *
 * @param baseUrl project URL, e.g. {@code https://abc.supabase.co}; {@code /rest/v1} is appended
 * @param apiKey key sent as {@code apikey} and bearer token
 * @param table messages table
 * @param timeout per-request timeout
 */
public record PostgrestConfig(URI baseUrl, String apiKey, String table, Duration timeout) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public PostgrestConfig {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(timeout, "timeout");
        if (baseUrl.getScheme() == null || baseUrl.getHost() == null) {
            throw new IllegalArgumentException("baseUrl must be absolute: " + baseUrl);
        }
        if (apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be blank");
        }
        if (table.isBlank()) {
            throw new IllegalArgumentException("table must not be blank");
        }
    }

    public static PostgrestConfig of(String baseUrl, String apiKey) {
        return new PostgrestConfig(URI.create(baseUrl), apiKey, Protocol.DEFAULT_MESSAGES_TABLE, DEFAULT_TIMEOUT);
    }

    public PostgrestConfig withTable(String table) {
        return new PostgrestConfig(baseUrl, apiKey, table, timeout);
    }

    public PostgrestConfig withTimeout(Duration timeout) {
        return new PostgrestConfig(baseUrl, apiKey, table, timeout);
    }

    /** {@code <baseUrl>/rest/v1/<table>} */
    URI tableUri() {
        String base = baseUrl.toString();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/rest/v1/" + table);
    }

    @Override
    public String toString() {
        return "PostgrestConfig{baseUrl=" + baseUrl + ", table=" + table + ", timeout=" + timeout + "}";
    }
}
