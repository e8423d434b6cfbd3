package io.chatrelay.server;

import io.chatrelay.store.postgrest.PostgrestConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelayConfigTest {

    @Test
    void defaultsWithoutEnvironment() {
        RelayConfig config = RelayConfig.fromEnvironment(Map.of());

        assertThat(config.port()).isEqualTo(8000);
        assertThat(config.messagesTable()).isEqualTo("whatsapp_messages");
        assertThat(config.heartbeat()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.storeTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.corsOrigins()).contains("http://localhost:3000", "http://localhost:5173");
        assertThat(config.postgrest()).isEmpty();
    }

    @Test
    void supabaseCredentialsSelectPostgrest() {
        RelayConfig config = RelayConfig.fromEnvironment(Map.of(
                "SUPABASE_URL", "https://abc.supabase.co",
                "SUPABASE_KEY", "sb_publishable_123",
                "MESSAGES_TABLE", "messages",
                "STORE_TIMEOUT_SECONDS", "3"));

        PostgrestConfig postgrest = config.postgrest().orElseThrow();
        assertThat(postgrest.baseUrl().getHost()).isEqualTo("abc.supabase.co");
        assertThat(postgrest.table()).isEqualTo("messages");
        assertThat(postgrest.timeout()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void halfConfiguredSupabaseIsRejected() {
        assertThatThrownBy(() -> RelayConfig.fromEnvironment(Map.of("SUPABASE_URL", "https://abc.supabase.co")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SUPABASE_KEY");
        assertThatThrownBy(() -> RelayConfig.fromEnvironment(Map.of("SUPABASE_KEY", "k", "SUPABASE_URL", " ")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void malformedNumbersAreRejected() {
        assertThatThrownBy(() -> RelayConfig.fromEnvironment(Map.of("PORT", "eighty")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("PORT");
        assertThatThrownBy(() -> RelayConfig.fromEnvironment(Map.of("HEARTBEAT_SECONDS", "0")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RelayConfig.fromEnvironment(Map.of("PORT", "70000")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void corsOriginsAreNormalized() {
        assertThat(RelayConfig.parseOrigins("https://app.example.com/, http://localhost:3000/x, https://app.example.com"))
                .containsExactly("https://app.example.com", "http://localhost:3000");
        assertThat(RelayConfig.fromEnvironment(Map.of("CORS_ORIGINS", "*")).anyOrigin()).isTrue();
        assertThatThrownBy(() -> RelayConfig.parseOrigins("localhost"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
