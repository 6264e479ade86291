package com.example.terminal_relay_service.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultCredentialResolverTest {

    @Test
    @DisplayName("Should prefer the session env over configured and process keys")
    void resolve_SessionKeyWins() {
        DefaultCredentialResolver resolver = new DefaultCredentialResolver("global-anthropic", "",
                Map.of("ANTHROPIC_API_KEY", "env-anthropic"));

        Map<String, String> credentials = resolver.resolveCredentials("u1", Map.of("ANTHROPIC_API_KEY", "session-anthropic"));

        assertThat(credentials).containsEntry("ANTHROPIC_API_KEY", "session-anthropic");
    }

    @Test
    @DisplayName("Should fall back to configured keys, then to the process environment")
    void resolve_FallbackChain() {
        DefaultCredentialResolver resolver = new DefaultCredentialResolver("global-anthropic", " ",
                Map.of("ANTHROPIC_API_KEY", "env-anthropic", "OPENAI_API_KEY", "env-openai"));

        Map<String, String> credentials = resolver.resolveCredentials(null, Map.of());

        assertThat(credentials)
                .containsEntry("ANTHROPIC_API_KEY", "global-anthropic")
                .containsEntry("OPENAI_API_KEY", "env-openai");
    }

    @Test
    @DisplayName("Should omit keys that no layer provides")
    void resolve_NothingConfigured_Empty() {
        DefaultCredentialResolver resolver = new DefaultCredentialResolver("", "", Map.of());

        assertThat(resolver.resolveCredentials("u1", null)).isEmpty();
    }
}
