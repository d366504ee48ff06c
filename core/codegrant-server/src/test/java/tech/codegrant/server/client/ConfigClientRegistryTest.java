package tech.codegrant.server.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.codegrant.server.principal.PasswordService;
import tech.codegrant.server.test.TestRegistry;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConfigClientRegistry.
 */
class ConfigClientRegistryTest {

    private static final String CALLBACK = "http://localhost:3000/callback";

    private final PasswordService passwordService = new PasswordService(1, 1024, 1);

    @Test
    @DisplayName("findByClientId should return a confidential client with its secret hashed")
    void findByClientId_shouldHashPlaintextSecret_whenConfidential() {
        TestRegistry registry = TestRegistry.empty()
            .withConfidentialClient("demo-client", "demo-client-secret", List.of(CALLBACK), List.of("read", "write"));
        ConfigClientRegistry clients = new ConfigClientRegistry(registry, passwordService);

        OAuthClient client = clients.findByClientId("demo-client").orElseThrow();

        assertThat(client.isConfidential()).isTrue();
        assertThat(client.clientSecretHash).startsWith("$argon2id$").doesNotContain("demo-client-secret");
        assertThat(passwordService.verifyPassword("demo-client-secret", client.clientSecretHash)).isTrue();
        assertThat(client.clientName).isEqualTo("demo-client name");
        assertThat(client.defaultScopes).containsExactly("read", "write");
    }

    @Test
    @DisplayName("findByClientId should return a public client when no secret is configured")
    void findByClientId_shouldReturnPublicClient_whenNoSecret() {
        TestRegistry registry = TestRegistry.empty()
            .withPublicClient("pkce-spa-client", List.of(CALLBACK), List.of("read"));
        ConfigClientRegistry clients = new ConfigClientRegistry(registry, passwordService);

        OAuthClient client = clients.findByClientId("pkce-spa-client").orElseThrow();

        assertThat(client.isPublic()).isTrue();
        assertThat(client.clientName).isEqualTo("pkce-spa-client");
    }

    @Test
    @DisplayName("findByClientId should return empty for unknown, null and inactive clients")
    void findByClientId_shouldReturnEmpty_whenUnknownOrInactive() {
        TestRegistry registry = TestRegistry.empty().withClient("disabled", new TestRegistry.Client(
            Optional.empty(), Optional.of("s"), Optional.empty(),
            List.of(CALLBACK), List.of("read"), Optional.empty(), false));
        ConfigClientRegistry clients = new ConfigClientRegistry(registry, passwordService);

        assertThat(clients.findByClientId("disabled")).isEmpty();
        assertThat(clients.findByClientId("unknown")).isEmpty();
        assertThat(clients.findByClientId(null)).isEmpty();
    }

    @Test
    @DisplayName("isRedirectUriAllowed should match registered URIs exactly")
    void isRedirectUriAllowed_shouldRequireExactMatch() {
        TestRegistry registry = TestRegistry.empty()
            .withConfidentialClient("exact", "s", List.of("http://a.com/cb"), List.of("read"));
        OAuthClient client = new ConfigClientRegistry(registry, passwordService).findByClientId("exact").orElseThrow();

        assertThat(client.isRedirectUriAllowed("http://a.com/cb")).isTrue();
        assertThat(client.isRedirectUriAllowed("http://a.com/cb/")).isFalse();
        assertThat(client.isRedirectUriAllowed("http://a.com/cb?x=1")).isFalse();
        assertThat(client.isRedirectUriAllowed("HTTP://a.com/cb")).isFalse();
        assertThat(client.isRedirectUriAllowed(null)).isFalse();
    }

    @Test
    @DisplayName("constructor should reject default scopes outside the allowed scopes")
    void constructor_shouldThrow_whenDefaultScopesNotAllowed() {
        TestRegistry registry = TestRegistry.empty().withClient("bad", new TestRegistry.Client(
            Optional.empty(), Optional.empty(), Optional.empty(),
            List.of(CALLBACK), List.of("read"), Optional.of(List.of("admin")), true));

        assertThatThrownBy(() -> new ConfigClientRegistry(registry, passwordService))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("bad");
    }
}
