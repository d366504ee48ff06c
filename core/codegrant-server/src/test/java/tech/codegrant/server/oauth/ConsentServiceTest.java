package tech.codegrant.server.oauth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.codegrant.server.client.ClientRegistry;
import tech.codegrant.server.client.OAuthClient;
import tech.codegrant.server.common.errors.OAuthException;
import tech.codegrant.server.principal.UserAccount;
import tech.codegrant.server.principal.UserDirectory;
import tech.codegrant.server.store.InMemoryAuthorizationCodeStore;
import tech.codegrant.server.test.MutableClock;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ConsentService with a mocked user directory and a real in-memory code store.
 */
@ExtendWith(MockitoExtension.class)
class ConsentServiceTest {

    private static final String CALLBACK = "http://localhost:3000/callback";
    private static final String CALLBACK_WITH_QUERY = "http://localhost:3000/callback?tenant=acme";

    @Mock
    private UserDirectory userDirectory;

    private InMemoryAuthorizationCodeStore codeStore;
    private ConsentService service;

    @BeforeEach
    void setUp() {
        OAuthClient client = new OAuthClient();
        client.clientId = "demo-client";
        client.clientName = "Demo Client";
        client.clientSecretHash = "$argon2id$hash";
        client.redirectUris = List.of(CALLBACK, CALLBACK_WITH_QUERY);
        client.allowedScopes = List.of("read", "write");
        client.defaultScopes = List.of("read");
        ClientRegistry registry = clientId -> "demo-client".equals(clientId) ? Optional.of(client) : Optional.empty();

        codeStore = new InMemoryAuthorizationCodeStore(Duration.ofMinutes(10), 1000,
            MutableClock.startingAt("2024-01-01T10:00:00Z"));
        service = new ConsentService(new AuthorizationRequestValidator(registry, new PkceService()),
            userDirectory, codeStore);
    }

    private static Map<String, String> queryParams(URI location) {
        Map<String, String> params = new LinkedHashMap<>();
        for (String pair : location.getRawQuery().split("&")) {
            int eq = pair.indexOf('=');
            params.put(pair.substring(0, eq), URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return params;
    }

    private static UserAccount demoUser() {
        return new UserAccount("1", "demo", "demo@example.com", "Demo User", "$argon2id$hash");
    }

    @Test
    @DisplayName("approve should redirect with a code bound to the user, client and redirect URI")
    void approve_shouldRedirectWithCode_whenCredentialsValid() {
        // Arrange
        when(userDirectory.authenticate("demo", "demo123")).thenReturn(Optional.of(demoUser()));
        AuthorizationRequest request = new AuthorizationRequest(
            "demo-client", CALLBACK, null, "read write", "state-123", null, null);

        // Act
        ConsentOutcome outcome = service.approve(request, "demo", "demo123");

        // Assert
        assertThat(outcome).isInstanceOf(ConsentOutcome.Redirect.class);
        URI location = ((ConsentOutcome.Redirect) outcome).location();
        assertThat(location.toString()).startsWith(CALLBACK + "?code=");

        Map<String, String> params = queryParams(location);
        assertThat(params.get("state")).isEqualTo("state-123");

        AuthorizationCode authCode = codeStore.consumeIfValid(params.get("code")).orElseThrow();
        assertThat(authCode.userId).isEqualTo("1");
        assertThat(authCode.clientId).isEqualTo("demo-client");
        assertThat(authCode.redirectUri).isEqualTo(CALLBACK);
        assertThat(authCode.scope).isEqualTo("read write");
    }

    @Test
    @DisplayName("approve should echo state byte-for-byte for printable ASCII")
    void approve_shouldEchoState_whenStateHasSpecialCharacters() {
        when(userDirectory.authenticate(any(), any())).thenReturn(Optional.of(demoUser()));
        StringBuilder printable = new StringBuilder();
        for (char c = 0x20; c < 0x7f; c++) {
            printable.append(c);
        }
        String state = printable.toString().repeat(3).substring(0, 256);

        ConsentOutcome outcome = service.approve(
            new AuthorizationRequest("demo-client", CALLBACK, null, null, state, null, null), "demo", "demo123");

        URI location = ((ConsentOutcome.Redirect) outcome).location();
        assertThat(queryParams(location).get("state")).isEqualTo(state);
    }

    @Test
    @DisplayName("approve should omit state when the client sent none and append to an existing query")
    void approve_shouldAppendWithAmpersand_whenRedirectHasQuery() {
        when(userDirectory.authenticate(any(), any())).thenReturn(Optional.of(demoUser()));

        ConsentOutcome outcome = service.approve(
            new AuthorizationRequest("demo-client", CALLBACK_WITH_QUERY, null, null, null, null, null), "demo", "demo123");

        URI location = ((ConsentOutcome.Redirect) outcome).location();
        assertThat(location.toString()).startsWith(CALLBACK_WITH_QUERY + "&code=");
        assertThat(queryParams(location)).containsKeys("tenant", "code").doesNotContainKey("state");
    }

    @Test
    @DisplayName("approve should return the context with a generic error when credentials are wrong")
    void approve_shouldReject_whenCredentialsInvalid() {
        when(userDirectory.authenticate("demo", "wrong")).thenReturn(Optional.empty());

        ConsentOutcome outcome = service.approve(
            new AuthorizationRequest("demo-client", CALLBACK, null, "read", "s1", null, null), "demo", "wrong");

        assertThat(outcome).isInstanceOfSatisfying(ConsentOutcome.Rejected.class, rejected -> {
            assertThat(rejected.context().error()).isEqualTo("Invalid username or password");
            assertThat(rejected.context().state()).isEqualTo("s1");
            assertThat(rejected.context().client_id()).isEqualTo("demo-client");
        });
    }

    @Test
    @DisplayName("approve should re-validate the request before authenticating the user")
    void approve_shouldThrow_whenRedirectTampered() {
        assertThatThrownBy(() -> service.approve(
                new AuthorizationRequest("demo-client", "http://evil.example/cb", null, "read", "s1", null, null),
                "demo", "demo123"))
            .isInstanceOf(OAuthException.class);

        verifyNoInteractions(userDirectory);
    }
}
