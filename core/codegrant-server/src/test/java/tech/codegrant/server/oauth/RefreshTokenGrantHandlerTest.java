package tech.codegrant.server.oauth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.codegrant.server.client.ClientAuthenticator;
import tech.codegrant.server.client.ClientRegistry;
import tech.codegrant.server.client.OAuthClient;
import tech.codegrant.server.common.errors.OAuthError;
import tech.codegrant.server.common.errors.OAuthException;
import tech.codegrant.server.principal.PasswordService;
import tech.codegrant.server.test.MutableClock;
import tech.codegrant.server.token.InMemoryTokenStore;
import tech.codegrant.server.token.SecureTokens;
import tech.codegrant.server.token.TokenIssuer;
import tech.codegrant.server.token.TokenResponse;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for refresh token rotation and reuse detection.
 */
class RefreshTokenGrantHandlerTest {

    private static final String SECRET = "demo-client-secret";

    private final PasswordService passwordService = new PasswordService(1, 1024, 1);
    private final MutableClock clock = MutableClock.startingAt("2024-01-01T10:00:00Z");

    private InMemoryTokenStore tokenStore;
    private TokenIssuer tokenIssuer;
    private ClientAuthenticator clientAuthenticator;
    private RefreshTokenGrantHandler handler;

    @BeforeEach
    void setUp() {
        Map<String, OAuthClient> clients = Map.of(
            "demo-client", client("demo-client", passwordService.hashPassword(SECRET)),
            "other-client", client("other-client", passwordService.hashPassword("other-secret")));
        ClientRegistry registry = clientId -> Optional.ofNullable(clientId).map(clients::get);

        tokenStore = new InMemoryTokenStore(Duration.ofHours(1), Duration.ofDays(30), 1000);
        tokenIssuer = new TokenIssuer(tokenStore, clock, Duration.ofHours(1), Duration.ofDays(30), true);
        clientAuthenticator = new ClientAuthenticator(registry, passwordService);
        handler = new RefreshTokenGrantHandler(tokenStore, tokenIssuer, clientAuthenticator, clock);
    }

    private static OAuthClient client(String clientId, String secretHash) {
        OAuthClient client = new OAuthClient();
        client.clientId = clientId;
        client.clientSecretHash = secretHash;
        client.redirectUris = List.of("http://localhost:3000/callback");
        client.allowedScopes = List.of("read", "write");
        client.defaultScopes = List.of("read");
        return client;
    }

    private TokenResponse refresh(String refreshToken, String scope) {
        return handler.refresh(TokenRequest.refreshToken(refreshToken, scope, null, "demo-client", SECRET));
    }

    private static void assertOAuthError(Runnable call, OAuthError expected) {
        assertThatThrownBy(call::run)
            .isInstanceOfSatisfying(OAuthException.class, e -> assertThat(e.getError()).isEqualTo(expected));
    }

    // ========================================
    // ROTATION
    // ========================================

    @Test
    @DisplayName("refresh should rotate the refresh token and keep the family")
    void refresh_shouldRotate_whenTokenValid() {
        // Arrange
        TokenResponse original = tokenIssuer.issue("demo-client", "1", "read write");

        // Act
        TokenResponse rotated = refresh(original.refresh_token(), null);

        // Assert
        assertThat(rotated.refresh_token()).isNotEqualTo(original.refresh_token());
        assertThat(rotated.access_token()).isNotEqualTo(original.access_token());
        assertThat(rotated.scope()).isEqualTo("read write");

        String originalFamily = tokenStore.findRefreshToken(SecureTokens.hash(original.refresh_token()))
            .orElseThrow().tokenFamily;
        String rotatedFamily = tokenStore.findRefreshToken(SecureTokens.hash(rotated.refresh_token()))
            .orElseThrow().tokenFamily;
        assertThat(rotatedFamily).isEqualTo(originalFamily);
        assertThat(tokenStore.findRefreshToken(SecureTokens.hash(original.refresh_token())).orElseThrow().replacedBy)
            .isEqualTo(SecureTokens.hash(rotated.refresh_token()));
    }

    @Test
    @DisplayName("refresh should allow narrowing but not widening the scope")
    void refresh_shouldNarrowScope_andRejectWidening() {
        TokenResponse original = tokenIssuer.issue("demo-client", "1", "read");
        TokenResponse wide = tokenIssuer.issue("demo-client", "1", "read write");

        assertOAuthError(() -> refresh(original.refresh_token(), "read write"), OAuthError.INVALID_SCOPE);
        assertThat(refresh(wide.refresh_token(), "write").scope()).isEqualTo("write");
    }

    // ========================================
    // REUSE DETECTION
    // ========================================

    @Test
    @DisplayName("refresh should revoke the whole family when a rotated token is presented again")
    void refresh_shouldRevokeFamily_whenRotatedTokenReused() {
        // Arrange
        TokenResponse original = tokenIssuer.issue("demo-client", "1", "read");
        TokenResponse rotated = refresh(original.refresh_token(), null);

        // Act: replay the old token
        assertOAuthError(() -> refresh(original.refresh_token(), null), OAuthError.INVALID_GRANT);

        // Assert: the successor is dead too, along with its access token
        assertOAuthError(() -> refresh(rotated.refresh_token(), null), OAuthError.INVALID_GRANT);
        assertThat(tokenStore.findAccessToken(SecureTokens.hash(rotated.access_token()))).isEmpty();
    }

    // ========================================
    // FAILURES
    // ========================================

    @Test
    @DisplayName("refresh should reject unknown and expired tokens with invalid_grant")
    void refresh_shouldFail_whenTokenUnknownOrExpired() {
        TokenResponse original = tokenIssuer.issue("demo-client", "1", "read");

        assertOAuthError(() -> refresh("not-a-token", null), OAuthError.INVALID_GRANT);

        clock.advance(Duration.ofDays(31));
        assertOAuthError(() -> refresh(original.refresh_token(), null), OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("refresh should require the refresh_token parameter")
    void refresh_shouldFail_whenTokenMissing() {
        assertOAuthError(() -> refresh(null, null), OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("refresh should reject a token presented by another client")
    void refresh_shouldFail_whenClientDiffers() {
        TokenResponse original = tokenIssuer.issue("demo-client", "1", "read");

        assertOAuthError(() -> handler.refresh(TokenRequest.refreshToken(
            original.refresh_token(), null, null, "other-client", "other-secret")), OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("refresh should reject a wrong client secret with invalid_client")
    void refresh_shouldFail_whenSecretWrong() {
        TokenResponse original = tokenIssuer.issue("demo-client", "1", "read");

        assertThatThrownBy(() -> handler.refresh(TokenRequest.refreshToken(
                original.refresh_token(), null, null, "demo-client", "wrong")))
            .isInstanceOfSatisfying(OAuthException.class, e -> {
                assertThat(e.getError()).isEqualTo(OAuthError.INVALID_CLIENT);
                assertThat(e.getStatus()).isEqualTo(401);
            });
    }

    @Test
    @DisplayName("refresh should be an unsupported grant when refresh tokens are disabled")
    void refresh_shouldFail_whenDisabled() {
        TokenIssuer disabled = new TokenIssuer(tokenStore, clock, Duration.ofHours(1), Duration.ofDays(30), false);
        RefreshTokenGrantHandler disabledHandler =
            new RefreshTokenGrantHandler(tokenStore, disabled, clientAuthenticator, clock);

        assertOAuthError(() -> disabledHandler.refresh(
            TokenRequest.refreshToken("anything", null, null, "demo-client", SECRET)), OAuthError.UNSUPPORTED_GRANT_TYPE);
    }
}
