package tech.codegrant.server.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.codegrant.server.client.ClientAuthenticator;
import tech.codegrant.server.client.ClientCredentials;
import tech.codegrant.server.client.OAuthClient;
import tech.codegrant.server.common.errors.OAuthError;
import tech.codegrant.server.common.errors.OAuthException;
import tech.codegrant.server.token.RefreshToken;
import tech.codegrant.server.token.SecureTokens;
import tech.codegrant.server.token.TokenIssuer;
import tech.codegrant.server.token.TokenResponse;
import tech.codegrant.server.token.TokenStore;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * refresh_token grant with rotation.
 *
 * Every refresh token is single use. Using it yields a new access token and a
 * new refresh token in the same family. Presenting a token that was already
 * rotated revokes the whole family, successors included.
 */
@ApplicationScoped
public class RefreshTokenGrantHandler {

    private static final Logger LOG = Logger.getLogger(RefreshTokenGrantHandler.class);

    static final String INVALID_REFRESH_TOKEN = "Invalid refresh token";

    private final TokenStore tokenStore;
    private final TokenIssuer tokenIssuer;
    private final ClientAuthenticator clientAuthenticator;
    private final Clock clock;

    @Inject
    public RefreshTokenGrantHandler(TokenStore tokenStore, TokenIssuer tokenIssuer,
                                    ClientAuthenticator clientAuthenticator, Clock clock) {
        this.tokenStore = tokenStore;
        this.tokenIssuer = tokenIssuer;
        this.clientAuthenticator = clientAuthenticator;
        this.clock = clock;
    }

    public TokenResponse refresh(TokenRequest request) {
        if (!tokenIssuer.refreshTokensEnabled()) {
            throw OAuthException.badRequest(OAuthError.UNSUPPORTED_GRANT_TYPE,
                "Supported grant types: authorization_code");
        }
        if (request.refreshToken() == null || request.refreshToken().isBlank()) {
            throw OAuthException.badRequest(OAuthError.INVALID_REQUEST, "refresh_token is required");
        }

        Instant now = clock.instant();
        String tokenHash = SecureTokens.hash(request.refreshToken());
        String nextRefreshToken = SecureTokens.generate();

        Optional<RefreshToken> consumed = tokenStore.consumeRefreshToken(
            tokenHash, SecureTokens.hash(nextRefreshToken), now);
        if (consumed.isEmpty()) {
            tokenStore.findRefreshToken(tokenHash)
                .filter(RefreshToken::wasRotated)
                .ifPresent(reused -> revokeFamily(reused, now));
            throw invalidRefreshToken();
        }
        RefreshToken previous = consumed.get();

        ClientCredentials credentials = ClientCredentials.resolve(
                request.authorizationHeader(), request.clientId(), request.clientSecret())
            .orElseThrow(() -> OAuthException.unauthorized(OAuthError.INVALID_CLIENT, "Client authentication failed"));

        OAuthClient client = clientAuthenticator.resolveClient(credentials);
        if (!client.clientId.equals(previous.clientId)) {
            LOG.warnf("Client %s presented a refresh token issued to client %s", client.clientId, previous.clientId);
            throw invalidRefreshToken();
        }
        clientAuthenticator.verifySecret(client, credentials);

        String scope = narrowScope(previous.scope, request.scope());

        LOG.debugf("Rotating refresh token for client %s, user %s", client.clientId, previous.userId);
        return tokenIssuer.issue(client.clientId, previous.userId, scope, previous.tokenFamily, nextRefreshToken);
    }

    private void revokeFamily(RefreshToken reused, Instant now) {
        int revoked = tokenStore.revokeTokenFamily(reused.tokenFamily, now);
        LOG.warnf("Refresh token reuse detected for client %s, user %s: revoked %d token(s) in family",
            reused.clientId, reused.userId, revoked);
    }

    /**
     * A refresh may ask for fewer scopes than originally granted, never more.
     */
    static String narrowScope(String grantedScope, String requestedScope) {
        List<String> requested = Scopes.parse(requestedScope);
        if (requested.isEmpty()) {
            return grantedScope;
        }
        if (!Scopes.parse(grantedScope).containsAll(requested)) {
            throw OAuthException.badRequest(OAuthError.INVALID_SCOPE,
                "Requested scope exceeds the originally granted scope");
        }
        return Scopes.join(requested);
    }

    private static OAuthException invalidRefreshToken() {
        return OAuthException.badRequest(OAuthError.INVALID_GRANT, INVALID_REFRESH_TOKEN);
    }
}
