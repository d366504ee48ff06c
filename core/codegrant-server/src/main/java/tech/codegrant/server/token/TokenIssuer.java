package tech.codegrant.server.token;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.codegrant.server.config.AuthServerConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Mints opaque access and refresh tokens and records their hashes.
 */
@ApplicationScoped
public class TokenIssuer {

    private static final Logger LOG = Logger.getLogger(TokenIssuer.class);

    private final TokenStore tokenStore;
    private final Clock clock;
    private final Duration accessTokenExpiry;
    private final Duration refreshTokenExpiry;
    private final boolean refreshTokensEnabled;

    @Inject
    public TokenIssuer(TokenStore tokenStore, AuthServerConfig config, Clock clock) {
        this(tokenStore, clock, config.accessTokenExpiry(),
            config.refreshTokens().expiry(), config.refreshTokens().enabled());
    }

    public TokenIssuer(TokenStore tokenStore, Clock clock, Duration accessTokenExpiry,
                       Duration refreshTokenExpiry, boolean refreshTokensEnabled) {
        this.tokenStore = tokenStore;
        this.clock = clock;
        this.accessTokenExpiry = accessTokenExpiry;
        this.refreshTokenExpiry = refreshTokenExpiry;
        this.refreshTokensEnabled = refreshTokensEnabled;
    }

    public boolean refreshTokensEnabled() {
        return refreshTokensEnabled;
    }

    /**
     * Issue tokens for a fresh grant. A new refresh token family is started.
     */
    public TokenResponse issue(String clientId, String userId, String scope) {
        String refreshToken = refreshTokensEnabled ? SecureTokens.generate() : null;
        return issue(clientId, userId, scope, SecureTokens.generate(), refreshToken);
    }

    /**
     * Issue tokens within an existing family.
     *
     * @param refreshToken pre-generated refresh token, or null to issue none
     */
    public TokenResponse issue(String clientId, String userId, String scope,
                               String tokenFamily, String refreshToken) {
        Instant now = clock.instant();
        String accessToken = SecureTokens.generate();

        AccessToken at = new AccessToken();
        at.tokenHash = SecureTokens.hash(accessToken);
        at.clientId = clientId;
        at.userId = userId;
        at.scope = scope;
        at.tokenFamily = refreshToken != null ? tokenFamily : null;
        at.issuedAt = now;
        at.expiresAt = now.plus(accessTokenExpiry);
        tokenStore.saveAccessToken(at);

        if (refreshToken != null) {
            RefreshToken rt = new RefreshToken();
            rt.tokenHash = SecureTokens.hash(refreshToken);
            rt.userId = userId;
            rt.clientId = clientId;
            rt.scope = scope;
            rt.tokenFamily = tokenFamily;
            rt.issuedAt = now;
            rt.expiresAt = now.plus(refreshTokenExpiry);
            tokenStore.saveRefreshToken(rt);
        }

        LOG.infof("Issued tokens for client %s, user %s, scope [%s]", clientId, userId, scope);
        return new TokenResponse(
            accessToken,
            TokenResponse.BEARER,
            accessTokenExpiry.toSeconds(),
            scope,
            refreshToken
        );
    }
}
