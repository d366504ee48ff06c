package tech.codegrant.server.store;

import org.jboss.logging.Logger;
import tech.codegrant.server.oauth.AuthorizationCode;
import tech.codegrant.server.oauth.AuthorizationCodeStore;
import tech.codegrant.server.token.SecureTokens;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared code minting and expiry handling. Backends only provide the
 * write and the atomic take.
 */
public abstract class AbstractAuthorizationCodeStore implements AuthorizationCodeStore {

    private static final Logger LOG = Logger.getLogger(AbstractAuthorizationCodeStore.class);

    protected final Duration codeExpiry;
    protected final Clock clock;

    protected AbstractAuthorizationCodeStore(Duration codeExpiry, Clock clock) {
        this.codeExpiry = codeExpiry;
        this.clock = clock;
    }

    @Override
    public String issue(String clientId, String userId, String redirectUri, String scope,
                        String codeChallenge, String codeChallengeMethod) {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(redirectUri, "redirectUri");

        Instant now = clock.instant();

        AuthorizationCode authCode = new AuthorizationCode();
        authCode.code = SecureTokens.generate();
        authCode.clientId = clientId;
        authCode.userId = userId;
        authCode.redirectUri = redirectUri;
        authCode.scope = scope;
        authCode.codeChallenge = codeChallenge;
        authCode.codeChallengeMethod = codeChallenge != null ? codeChallengeMethod : null;
        authCode.issuedAt = now;
        authCode.expiresAt = now.plus(codeExpiry);

        save(authCode, codeExpiry);

        LOG.debugf("Issued authorization code %s for client %s, user %s",
            SecureTokens.logPrefix(authCode.code), clientId, userId);
        return authCode.code;
    }

    @Override
    public Optional<AuthorizationCode> consumeIfValid(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }

        Optional<AuthorizationCode> taken = take(code);
        if (taken.isEmpty()) {
            LOG.debugf("Authorization code %s not found or already consumed", SecureTokens.logPrefix(code));
            return Optional.empty();
        }

        AuthorizationCode authCode = taken.get();
        if (authCode.isExpired(clock.instant())) {
            LOG.debugf("Authorization code %s expired at %s", SecureTokens.logPrefix(code), authCode.expiresAt);
            return Optional.empty();
        }

        authCode.consumed = true;
        return Optional.of(authCode);
    }

    /**
     * Persist the code so that it disappears after {@code ttl}.
     */
    protected abstract void save(AuthorizationCode authCode, Duration ttl);

    /**
     * Remove and return the stored code in one atomic step.
     */
    protected abstract Optional<AuthorizationCode> take(String code);
}
