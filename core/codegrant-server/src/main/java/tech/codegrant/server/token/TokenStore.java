package tech.codegrant.server.token;

import java.time.Instant;
import java.util.Optional;

/**
 * Expiring store for issued tokens, keyed by token hash.
 */
public interface TokenStore {

    void saveAccessToken(AccessToken accessToken);

    Optional<AccessToken> findAccessToken(String tokenHash);

    void saveRefreshToken(RefreshToken refreshToken);

    /**
     * Find a refresh token record in any state, including revoked.
     */
    Optional<RefreshToken> findRefreshToken(String tokenHash);

    /**
     * Atomically revoke a valid refresh token and link it to its successor.
     * Of any number of concurrent calls for one hash, at most one returns a value.
     *
     * @return the token as it was before revocation, or empty if it was unknown, expired or already revoked
     */
    Optional<RefreshToken> consumeRefreshToken(String tokenHash, String replacedByHash, Instant now);

    /**
     * Revoke every refresh token of a family and drop the access tokens issued with them.
     *
     * @return number of refresh tokens revoked
     */
    int revokeTokenFamily(String tokenFamily, Instant now);
}
