package tech.codegrant.server.token;

import java.time.Instant;

/**
 * Server-side record of an issued access token.
 *
 * Security: Only the token hash is stored, not the actual token.
 */
public class AccessToken {

    /**
     * SHA-256 hash of the access token.
     */
    public String tokenHash;

    public String clientId;

    public String userId;

    /**
     * Granted scopes, space-delimited.
     */
    public String scope;

    /**
     * Refresh token family this token was issued with, if any.
     */
    public String tokenFamily;

    public Instant issuedAt;

    public Instant expiresAt;

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
