package tech.codegrant.server.token;

import java.time.Instant;

/**
 * Stores refresh tokens for long-lived sessions.
 *
 * Features:
 * - Token rotation: Each use issues a new refresh token
 * - Family tracking: All tokens in a family are invalidated on reuse detection
 *
 * Security: Only the token hash is stored, not the actual token.
 */
public class RefreshToken {

    /**
     * SHA-256 hash of the refresh token.
     */
    public String tokenHash;

    /**
     * The user this token was issued for.
     */
    public String userId;

    /**
     * OAuth client that requested this token.
     */
    public String clientId;

    /**
     * Scopes granted with this token.
     */
    public String scope;

    /**
     * Token family for refresh token rotation.
     *
     * All tokens in a family are invalidated if reuse is detected
     * (an old token is presented after a newer one was issued).
     */
    public String tokenFamily;

    public Instant issuedAt;

    public Instant expiresAt;

    public boolean revoked = false;

    /**
     * When this token was revoked (null if not revoked).
     */
    public Instant revokedAt;

    /**
     * Hash of the token that replaced this one (for rotation tracking).
     */
    public String replacedBy;

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isValid(Instant now) {
        return !revoked && !isExpired(now);
    }

    /**
     * A token that was rotated and is being presented again.
     */
    public boolean wasRotated() {
        return revoked && replacedBy != null;
    }

    /**
     * Copy of this record marked as revoked.
     */
    public RefreshToken revoke(Instant when, String replacedByHash) {
        RefreshToken copy = new RefreshToken();
        copy.tokenHash = tokenHash;
        copy.userId = userId;
        copy.clientId = clientId;
        copy.scope = scope;
        copy.tokenFamily = tokenFamily;
        copy.issuedAt = issuedAt;
        copy.expiresAt = expiresAt;
        copy.revoked = true;
        copy.revokedAt = when;
        copy.replacedBy = replacedByHash;
        return copy;
    }
}
