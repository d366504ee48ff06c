package tech.codegrant.server.oauth;

import java.time.Instant;

/**
 * A single-use authorization code and the grant it is bound to.
 *
 * Codes are:
 * - Short-lived (default: 10 minutes)
 * - Single-use (removed from the store by the first successful consume)
 * - Bound to client, user, redirect URI, scope and PKCE challenge
 *
 * The client's state parameter is never stored.
 */
public class AuthorizationCode {

    /**
     * The code value (32 random bytes, base64url).
     */
    public String code;

    /**
     * OAuth client that initiated this authorization.
     */
    public String clientId;

    /**
     * The authenticated user.
     */
    public String userId;

    /**
     * Redirect URI used in the authorization request.
     * Must match byte-for-byte during token exchange.
     */
    public String redirectUri;

    /**
     * Granted scopes, space-delimited.
     */
    public String scope;

    /**
     * PKCE code challenge (required for public clients).
     */
    public String codeChallenge;

    /**
     * PKCE challenge method. Only S256 is accepted.
     */
    public String codeChallengeMethod;

    public Instant issuedAt;

    public Instant expiresAt;

    /**
     * Set once the code has been taken out of the store.
     */
    public boolean consumed = false;

    public boolean hasCodeChallenge() {
        return codeChallenge != null && !codeChallenge.isEmpty();
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isValid(Instant now) {
        return !consumed && !isExpired(now);
    }
}
