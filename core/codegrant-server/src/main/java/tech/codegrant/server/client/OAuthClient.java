package tech.codegrant.server.client;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A registered OAuth2 client.
 *
 * <p>Client type follows from the secret:
 * <ul>
 *   <li>PUBLIC: no secret on file, PKCE required (SPAs, mobile apps)</li>
 *   <li>CONFIDENTIAL: Argon2id secret hash on file (server-side apps)</li>
 * </ul>
 *
 * <p>Loaded once at startup and never modified afterwards.
 */
public class OAuthClient {

    /**
     * Unique client identifier used in OAuth flows.
     */
    public String clientId;

    /**
     * Human-readable name shown on the consent step.
     */
    public String clientName;

    /**
     * Argon2id hash of the client secret. Null for PUBLIC clients.
     */
    public String clientSecretHash;

    /**
     * Allowed redirect URIs. Must match exactly.
     */
    public List<String> redirectUris = new ArrayList<>();

    /**
     * Scopes this client may request.
     */
    public List<String> allowedScopes = new ArrayList<>();

    /**
     * Scopes granted when a request omits scope.
     */
    public List<String> defaultScopes = new ArrayList<>();

    /**
     * Inactive clients are treated as unknown.
     */
    public boolean active = true;

    public OAuthClient() {
    }

    /**
     * Check if a redirect URI is registered. Byte-for-byte comparison only.
     */
    public boolean isRedirectUriAllowed(String uri) {
        if (redirectUris == null || uri == null) {
            return false;
        }
        return redirectUris.contains(uri);
    }

    /**
     * Check if every scope in the collection is allowed for this client.
     */
    public boolean allowsScopes(Collection<String> scopes) {
        return allowedScopes != null && allowedScopes.containsAll(scopes);
    }

    public boolean isPublic() {
        return clientSecretHash == null;
    }

    public boolean isConfidential() {
        return clientSecretHash != null;
    }
}
