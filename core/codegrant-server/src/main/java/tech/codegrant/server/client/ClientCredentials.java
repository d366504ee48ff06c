package tech.codegrant.server.client;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Client identity presented at the token endpoint.
 *
 * @param clientId     the client_id
 * @param clientSecret the secret, null when the client sent none
 */
public record ClientCredentials(String clientId, String clientSecret) {

    private static final String BASIC_PREFIX = "Basic ";

    /**
     * Resolve credentials from HTTP Basic (preferred) or the form body.
     *
     * @return empty when neither source names a client, or the Basic header is malformed
     */
    public static Optional<ClientCredentials> resolve(String authHeader, String formClientId, String formClientSecret) {
        if (authHeader != null && authHeader.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return parseBasicAuth(authHeader);
        }
        if (formClientId != null && !formClientId.isBlank()) {
            return Optional.of(new ClientCredentials(formClientId, emptyToNull(formClientSecret)));
        }
        return Optional.empty();
    }

    static Optional<ClientCredentials> parseBasicAuth(String authHeader) {
        String base64 = authHeader.substring(BASIC_PREFIX.length()).trim();
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(base64), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        int colonIdx = decoded.indexOf(':');
        if (colonIdx <= 0) {
            return Optional.empty();
        }
        return Optional.of(new ClientCredentials(
            decoded.substring(0, colonIdx),
            emptyToNull(decoded.substring(colonIdx + 1))));
    }

    public boolean hasSecret() {
        return clientSecret != null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
