package tech.codegrant.server.common.errors;

/**
 * OAuth2 error codes returned in the "error" field of error responses.
 *
 * invalid_grant covers unknown, expired and already-used codes
 * as well as redirect URI and PKCE mismatches.
 */
public enum OAuthError {
    INVALID_REQUEST("invalid_request"),
    INVALID_CLIENT("invalid_client"),
    INVALID_REDIRECT_URI("invalid_redirect_uri"),
    UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type"),
    INVALID_SCOPE("invalid_scope"),
    INVALID_GRANT("invalid_grant"),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type"),
    INVALID_TOKEN("invalid_token"),
    TEMPORARILY_UNAVAILABLE("temporarily_unavailable"),
    SERVER_ERROR("server_error");

    private final String code;

    OAuthError(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
