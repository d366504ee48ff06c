package tech.codegrant.server.token;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Successful token endpoint response. refresh_token is omitted when refresh tokens are disabled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
    String access_token,
    String token_type,
    long expires_in,
    String scope,
    String refresh_token
) {
    public static final String BEARER = "bearer";
}
