package tech.codegrant.server.oauth;

/**
 * Form parameters and Authorization header of a token endpoint call.
 */
public record TokenRequest(
    String grantType,
    String code,
    String redirectUri,
    String codeVerifier,
    String refreshToken,
    String scope,
    String authorizationHeader,
    String clientId,
    String clientSecret
) {
    public static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
    public static final String GRANT_REFRESH_TOKEN = "refresh_token";

    public static TokenRequest authorizationCode(String code, String redirectUri, String codeVerifier,
                                                 String authorizationHeader, String clientId, String clientSecret) {
        return new TokenRequest(GRANT_AUTHORIZATION_CODE, code, redirectUri, codeVerifier, null, null,
            authorizationHeader, clientId, clientSecret);
    }

    public static TokenRequest refreshToken(String refreshToken, String scope,
                                            String authorizationHeader, String clientId, String clientSecret) {
        return new TokenRequest(GRANT_REFRESH_TOKEN, null, null, null, refreshToken, scope,
            authorizationHeader, clientId, clientSecret);
    }
}
