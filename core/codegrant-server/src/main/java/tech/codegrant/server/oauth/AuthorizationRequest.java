package tech.codegrant.server.oauth;

/**
 * Parameters of an authorization request, as received at /authorize or echoed by the consent form.
 */
public record AuthorizationRequest(
    String clientId,
    String redirectUri,
    String responseType,
    String scope,
    String state,
    String codeChallenge,
    String codeChallengeMethod
) {
}
