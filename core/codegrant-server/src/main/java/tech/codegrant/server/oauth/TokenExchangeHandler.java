package tech.codegrant.server.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.codegrant.server.client.ClientAuthenticator;
import tech.codegrant.server.client.ClientCredentials;
import tech.codegrant.server.client.OAuthClient;
import tech.codegrant.server.common.errors.OAuthError;
import tech.codegrant.server.common.errors.OAuthException;
import tech.codegrant.server.token.SecureTokens;
import tech.codegrant.server.token.TokenIssuer;
import tech.codegrant.server.token.TokenResponse;

/**
 * Exchanges an authorization code for tokens.
 *
 * <p>Steps, each failure terminal:
 * <ol>
 *   <li>grant_type must be authorization_code</li>
 *   <li>consume the code (the only mutation, before any other check)</li>
 *   <li>authenticate the client and check the code was issued to it</li>
 *   <li>redirect_uri must equal the one bound to the code</li>
 *   <li>verify PKCE when the code carries a challenge</li>
 *   <li>issue tokens</li>
 * </ol>
 *
 * <p>A code that fails any check after step 2 is gone for good.
 */
@ApplicationScoped
public class TokenExchangeHandler {

    private static final Logger LOG = Logger.getLogger(TokenExchangeHandler.class);

    static final String INVALID_GRANT = "Invalid authorization grant";

    private final AuthorizationCodeStore codeStore;
    private final ClientAuthenticator clientAuthenticator;
    private final PkceService pkceService;
    private final TokenIssuer tokenIssuer;

    @Inject
    public TokenExchangeHandler(AuthorizationCodeStore codeStore, ClientAuthenticator clientAuthenticator,
                                PkceService pkceService, TokenIssuer tokenIssuer) {
        this.codeStore = codeStore;
        this.clientAuthenticator = clientAuthenticator;
        this.pkceService = pkceService;
        this.tokenIssuer = tokenIssuer;
    }

    public TokenResponse exchange(TokenRequest request) {
        if (!TokenRequest.GRANT_AUTHORIZATION_CODE.equals(request.grantType())) {
            throw OAuthException.badRequest(OAuthError.UNSUPPORTED_GRANT_TYPE,
                "Supported grant types: authorization_code, refresh_token");
        }

        AuthorizationCode authCode = codeStore.consumeIfValid(request.code())
            .orElseThrow(TokenExchangeHandler::invalidGrant);

        ClientCredentials credentials = ClientCredentials.resolve(
                request.authorizationHeader(), request.clientId(), request.clientSecret())
            .orElseThrow(() -> OAuthException.unauthorized(OAuthError.INVALID_CLIENT, "Client authentication failed"));

        OAuthClient client = clientAuthenticator.resolveClient(credentials);
        if (!client.clientId.equals(authCode.clientId)) {
            LOG.warnf("Client %s presented code %s issued to client %s",
                client.clientId, SecureTokens.logPrefix(authCode.code), authCode.clientId);
            throw invalidGrant();
        }
        clientAuthenticator.verifySecret(client, credentials);

        if (!authCode.redirectUri.equals(request.redirectUri())) {
            LOG.debugf("redirect_uri mismatch for client %s", client.clientId);
            throw invalidGrant();
        }

        if (authCode.hasCodeChallenge()) {
            if (!pkceService.verifyCodeChallenge(request.codeVerifier(), authCode.codeChallenge)) {
                LOG.debugf("PKCE verification failed for client %s", client.clientId);
                throw invalidGrant();
            }
        } else if (client.isPublic()) {
            LOG.warnf("Public client %s presented a code without a PKCE challenge", client.clientId);
            throw invalidGrant();
        }

        return tokenIssuer.issue(client.clientId, authCode.userId, authCode.scope);
    }

    static OAuthException invalidGrant() {
        return OAuthException.badRequest(OAuthError.INVALID_GRANT, INVALID_GRANT);
    }
}
