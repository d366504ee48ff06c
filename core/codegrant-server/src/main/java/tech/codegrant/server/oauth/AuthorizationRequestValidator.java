package tech.codegrant.server.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.codegrant.server.client.ClientRegistry;
import tech.codegrant.server.client.OAuthClient;
import tech.codegrant.server.common.errors.OAuthError;
import tech.codegrant.server.common.errors.OAuthException;

import java.util.List;

/**
 * Validates authorization requests against the client registry.
 *
 * Checks run in a fixed order and the first failure wins:
 * client, redirect URI, response type, PKCE parameters, scope.
 * Validation has no side effects.
 */
@ApplicationScoped
public class AuthorizationRequestValidator {

    private static final Logger LOG = Logger.getLogger(AuthorizationRequestValidator.class);

    static final String RESPONSE_TYPE_CODE = "code";

    private final ClientRegistry clientRegistry;
    private final PkceService pkceService;

    @Inject
    public AuthorizationRequestValidator(ClientRegistry clientRegistry, PkceService pkceService) {
        this.clientRegistry = clientRegistry;
        this.pkceService = pkceService;
    }

    /**
     * Validate a request arriving at /authorize.
     *
     * @return the consent context to present to the user
     * @throws OAuthException on the first failed check
     */
    public ConsentContext validate(AuthorizationRequest request) {
        OAuthClient client = validateClientAndRedirect(request);

        if (!RESPONSE_TYPE_CODE.equals(request.responseType())) {
            LOG.debugf("Unsupported response_type '%s' from client %s", request.responseType(), client.clientId);
            throw OAuthException.badRequest(OAuthError.UNSUPPORTED_RESPONSE_TYPE,
                "Only response_type=code is supported");
        }

        return validateGrant(client, request);
    }

    /**
     * Re-validate the parameters echoed by the consent form. The form carries no response_type.
     */
    public ConsentContext revalidate(AuthorizationRequest request) {
        OAuthClient client = validateClientAndRedirect(request);
        return validateGrant(client, request);
    }

    private OAuthClient validateClientAndRedirect(AuthorizationRequest request) {
        OAuthClient client = clientRegistry.findByClientId(request.clientId())
            .orElseThrow(() -> {
                LOG.debugf("Authorization request for unknown client %s", request.clientId());
                return OAuthException.badRequest(OAuthError.INVALID_CLIENT, "Unknown client");
            });

        if (!client.isRedirectUriAllowed(request.redirectUri())) {
            LOG.warnf("Unregistered redirect_uri for client %s: %s", client.clientId, request.redirectUri());
            throw OAuthException.badRequest(OAuthError.INVALID_REDIRECT_URI,
                "Redirect URI is not registered for this client");
        }
        return client;
    }

    private ConsentContext validateGrant(OAuthClient client, AuthorizationRequest request) {
        String codeChallenge = emptyToNull(request.codeChallenge());
        String method = emptyToNull(request.codeChallengeMethod());

        if (codeChallenge == null) {
            if (method != null) {
                throw OAuthException.badRequest(OAuthError.INVALID_REQUEST,
                    "code_challenge_method requires code_challenge");
            }
            if (client.isPublic()) {
                throw OAuthException.badRequest(OAuthError.INVALID_REQUEST,
                    "PKCE code_challenge is required for public clients");
            }
        } else {
            if (method == null) {
                method = PkceService.METHOD_S256;
            }
            if (!pkceService.isSupportedMethod(method)) {
                throw OAuthException.badRequest(OAuthError.INVALID_REQUEST,
                    "Unsupported code_challenge_method, only S256 is allowed");
            }
            if (!pkceService.isValidCodeChallenge(codeChallenge)) {
                throw OAuthException.badRequest(OAuthError.INVALID_REQUEST,
                    "code_challenge must be 43-128 characters");
            }
        }

        List<String> requested = Scopes.parse(request.scope());
        List<String> granted = requested.isEmpty() ? client.defaultScopes : requested;
        if (!client.allowsScopes(granted)) {
            LOG.debugf("Client %s requested scopes outside its allowed set: %s", client.clientId, requested);
            throw OAuthException.badRequest(OAuthError.INVALID_SCOPE,
                "Requested scope is not allowed for this client");
        }

        return new ConsentContext(
            client.clientId,
            client.clientName,
            request.redirectUri(),
            Scopes.join(granted),
            List.copyOf(granted),
            request.state(),
            codeChallenge,
            codeChallenge != null ? method : null,
            null
        );
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
