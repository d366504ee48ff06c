package tech.codegrant.server.client;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.codegrant.server.common.errors.OAuthError;
import tech.codegrant.server.common.errors.OAuthException;
import tech.codegrant.server.principal.PasswordService;

/**
 * Authenticates clients at the token endpoint.
 *
 * Resolution and secret verification are separate steps so callers can check
 * the grant's client binding in between.
 */
@ApplicationScoped
public class ClientAuthenticator {

    private static final Logger LOG = Logger.getLogger(ClientAuthenticator.class);

    static final String AUTH_FAILED = "Client authentication failed";

    private final ClientRegistry clientRegistry;
    private final PasswordService passwordService;

    @Inject
    public ClientAuthenticator(ClientRegistry clientRegistry, PasswordService passwordService) {
        this.clientRegistry = clientRegistry;
        this.passwordService = passwordService;
    }

    /**
     * Look up the client named by the credentials.
     *
     * @throws OAuthException invalid_client (401) when the client is unknown or inactive
     */
    public OAuthClient resolveClient(ClientCredentials credentials) {
        return clientRegistry.findByClientId(credentials.clientId())
            .orElseThrow(() -> {
                LOG.debugf("Client authentication failed: unknown client %s", credentials.clientId());
                return OAuthException.unauthorized(OAuthError.INVALID_CLIENT, AUTH_FAILED);
            });
    }

    /**
     * Verify the secret of a confidential client. Public clients pass without one.
     *
     * @throws OAuthException invalid_client (401) when the secret is missing or wrong
     */
    public void verifySecret(OAuthClient client, ClientCredentials credentials) {
        if (client.isPublic()) {
            return;
        }
        if (!credentials.hasSecret()
                || !passwordService.verifyPassword(credentials.clientSecret(), client.clientSecretHash)) {
            LOG.warnf("Client authentication failed: bad secret for client %s", client.clientId);
            throw OAuthException.unauthorized(OAuthError.INVALID_CLIENT, AUTH_FAILED);
        }
    }
}
