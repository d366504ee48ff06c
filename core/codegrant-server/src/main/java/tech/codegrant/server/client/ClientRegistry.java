package tech.codegrant.server.client;

import java.util.Optional;

/**
 * Read-only lookup of registered clients.
 */
public interface ClientRegistry {

    /**
     * Find an active client. Unknown and inactive clients both yield empty.
     */
    Optional<OAuthClient> findByClientId(String clientId);
}
