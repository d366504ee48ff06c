package tech.codegrant.server.client;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.codegrant.server.config.RegistryConfig;
import tech.codegrant.server.principal.PasswordService;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client registry loaded from {@code codegrant.registry.clients.*}.
 *
 * A plaintext {@code secret} is hashed with Argon2id when the registry loads;
 * {@code secret-hash} is taken as is. Clients with neither are public.
 */
@ApplicationScoped
public class ConfigClientRegistry implements ClientRegistry {

    private static final Logger LOG = Logger.getLogger(ConfigClientRegistry.class);

    private final Map<String, OAuthClient> clients;

    @Inject
    public ConfigClientRegistry(RegistryConfig config, PasswordService passwordService) {
        Map<String, OAuthClient> loaded = new HashMap<>();
        config.clients().forEach((clientId, entry) -> {
            if (entry.redirectUris().isEmpty()) {
                throw new IllegalStateException("Client '" + clientId + "' must register at least one redirect URI");
            }

            OAuthClient client = new OAuthClient();
            client.clientId = clientId;
            client.clientName = entry.name().orElse(clientId);
            client.clientSecretHash = entry.secretHash()
                .or(() -> entry.secret().map(passwordService::hashPassword))
                .orElse(null);
            client.redirectUris = List.copyOf(entry.redirectUris());
            client.allowedScopes = List.copyOf(entry.scopes());
            client.defaultScopes = List.copyOf(entry.defaultScopes().orElse(entry.scopes()));
            client.active = entry.active();

            if (!client.allowedScopes.containsAll(client.defaultScopes)) {
                throw new IllegalStateException("Client '" + clientId + "' has default scopes outside its allowed scopes");
            }

            loaded.put(clientId, client);
            LOG.infof("Registered %s client %s (%d redirect URI(s), active=%s)",
                client.isPublic() ? "public" : "confidential", clientId, client.redirectUris.size(), client.active);
        });
        this.clients = Collections.unmodifiableMap(loaded);
    }

    @Override
    public Optional<OAuthClient> findByClientId(String clientId) {
        if (clientId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(clientId)).filter(client -> client.active);
    }
}
