package tech.codegrant.server.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static registrations loaded at startup: OAuth clients and the seeded user accounts.
 *
 * <pre>
 * codegrant.registry.clients.demo-client.name=Demo Client
 * codegrant.registry.clients.demo-client.secret=demo-client-secret
 * codegrant.registry.clients.demo-client.redirect-uris=http://localhost:3000/callback
 * codegrant.registry.clients.demo-client.scopes=read,write
 *
 * codegrant.registry.users.demo.id=1
 * codegrant.registry.users.demo.email=demo@example.com
 * codegrant.registry.users.demo.password=demo123
 * </pre>
 *
 * Map keys are the client_id and the username respectively.
 */
@ConfigMapping(prefix = "codegrant.registry")
public interface RegistryConfig {

    Map<String, ClientEntry> clients();

    Map<String, UserEntry> users();

    interface ClientEntry {

        /**
         * Human-readable name shown on the consent step.
         */
        Optional<String> name();

        /**
         * Plaintext secret, hashed once when the registry loads.
         * Omit both secret and secret-hash for a public (PKCE-only) client.
         */
        Optional<String> secret();

        /**
         * Argon2id hash of the client secret (PHC format).
         */
        @WithName("secret-hash")
        Optional<String> secretHash();

        /**
         * Exact redirect URIs. No prefix matching is applied.
         */
        @WithName("redirect-uris")
        List<String> redirectUris();

        /**
         * Scopes the client may request.
         */
        List<String> scopes();

        /**
         * Scopes granted when a request omits scope. Defaults to all allowed scopes.
         */
        @WithName("default-scopes")
        Optional<List<String>> defaultScopes();

        @WithDefault("true")
        boolean active();
    }

    interface UserEntry {

        /**
         * Stable subject identifier. Defaults to the username.
         */
        Optional<String> id();

        String email();

        @WithName("full-name")
        Optional<String> fullName();

        Optional<String> password();

        @WithName("password-hash")
        Optional<String> passwordHash();

        @WithDefault("true")
        boolean active();
    }
}
